package com.example.expensechat.service.currency;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Danh mục tiền tệ được hỗ trợ, ký hiệu hiển thị và ký hiệu/tên dùng để nhận diện. */
public final class CurrencyCatalog {

    private CurrencyCatalog() {}

    public static final List<String> CODES = List.of(
            "USD", "EUR", "GBP", "JPY", "CAD", "AUD", "CHF", "CNY", "INR", "MXN", "BRL", "ZAR",
            "RUB", "KRW", "SGD", "HKD", "NZD", "SEK", "NOK", "DKK", "PLN", "CZK", "HUF", "TRY",
            "TWD", "THB", "IDR", "MYR", "PHP", "VND", "ILS", "AED", "SAR", "QAR", "KWD", "BHD",
            "OMR", "JOD", "LBP", "EGP", "NGN", "CLP", "COP", "PEN", "ARS", "UYU");

    private static final Map<String, String> DISPLAY_SYMBOLS = Map.ofEntries(
            Map.entry("USD", "$"), Map.entry("EUR", "€"), Map.entry("GBP", "£"), Map.entry("JPY", "¥"),
            Map.entry("INR", "₹"), Map.entry("RUB", "₽"), Map.entry("KRW", "₩"), Map.entry("TRY", "₺"),
            Map.entry("VND", "₫"), Map.entry("ILS", "₪"), Map.entry("AED", "د.إ"), Map.entry("SAR", "﷼"),
            Map.entry("KWD", "KD"), Map.entry("BHD", "BD"), Map.entry("NGN", "₦"), Map.entry("PHP", "₱"),
            Map.entry("BRL", "R$"), Map.entry("CAD", "C$"), Map.entry("AUD", "A$"), Map.entry("NZD", "NZ$"),
            Map.entry("SEK", "kr"), Map.entry("NOK", "kr"), Map.entry("DKK", "kr"), Map.entry("PLN", "zł"),
            Map.entry("CZK", "Kč"), Map.entry("HUF", "Ft"), Map.entry("TWD", "NT$"), Map.entry("THB", "฿"),
            Map.entry("IDR", "Rp"), Map.entry("MYR", "RM"), Map.entry("SGD", "S$"), Map.entry("HKD", "HK$"),
            Map.entry("CNY", "CN¥"), Map.entry("ARS", "ARS$"), Map.entry("CLP", "CLP$"), Map.entry("COP", "COP$"),
            Map.entry("PEN", "S/"), Map.entry("UYU", "UYU$"));

    /** Ký hiệu → mã, dùng để nhận diện trong câu người dùng. */
    static final Map<String, String> SYMBOL_TO_CODE;

    /** Tên gọi thông dụng → mã. */
    static final Map<String, String> WORD_TO_CODE;

    static {
        Map<String, String> symbols = new LinkedHashMap<>();
        symbols.put("$", "USD");
        symbols.put("€", "EUR");
        symbols.put("£", "GBP");
        symbols.put("¥", "JPY");
        symbols.put("₹", "INR");
        symbols.put("₽", "RUB");
        symbols.put("₩", "KRW");
        symbols.put("₺", "TRY");
        symbols.put("₫", "VND");
        symbols.put("₪", "ILS");
        symbols.put("د.إ", "AED");
        symbols.put("﷼", "SAR");
        symbols.put("KD", "KWD");
        symbols.put("BD", "BHD");
        symbols.put("₦", "NGN");
        symbols.put("₱", "PHP");
        symbols.put("R$", "BRL");
        symbols.put("C$", "CAD");
        symbols.put("A$", "AUD");
        symbols.put("NZ$", "NZD");
        symbols.put("kr", "SEK");
        symbols.put("Nkr", "NOK");
        symbols.put("Dkr", "DKK");
        symbols.put("zł", "PLN");
        symbols.put("Kč", "CZK");
        symbols.put("Ft", "HUF");
        symbols.put("NT$", "TWD");
        symbols.put("฿", "THB");
        symbols.put("Rp", "IDR");
        symbols.put("RM", "MYR");
        symbols.put("S$", "SGD");
        symbols.put("HK$", "HKD");
        symbols.put("CN¥", "CNY");
        symbols.put("MX$", "MXN");
        symbols.put("ARS$", "ARS");
        symbols.put("CLP$", "CLP");
        symbols.put("COP$", "COP");
        symbols.put("S/", "PEN");
        symbols.put("UYU$", "UYU");
        SYMBOL_TO_CODE = symbols;

        Map<String, String> words = new LinkedHashMap<>();
        words.put("dollars", "USD");
        words.put("dollar", "USD");
        words.put("bucks", "USD");
        words.put("euros", "EUR");
        words.put("euro", "EUR");
        words.put("pounds", "GBP");
        words.put("pound", "GBP");
        words.put("yen", "JPY");
        words.put("rupees", "INR");
        words.put("rupee", "INR");
        words.put("dong", "VND");
        words.put("yuan", "CNY");
        words.put("francs", "CHF");
        words.put("franc", "CHF");
        words.put("pesos", "MXN");
        words.put("peso", "MXN");
        words.put("rubles", "RUB");
        words.put("ruble", "RUB");
        words.put("baht", "THB");
        words.put("ringgit", "MYR");
        words.put("rupiah", "IDR");
        words.put("lira", "TRY");
        words.put("zloty", "PLN");
        words.put("dirhams", "AED");
        words.put("dirham", "AED");
        words.put("riyals", "SAR");
        words.put("riyal", "SAR");
        words.put("shekels", "ILS");
        words.put("shekel", "ILS");
        words.put("rand", "ZAR");
        words.put("naira", "NGN");
        WORD_TO_CODE = words;
    }

    public static boolean isSupported(String code) {
        return code != null && CODES.contains(code.trim().toUpperCase(Locale.ROOT));
    }

    public static String symbolOf(String code) {
        if (code == null) return "";
        return DISPLAY_SYMBOLS.getOrDefault(code.toUpperCase(Locale.ROOT), code.toUpperCase(Locale.ROOT));
    }

    /** Ký hiệu sắp theo độ dài giảm dần để "HK$" được khớp trước "$". */
    static List<String> symbolsLongestFirst() {
        return SYMBOL_TO_CODE.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    static Optional<String> codeForWord(String word) {
        return Optional.ofNullable(WORD_TO_CODE.get(word.toLowerCase(Locale.ROOT)));
    }
}
