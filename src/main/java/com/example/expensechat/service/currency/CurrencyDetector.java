package com.example.expensechat.service.currency;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tìm cặp số tiền + tiền tệ trong câu người dùng. Thứ tự thử:
 * ký hiệu trước số, số trước ký hiệu, số trước mã/tên tiền, mã trước số.
 */
@Component
public class CurrencyDetector {

    private static final String AMOUNT = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)";

    private final List<Pattern> patterns;

    public CurrencyDetector() {
        String symbols = CurrencyCatalog.symbolsLongestFirst().stream()
                .map(CurrencyDetector::symbolAlternative)
                .collect(Collectors.joining("|"));
        String codes = String.join("|", CurrencyCatalog.CODES);
        String words = String.join("|", CurrencyCatalog.WORD_TO_CODE.keySet());

        this.patterns = List.of(
                Pattern.compile("(?<cur>" + symbols + ")\\s?" + AMOUNT),
                Pattern.compile(AMOUNT + "\\s?(?<cur>" + symbols + ")"),
                Pattern.compile(AMOUNT + "\\s?(?<cur>(?i:" + codes + "|" + words + "))\\b"),
                Pattern.compile("\\b(?<cur>" + codes + ")\\s?" + AMOUNT));
    }

    public Optional<DetectedAmount> detect(String utterance) {
        if (utterance == null || utterance.isBlank()) return Optional.empty();
        for (Pattern p : patterns) {
            Matcher m = p.matcher(utterance);
            if (m.find()) {
                String amount = amountGroup(m);
                return toCode(m.group("cur"))
                        .map(code -> new DetectedAmount(new BigDecimal(amount.replace(",", "")), code));
            }
        }
        return Optional.empty();
    }

    private static String amountGroup(Matcher m) {
        // "cur" cũng được đánh số, nhóm số tiền là nhóm bắt đầu bằng chữ số
        for (int i = 1; i <= m.groupCount(); i++) {
            String g = m.group(i);
            if (g != null && !g.isEmpty() && Character.isDigit(g.charAt(0))) return g;
        }
        throw new IllegalStateException("No amount group in " + m.group());
    }

    private static Optional<String> toCode(String token) {
        String code = CurrencyCatalog.SYMBOL_TO_CODE.get(token);
        if (code != null) return Optional.of(code);
        String upper = token.toUpperCase(java.util.Locale.ROOT);
        if (CurrencyCatalog.CODES.contains(upper)) return Optional.of(upper);
        return CurrencyCatalog.codeForWord(token);
    }

    /** Ký hiệu chữ (kr, Ft, RM...) phải đứng riêng, không dính vào từ khác. */
    private static String symbolAlternative(String symbol) {
        String quoted = Pattern.quote(symbol);
        if (Character.isLetter(symbol.charAt(0))) quoted = "(?<!\\p{L})" + quoted;
        if (Character.isLetter(symbol.charAt(symbol.length() - 1))) quoted = quoted + "(?!\\p{L})";
        return quoted;
    }
}
