package com.example.expensechat.service.currency;

import com.example.expensechat.exception.UpstreamUnavailableException;
import com.example.expensechat.service.implement.ExchangeRateServiceImpl;
import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.SqlValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Quy đổi amount của INSERT expenses sang tiền tệ của book đích khi người dùng
 * nói số tiền bằng tiền tệ khác. Lỗi tỷ giá không làm hỏng câu lệnh.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CurrencyNormalizer {
    private final CurrencyDetector currencyDetector;
    private final ExchangeRateServiceImpl exchangeRateService;

    public NormalizedInsert normalize(InsertStatement insert, String utterance, String bookCurrency) {
        if (insert.table() != OwnedTable.EXPENSES || bookCurrency == null) {
            return new NormalizedInsert(insert, null);
        }
        Optional<DetectedAmount> detected = currencyDetector.detect(utterance);
        if (detected.isEmpty() || detected.get().currency().equalsIgnoreCase(bookCurrency)) {
            return new NormalizedInsert(insert, null);
        }

        String from = detected.get().currency();
        Optional<BigDecimal> own = insert.valueOf("amount").flatMap(SqlValue::number);
        if (own.isEmpty()) {
            return new NormalizedInsert(insert, null);
        }
        // mỗi câu INSERT quy đổi số tiền của chính nó, tiền tệ lấy từ câu người dùng
        BigDecimal original = own.get().setScale(2, RoundingMode.HALF_UP);
        try {
            BigDecimal rate = exchangeRateService.rate(from, bookCurrency);
            BigDecimal converted = own.get().multiply(rate).setScale(2, RoundingMode.HALF_UP);
            log.info("Converted {} {} -> {} {}", original, from, converted, bookCurrency);
            return new NormalizedInsert(insert.with("amount", SqlValue.number(converted)),
                    "💱 Converted %s %s to %s %s".formatted(original.toPlainString(), from,
                            converted.toPlainString(), bookCurrency));
        } catch (UpstreamUnavailableException e) {
            log.warn("Currency conversion {} -> {} skipped: {}", from, bookCurrency, e.getMessage());
            return new NormalizedInsert(insert,
                    "⚠️ Could not convert %s %s to %s right now, the amount was saved as given."
                            .formatted(original.toPlainString(), from, bookCurrency));
        }
    }
}
