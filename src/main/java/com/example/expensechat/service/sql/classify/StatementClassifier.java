package com.example.expensechat.service.sql.classify;

import com.example.expensechat.service.sql.druid.implement.StatementParserImpl;
import com.example.expensechat.service.sql.druid.service.SqlFragmentRepair;
import com.example.expensechat.service.sql.dto.ClassifiedStatement;
import com.example.expensechat.service.sql.dto.StatementKind;
import com.example.expensechat.service.sql.dto.UnsupportedStatement;
import com.example.expensechat.service.sql.extract.SqlText;
import com.example.expensechat.service.sql.screen.SecurityScreener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Quyết định biến thể theo động từ đầu câu, sửa mảnh ghép lỗi rồi parse đúng một lần.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementClassifier {
    private final SqlFragmentRepair repair;
    private final SecurityScreener screener;
    private final StatementParserImpl parser;

    public static StatementKind kindOf(String sql) {
        return switch (SqlText.leadingVerb(sql)) {
            case "insert" -> StatementKind.INSERT;
            case "update" -> StatementKind.UPDATE;
            case "select" -> StatementKind.SELECT;
            default -> StatementKind.UNSUPPORTED;
        };
    }

    /**
     * @param sql câu lệnh đã qua screener
     * @throws com.example.expensechat.exception.ValidationException nếu cấu trúc không được hỗ trợ
     * @throws com.example.expensechat.exception.SecurityViolationException nếu text sau khi sửa vi phạm
     */
    public ClassifiedStatement classify(String sql) {
        StatementKind kind = kindOf(sql);
        if (kind == StatementKind.UNSUPPORTED) {
            log.warn("Unsupported statement: {}", sql);
            return new UnsupportedStatement(sql, SqlText.leadingVerb(sql));
        }

        String text = stripTerminator(sql);
        String repaired = repair.repair(text);
        if (!repaired.equals(text)) {
            screener.screen(repaired, kind);
        }

        return switch (kind) {
            case INSERT -> parser.parseInsert(repaired);
            case UPDATE -> parser.parseUpdate(repaired);
            case SELECT -> parser.parseSelect(repaired);
            default -> throw new IllegalStateException("Unexpected kind " + kind);
        };
    }

    private static String stripTerminator(String sql) {
        String s = sql.strip();
        while (s.endsWith(";")) s = s.substring(0, s.length() - 1).stripTrailing();
        return s;
    }
}
