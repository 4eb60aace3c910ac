package com.example.expensechat.service.sql.screen;

import com.example.expensechat.exception.SecurityViolationException;
import com.example.expensechat.service.sql.dto.StatementKind;
import com.example.expensechat.service.sql.extract.SqlText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Kiểm tra lexical trước khi parse. Chỉ xét phần text nằm ngoài literal chuỗi.
 * Mọi vi phạm ném {@link SecurityViolationException}.
 */
@Slf4j
@Component
public class SecurityScreener {

    static final Set<String> DENYLIST = Set.of(
            "drop", "delete", "alter", "create", "truncate", "exec", "execute", "grant", "revoke",
            "rename", "replace", "merge", "call", "load", "handler", "lock", "unlock", "shutdown",
            "outfile", "dumpfile", "sleep", "benchmark");

    private static final Map<StatementKind, Set<String>> FOREIGN_VERBS = Map.of(
            StatementKind.INSERT, Set.of("update", "select"),
            StatementKind.UPDATE, Set.of("insert", "select"),
            StatementKind.SELECT, Set.of("insert", "update"));

    private static final Pattern TOKEN = Pattern.compile("[a-z_][a-z0-9_]*");

    /**
     * @param sql  một câu lệnh đã tách (có thể còn ';' ở cuối)
     * @param kind lớp khai báo theo động từ đầu câu
     */
    public void screen(String sql, StatementKind kind) {
        String masked;
        try {
            masked = SqlText.maskLiterals(sql);
        } catch (IllegalStateException e) {
            throw reject("'", "Unterminated string literal", sql);
        }
        String lower = masked.toLowerCase(Locale.ROOT);

        for (String delimiter : new String[]{"--", "/*", "*/", "#"}) {
            if (lower.contains(delimiter)) {
                throw reject(delimiter, "Comment delimiter '" + delimiter + "' is not allowed", sql);
            }
        }

        String body = lower.stripTrailing();
        if (body.endsWith(";")) body = body.substring(0, body.length() - 1);
        if (body.indexOf(';') >= 0) {
            throw reject(";", "Stacked statements are not allowed", sql);
        }

        Set<String> foreign = FOREIGN_VERBS.getOrDefault(kind, Set.of());
        int whereCount = 0;
        boolean connectorBeforeWhere = false;
        Matcher m = TOKEN.matcher(lower);
        while (m.find()) {
            String token = m.group();
            if (DENYLIST.contains(token)) {
                throw reject(token, "Forbidden keyword: " + token, sql);
            }
            if (foreign.contains(token)) {
                throw reject(token, "Keyword '" + token + "' is not allowed in " + kind + " statements", sql);
            }
            if (kind == StatementKind.UPDATE) {
                if (token.equals("where")) {
                    whereCount++;
                } else if (whereCount == 0 && (token.equals("and") || token.equals("or"))) {
                    connectorBeforeWhere = true;
                }
            }
        }

        if (kind == StatementKind.UPDATE) {
            if (whereCount > 1) {
                throw reject("where", "UPDATE has more than one WHERE clause", sql);
            }
            if (connectorBeforeWhere) {
                throw reject("and", "UPDATE has a condition outside its WHERE clause", sql);
            }
        }
    }

    private static SecurityViolationException reject(String token, String message, String sql) {
        log.warn("Rejected statement ({}): {}", message, sql);
        return new SecurityViolationException(token, message);
    }
}
