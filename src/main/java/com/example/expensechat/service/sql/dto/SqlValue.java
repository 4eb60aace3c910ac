package com.example.expensechat.service.sql.dto;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Một giá trị SQL đã render (literal hoặc biểu thức). Chuỗi luôn được bao bằng nháy đơn,
 * nháy đơn bên trong được nhân đôi.
 */
public record SqlValue(String sql) {

    public static final SqlValue NOW = new SqlValue("NOW()");
    public static final SqlValue CURDATE = new SqlValue("CURDATE()");
    public static final SqlValue FALSE = new SqlValue("false");
    public static final SqlValue EMPTY = string("");

    public static SqlValue string(String text) {
        return new SqlValue(quote(text));
    }

    public static SqlValue number(BigDecimal number) {
        return new SqlValue(number.toPlainString());
    }

    public static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    public boolean isStringLiteral() {
        return sql.length() >= 2 && sql.startsWith("'") && sql.endsWith("'");
    }

    /** Nội dung literal chuỗi (đã bỏ nháy), rỗng nếu không phải chuỗi. */
    public Optional<String> text() {
        if (!isStringLiteral()) return Optional.empty();
        return Optional.of(sql.substring(1, sql.length() - 1).replace("''", "'"));
    }

    public Optional<BigDecimal> number() {
        String s = isStringLiteral() ? text().orElse("") : sql;
        try {
            return Optional.of(new BigDecimal(s.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean isFunctionCall() {
        return !isStringLiteral() && sql.endsWith(")") && sql.indexOf('(') > 0;
    }

    public boolean isTrue() {
        String s = sql.trim().toLowerCase(Locale.ROOT);
        return s.equals("true") || s.equals("1") || s.equals("'1'") || s.equals("'true'");
    }
}
