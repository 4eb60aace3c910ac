package com.example.expensechat.service.sql.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Tiện ích lexical dùng chung cho extractor/screener/repair.
 * Literal chuỗi là '...' hoặc "..." với nháy nhân đôi để escape.
 */
public final class SqlText {

    private SqlText() {}

    /** Ký tự thay cho nội dung literal khi mask. */
    public static final char MASK = '_';

    /**
     * Thay mọi ký tự bên trong literal chuỗi (kể cả nháy) bằng {@link #MASK}, giữ nguyên độ dài.
     *
     * @throws IllegalStateException nếu literal không được đóng
     */
    public static String maskLiterals(String sql) {
        StringBuilder sb = new StringBuilder(sql.length());
        char quote = 0;
        for (int i = 0; i < sql.length(); i++) {
            char ch = sql.charAt(i);
            if (quote == 0) {
                if (ch == '\'' || ch == '"') {
                    quote = ch;
                    sb.append(MASK);
                } else {
                    sb.append(ch);
                }
                continue;
            }
            sb.append(MASK);
            if (ch == quote) {
                // nháy đôi '' là escape, vẫn ở trong literal
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    sb.append(MASK);
                    i++;
                } else {
                    quote = 0;
                }
            }
        }
        if (quote != 0) {
            throw new IllegalStateException("Unterminated string literal");
        }
        return sb.toString();
    }

    public static boolean hasUnterminatedLiteral(String sql) {
        try {
            maskLiterals(sql);
            return false;
        } catch (IllegalStateException e) {
            return true;
        }
    }

    /** Tách theo ';' nằm ngoài literal. Literal hở được giữ nguyên tới cuối đoạn. */
    public static List<String> splitOutsideLiterals(String sql) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < sql.length(); i++) {
            char ch = sql.charAt(i);
            if (quote != 0) {
                cur.append(ch);
                if (ch == quote) {
                    if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                        cur.append(sql.charAt(++i));
                    } else {
                        quote = 0;
                    }
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
                cur.append(ch);
            } else if (ch == ';') {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        out.add(cur.toString());
        return out;
    }

    /** Từ đầu tiên (đã lower-case) của câu lệnh, rỗng nếu không có. */
    public static String leadingVerb(String sql) {
        String s = sql.stripLeading();
        int end = 0;
        while (end < s.length() && Character.isLetter(s.charAt(end))) end++;
        return s.substring(0, end).toLowerCase(java.util.Locale.ROOT);
    }
}
