package com.example.expensechat.service.sql.dto;

/**
 * @param sql       biểu thức đã chuẩn hoá alias
 * @param alias     alias của cột (có thể null)
 * @param aggregate true nếu chứa hàm gộp (SUM, COUNT...)
 * @param wildcard  true cho {@code *}
 */
public record SelectItem(String sql, String alias, boolean aggregate, boolean wildcard) {

    public static SelectItem column(String sql, String alias) {
        return new SelectItem(sql, alias, false, false);
    }

    public String render() {
        return alias == null ? sql : sql + " AS " + alias;
    }
}
