package com.example.expensechat.service.sql.druid.service;

import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;
import com.alibaba.druid.sql.ast.expr.SQLExistsExpr;
import com.alibaba.druid.sql.ast.expr.SQLInSubQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.expr.SQLQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLVariantRefExpr;
import com.alibaba.druid.sql.dialect.mysql.visitor.MySqlASTVisitorAdapter;
import com.example.expensechat.exception.ValidationException;

import java.util.Locale;
import java.util.Set;

/**
 * Duyệt cây biểu thức: chặn subquery, EXISTS, IN (subquery), biến/placeholder và một số
 * hàm lộ thông tin máy chủ. Đồng thời ghi nhận có hàm gộp hay không.
 */
final class ExprGuard extends MySqlASTVisitorAdapter {

    private static final Set<String> FORBIDDEN_FUNCTIONS = Set.of(
            "load_file", "sleep", "benchmark", "get_lock", "release_lock", "database", "schema",
            "version", "user", "current_user", "system_user", "session_user", "connection_id");

    private boolean aggregate;

    static boolean check(SQLObject node) {
        ExprGuard guard = new ExprGuard();
        node.accept(guard);
        return guard.aggregate;
    }

    @Override
    public boolean visit(SQLQueryExpr x) {
        throw new ValidationException("subquery", x.toString(), "Subqueries are not allowed");
    }

    @Override
    public boolean visit(SQLExistsExpr x) {
        throw new ValidationException("subquery", x.toString(), "EXISTS subqueries are not allowed");
    }

    @Override
    public boolean visit(SQLInSubQueryExpr x) {
        throw new ValidationException("subquery", x.toString(), "IN (subquery) is not allowed");
    }

    @Override
    public boolean visit(SQLVariantRefExpr x) {
        throw new ValidationException("variable", x.getName(), "Variables and placeholders are not allowed");
    }

    @Override
    public boolean visit(SQLMethodInvokeExpr x) {
        checkFunction(x.getMethodName());
        return true;
    }

    @Override
    public boolean visit(SQLAggregateExpr x) {
        checkFunction(x.getMethodName());
        aggregate = true;
        return true;
    }

    private static void checkFunction(String name) {
        if (name != null && FORBIDDEN_FUNCTIONS.contains(name.toLowerCase(Locale.ROOT))) {
            throw new ValidationException("function", name, "Function %s is not allowed".formatted(name));
        }
    }
}
