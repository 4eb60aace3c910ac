package com.example.expensechat.service.sql.druid.service;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLLimit;
import com.alibaba.druid.sql.ast.SQLOrderBy;
import com.alibaba.druid.sql.ast.SQLSetQuantifier;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.expr.SQLAllColumnExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExprGroup;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOperator;
import com.alibaba.druid.sql.ast.expr.SQLCharExpr;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLIntegerExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectGroupByClause;
import com.alibaba.druid.sql.ast.statement.SQLSelectItem;
import com.alibaba.druid.sql.ast.statement.SQLSelectOrderByItem;
import com.alibaba.druid.sql.ast.statement.SQLSelectQuery;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLTableSource;
import com.alibaba.druid.sql.ast.statement.SQLUpdateSetItem;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlInsertStatement;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlUpdateStatement;
import com.example.expensechat.exception.ValidationException;
import com.example.expensechat.service.sql.druid.implement.StatementParserImpl;
import com.example.expensechat.service.sql.dto.Assignment;
import com.example.expensechat.service.sql.dto.ColumnRef;
import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.Join;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.Predicate;
import com.example.expensechat.service.sql.dto.SelectItem;
import com.example.expensechat.service.sql.dto.SelectStatement;
import com.example.expensechat.service.sql.dto.SqlValue;
import com.example.expensechat.service.sql.dto.UpdateStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parser dựa trên Alibaba Druid (dialect MySQL).
 * - Chỉ nhận đúng 1 statement; mọi lỗi parse được gói thành ValidationException.
 * - Cột được chuẩn hoá về tên camelCase và alias b/c/e ngay tại đây, các tầng sau chỉ làm việc với IR.
 */
@Slf4j
@Service
public class StatementParser implements StatementParserImpl {

    /* ===================== INSERT ===================== */

    @Override
    public InsertStatement parseInsert(String sql) {
        SQLStatement st = parseSingle(sql);
        if (!(st instanceof SQLInsertStatement insert)) {
            throw new ValidationException("statement", sql, "Expected an INSERT statement");
        }
        if (insert.getQuery() != null) {
            throw new ValidationException("statement", sql, "INSERT ... SELECT is not allowed");
        }
        if (insert instanceof MySqlInsertStatement my && !my.getDuplicateKeyUpdate().isEmpty()) {
            throw new ValidationException("statement", sql, "ON DUPLICATE KEY UPDATE is not allowed");
        }
        if (insert.getValuesList().size() != 1) {
            throw new ValidationException("values", String.valueOf(insert.getValuesList().size()),
                    "Only single-row INSERT statements are allowed");
        }
        OwnedTable table = ownedTable(insert.getTableSource());
        ExprGuard.check(insert);

        List<String> columns = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SQLExpr c : insert.getColumns()) {
            String raw = columnName(c);
            String column = table.canonicalColumn(raw).orElse(raw);
            if (!seen.add(column.toLowerCase(Locale.ROOT))) {
                throw new ValidationException("column", column, "Column \"%s\" is listed twice".formatted(column));
            }
            columns.add(column);
        }
        if (columns.isEmpty()) {
            throw new ValidationException("columns", "", "INSERT must list its columns");
        }

        List<SQLExpr> rawValues = insert.getValuesList().get(0).getValues();
        if (rawValues.size() != columns.size()) {
            throw new ValidationException("values", String.valueOf(rawValues.size()),
                    "INSERT lists %d column(s) but %d value(s)".formatted(columns.size(), rawValues.size()));
        }
        List<SqlValue> values = new ArrayList<>(rawValues.size());
        for (SQLExpr v : rawValues) {
            values.add(new SqlValue(ScopedOutputVisitor.render(v, ColumnScope.none()).sql()));
        }
        return new InsertStatement(table, columns, values);
    }

    /* ===================== UPDATE ===================== */

    @Override
    public UpdateStatement parseUpdate(String sql) {
        SQLStatement st = parseSingle(sql);
        if (!(st instanceof SQLUpdateStatement update)) {
            throw new ValidationException("statement", sql, "Expected an UPDATE statement");
        }
        if (!(update.getTableSource() instanceof SQLExprTableSource source)) {
            throw new ValidationException("table", String.valueOf(update.getTableSource()),
                    "UPDATE must target exactly one table");
        }
        OwnedTable table = ownedTable(source);
        ExprGuard.check(update);
        ColumnScope scope = ColumnScope.forUpdate(table, alias(source.getAlias()));

        List<Assignment> assignments = new ArrayList<>();
        for (SQLUpdateSetItem item : update.getItems()) {
            String column;
            if (item.getColumn() instanceof SQLPropertyExpr p && p.getOwner() instanceof SQLIdentifierExpr owner) {
                column = scope.resolveQualified(SQLUtils.normalize(owner.getName()), SQLUtils.normalize(p.getName())).column();
            } else {
                String raw = columnName(item.getColumn());
                column = table.canonicalColumn(raw).orElse(raw);
            }
            SqlValue value = new SqlValue(ScopedOutputVisitor.render(item.getValue(), scope).sql());
            assignments.add(new Assignment(column, value));
        }

        List<Predicate> filters = predicates(update.getWhere(), scope);
        List<String> orderBy = List.of();
        Long limit = null;
        if (update instanceof MySqlUpdateStatement my) {
            orderBy = orderBy(my.getOrderBy(), scope);
            limit = my.getLimit() == null ? null : limitValue(my.getLimit().getRowCount());
        }
        return new UpdateStatement(table, assignments, filters, orderBy, limit);
    }

    /* ===================== SELECT ===================== */

    @Override
    public SelectStatement parseSelect(String sql) {
        SQLStatement st = parseSingle(sql);
        if (!(st instanceof SQLSelectStatement selectStatement)) {
            throw new ValidationException("statement", sql, "Expected a SELECT statement");
        }
        SQLSelect select = selectStatement.getSelect();
        if (select.getWithSubQuery() != null) {
            throw new ValidationException("statement", sql, "WITH clauses are not allowed");
        }
        SQLSelectQuery query = select.getQuery();
        if (!(query instanceof SQLSelectQueryBlock block)) {
            throw new ValidationException("statement", sql, "UNION and nested queries are not allowed");
        }
        if (block.getFrom() == null) {
            throw new ValidationException("table", "", "SELECT must read from books, categories or expenses");
        }
        ExprGuard.check(block);

        // bảng trong FROM/JOIN
        Map<String, OwnedTable> declared = new LinkedHashMap<>();
        List<OwnedTable> tables = new ArrayList<>();
        List<SQLJoinTableSource> joinNodes = new ArrayList<>();
        collectTables(block.getFrom(), declared, tables, joinNodes);
        OwnedTable base = tables.stream().max(java.util.Comparator.comparingInt(OwnedTable::depth)).orElseThrow();

        Set<String> selectAliases = new LinkedHashSet<>();
        for (SQLSelectItem item : block.getSelectList()) {
            String a = alias(item.getAlias());
            if (a != null) selectAliases.add(a);
        }
        ColumnScope scope = ColumnScope.forSelect(declared, base, selectAliases);

        List<SelectItem> projection = new ArrayList<>();
        for (SQLSelectItem item : block.getSelectList()) {
            projection.add(selectItem(item, scope));
        }

        List<Join> joins = new ArrayList<>();
        for (SQLJoinTableSource j : joinNodes) {
            OwnedTable right = ownedTable((SQLExprTableSource) j.getRight());
            String on = j.getCondition() == null ? null : ScopedOutputVisitor.render(j.getCondition(), scope).sql();
            joins.add(new Join(right, on));
        }

        List<Predicate> filters = predicates(block.getWhere(), scope);

        List<String> groupBy = new ArrayList<>();
        String having = null;
        SQLSelectGroupByClause group = block.getGroupBy();
        if (group != null) {
            for (SQLExpr g : group.getItems()) {
                groupBy.add(ScopedOutputVisitor.render(g, scope, true).sql());
            }
            if (group.getHaving() != null) {
                having = ScopedOutputVisitor.render(group.getHaving(), scope, true).sql();
            }
        }

        SQLOrderBy order = block.getOrderBy() != null ? block.getOrderBy() : select.getOrderBy();
        List<String> orderBy = orderBy(order, scope);

        Long limit = null;
        Long offset = null;
        SQLLimit l = block.getLimit();
        if (l != null) {
            limit = limitValue(l.getRowCount());
            offset = l.getOffset() == null ? null : limitValue(l.getOffset());
        }
        boolean distinct = block.getDistionOption() == SQLSetQuantifier.DISTINCT;
        return new SelectStatement(distinct, projection, base, joins, filters,
                groupBy, having, orderBy, limit, offset);
    }

    /* ===================== Helpers ===================== */

    private static SQLStatement parseSingle(String sql) {
        final List<SQLStatement> list;
        try {
            list = SQLUtils.parseStatements(sql, DbType.mysql);
        } catch (RuntimeException e) {
            log.warn("Druid parse failed: {}", e.getMessage());
            throw new ValidationException("statement", sql, "Could not parse SQL: " + firstLine(e.getMessage()));
        }
        if (list.size() != 1) {
            throw new ValidationException("statement", sql, "Expected exactly one statement, got " + list.size());
        }
        return list.get(0);
    }

    private static void collectTables(SQLTableSource source, Map<String, OwnedTable> declared,
                                      List<OwnedTable> tables, List<SQLJoinTableSource> joins) {
        if (source instanceof SQLExprTableSource expr) {
            OwnedTable t = ownedTable(expr);
            if (tables.contains(t)) {
                throw new ValidationException("table", t.tableName(), "Table %s is referenced twice".formatted(t.tableName()));
            }
            tables.add(t);
            declared.put(t.tableName(), t);
            String a = alias(expr.getAlias());
            if (a != null) declared.put(a.toLowerCase(Locale.ROOT), t);
        } else if (source instanceof SQLJoinTableSource join) {
            collectTables(join.getLeft(), declared, tables, joins);
            if (!(join.getRight() instanceof SQLExprTableSource)) {
                throw new ValidationException("table", String.valueOf(join.getRight()), "Only plain tables can be joined");
            }
            collectTables(join.getRight(), declared, tables, joins);
            joins.add(join);
        } else {
            throw new ValidationException("table", String.valueOf(source), "Subqueries in FROM are not allowed");
        }
    }

    private static OwnedTable ownedTable(SQLTableSource source) {
        if (!(source instanceof SQLExprTableSource expr) || !(expr.getExpr() instanceof SQLIdentifierExpr id)) {
            throw new ValidationException("table", String.valueOf(source),
                    "Only books, categories and expenses can be used (no schema prefix)");
        }
        String name = SQLUtils.normalize(id.getName());
        return OwnedTable.fromName(name).orElseThrow(() -> new ValidationException("table", name,
                "Table \"%s\" is not available".formatted(name)));
    }

    private static SelectItem selectItem(SQLSelectItem item, ColumnScope scope) {
        SQLExpr expr = item.getExpr();
        String alias = alias(item.getAlias());
        if (expr instanceof SQLAllColumnExpr) {
            return new SelectItem("*", null, false, true);
        }
        boolean aggregate = ExprGuard.check(expr);
        String rendered = ScopedOutputVisitor.render(expr, scope).sql();
        boolean wildcard = expr instanceof SQLPropertyExpr p && "*".equals(p.getName());
        return new SelectItem(rendered, alias, aggregate, wildcard);
    }

    private static List<Predicate> predicates(SQLExpr where, ColumnScope scope) {
        List<Predicate> out = new ArrayList<>();
        if (where == null) return out;
        List<SQLExpr> conjuncts = new ArrayList<>();
        flatten(where, conjuncts);
        for (SQLExpr c : conjuncts) {
            ScopedOutputVisitor.Rendered r = ScopedOutputVisitor.render(c, scope);
            ColumnRef eqColumn = null;
            String eqLiteral = null;
            if (c instanceof SQLBinaryOpExpr b && b.getOperator() == SQLBinaryOperator.Equality) {
                SQLExpr col = b.getRight() instanceof SQLCharExpr ? b.getLeft() : b.getRight();
                SQLExpr lit = b.getRight() instanceof SQLCharExpr ? b.getRight() : b.getLeft();
                if (lit instanceof SQLCharExpr ch && (col instanceof SQLIdentifierExpr || col instanceof SQLPropertyExpr)) {
                    List<ColumnRef> refs = ScopedOutputVisitor.render(col, scope).columns();
                    if (refs.size() == 1) {
                        eqColumn = refs.get(0);
                        eqLiteral = ch.getText();
                    }
                }
            }
            out.add(new Predicate(r.sql(), r.columns(), isCompound(c), false, eqColumn, eqLiteral));
        }
        return out;
    }

    private static void flatten(SQLExpr expr, List<SQLExpr> out) {
        if (expr instanceof SQLBinaryOpExpr b && b.getOperator() == SQLBinaryOperator.BooleanAnd) {
            flatten(b.getLeft(), out);
            flatten(b.getRight(), out);
        } else if (expr instanceof SQLBinaryOpExprGroup g && g.getOperator() == SQLBinaryOperator.BooleanAnd) {
            for (SQLExpr item : g.getItems()) flatten(item, out);
        } else {
            out.add(expr);
        }
    }

    private static boolean isCompound(SQLExpr expr) {
        SQLBinaryOperator op = null;
        if (expr instanceof SQLBinaryOpExpr b) op = b.getOperator();
        if (expr instanceof SQLBinaryOpExprGroup g) op = g.getOperator();
        return op == SQLBinaryOperator.BooleanOr || op == SQLBinaryOperator.BooleanXor;
    }

    private static List<String> orderBy(SQLOrderBy order, ColumnScope scope) {
        List<String> out = new ArrayList<>();
        if (order == null) return out;
        for (SQLSelectOrderByItem item : order.getItems()) {
            out.add(ScopedOutputVisitor.render(item, scope, true).sql());
        }
        return out;
    }

    private static Long limitValue(SQLExpr expr) {
        if (expr instanceof SQLIntegerExpr i && i.getNumber().longValue() >= 0) {
            return i.getNumber().longValue();
        }
        throw new ValidationException("limit", String.valueOf(expr), "LIMIT must be a non-negative integer");
    }

    private static String columnName(SQLExpr expr) {
        if (expr instanceof SQLIdentifierExpr id) return SQLUtils.normalize(id.getName());
        if (expr instanceof SQLPropertyExpr p) return SQLUtils.normalize(p.getName());
        throw new ValidationException("column", String.valueOf(expr), "Unsupported column expression");
    }

    private static String alias(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return SQLUtils.normalize(raw.trim());
    }

    private static String firstLine(String s) {
        if (s == null) return "syntax error";
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }
}
