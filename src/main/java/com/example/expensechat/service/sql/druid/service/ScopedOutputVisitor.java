package com.example.expensechat.service.sql.druid.service;

import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.expr.SQLCharExpr;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.dialect.mysql.visitor.MySqlOutputVisitor;
import com.example.expensechat.exception.ValidationException;
import com.example.expensechat.service.sql.dto.ColumnRef;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.SqlValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Output visitor của Druid (MySQL) in lại biểu thức với cột đã chuẩn hoá và
 * literal chuỗi được quote lại theo một cách duy nhất. Ghi nhận các cột đã gặp.
 */
final class ScopedOutputVisitor extends MySqlOutputVisitor {

    private final StringBuilder out;
    private final ColumnScope scope;
    private final boolean aliasesVisible;
    private final List<ColumnRef> columns = new ArrayList<>();

    private ScopedOutputVisitor(StringBuilder out, ColumnScope scope, boolean aliasesVisible) {
        super(out);
        this.out = out;
        this.scope = scope;
        this.aliasesVisible = aliasesVisible;
    }

    static Rendered render(SQLObject node, ColumnScope scope) {
        return render(node, scope, false);
    }

    /** @param aliasesVisible true cho ORDER BY/GROUP BY/HAVING, nơi alias của SELECT được phép */
    static Rendered render(SQLObject node, ColumnScope scope, boolean aliasesVisible) {
        ScopedOutputVisitor v = new ScopedOutputVisitor(new StringBuilder(), scope, aliasesVisible);
        node.accept(v);
        return new Rendered(v.out.toString().trim(), List.copyOf(v.columns));
    }

    @Override
    public boolean visit(SQLIdentifierExpr x) {
        String name = SQLUtils.normalize(x.getName());
        Optional<ColumnRef> ref = aliasesVisible && scope.isSelectAlias(name)
                ? Optional.empty()
                : scope.resolveBare(name);
        if (ref.isPresent()) {
            columns.add(ref.get());
            print(scope.render(ref.get()));
        } else {
            print(x.getName());
        }
        return false;
    }

    @Override
    public boolean visit(SQLPropertyExpr x) {
        SQLExpr owner = x.getOwner();
        if (!(owner instanceof SQLIdentifierExpr ownerId)) {
            throw new ValidationException("column", x.toString(), "Schema-qualified names are not allowed");
        }
        String ownerName = SQLUtils.normalize(ownerId.getName());
        String name = SQLUtils.normalize(x.getName());
        if ("*".equals(name)) {
            OwnedTable table = scope.table(ownerName);
            print(scope.renderStar(table));
            return false;
        }
        ColumnRef ref = scope.resolveQualified(ownerName, name);
        columns.add(ref);
        print(scope.render(ref));
        return false;
    }

    @Override
    public boolean visit(SQLCharExpr x) {
        String text = x.getText();
        if (text.indexOf('\\') >= 0) {
            throw new ValidationException("literal", text, "Backslashes are not allowed in string values");
        }
        print(SqlValue.quote(text));
        return false;
    }

    record Rendered(String sql, List<ColumnRef> columns) {
    }
}
