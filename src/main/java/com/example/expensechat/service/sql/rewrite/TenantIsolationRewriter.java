package com.example.expensechat.service.sql.rewrite;

import com.example.expensechat.config.GatewayConfig;
import com.example.expensechat.exception.ValidationException;
import com.example.expensechat.service.scope.UserScope;
import com.example.expensechat.service.sql.dto.ClassifiedStatement;
import com.example.expensechat.service.sql.dto.ColumnRef;
import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.Join;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.Predicate;
import com.example.expensechat.service.sql.dto.SelectItem;
import com.example.expensechat.service.sql.dto.SelectStatement;
import com.example.expensechat.service.sql.dto.SqlValue;
import com.example.expensechat.service.sql.dto.UpdateStatement;
import com.example.expensechat.service.sql.extract.SqlText;
import com.example.expensechat.service.sql.validate.SemanticValidator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Ép mọi câu lệnh vào phạm vi của người dùng theo chuỗi Expense → Category → Book → User.
 * Làm việc trên IR và idempotent: rewrite(rewrite(s)) cho cùng kết quả với rewrite(s).
 */
@Component
public class TenantIsolationRewriter {

    private static final Pattern OWNER_TOKEN = Pattern.compile("(?i)\\buserid\\b");

    private final GatewayConfig gatewayConfig;
    private final Supplier<String> idGenerator;

    @Autowired
    public TenantIsolationRewriter(GatewayConfig gatewayConfig) {
        this(gatewayConfig, () -> UUID.randomUUID().toString());
    }

    public TenantIsolationRewriter(GatewayConfig gatewayConfig, Supplier<String> idGenerator) {
        this.gatewayConfig = gatewayConfig;
        this.idGenerator = idGenerator;
    }

    /** @param scope người dùng đang gửi yêu cầu (id + books để đổi nhãn book trong SELECT) */
    public ClassifiedStatement rewrite(ClassifiedStatement statement, UserScope scope) {
        String userId = requireSafeUserId(scope.userId());
        if (statement instanceof SelectStatement select) return rewriteSelect(select, userId, scope);
        if (statement instanceof UpdateStatement update) return rewriteUpdate(update, userId);
        if (statement instanceof InsertStatement insert) return rewriteInsert(insert, userId);
        return statement;
    }

    /* ===================== SELECT ===================== */

    private SelectStatement rewriteSelect(SelectStatement select, String userId, UserScope scope) {
        OwnedTable base = select.baseTable();

        List<SelectItem> projection = new ArrayList<>();
        for (SelectItem item : select.projection()) {
            if (item.wildcard() && "*".equals(item.sql())) {
                projection.addAll(expandStar(base));
            } else {
                projection.add(item);
            }
        }
        if (base == OwnedTable.EXPENSES && !select.aggregated() && !hasCurrency(projection)) {
            projection.add(SelectItem.column("b.currency", "book_currency"));
        }

        List<Predicate> filters = new ArrayList<>();
        for (Predicate p : select.filters()) {
            if (isOwnerPredicate(p)) continue;
            filters.add(resolveBookLabel(p, scope));
        }
        filters.add(Predicate.owner("b.userId = " + SqlValue.quote(userId), new ColumnRef(OwnedTable.BOOKS, OwnedTable.OWNER_COLUMN)));

        long cap = gatewayConfig.maxSelectRows();
        Long limit = select.limit() == null ? cap : Math.min(select.limit(), cap);
        return select.withScope(projection, canonicalJoins(base), filters, limit);
    }

    static List<Join> canonicalJoins(OwnedTable base) {
        return switch (base) {
            case EXPENSES -> List.of(
                    new Join(OwnedTable.CATEGORIES, "e.categoryId = c.id"),
                    new Join(OwnedTable.BOOKS, "c.bookId = b.id"));
            case CATEGORIES -> List.of(new Join(OwnedTable.BOOKS, "c.bookId = b.id"));
            case BOOKS -> List.of();
        };
    }

    private static List<SelectItem> expandStar(OwnedTable base) {
        return switch (base) {
            case EXPENSES -> List.of(
                    SelectItem.column("e.*", null),
                    SelectItem.column("c.name", "category_name"),
                    SelectItem.column("b.name", "book_name"),
                    SelectItem.column("b.currency", "book_currency"));
            case CATEGORIES -> List.of(
                    SelectItem.column("c.*", null),
                    SelectItem.column("b.name", "book_name"));
            case BOOKS -> List.of(SelectItem.column("b.*", null));
        };
    }

    private static boolean hasCurrency(List<SelectItem> projection) {
        return projection.stream().anyMatch(i ->
                "b.currency".equalsIgnoreCase(i.sql()) || "b.*".equals(i.sql())
                        || (i.alias() != null && i.alias().toLowerCase(Locale.ROOT).endsWith("currency")));
    }

    /** {@code c.bookId = 'House'}: nhãn trùng tên một book của người dùng được thay bằng id của book đó. */
    private static Predicate resolveBookLabel(Predicate p, UserScope scope) {
        if (!p.isEquality() || p.compound()) return p;
        ColumnRef col = p.equalityColumn();
        boolean idColumn = col.is("bookId") || (col.table() == OwnedTable.BOOKS && col.is("id"));
        if (!idColumn || SemanticValidator.isSurrogateKey(p.equalityLiteral())) return p;
        return scope.bookByName(p.equalityLiteral())
                .map(book -> new Predicate(col.qualified() + " = " + SqlValue.quote(book.getId()),
                        List.of(col), false, false, col, book.getId()))
                .orElse(p);
    }

    /* ===================== UPDATE ===================== */

    private UpdateStatement rewriteUpdate(UpdateStatement update, String userId) {
        List<Predicate> filters = new ArrayList<>();
        for (Predicate p : update.filters()) {
            if (!isOwnerPredicate(p)) filters.add(p);
        }
        String uid = SqlValue.quote(userId);
        Predicate owner = switch (update.table()) {
            case BOOKS -> Predicate.owner("userId = " + uid,
                    new ColumnRef(OwnedTable.BOOKS, "userId"));
            case CATEGORIES -> Predicate.owner("bookId IN (SELECT b.id FROM books b WHERE b.userId = " + uid + ")",
                    new ColumnRef(OwnedTable.CATEGORIES, "bookId"));
            case EXPENSES -> Predicate.owner("categoryId IN (SELECT c.id FROM categories c JOIN books b ON c.bookId = b.id WHERE b.userId = " + uid + ")",
                    new ColumnRef(OwnedTable.EXPENSES, "categoryId"));
        };
        filters.add(owner);
        return update.withFilters(filters);
    }

    /* ===================== INSERT ===================== */

    private InsertStatement rewriteInsert(InsertStatement insert, String userId) {
        InsertStatement out = insert;
        boolean keepId = out.valueOf("id").flatMap(SqlValue::text).map(SemanticValidator::isUuid).orElse(false);
        if (!keepId) {
            out = out.with("id", SqlValue.string(idGenerator.get()));
        }
        if (out.table() == OwnedTable.BOOKS) {
            out = out.with(OwnedTable.OWNER_COLUMN, SqlValue.string(userId));
        }

        out = out.withDefault("createdAt", SqlValue.NOW).withDefault("updatedAt", SqlValue.NOW);
        switch (out.table()) {
            case BOOKS -> out = out
                    .withDefault("description", SqlValue.EMPTY)
                    .withDefault("isArchived", SqlValue.FALSE);
            case CATEGORIES -> out = out
                    .withDefault("description", SqlValue.EMPTY)
                    .withDefault("icon", SqlValue.EMPTY)
                    .withDefault("color", SqlValue.EMPTY)
                    .withDefault("isDisabled", SqlValue.FALSE)
                    .withDefault("isDefault", SqlValue.FALSE);
            case EXPENSES -> {
                out = out
                        .withDefault("date", SqlValue.CURDATE)
                        .withDefault("description", SqlValue.EMPTY)
                        .withDefault("paymentMethod", SqlValue.string("Other"))
                        .withDefault("isDisabled", SqlValue.FALSE);
                String method = out.valueOf("paymentMethod").flatMap(SqlValue::text).orElse("Other");
                for (String canonical : SemanticValidator.PAYMENT_METHODS) {
                    if (canonical.equalsIgnoreCase(method) && !canonical.equals(method)) {
                        out = out.with("paymentMethod", SqlValue.string(canonical));
                    }
                }
            }
        }
        return out;
    }

    /* ===================== Helpers ===================== */

    /** Vế lọc theo người dùng, kể cả {@code userId = ...} trên bảng không có cột đó. */
    public static boolean isOwnerPredicate(Predicate p) {
        return p.ownerScope() || p.references(OwnedTable.OWNER_COLUMN)
                || OWNER_TOKEN.matcher(SqlText.maskLiterals(p.sql())).find();
    }

    static String requireSafeUserId(String userId) {
        if (userId == null || userId.isBlank() || userId.indexOf('\'') >= 0 || userId.indexOf('\\') >= 0) {
            throw new ValidationException("userId", String.valueOf(userId), "Invalid user id");
        }
        return userId;
    }
}
