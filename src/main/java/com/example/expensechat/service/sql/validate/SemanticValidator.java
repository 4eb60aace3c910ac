package com.example.expensechat.service.sql.validate;

import com.example.expensechat.entity.Book;
import com.example.expensechat.entity.Category;
import com.example.expensechat.exception.DuplicateEntityException;
import com.example.expensechat.exception.ValidationException;
import com.example.expensechat.service.context.ConversationContext;
import com.example.expensechat.service.currency.CurrencyCatalog;
import com.example.expensechat.service.scope.UserScope;
import com.example.expensechat.service.sql.dto.ClassifiedStatement;
import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.Predicate;
import com.example.expensechat.service.sql.dto.SelectStatement;
import com.example.expensechat.service.sql.dto.SqlValue;
import com.example.expensechat.service.sql.dto.UnsupportedStatement;
import com.example.expensechat.service.sql.dto.UpdateStatement;
import com.example.expensechat.service.sql.rewrite.TenantIsolationRewriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Kiểm tra ngữ nghĩa trên IR trước khi rewrite: trường bắt buộc, dạng khoá, quyền sở hữu,
 * trùng tên, allowlist của UPDATE. Không bao giờ tự sửa câu lệnh.
 */
@Slf4j
@Component
public class SemanticValidator {

    public static final List<String> PAYMENT_METHODS = List.of("Cash", "Credit Card", "Wire Transfer", "PayPal", "Other");

    private static final Pattern UUID_SHAPE =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern CUID_SHAPE = Pattern.compile("^c[a-z0-9]{24}$");

    public static boolean isSurrogateKey(String value) {
        return value != null && (UUID_SHAPE.matcher(value).matches() || CUID_SHAPE.matcher(value).matches());
    }

    public static boolean isUuid(String value) {
        return value != null && UUID_SHAPE.matcher(value).matches();
    }

    /**
     * @return category còn thiếu (expense chờ tạo category), rỗng nếu câu lệnh hợp lệ
     * @throws ValidationException      câu lệnh sai
     * @throws DuplicateEntityException book/category trùng tên
     */
    public Optional<MissingCategory> validate(ClassifiedStatement statement, UserScope scope,
                                              String utterance, ConversationContext context) {
        if (statement instanceof InsertStatement insert) {
            return validateInsert(insert, scope, utterance, context);
        }
        if (statement instanceof UpdateStatement update) {
            validateUpdate(update);
        } else if (statement instanceof SelectStatement select) {
            validateSelect(select, scope);
        } else if (statement instanceof UnsupportedStatement unsupported) {
            throw new ValidationException("statement", unsupported.verb(),
                    "Only INSERT, UPDATE and SELECT statements are supported");
        }
        return Optional.empty();
    }

    /* ===================== INSERT ===================== */

    private Optional<MissingCategory> validateInsert(InsertStatement insert, UserScope scope,
                                                     String utterance, ConversationContext context) {
        OwnedTable table = insert.table();
        for (String column : insert.columns()) {
            if (table.canonicalColumn(column).isEmpty()) {
                throw new ValidationException("column", column,
                        "Unknown column \"%s\" for %s".formatted(column, table.tableName()));
            }
        }

        if (table == OwnedTable.EXPENSES) {
            return validateExpenseInsert(insert, scope, utterance, context);
        }
        if (table == OwnedTable.CATEGORIES) {
            validateCategoryInsert(insert, scope);
        } else {
            validateBookInsert(insert, scope);
        }
        return Optional.empty();
    }

    private Optional<MissingCategory> validateExpenseInsert(InsertStatement insert, UserScope scope,
                                                            String utterance, ConversationContext context) {
        checkAmount(required(insert, "amount"));
        insert.valueOf("paymentMethod").ifPresent(this::checkPaymentMethod);
        insert.valueOf("date").ifPresent(this::checkDate);

        SqlValue categoryValue = required(insert, "categoryId");
        String categoryId = categoryValue.text().orElseThrow(() -> new ValidationException("categoryId",
                categoryValue.sql(), "categoryId must be a quoted category id"));

        if (isSurrogateKey(categoryId)) {
            Category category = scope.categoryById(categoryId).orElseThrow(() -> new ValidationException(
                    "categoryId", categoryId, "That category does not belong to any of your books"));
            return checkCategoryBook(category, scope, utterance, context);
        }

        // categoryId là nhãn: xác định book đích rồi quyết định
        Optional<Book> target = namedOrLastBook(scope, utterance, context).or(scope::onlyBook);
        if (target.isEmpty()) {
            throw new ValidationException("categoryId", categoryId,
                    "Which book should \"%s\" go to? Your books are: %s.".formatted(categoryId, scope.bookNames()));
        }
        Book book = target.get();
        if (scope.categoryByName(book.getId(), categoryId).isPresent()) {
            throw new ValidationException("categoryId", categoryId,
                    "Category \"%s\" must be referenced by its id, please try again.".formatted(categoryId));
        }
        log.info("Category \"{}\" is missing in book \"{}\"", categoryId, book.getName());
        return Optional.of(new MissingCategory(categoryId, book));
    }

    /** Category có id hợp lệ nhưng nằm ở book khác với book người dùng nhắc tới: không được thay thế. */
    private Optional<MissingCategory> checkCategoryBook(Category category, UserScope scope,
                                                        String utterance, ConversationContext context) {
        Optional<Book> target = namedOrLastBook(scope, utterance, context);
        if (target.isEmpty() || target.get().getId().equals(category.getBookId())) {
            return Optional.empty();
        }
        Book book = target.get();
        if (scope.categoryByName(book.getId(), category.getName()).isPresent()) {
            throw new ValidationException("categoryId", category.getId(),
                    "Category \"%s\" belongs to another book, use the one in \"%s\"."
                            .formatted(category.getName(), book.getName()));
        }
        log.info("Category \"{}\" picked from another book, missing in \"{}\"", category.getName(), book.getName());
        return Optional.of(new MissingCategory(category.getName(), book));
    }

    private static Optional<Book> namedOrLastBook(UserScope scope, String utterance, ConversationContext context) {
        return scope.bookNamedIn(utterance)
                .or(() -> Optional.ofNullable(context.lastBook()).flatMap(ref -> scope.bookById(ref.id())));
    }

    private void validateCategoryInsert(InsertStatement insert, UserScope scope) {
        String name = requiredText(insert, "name");
        String bookId = requiredText(insert, "bookId");
        if (!isSurrogateKey(bookId)) {
            throw new ValidationException("bookId", bookId, "bookId must be a book id, not a name");
        }
        if (scope.bookById(bookId).isEmpty()) {
            throw new ValidationException("bookId", bookId, "That book does not belong to you");
        }
        if (insert.valueOf("isDefault").map(SqlValue::isTrue).orElse(false)) {
            throw new ValidationException("isDefault", "true", "Default categories cannot be created");
        }
        if (scope.categoryByName(bookId, name).isPresent()) {
            throw new DuplicateEntityException("Category", name);
        }
    }

    private void validateBookInsert(InsertStatement insert, UserScope scope) {
        String name = requiredText(insert, "name");
        checkCurrency(required(insert, "currency"));
        if (scope.bookByName(name).isPresent()) {
            throw new DuplicateEntityException("Book", name);
        }
    }

    /* ===================== UPDATE ===================== */

    private void validateUpdate(UpdateStatement update) {
        OwnedTable table = update.table();
        for (var a : update.assignments()) {
            String column = a.column();
            if (OwnedTable.SENSITIVE_COLUMNS.stream().anyMatch(s -> s.equalsIgnoreCase(column))) {
                throw new ValidationException("column", column, "Column \"%s\" cannot be changed".formatted(column));
            }
            if (!table.updatableColumns().contains(column)) {
                throw new ValidationException("column", column,
                        "Column \"%s\" of %s cannot be updated".formatted(column, table.tableName()));
            }
            switch (column) {
                case "amount" -> checkAmount(a.value());
                case "currency" -> checkCurrency(a.value());
                case "paymentMethod" -> checkPaymentMethod(a.value());
                case "date" -> checkDate(a.value());
                case "name" -> {
                    if (a.value().text().map(String::isBlank).orElse(true)) {
                        throw new ValidationException("name", a.value().sql(), "Name cannot be empty");
                    }
                }
                default -> { }
            }
        }
        boolean targeted = update.filters().stream().anyMatch(p -> !TenantIsolationRewriter.isOwnerPredicate(p));
        if (!targeted && update.limit() == null) {
            throw new ValidationException("where", "",
                    "UPDATE must say which %s to change".formatted(table.tableName()));
        }
    }

    /* ===================== SELECT ===================== */

    private void validateSelect(SelectStatement select, UserScope scope) {
        for (Predicate p : select.filters()) {
            if (!p.isEquality() || p.compound()) continue;
            var col = p.equalityColumn();
            String literal = p.equalityLiteral();
            boolean bookName = col.table() == OwnedTable.BOOKS && col.is("name");
            boolean bookId = col.is("bookId") || (col.table() == OwnedTable.BOOKS && col.is("id"));
            if (!bookName && !bookId) continue;

            boolean resolves = scope.bookByName(literal).isPresent() || (bookId && scope.bookById(literal).isPresent());
            if (!resolves) {
                throw new ValidationException("book", literal,
                        "No book named \"%s\" was found. Your books are: %s.".formatted(literal, scope.bookNames()));
            }
        }
    }

    /* ===================== Helpers ===================== */

    private static SqlValue required(InsertStatement insert, String column) {
        SqlValue v = insert.valueOf(column).orElseThrow(() -> new ValidationException(column, "",
                "Missing required field \"%s\"".formatted(column)));
        if (v.sql().equalsIgnoreCase("null")) {
            throw new ValidationException(column, "NULL", "Field \"%s\" cannot be NULL".formatted(column));
        }
        return v;
    }

    private static String requiredText(InsertStatement insert, String column) {
        SqlValue v = required(insert, column);
        String text = v.text().orElseThrow(() -> new ValidationException(column, v.sql(),
                "Field \"%s\" must be a quoted value".formatted(column)));
        if (text.isBlank()) {
            throw new ValidationException(column, text, "Field \"%s\" cannot be empty".formatted(column));
        }
        return text;
    }

    private void checkAmount(SqlValue value) {
        BigDecimal amount = value.number().orElseThrow(() -> new ValidationException("amount", value.sql(),
                "Amount must be a number"));
        if (amount.signum() < 0) {
            throw new ValidationException("amount", value.sql(), "Amount cannot be negative");
        }
    }

    private void checkPaymentMethod(SqlValue value) {
        String method = value.text().orElse(value.sql());
        if (PAYMENT_METHODS.stream().noneMatch(m -> m.equalsIgnoreCase(method))) {
            throw new ValidationException("paymentMethod", method,
                    "Payment method must be one of: " + String.join(", ", PAYMENT_METHODS));
        }
    }

    private void checkCurrency(SqlValue value) {
        String currency = value.text().orElse(value.sql());
        if (!CurrencyCatalog.CODES.contains(currency)) {
            throw new ValidationException("currency", currency, "Unsupported currency \"%s\"".formatted(currency));
        }
    }

    private void checkDate(SqlValue value) {
        Optional<String> text = value.text();
        if (text.isEmpty()) return; // CURDATE(), DATE_SUB(...)
        try {
            LocalDate.parse(text.get());
        } catch (DateTimeParseException e) {
            throw new ValidationException("date", text.get(), "Date must look like YYYY-MM-DD");
        }
    }
}
