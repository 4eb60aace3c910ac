package com.example.expensechat.service.format;

import com.example.expensechat.entity.Book;
import com.example.expensechat.service.currency.CurrencyCatalog;
import com.example.expensechat.service.scope.UserScope;
import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.SqlValue;
import com.example.expensechat.service.sql.dto.StatementOutcome;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedCaseInsensitiveMap;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dựng câu trả lời cho người dùng từ kết quả thực thi. Mọi xác nhận đều đến từ đây,
 * không bao giờ từ text của model.
 */
@Component
public class ResponseFormatter {

    public static final String NO_OPERATION_WARNING = "⚠️ **No database operation performed.** The AI generated a success "
            + "message without creating the required SQL query.\n\nPlease try your request again with complete details "
            + "like \"Add expense $50 for groceries in the Food category\".";

    public static final String NO_SQL_HINT = "❌ **No SQL query found in response.** Please ask for a specific operation "
            + "(e.g., \"Create a book called Personal Budget\" or \"Show me all expenses from last month\").";

    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH);

    private static final Set<String> HIDDEN_FIELDS = Set.of(
            "id", "userid", "createdat", "updatedat", "isarchived", "isdisabled", "isdefault");

    private static final Set<String> HIDDEN_GENERIC = Set.of(
            "id", "userid", "bookid", "categoryid", "isdisabled", "isarchived", "isdefault", "createdat", "updatedat");

    public String format(List<StatementOutcome> outcomes, UserScope scope) {
        if (outcomes.size() == 1) return line(outcomes.get(0), scope);
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            lines.add((i + 1) + ". " + line(outcomes.get(i), scope));
        }
        return String.join("\n", lines);
    }

    public String line(StatementOutcome o, UserScope scope) {
        String text = switch (o.status()) {
            case FAILED -> "❌ " + o.message();
            case NEEDS_CATEGORY -> o.message();
            case SUCCESS -> switch (o.kind()) {
                case INSERT -> inserted(o.inserted(), scope);
                case UPDATE -> o.affectedRows() > 0
                        ? "✅ Successfully updated %d record(s)".formatted(o.affectedRows())
                        : "ℹ️ No matching records were found, nothing was updated";
                case SELECT -> report(o.rows());
                case UNSUPPORTED -> "❌ Unsupported statement";
            };
        };
        return o.note() == null ? text : text + "\n" + o.note();
    }

    /* ===================== INSERT ===================== */

    String inserted(InsertStatement insert, UserScope scope) {
        String currency = currencyOf(insert, scope).orElse(null);
        List<String> fields = new ArrayList<>();
        for (int i = 0; i < insert.columns().size(); i++) {
            String column = insert.columns().get(i);
            SqlValue value = insert.values().get(i);
            if (HIDDEN_FIELDS.contains(column.toLowerCase(Locale.ROOT)) || value.isFunctionCall()
                    || value.sql().equalsIgnoreCase("null")) {
                continue;
            }
            String shown = switch (column) {
                case "categoryId" -> value.text().flatMap(scope::categoryById)
                        .map(c -> "category: " + c.getName() + scope.bookOf(c).map(b -> " (" + b.getName() + ")").orElse(""))
                        .orElse(null);
                case "bookId" -> value.text().flatMap(scope::bookById).map(b -> "book: " + b.getName()).orElse(null);
                case "amount" -> value.number().map(n -> "amount: " + money(n, currency)).orElse(null);
                case "date" -> value.text().map(d -> "date: " + displayDate(d)).orElse(null);
                default -> value.text().filter(t -> !t.isBlank()).map(t -> column + ": " + t).orElse(null);
            };
            if (shown != null) fields.add(shown);
        }
        return fields.isEmpty() ? "✅ Successfully added" : "✅ Successfully added: " + String.join(", ", fields);
    }

    private static Optional<String> currencyOf(InsertStatement insert, UserScope scope) {
        if (insert.table() != OwnedTable.EXPENSES) return Optional.empty();
        return insert.valueOf("categoryId").flatMap(SqlValue::text)
                .flatMap(scope::categoryById)
                .flatMap(scope::bookOf)
                .map(Book::getCurrency);
    }

    /* ===================== SELECT ===================== */

    String report(List<Map<String, Object>> rawRows) {
        if (rawRows.isEmpty()) return "📊 No records found";
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> r : rawRows) {
            Map<String, Object> ci = new LinkedCaseInsensitiveMap<>(Locale.ROOT);
            ci.putAll(r);
            rows.add(ci);
        }

        Map<String, Object> first = rows.get(0);
        RowShape shape = RowShape.of(first);
        StringBuilder sb = new StringBuilder("📊 Found %d record%s:".formatted(rows.size(), rows.size() == 1 ? "" : "s"));
        for (int i = 0; i < rows.size(); i++) {
            String line = switch (shape) {
                case EXPENSE -> expenseLine(rows.get(i));
                case BOOK -> bookLine(rows.get(i));
                case CATEGORY -> categoryLine(rows.get(i));
                case GENERIC -> genericLine(rows.get(i));
            };
            if (!line.isEmpty()) sb.append("\n  ").append(i + 1).append(". ").append(line);
        }
        return sb.toString();
    }

    private String expenseLine(Map<String, Object> row) {
        String currency = str(row.get("book_currency")).or(() -> str(row.get("currency"))).orElse("USD");
        StringBuilder line = new StringBuilder(money(decimal(row.get("amount")).orElse(BigDecimal.ZERO), currency));
        str(row.get("description")).ifPresent(d -> line.append(" for \"").append(d).append('"'));
        str(row.get("category_name")).or(() -> str(row.get("category")))
                .ifPresent(c -> line.append(" [").append(c).append(']'));
        str(row.get("book_name")).or(() -> str(row.get("book"))).ifPresent(b -> line.append(" in ").append(b));
        str(row.get("paymentMethod")).ifPresent(p -> line.append(" via ").append(p));
        if (row.get("date") != null) line.append(" on ").append(displayDate(row.get("date")));
        return line.toString();
    }

    private String bookLine(Map<String, Object> row) {
        String name = str(row.get("name")).or(() -> str(row.get("book_name"))).orElse("Unknown");
        String line = "Book: " + name;
        Optional<String> currency = str(row.get("currency"));
        if (currency.isPresent()) line += " with currency " + currency.get();
        if (Boolean.TRUE.equals(bool(row.get("isArchived")))) line += " (archived)";
        return line;
    }

    private String categoryLine(Map<String, Object> row) {
        String name = str(row.get("name")).or(() -> str(row.get("category_name"))).orElse("Unknown");
        String line = "Category: " + name;
        Optional<String> book = str(row.get("book_name"));
        if (book.isPresent()) line += " in " + book.get() + " book";
        if (Boolean.TRUE.equals(bool(row.get("isDisabled")))) line += " (disabled)";
        return line;
    }

    private String genericLine(Map<String, Object> row) {
        String currency = str(row.get("book_currency")).or(() -> str(row.get("currency"))).orElse(null);
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Object> e : row.entrySet()) {
            String key = e.getKey();
            String lower = key.toLowerCase(Locale.ROOT);
            if (HIDDEN_GENERIC.contains(lower) || e.getValue() == null || lower.endsWith("currency")) continue;
            Object v = e.getValue();
            String shown;
            if (v instanceof Number n && (lower.contains("amount") || lower.contains("total") || lower.contains("sum"))) {
                shown = money(new BigDecimal(n.toString()), currency);
            } else if (lower.equals("date") || v instanceof java.util.Date || v instanceof LocalDate || v instanceof LocalDateTime) {
                shown = displayDate(v);
            } else {
                shown = String.valueOf(v);
            }
            parts.add(key + ": " + shown);
        }
        return String.join(", ", parts);
    }

    /* ===================== Helpers ===================== */

    public static String money(BigDecimal amount, String currency) {
        String value = amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return currency == null ? value : CurrencyCatalog.symbolOf(currency) + value;
    }

    static String displayDate(Object value) {
        if (value == null) return "";
        LocalDate date;
        if (value instanceof LocalDate d) {
            date = d;
        } else if (value instanceof LocalDateTime dt) {
            date = dt.toLocalDate();
        } else if (value instanceof java.sql.Date d) {
            date = d.toLocalDate();
        } else if (value instanceof Timestamp ts) {
            date = ts.toLocalDateTime().toLocalDate();
        } else {
            String s = value.toString();
            try {
                date = LocalDate.parse(s.length() >= 10 ? s.substring(0, 10) : s);
            } catch (DateTimeParseException e) {
                return s;
            }
        }
        return DISPLAY_DATE.format(date);
    }

    private static Optional<String> str(Object v) {
        if (v == null) return Optional.empty();
        String s = v.toString();
        return s.isBlank() ? Optional.empty() : Optional.of(s);
    }

    private static Optional<BigDecimal> decimal(Object v) {
        if (v instanceof BigDecimal b) return Optional.of(b);
        if (v instanceof Number n) return Optional.of(new BigDecimal(n.toString()));
        try {
            return v == null ? Optional.empty() : Optional.of(new BigDecimal(v.toString()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Boolean bool(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        return v == null ? null : Boolean.valueOf(v.toString());
    }

    /** Phân loại dòng kết quả theo tập cột để chọn cách hiển thị. */
    enum RowShape {
        EXPENSE, BOOK, CATEGORY, GENERIC;

        static RowShape of(Map<String, Object> row) {
            boolean amount = row.containsKey("amount");
            if (amount && (row.containsKey("date") || row.containsKey("categoryId")
                    || row.containsKey("category_name") || row.containsKey("paymentMethod"))) {
                return EXPENSE;
            }
            if (!amount && row.containsKey("name") && (row.containsKey("bookId") || row.containsKey("book_name"))) {
                return CATEGORY;
            }
            if (!amount && row.containsKey("name") && row.containsKey("currency")) {
                return BOOK;
            }
            return GENERIC;
        }
    }
}
