package com.example.expensechat.service.sql.rewrite;

import com.example.expensechat.config.GatewayConfig;
import com.example.expensechat.exception.ValidationException;
import com.example.expensechat.service.scope.UserScope;
import com.example.expensechat.service.sql.classify.StatementClassifier;
import com.example.expensechat.service.sql.druid.service.SqlFragmentRepair;
import com.example.expensechat.service.sql.druid.service.StatementParser;
import com.example.expensechat.service.sql.dto.ClassifiedStatement;
import com.example.expensechat.service.sql.screen.SecurityScreener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.example.expensechat.service.scope.ScopeFixtures.HOUSE_ID;
import static com.example.expensechat.service.scope.ScopeFixtures.scope;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TenantIsolationRewriterTest {

    private static final String NEW_ID = "aaaaaaaa-aaaa-aaaa-aaaa-aaaaaaaaaaaa";

    private final StatementClassifier classifier =
            new StatementClassifier(new SqlFragmentRepair(), new SecurityScreener(), new StatementParser());
    private final TenantIsolationRewriter rewriter =
            new TenantIsolationRewriter(new GatewayConfig(100, 20, 50), () -> NEW_ID);
    private final SqlRenderer renderer = new SqlRenderer();

    private String rewritten(String sql) {
        return renderer.render(rewriter.rewrite(classifier.classify(sql), scope())).sql();
    }

    @Test
    void selectStarIsExpandedAndScopedAlongTheOwnershipChain() {
        assertThat(rewritten("SELECT * FROM expenses")).isEqualTo(
                "SELECT e.*, c.name AS category_name, b.name AS book_name, b.currency AS book_currency "
                        + "FROM expenses e JOIN categories c ON e.categoryId = c.id JOIN books b ON c.bookId = b.id "
                        + "WHERE b.userId = 'user-1' LIMIT 100");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT amount FROM expenses",
            "SELECT amount FROM expenses WHERE userId = 'user-2'",
            "SELECT e.amount FROM expenses e JOIN categories c ON e.categoryId = c.id JOIN books b ON c.bookId = b.id WHERE b.userId = 'user-2'",
            "SELECT amount FROM expenses WHERE amount > 1 OR b.userId = 'user-2'",
            "SELECT name FROM categories WHERE name = 'Food'",
            "SELECT name FROM books WHERE userId = 'user-1'"
    })
    void everySelectEndsUpFilteredByTheRequestingUser(String sql) {
        String out = rewritten(sql);

        assertThat(out).contains("b.userId = 'user-1'");
        assertThat(out).doesNotContain("user-2");
        assertThat(out.indexOf("userId")).isEqualTo(out.lastIndexOf("userId"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "UPDATE expenses SET amount = 5 WHERE id = 'e1'",
            "UPDATE expenses SET amount = 5 WHERE id = 'e1' AND categoryId = 'c-of-someone-else'",
            "UPDATE categories SET name = 'Meals' WHERE name = 'Food'",
            "UPDATE books SET name = 'Home' WHERE userId = 'user-2' AND name = 'House'"
    })
    void everyUpdateCarriesTheOwnerFilter(String sql) {
        String out = rewritten(sql);

        assertThat(out).contains("userId = 'user-1'");
        assertThat(out).doesNotContain("user-2");
    }

    @Test
    void expenseUpdateIsScopedThroughCategories() {
        assertThat(rewritten("UPDATE expenses SET amount = 5 WHERE id = 'e1'")).isEqualTo(
                "UPDATE expenses SET amount = 5 WHERE id = 'e1' AND categoryId IN "
                        + "(SELECT c.id FROM categories c JOIN books b ON c.bookId = b.id WHERE b.userId = 'user-1')");
    }

    @Test
    void bookInsertGetsOwnerIdAndDefaults() {
        String out = rewritten("INSERT INTO books (name, currency, userId) VALUES ('Savings', 'EUR', 'user-2')");

        assertThat(out).startsWith("INSERT INTO books (name, currency, userId, id, createdAt, updatedAt, description, isArchived)")
                .contains("'user-1'")
                .contains("'" + NEW_ID + "'")
                .doesNotContain("user-2");
    }

    @Test
    void expenseInsertGetsCanonicalPaymentMethodAndDefaultDate() {
        String out = rewritten("INSERT INTO expenses (amount, categoryId, paymentMethod) VALUES (5, 'c1', 'credit card')");

        assertThat(out).contains("'Credit Card'").contains("CURDATE()").doesNotContain("'credit card'");
    }

    @Test
    void selectLimitIsCapped() {
        assertThat(rewritten("SELECT name FROM books LIMIT 500")).endsWith("LIMIT 100");
        assertThat(rewritten("SELECT name FROM books LIMIT 5")).endsWith("LIMIT 5");
    }

    @Test
    void bookNameUsedAsIdIsResolved() {
        assertThat(rewritten("SELECT name FROM categories WHERE bookId = 'House'"))
                .contains("c.bookId = '" + HOUSE_ID + "'");
    }

    @Test
    void rewriteIsIdempotent() {
        for (String sql : List.of(
                "SELECT * FROM expenses WHERE amount > 3 ORDER BY amount DESC",
                "SELECT c.name, SUM(e.amount) AS total FROM expenses e JOIN categories c ON e.categoryId = c.id GROUP BY c.name",
                "UPDATE categories SET color = 'red' WHERE id = 'c1'",
                "INSERT INTO books (name, currency) VALUES ('Savings', 'EUR')")) {
            ClassifiedStatement once = rewriter.rewrite(classifier.classify(sql), scope());
            ClassifiedStatement twice = rewriter.rewrite(once, scope());

            assertThat(twice).as(sql).isEqualTo(once);
            assertThat(renderer.render(twice).sql()).isEqualTo(renderer.render(once).sql());
        }
    }

    @Test
    void unsafeUserIdIsRefused() {
        UserScope bad = new UserScope("x' OR '1'='1", List.of(), List.of());
        assertThatThrownBy(() -> rewriter.rewrite(classifier.classify("SELECT name FROM books"), bad))
                .isInstanceOf(ValidationException.class);
    }
}
