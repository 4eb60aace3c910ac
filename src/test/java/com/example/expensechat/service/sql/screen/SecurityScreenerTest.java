package com.example.expensechat.service.sql.screen;

import com.example.expensechat.exception.SecurityViolationException;
import com.example.expensechat.service.sql.dto.StatementKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurityScreenerTest {

    private final SecurityScreener screener = new SecurityScreener();

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM expenses; DROP TABLE books",
            "SELECT * FROM books -- where userId = 'x'",
            "SELECT * FROM books /* hidden */",
            "SELECT * FROM books # note",
            "SELECT * FROM books WHERE name = 'open",
            "SELECT SLEEP(5) FROM books",
            "SELECT * FROM books INTO OUTFILE '/tmp/x'"
    })
    void rejectsDangerousSelects(String sql) {
        assertThatThrownBy(() -> screener.screen(sql, StatementKind.SELECT))
                .isInstanceOf(SecurityViolationException.class);
    }

    @Test
    void rejectsVerbsForeignToTheDeclaredKind() {
        assertThatThrownBy(() -> screener.screen(
                "INSERT INTO expenses (amount, categoryId) SELECT amount, categoryId FROM expenses", StatementKind.INSERT))
                .isInstanceOf(SecurityViolationException.class)
                .hasMessageContaining("select");
    }

    @Test
    void rejectsMalformedUpdateFilters() {
        assertThatThrownBy(() -> screener.screen(
                "UPDATE expenses SET amount = 5 WHERE id = 'a' WHERE id = 'b'", StatementKind.UPDATE))
                .hasMessageContaining("more than one WHERE");
        assertThatThrownBy(() -> screener.screen(
                "UPDATE expenses SET amount = 5 AND description = 'x' WHERE id = 'a'", StatementKind.UPDATE))
                .hasMessageContaining("outside its WHERE");
    }

    @Test
    void keywordsInsideLiteralsAreIgnored() {
        assertThatCode(() -> screener.screen(
                "INSERT INTO expenses (amount, description, categoryId) VALUES (5, 'drop off -- delete; select', 'c1')",
                StatementKind.INSERT))
                .doesNotThrowAnyException();
    }

    @Test
    void trailingSemicolonIsAllowed() {
        assertThatCode(() -> screener.screen("SELECT name FROM books;", StatementKind.SELECT))
                .doesNotThrowAnyException();
    }
}
