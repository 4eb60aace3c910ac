package com.example.expensechat.service.sql.execute;

import com.example.expensechat.config.ErrorConfig;
import com.example.expensechat.exception.ExecutionFailureException;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.RenderedStatement;
import com.example.expensechat.service.sql.dto.StatementKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementExecutorTest {

    private EmbeddedDatabase db;
    private JdbcTemplate jdbc;
    private StatementExecutor executor;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("schema.sql")
                .build();
        jdbc = new JdbcTemplate(db);
        executor = new StatementExecutor(jdbc);
        jdbc.update("INSERT INTO books (id, userId, name, currency) VALUES ('b1', 'user-1', 'House', 'USD')");
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void insertReturnsAffectedRows() {
        int count = executor.update(new RenderedStatement(StatementKind.INSERT, OwnedTable.CATEGORIES,
                "INSERT INTO categories (id, bookId, name) VALUES ('c1', 'b1', 'Food')"));

        assertThat(count).isEqualTo(1);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM categories", Integer.class)).isEqualTo(1);
    }

    @Test
    void queryRowsAreCaseInsensitive() {
        List<Map<String, Object>> rows = executor.query(new RenderedStatement(StatementKind.SELECT, OwnedTable.BOOKS,
                "SELECT b.name, b.currency FROM books b WHERE b.userId = 'user-1'"));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).get("NAME")).isEqualTo("House");
        assertThat(rows.get(0).get("currency")).isEqualTo("USD");
    }

    @Test
    void earlierWritesSurviveALaterFailure() {
        executor.update(new RenderedStatement(StatementKind.INSERT, OwnedTable.CATEGORIES,
                "INSERT INTO categories (id, bookId, name) VALUES ('c1', 'b1', 'Food')"));

        assertThatThrownBy(() -> executor.update(new RenderedStatement(StatementKind.INSERT, OwnedTable.CATEGORIES,
                "INSERT INTO categories (id, bookId, name) VALUES ('c1', 'b1', 'Again')")))
                .isInstanceOf(ExecutionFailureException.class)
                .extracting("errorCode").isEqualTo(ErrorConfig.EXECUTION_FAILURE);

        assertThat(jdbc.queryForObject("SELECT name FROM categories WHERE id = 'c1'", String.class)).isEqualTo("Food");
    }

    @Test
    void kindMustMatchTheEntryPoint() {
        RenderedStatement select = new RenderedStatement(StatementKind.SELECT, OwnedTable.BOOKS, "SELECT 1");
        RenderedStatement update = new RenderedStatement(StatementKind.UPDATE, OwnedTable.BOOKS,
                "UPDATE books SET name = 'x' WHERE 1 = 0");

        assertThatThrownBy(() -> executor.update(select)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.query(update)).isInstanceOf(IllegalArgumentException.class);
    }
}
