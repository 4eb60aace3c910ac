package com.example.expensechat.service.sql.extract;

import com.example.expensechat.service.sql.dto.ExtractionResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatementExtractorTest {

    private final StatementExtractor extractor = new StatementExtractor();

    @Test
    void extractsStatementsFromSqlBlocksOnly() {
        String reply = """
                Here is the query:
                ```sql
                SELECT * FROM expenses WHERE amount > 10;
                ```
                And an example that must not run: SELECT * FROM books
                """;

        ExtractionResult result = extractor.extract(reply);

        assertThat(result.statements()).containsExactly("SELECT * FROM expenses WHERE amount > 10");
        assertThat(result.residualText()).contains("Here is the query:")
                .contains("must not run")
                .doesNotContain("amount > 10");
    }

    @Test
    void splitsMultipleStatementsInOneBlockAndAcrossBlocks() {
        String reply = """
                ```sql
                INSERT INTO books (name, currency) VALUES ('Trip', 'EUR');
                INSERT INTO books (name, currency) VALUES ('Home', 'USD');
                ```
                ```MySQL
                SELECT name FROM books
                ```
                """;

        ExtractionResult result = extractor.extract(reply);

        assertThat(result.statements()).hasSize(3);
        assertThat(result.statements().get(2)).isEqualTo("SELECT name FROM books");
    }

    @Test
    void semicolonInsideLiteralDoesNotSplit() {
        ExtractionResult result = extractor.extract("```sql\nINSERT INTO books (name, currency) VALUES ('a;b', 'USD');\n```");

        assertThat(result.statements()).containsExactly("INSERT INTO books (name, currency) VALUES ('a;b', 'USD')");
    }

    @Test
    void plainCodeBlocksAreResidual() {
        ExtractionResult result = extractor.extract("```\nSELECT * FROM books\n```");

        assertThat(result.hasStatements()).isFalse();
        assertThat(result.residualText()).contains("SELECT * FROM books");
    }

    @Test
    void emptyReply() {
        assertThat(extractor.extract(null).hasStatements()).isFalse();
        assertThat(extractor.extract("   ").residualText()).isEmpty();
    }
}
