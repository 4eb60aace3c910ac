package com.example.expensechat.service.chat;

import com.example.expensechat.dto.request.ChatRequest;
import com.example.expensechat.dto.response.ChatResponse;
import com.example.expensechat.exception.UpstreamUnavailableException;
import com.example.expensechat.service.context.CategoryResolution;
import com.example.expensechat.service.context.ConversationContext;
import com.example.expensechat.service.context.PendingExpense;
import com.example.expensechat.service.format.ResponseFormatter;
import com.example.expensechat.service.implement.ExchangeRateServiceImpl;
import com.example.expensechat.service.llm.LlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;

import static com.example.expensechat.service.scope.ScopeFixtures.HOUSE_FOOD_ID;
import static com.example.expensechat.service.scope.ScopeFixtures.HOUSE_ID;
import static com.example.expensechat.service.scope.ScopeFixtures.TRIP_ID;
import static com.example.expensechat.service.scope.ScopeFixtures.USER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
class ChatGatewayScenarioTest {

    private static final String SECRET_BOOK_ID = "99999999-9999-9999-9999-999999999999";
    private static final String TRIP_BILLS_ID = "66666666-6666-6666-6666-666666666666";

    @Autowired
    private ChatGatewayService chatGatewayService;

    @Autowired
    private JdbcTemplate jdbc;

    @MockBean
    private LlmService llmService;

    @MockBean
    private ExchangeRateServiceImpl exchangeRateService;

    @BeforeEach
    void seed() {
        jdbc.update("DELETE FROM expenses");
        jdbc.update("DELETE FROM categories");
        jdbc.update("DELETE FROM books");
        jdbc.update("DELETE FROM chat_messages");
        jdbc.update("DELETE FROM chat_contexts");
        jdbc.update("INSERT INTO books (id, userId, name, currency) VALUES (?, ?, 'House', 'USD')", HOUSE_ID, USER);
        jdbc.update("INSERT INTO books (id, userId, name, currency) VALUES (?, ?, 'Trip', 'EUR')", TRIP_ID, USER);
        jdbc.update("INSERT INTO books (id, userId, name, currency) VALUES (?, 'user-2', 'Secret', 'USD')", SECRET_BOOK_ID);
        jdbc.update("INSERT INTO categories (id, bookId, name) VALUES (?, ?, 'Food')", HOUSE_FOOD_ID, HOUSE_ID);
        when(exchangeRateService.rate(anyString(), anyString())).thenReturn(BigDecimal.ONE);
    }

    @Test
    void missingCategoryIsCreatedThenExpenseInsertedAfterTwoConfirmations() {
        String message = "Add $120 for electricity to House under Bills & Utilities";
        llmReplies("""
                ```sql
                INSERT INTO expenses (amount, categoryId, description, paymentMethod, date)
                VALUES (120, 'Bills & Utilities', 'Electricity', 'Cash', '2026-03-01');
                ```""");

        ChatResponse asked = chat(message, null);

        assertThat(asked.getResponse())
                .contains("🤔 The category \"Bills & Utilities\" doesn't exist in your book \"House\"");
        assertThat(asked.isRequiresConfirmation()).isTrue();
        assertThat(asked.getContext().pendingExpense().state()).isEqualTo(CategoryResolution.AWAITING_CONFIRMATION);
        assertThat(count("categories")).isEqualTo(1);

        ChatResponse created = chat("yes", asked.getContext());

        assertThat(created.getResponse()).isEqualTo("✅ Created category \"Bills & Utilities\" in \"House\". "
                + "Shall I add the expense of $120.00 for \"Electricity\" now? (yes/no)");
        assertThat(created.getContext().pendingExpense().state()).isEqualTo(CategoryResolution.READY);
        assertThat(jdbc.queryForObject("SELECT bookId FROM categories WHERE name = 'Bills & Utilities'", String.class))
                .isEqualTo(HOUSE_ID);

        ChatResponse inserted = chat("go ahead", created.getContext());

        assertThat(inserted.getResponse()).startsWith("✅ Successfully added");
        assertThat(inserted.getContext().hasPending()).isFalse();
        assertThat(inserted.getContext().lastCategory().name()).isEqualTo("Bills & Utilities");
        assertThat(jdbc.queryForObject("SELECT amount FROM expenses", BigDecimal.class)).isEqualByComparingTo("120");
        verify(llmService).complete(anyList());
    }

    @Test
    void electricityBillForHouseNeedsTwoShortConfirmationsWithoutClientContext() {
        llmReplies("```sql\nINSERT INTO expenses (amount, categoryId, description) "
                + "VALUES (40, 'Bills & Utilities', 'Electricity bill');\n```");

        ChatResponse asked = chat("add electricity bill 40 for House", null);

        assertThat(asked.getResponse()).contains("\"Bills & Utilities\" doesn't exist in your book \"House\"");
        assertThat(count("categories")).isEqualTo(1);
        assertThat(count("expenses")).isZero();

        ChatResponse created = chat("yes", null);

        assertThat(created.getResponse()).startsWith("✅ Created category \"Bills & Utilities\" in \"House\"");
        assertThat(jdbc.queryForList("SELECT name FROM categories WHERE bookId = ? ORDER BY name", String.class, HOUSE_ID))
                .containsExactly("Bills & Utilities", "Food");
        assertThat(count("expenses")).isZero();

        ChatResponse inserted = chat("add it now", null);

        assertThat(inserted.getResponse()).startsWith("✅ Successfully added");
        assertThat(jdbc.queryForList("SELECT e.amount FROM expenses e JOIN categories c ON e.categoryId = c.id "
                + "WHERE c.name = 'Bills & Utilities' AND c.bookId = ?", BigDecimal.class, HOUSE_ID))
                .singleElement()
                .satisfies(amount -> assertThat(amount).isEqualByComparingTo("40.00"));
        assertThat(count("expenses")).isEqualTo(1);
        verify(llmService).complete(anyList());
    }

    @Test
    void categoryOfAnotherBookIsNeverUsedInstead() {
        jdbc.update("INSERT INTO categories (id, bookId, name) VALUES (?, ?, 'Bills & Utilities')", TRIP_BILLS_ID, TRIP_ID);
        llmReplies("```sql\nINSERT INTO expenses (amount, categoryId, description) "
                + "VALUES (40, '" + TRIP_BILLS_ID + "', 'Electricity bill');\n```");

        ChatResponse response = chat("add electricity bill 40 for House", null);

        assertThat(response.getResponse()).contains("\"Bills & Utilities\" doesn't exist in your book \"House\"");
        assertThat(response.isRequiresConfirmation()).isTrue();
        assertThat(count("expenses")).isZero();
    }

    @Test
    void pendingAmountIsShownInTheCurrencyTheUserSpoke() {
        when(exchangeRateService.rate("EUR", "USD")).thenReturn(new BigDecimal("1.10"));
        llmReplies("```sql\nINSERT INTO expenses (amount, categoryId, description) "
                + "VALUES (40, 'Bills & Utilities', 'Electricity bill');\n```");
        chat("add electricity bill €40 for House", null);

        ChatResponse created = chat("yes", null);
        chat("yes", null);

        assertThat(created.getResponse()).contains("the expense of €40.00 for \"Electricity bill\"");
        assertThat(jdbc.queryForObject("SELECT amount FROM expenses", BigDecimal.class)).isEqualByComparingTo("44.00");
    }

    @Test
    void malformedClientContextIsIgnored() {
        llmReplies("```sql\nSELECT * FROM books;\n```");
        ConversationContext broken = new ConversationContext(null, null,
                new PendingExpense(null, null, null, null, null, null, null, null, null));

        ChatResponse response = chat("show books", broken);

        assertThat(response.getResponse()).contains("Book: House with currency USD");
        assertThat(response.getContext().hasPending()).isFalse();
    }

    @Test
    void decliningDropsThePendingExpense() {
        llmReplies("```sql\nINSERT INTO expenses (amount, categoryId, description) VALUES (9, 'Snacks', 'Chips');\n```");
        ChatResponse asked = chat("Add 9 for chips to House under Snacks", null);

        ChatResponse declined = chat("no", asked.getContext());

        assertThat(declined.getResponse()).isEqualTo(ChatGatewayService.DECLINED_REPLY);
        assertThat(declined.getContext().hasPending()).isFalse();
        assertThat(count("categories")).isEqualTo(1);
        assertThat(count("expenses")).isZero();
    }

    @Test
    void duplicateBookIsRejected() {
        llmReplies("```sql\nINSERT INTO books (name, currency) VALUES ('House', 'USD');\n```");

        ChatResponse response = chat("Create a book called House", null);

        assertThat(response.getResponse()).contains("❌ Book \"House\" already exists");
        assertThat(count("books")).isEqualTo(3);
    }

    @Test
    void unknownBookIsReported() {
        llmReplies("```sql\nSELECT * FROM expenses e JOIN categories c ON e.categoryId = c.id "
                + "JOIN books b ON c.bookId = b.id WHERE b.name = 'Vault';\n```");

        ChatResponse response = chat("show expenses in Vault", null);

        assertThat(response.getResponse()).contains("No book named \"Vault\" was found. Your books are: House, Trip.");
    }

    @Test
    void selectOnlySeesTheUsersOwnBooks() {
        llmReplies("Here are your books:\n```sql\nSELECT * FROM books;\n```");

        ChatResponse response = chat("show my books", null);

        assertThat(response.getResponse())
                .contains("Book: House with currency USD")
                .contains("Book: Trip with currency EUR")
                .doesNotContain("Secret");
    }

    @Test
    void fakeSuccessWithoutSqlIsReplacedByAWarning() {
        llmReplies("✅ I've added the expense of $50 for taxi!");

        ChatResponse response = chat("Add 50 for taxi", null);

        assertThat(response.getResponse()).isEqualTo(ResponseFormatter.NO_OPERATION_WARNING);
        assertThat(count("expenses")).isZero();
    }

    @Test
    void oneForbiddenStatementBlocksTheWholeReply() {
        llmReplies("```sql\nINSERT INTO books (name, currency) VALUES ('Garden', 'USD');\nDELETE FROM books WHERE name = 'Trip';\n```");

        ChatResponse response = chat("add a Garden book and remove Trip", null);

        assertThat(response.getResponse()).startsWith("❌ The generated SQL was rejected for safety reasons");
        assertThat(count("books")).isEqualTo(3);
    }

    @Test
    void unavailableModelGivesACannedReplyAndStillRecordsHistory() {
        when(llmService.complete(anyList())).thenThrow(new UpstreamUnavailableException("llm", "rate limited"));

        ChatResponse response = chat("show my books", null);

        assertThat(response.getResponse()).isEqualTo(ChatGatewayService.LLM_UNAVAILABLE_REPLY);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM chat_messages WHERE userId = ?", Integer.class, USER))
                .isEqualTo(2);
    }

    @Test
    void unrelatedMessageAbandonsThePendingExpense() {
        llmReplies("```sql\nINSERT INTO expenses (amount, categoryId) VALUES (5, 'Parking');\n```");
        ChatResponse asked = chat("Add 5 for parking to House", null);
        llmReplies("```sql\nSELECT * FROM books;\n```");

        ChatResponse next = chat("show my books", asked.getContext());

        assertThat(next.getContext().hasPending()).isFalse();
        assertThat(next.getResponse()).contains("Book: House");
        verify(exchangeRateService, never()).rate(anyString(), anyString());
    }

    private void llmReplies(String reply) {
        when(llmService.complete(anyList())).thenReturn(reply);
    }

    private ChatResponse chat(String message, ConversationContext context) {
        return chatGatewayService.chat(USER, ChatRequest.builder().message(message).context(context).build());
    }

    private int count(String table) {
        return jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }
}
