package com.example.expensechat.service.context;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingExpenseTest {

    private final PendingExpense resolving = PendingExpense.resolving(new BigDecimal("120"), "Electricity", "Cash",
            null, new EntityRef("b1", "House"), "Bills & Utilities", "Add $120 electricity to House");

    @Test
    void happyPathThroughConfirmation() {
        PendingExpense awaiting = resolving.needsCategory().awaitingConfirmation();
        PendingExpense ready = awaiting.ready(new EntityRef("c9", "Bills & Utilities"));

        assertThat(awaiting.is(CategoryResolution.AWAITING_CONFIRMATION)).isTrue();
        assertThat(ready.state()).isEqualTo(CategoryResolution.READY);
        assertThat(ready.category().id()).isEqualTo("c9");
        assertThat(ready.amount()).isEqualByComparingTo("120");
        assertThat(resolving.state()).isEqualTo(CategoryResolution.RESOLVING);
    }

    @Test
    void illegalTransitionsAreRefused() {
        assertThatThrownBy(resolving::awaitingConfirmation).isInstanceOf(IllegalStateException.class);
        PendingExpense abandoned = resolving.needsCategory().awaitingConfirmation().abandoned();
        assertThat(abandoned.is(CategoryResolution.ABANDONED)).isTrue();
        assertThatThrownBy(() -> abandoned.ready(new EntityRef("c", "x"))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(abandoned::abandoned).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void contextHoldsAtMostOnePendingExpense() {
        ConversationContext ctx = ConversationContext.empty().withPending(resolving);

        assertThat(ctx.hasPending()).isTrue();
        assertThat(ctx.clearPending().hasPending()).isFalse();
        assertThat(ConversationContext.sanitize(null)).isEqualTo(ConversationContext.empty());
    }

    @Test
    void incompleteContextIsDropped() {
        PendingExpense blank = new PendingExpense(null, null, null, null, null, null, null, null, null);
        PendingExpense readyWithoutCategory = new PendingExpense(BigDecimal.TEN, "Taxi", null, null,
                new EntityRef("b1", "House"), "Transport", null, "taxi 10", CategoryResolution.READY);
        PendingExpense abandoned = resolving.needsCategory().awaitingConfirmation().abandoned();

        assertThat(ConversationContext.sanitize(new ConversationContext(null, null, blank)))
                .isEqualTo(ConversationContext.empty());
        assertThat(ConversationContext.sanitize(ConversationContext.empty().withPending(readyWithoutCategory)).hasPending())
                .isFalse();
        assertThat(ConversationContext.sanitize(ConversationContext.empty().withPending(abandoned)).hasPending())
                .isFalse();
        assertThat(ConversationContext.sanitize(new ConversationContext(new EntityRef(null, "House"),
                new EntityRef("c1", "Food"), null)))
                .isEqualTo(new ConversationContext(null, new EntityRef("c1", "Food"), null));

        ConversationContext valid = ConversationContext.empty().withPending(resolving.needsCategory().awaitingConfirmation());
        assertThat(ConversationContext.sanitize(valid)).isEqualTo(valid);
    }
}
