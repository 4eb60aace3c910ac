package com.example.expensechat.service.context;

import com.example.expensechat.entity.ConversationState;
import com.example.expensechat.repository.ConversationStateRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationContextStoreTest {

    private ConversationStateRepository repository;
    private ConversationContextStore store;

    private final ConversationContext awaiting = ConversationContext.empty()
            .withLastBook(new EntityRef("b1", "House"))
            .withPending(PendingExpense.resolving(new BigDecimal("40"), "Electricity bill", null, null,
                    new EntityRef("b1", "House"), "Bills & Utilities", "add electricity bill 40 for House")
                    .needsCategory()
                    .awaitingConfirmation());

    @BeforeEach
    void setUp() {
        repository = mock(ConversationStateRepository.class);
        store = new ConversationContextStore(repository, new ObjectMapper());
    }

    @Test
    void savedContextIsLoadedBack() {
        when(repository.save(any(ConversationState.class))).thenAnswer(inv -> inv.getArgument(0));

        store.save("user-1", awaiting);

        ArgumentCaptor<ConversationState> saved = ArgumentCaptor.forClass(ConversationState.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getUserId()).isEqualTo("user-1");

        when(repository.findById("user-1")).thenReturn(Optional.of(saved.getValue()));
        ConversationContext loaded = store.load("user-1");

        assertThat(loaded.pendingExpense().state()).isEqualTo(CategoryResolution.AWAITING_CONFIRMATION);
        assertThat(loaded.pendingExpense().amount()).isEqualByComparingTo("40");
        assertThat(loaded.pendingExpense().book()).isEqualTo(new EntityRef("b1", "House"));
        assertThat(loaded.lastBook().name()).isEqualTo("House");
    }

    @Test
    void missingOrUnreadableContextIsEmpty() {
        when(repository.findById("user-1")).thenReturn(Optional.empty());
        when(repository.findById("user-2")).thenReturn(Optional.of(new ConversationState("user-2", "{not json", LocalDateTime.now())));
        when(repository.findById("user-3")).thenReturn(Optional.of(new ConversationState("user-3",
                "{\"pendingExpense\":{\"amount\":null,\"state\":null}}", LocalDateTime.now())));

        assertThat(store.load("user-1")).isEqualTo(ConversationContext.empty());
        assertThat(store.load("user-2")).isEqualTo(ConversationContext.empty());
        assertThat(store.load("user-3")).isEqualTo(ConversationContext.empty());
    }

    @Test
    void storeFailuresNeverFailTheTurn() {
        when(repository.findById("user-1")).thenThrow(new DataAccessResourceFailureException("down"));
        when(repository.save(any(ConversationState.class))).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(store.load("user-1")).isEqualTo(ConversationContext.empty());
        assertThatCode(() -> store.save("user-1", awaiting)).doesNotThrowAnyException();
    }
}
