package com.example.expensechat.service.context;

import com.example.expensechat.entity.ConversationState;
import com.example.expensechat.repository.ConversationStateRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Giữ ngữ cảnh (lastBook, lastCategory, pending expense) của mỗi người dùng giữa các lượt chat.
 * Lỗi đọc/ghi chỉ được log, lượt chat vẫn tiếp tục với ngữ cảnh rỗng.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationContextStore {
    private final ConversationStateRepository conversationStateRepository;
    private final ObjectMapper om;

    public ConversationContext load(String userId) {
        try {
            return conversationStateRepository.findById(userId)
                    .map(state -> read(userId, state.getContextJson()))
                    .orElse(ConversationContext.empty());
        } catch (DataAccessException e) {
            log.error("Could not load conversation context for user {}", userId, e);
            return ConversationContext.empty();
        }
    }

    public void save(String userId, ConversationContext context) {
        try {
            conversationStateRepository.save(ConversationState.builder()
                    .userId(userId)
                    .contextJson(om.writeValueAsString(ConversationContext.sanitize(context)))
                    .updatedAt(LocalDateTime.now())
                    .build());
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("Could not save conversation context for user {}", userId, e);
        }
    }

    @Transactional
    public void clear(String userId) {
        conversationStateRepository.deleteById(userId);
        log.info("Cleared conversation context for user {}", userId);
    }

    private ConversationContext read(String userId, String json) {
        try {
            return ConversationContext.sanitize(om.readValue(json, ConversationContext.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable conversation context for user {}: {}", userId, e.getOriginalMessage());
            return ConversationContext.empty();
        }
    }
}
