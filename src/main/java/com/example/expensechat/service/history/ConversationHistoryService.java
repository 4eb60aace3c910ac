package com.example.expensechat.service.history;

import com.example.expensechat.config.ErrorConfig;
import com.example.expensechat.config.GatewayConfig;
import com.example.expensechat.dto.ConversationMessageDto;
import com.example.expensechat.entity.ConversationTurn;
import com.example.expensechat.exception.AppException;
import com.example.expensechat.repository.ConversationTurnRepository;
import com.example.expensechat.service.implement.ConversationHistoryServiceImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationHistoryService implements ConversationHistoryServiceImpl {
    private static final Set<String> ROLES = Set.of(ConversationTurn.ROLE_USER, ConversationTurn.ROLE_ASSISTANT);

    private final ConversationTurnRepository conversationTurnRepository;
    private final GatewayConfig gatewayConfig;

    @Override
    public List<ConversationMessageDto> forPrompt(String userId, List<ConversationMessageDto> clientHistory) {
        int limit = gatewayConfig.historyLimit();
        if (clientHistory != null && !clientHistory.isEmpty()) {
            List<ConversationMessageDto> filtered = clientHistory.stream()
                    .filter(m -> m != null && m.getRole() != null && ROLES.contains(m.getRole()))
                    .filter(m -> m.getContent() != null && !m.getContent().isBlank())
                    .toList();
            return filtered.subList(Math.max(0, filtered.size() - limit), filtered.size());
        }
        List<ConversationTurn> stored = new ArrayList<>(
                conversationTurnRepository.findByUserIdOrderByCreatedAtDescRoleAsc(userId, PageRequest.of(0, limit)));
        Collections.reverse(stored);
        return stored.stream()
                .map(t -> ConversationMessageDto.of(t.getRole(), t.getContent()))
                .toList();
    }

    @Override
    public List<ConversationTurn> recent(String userId) {
        List<ConversationTurn> turns = new ArrayList<>(
                conversationTurnRepository.findByUserIdOrderByCreatedAtDescRoleAsc(userId, PageRequest.of(0, gatewayConfig.historyPageSize())));
        Collections.reverse(turns);
        return turns;
    }

    @Override
    public ConversationTurn append(String userId, String role, String content) {
        if (role == null || !ROLES.contains(role)) {
            throw new AppException(ErrorConfig.BAD_REQUEST, "Role must be 'user' or 'assistant'");
        }
        if (content == null || content.isBlank()) {
            throw new AppException(ErrorConfig.BAD_REQUEST, "Content is empty");
        }
        return conversationTurnRepository.save(ConversationTurn.builder()
                .userId(userId)
                .role(role)
                .content(content)
                .createdAt(LocalDateTime.now())
                .build());
    }

    @Override
    public void recordExchange(String userId, String userMessage, String assistantMessage) {
        try {
            append(userId, ConversationTurn.ROLE_USER, userMessage);
            append(userId, ConversationTurn.ROLE_ASSISTANT, assistantMessage);
        } catch (DataAccessException | AppException e) {
            // không làm hỏng request nếu lưu lịch sử lỗi
            log.error("Could not save chat messages for user {}", userId, e);
        }
    }

    @Override
    @Transactional
    public int clear(String userId) {
        int deleted = conversationTurnRepository.deleteAllByUserId(userId);
        log.info("Cleared {} chat message(s) for user {}", deleted, userId);
        return deleted;
    }
}
