package com.example.expensechat.controller;

import com.example.expensechat.dto.HistoryEntryDto;
import com.example.expensechat.dto.request.ChatRequest;
import com.example.expensechat.dto.request.HistoryMessageRequest;
import com.example.expensechat.dto.response.ChatResponse;
import com.example.expensechat.dto.response.HistoryResponse;
import com.example.expensechat.entity.ConversationTurn;
import com.example.expensechat.service.chat.ChatGatewayService;
import com.example.expensechat.service.context.ConversationContextStore;
import com.example.expensechat.service.history.ConversationHistoryService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/chat")
public class ChatController {
    static final String USER_HEADER = "X-User-Id";

    private final ChatGatewayService chatGatewayService;
    private final ConversationHistoryService historyService;
    private final ConversationContextStore contextStore;

    @PostMapping
    public ResponseEntity<ChatResponse> onMessage(@RequestHeader(USER_HEADER) String userId,
                                                  @RequestBody ChatRequest chatRequest,
                                                  HttpServletRequest request) {
        log.info("Chat message from user {}", userId);
        ChatResponse response = chatGatewayService.chat(userId, chatRequest);
        response.setPath(request.getRequestURI());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/history")
    public ResponseEntity<HistoryResponse> history(@RequestHeader(USER_HEADER) String userId, HttpServletRequest request) {
        List<HistoryEntryDto> messages = historyService.recent(userId).stream()
                .map(ChatController::toEntry)
                .toList();
        return ResponseEntity.ok(HistoryResponse.builder()
                .status("OK")
                .path(request.getRequestURI())
                .messages(messages)
                .build());
    }

    @PostMapping("/history")
    public ResponseEntity<HistoryResponse> append(@RequestHeader(USER_HEADER) String userId,
                                                  @RequestBody HistoryMessageRequest body,
                                                  HttpServletRequest request) {
        ConversationTurn saved = historyService.append(userId, body.getRole(), body.getContent());
        return ResponseEntity.ok(HistoryResponse.builder()
                .status("OK")
                .path(request.getRequestURI())
                .messages(List.of(toEntry(saved)))
                .build());
    }

    @DeleteMapping("/history")
    public ResponseEntity<HistoryResponse> clear(@RequestHeader(USER_HEADER) String userId, HttpServletRequest request) {
        int deleted = historyService.clear(userId);
        contextStore.clear(userId);
        return ResponseEntity.ok(HistoryResponse.builder()
                .status("OK")
                .path(request.getRequestURI())
                .messages(List.of())
                .deleted(deleted)
                .message("Chat history cleared")
                .build());
    }

    private static HistoryEntryDto toEntry(ConversationTurn turn) {
        return HistoryEntryDto.builder()
                .role(turn.getRole())
                .content(turn.getContent())
                .createdAt(turn.getCreatedAt())
                .build();
    }
}
