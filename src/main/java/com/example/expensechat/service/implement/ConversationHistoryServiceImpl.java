package com.example.expensechat.service.implement;

import com.example.expensechat.dto.ConversationMessageDto;
import com.example.expensechat.entity.ConversationTurn;

import java.util.List;

public interface ConversationHistoryServiceImpl {
    /**
     * Lịch sử gửi kèm cho LLM: ưu tiên lịch sử client gửi (chỉ user/assistant, giới hạn độ dài),
     * nếu không có thì lấy các lượt đã lưu.
     */
    List<ConversationMessageDto> forPrompt(String userId, List<ConversationMessageDto> clientHistory);

    /** Các lượt gần nhất, cũ nhất trước. */
    List<ConversationTurn> recent(String userId);

    ConversationTurn append(String userId, String role, String content);

    /** Lưu cả hai phía của một lượt; lỗi chỉ được ghi log. */
    void recordExchange(String userId, String userMessage, String assistantMessage);

    int clear(String userId);
}
