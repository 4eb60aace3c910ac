package com.example.expensechat.service.implement;

import com.example.expensechat.dto.ConversationMessageDto;
import com.example.expensechat.service.context.ConversationContext;
import com.example.expensechat.service.scope.UserScope;

import java.util.List;

public interface PromptServiceImpl {
    /**
     * Dựng danh sách message gửi LLM: system prompt (books/categories của người dùng + luật sinh SQL),
     * lịch sử đã lọc, rồi câu hiện tại.
     */
    List<ConversationMessageDto> build(String message, List<ConversationMessageDto> history,
                                       UserScope scope, ConversationContext context);
}
