package com.example.expensechat.service.implement;

import com.example.expensechat.dto.ConversationMessageDto;

import java.util.List;

public interface LlmServiceImpl {
    /**
     * Gọi chat completions với model chính; nếu bị rate-limit thì thử đúng một lần với model dự phòng.
     * @param messages system + lịch sử + câu hiện tại
     * @return text trả lời (có thể rỗng)
     * @throws com.example.expensechat.exception.UpstreamUnavailableException khi cả hai lần đều lỗi
     */
    String complete(List<ConversationMessageDto> messages);
}
