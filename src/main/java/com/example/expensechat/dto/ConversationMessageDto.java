package com.example.expensechat.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.FieldDefaults;

/** Một tin nhắn trong hội thoại gửi cho LLM (role: system | user | assistant). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ConversationMessageDto {
    String role;
    String content;

    public static ConversationMessageDto of(String role, String content) {
        return new ConversationMessageDto(role, content);
    }
}
