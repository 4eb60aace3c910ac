package com.example.expensechat.dto.request;

import com.example.expensechat.dto.ConversationMessageDto;
import com.example.expensechat.service.context.ConversationContext;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ChatRequest {
    String message;
    List<ConversationMessageDto> conversationHistory;
    ConversationContext context;
}
