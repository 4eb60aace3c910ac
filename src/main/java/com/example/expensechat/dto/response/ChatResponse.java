package com.example.expensechat.dto.response;

import com.example.expensechat.dto.OutcomeDto;
import com.example.expensechat.service.context.ConversationContext;
import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.experimental.FieldDefaults;
import lombok.experimental.SuperBuilder;

import java.util.List;

@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@Data
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ChatResponse extends APIResponseDto {
    String response;
    boolean requiresConfirmation;
    ConversationContext context;
    List<OutcomeDto> outcomes;
}
