package com.example.expensechat.dto.response;

import com.example.expensechat.dto.HistoryEntryDto;
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
public class HistoryResponse extends APIResponseDto {
    List<HistoryEntryDto> messages;
    int deleted;
}
