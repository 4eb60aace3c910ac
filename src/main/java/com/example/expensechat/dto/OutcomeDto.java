package com.example.expensechat.dto;

import com.example.expensechat.service.sql.dto.StatementOutcome;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.FieldDefaults;

/** Kết quả từng câu lệnh trả về cho client. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class OutcomeDto {
    String kind;
    String table;
    String status;
    int affectedRows;
    int rowCount;
    String errorCode;
    String message;

    public static OutcomeDto from(StatementOutcome o) {
        return OutcomeDto.builder()
                .kind(o.kind().name())
                .table(o.table() == null ? null : o.table().tableName())
                .status(o.status().name())
                .affectedRows(o.affectedRows())
                .rowCount(o.rows().size())
                .errorCode(o.errorCode())
                .message(o.message())
                .build();
    }
}
