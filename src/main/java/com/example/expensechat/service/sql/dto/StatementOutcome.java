package com.example.expensechat.service.sql.dto;

import java.util.List;
import java.util.Map;

/**
 * Kết quả của đúng một câu lệnh trong phản hồi của LLM.
 *
 * @param inserted     câu INSERT đã thực thi (để dựng xác nhận), null với loại khác
 * @param rows         các dòng của SELECT
 * @param affectedRows số dòng bị INSERT/UPDATE tác động
 * @param errorCode    mã lỗi khi FAILED
 * @param message      thông báo lỗi (FAILED) hoặc câu hỏi cho người dùng (NEEDS_CATEGORY)
 * @param note         ghi chú phụ, vd quy đổi tiền tệ
 */
public record StatementOutcome(StatementKind kind,
                               OwnedTable table,
                               OutcomeStatus status,
                               InsertStatement inserted,
                               List<Map<String, Object>> rows,
                               int affectedRows,
                               String errorCode,
                               String message,
                               String note) {

    public static StatementOutcome inserted(InsertStatement insert, int count, String note) {
        return new StatementOutcome(StatementKind.INSERT, insert.table(), OutcomeStatus.SUCCESS, insert,
                List.of(), count, null, null, note);
    }

    public static StatementOutcome updated(OwnedTable table, int count) {
        return new StatementOutcome(StatementKind.UPDATE, table, OutcomeStatus.SUCCESS, null, List.of(), count, null, null, null);
    }

    public static StatementOutcome selected(OwnedTable table, List<Map<String, Object>> rows) {
        return new StatementOutcome(StatementKind.SELECT, table, OutcomeStatus.SUCCESS, null, rows, 0, null, null, null);
    }

    public static StatementOutcome failed(StatementKind kind, String errorCode, String message) {
        return new StatementOutcome(kind, null, OutcomeStatus.FAILED, null, List.of(), 0, errorCode, message, null);
    }

    public static StatementOutcome needsCategory(String question) {
        return new StatementOutcome(StatementKind.INSERT, OwnedTable.EXPENSES, OutcomeStatus.NEEDS_CATEGORY, null,
                List.of(), 0, null, question, null);
    }

    public boolean succeeded() {
        return status == OutcomeStatus.SUCCESS;
    }

}
