package com.example.expensechat.service.currency;

import com.example.expensechat.service.sql.dto.InsertStatement;

/**
 * @param statement câu INSERT (đã thay amount nếu quy đổi được)
 * @param note      ghi chú cho người dùng (quy đổi thành công hoặc cảnh báo), null nếu không có
 */
public record NormalizedInsert(InsertStatement statement, String note) {
}
