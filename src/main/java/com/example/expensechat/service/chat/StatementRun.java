package com.example.expensechat.service.chat;

import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.StatementOutcome;
import com.example.expensechat.service.sql.validate.MissingCategory;

/**
 * @param outcome kết quả hiển thị
 * @param insert  INSERT đã thực thi (sau rewrite, có id do gateway sinh) hoặc INSERT expense đang chờ category
 * @param missing khác null khi expense cần tạo category trước
 */
public record StatementRun(StatementOutcome outcome, InsertStatement insert, MissingCategory missing) {

    public static StatementRun of(StatementOutcome outcome) {
        return new StatementRun(outcome, null, null);
    }
}
