package com.example.expensechat.service.sql.druid.implement;

import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.SelectStatement;
import com.example.expensechat.service.sql.dto.UpdateStatement;

/**
 * Facade mỏng cho Druid: parse một câu SQL (MySQL) đã qua screener thành IR bất biến.
 * Mọi lỗi cú pháp/cấu trúc đều ném ValidationException.
 */
public interface StatementParserImpl {

    /** INSERT một dòng, có danh sách cột, không INSERT…SELECT. */
    InsertStatement parseInsert(String sql);

    /** UPDATE một bảng sở hữu. */
    UpdateStatement parseUpdate(String sql);

    /** SELECT trên books/categories/expenses; không subquery/UNION/CTE. */
    SelectStatement parseSelect(String sql);
}
