package com.example.expensechat.service.sql.dto;

import java.util.List;

/**
 * @param statements   các câu SQL ứng viên, theo thứ tự xuất hiện
 * @param residualText phần text nằm ngoài khối code (không bao giờ được thực thi)
 */
public record ExtractionResult(List<String> statements, String residualText) {

    public ExtractionResult {
        statements = List.copyOf(statements);
        residualText = residualText == null ? "" : residualText;
    }

    public boolean hasStatements() {
        return !statements.isEmpty();
    }
}
