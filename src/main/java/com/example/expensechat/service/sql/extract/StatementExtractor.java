package com.example.expensechat.service.sql.extract;

import com.example.expensechat.service.sql.dto.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tách phản hồi của LLM thành các câu SQL ứng viên.
 * Chỉ nội dung trong khối ```sql / ```mysql mới được coi là SQL; phần còn lại là residual.
 */
@Slf4j
@Component
public class StatementExtractor {

    private static final Pattern BLOCK = Pattern.compile(
            "```(?:sql|mysql)[ \\t]*\\r?\\n?(.*?)```",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public ExtractionResult extract(String reply) {
        if (reply == null || reply.isBlank()) {
            return new ExtractionResult(List.of(), "");
        }

        List<String> statements = new ArrayList<>();
        StringBuilder residual = new StringBuilder();
        Matcher m = BLOCK.matcher(reply);
        int last = 0;
        while (m.find()) {
            residual.append(reply, last, m.start());
            for (String fragment : SqlText.splitOutsideLiterals(m.group(1))) {
                String s = fragment.trim();
                if (!s.isEmpty()) statements.add(s);
            }
            last = m.end();
        }
        residual.append(reply.substring(last));

        log.info("Extracted {} statement(s) from LLM reply", statements.size());
        return new ExtractionResult(statements, residual.toString().trim());
    }
}
