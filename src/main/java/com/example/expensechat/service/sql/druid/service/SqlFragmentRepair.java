package com.example.expensechat.service.sql.druid.service;

import com.example.expensechat.service.sql.extract.SqlText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sửa các mảnh SQL do ghép chuỗi ngây thơ: chỉ XOÁ (AND/OR thừa ở cuối, WHERE rỗng,
 * WHERE AND, connector đứng ngay trước ORDER/GROUP/LIMIT/HAVING). Không bao giờ thêm điều kiện.
 * Tìm vị trí trên text đã mask literal nên nội dung chuỗi không bị đụng tới.
 */
@Slf4j
@Component
public class SqlFragmentRepair {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Pattern> RULES = List.of(
            // AND/OR treo ở cuối câu
            Pattern.compile("\\s+((?:and|or)\\s*;?)\\s*$", FLAGS),
            // WHERE rỗng ở cuối câu
            Pattern.compile("\\s+(where\\s*;?)\\s*$", FLAGS),
            // WHERE AND x
            Pattern.compile("\\bwhere\\s+((?:and|or)\\s+)", FLAGS),
            // ... AND ORDER BY / WHERE LIMIT ...
            Pattern.compile("\\s+((?:and|or|where)\\s+)(?=(?:order|group)\\s+by\\b|limit\\b|having\\b)", FLAGS));

    /** @return text đã sửa (giống hệt input nếu không có gì cần sửa) */
    public String repair(String sql) {
        String current = sql;
        boolean changed = true;
        while (changed) {
            changed = false;
            String masked = SqlText.maskLiterals(current);
            for (Pattern rule : RULES) {
                Matcher m = rule.matcher(masked);
                if (m.find()) {
                    current = current.substring(0, m.start(1)) + current.substring(m.end(1));
                    changed = true;
                    break;
                }
            }
        }
        current = current.strip();
        if (!current.equals(sql.strip())) {
            log.info("Repaired SQL fragment: [{}] -> [{}]", sql, current);
        }
        return current;
    }
}
