package com.example.expensechat.service.sql.execute;

import com.example.expensechat.exception.ExecutionFailureException;
import com.example.expensechat.service.sql.dto.RenderedStatement;
import com.example.expensechat.service.sql.dto.StatementKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Chạy từng câu lệnh đã render qua JdbcTemplate. Không bọc transaction:
 * mỗi câu tự commit, câu sau lỗi không rollback câu trước.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementExecutor {
    private final JdbcTemplate jdbcTemplate;

    /** INSERT/UPDATE → số dòng bị tác động. */
    public int update(RenderedStatement statement) {
        if (statement.kind() == StatementKind.SELECT) {
            throw new IllegalArgumentException("SELECT must go through query()");
        }
        log.info("Executing {}: {}", statement.kind(), statement.sql());
        try {
            return jdbcTemplate.update(statement.sql());
        } catch (DataAccessException e) {
            throw failure(statement, e);
        }
    }

    /** SELECT → các dòng (map không phân biệt hoa thường theo tên cột). */
    public List<Map<String, Object>> query(RenderedStatement statement) {
        if (statement.kind() != StatementKind.SELECT) {
            throw new IllegalArgumentException("Only SELECT can be queried");
        }
        log.info("Executing SELECT: {}", statement.sql());
        try {
            return jdbcTemplate.queryForList(statement.sql());
        } catch (DataAccessException e) {
            throw failure(statement, e);
        }
    }

    private static ExecutionFailureException failure(RenderedStatement statement, DataAccessException e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage() == null ? e.getClass().getSimpleName() : cause.getMessage();
        log.error("Statement failed [{}]: {}", statement.sql(), message, e);
        return new ExecutionFailureException(message, e);
    }
}
