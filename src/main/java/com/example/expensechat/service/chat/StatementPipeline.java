package com.example.expensechat.service.chat;

import com.example.expensechat.entity.Book;
import com.example.expensechat.exception.GatewayException;
import com.example.expensechat.service.context.ConversationContext;
import com.example.expensechat.service.currency.CurrencyNormalizer;
import com.example.expensechat.service.currency.NormalizedInsert;
import com.example.expensechat.service.scope.UserScope;
import com.example.expensechat.service.sql.classify.StatementClassifier;
import com.example.expensechat.service.sql.dto.ClassifiedStatement;
import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.RenderedStatement;
import com.example.expensechat.service.sql.dto.SqlValue;
import com.example.expensechat.service.sql.dto.StatementKind;
import com.example.expensechat.service.sql.dto.StatementOutcome;
import com.example.expensechat.service.sql.execute.StatementExecutor;
import com.example.expensechat.service.sql.rewrite.SqlRenderer;
import com.example.expensechat.service.sql.rewrite.TenantIsolationRewriter;
import com.example.expensechat.service.sql.screen.SecurityScreener;
import com.example.expensechat.service.sql.validate.MissingCategory;
import com.example.expensechat.service.sql.validate.SemanticValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Một câu lệnh: screen → classify → validate → quy đổi tiền tệ → rewrite → render → execute.
 * Lỗi của câu lệnh chỉ ảnh hưởng chính nó và được trả về dưới dạng outcome FAILED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementPipeline {
    private final SecurityScreener screener;
    private final StatementClassifier classifier;
    private final SemanticValidator validator;
    private final CurrencyNormalizer currencyNormalizer;
    private final TenantIsolationRewriter rewriter;
    private final SqlRenderer renderer;
    private final StatementExecutor executor;

    /**
     * @param utterance câu người dùng dùng để xác định book và tiền tệ
     */
    public StatementRun run(String sql, UserScope scope, String utterance, ConversationContext context) {
        StatementKind declared = StatementClassifier.kindOf(sql);
        try {
            screener.screen(sql, declared);
            ClassifiedStatement statement = classifier.classify(sql);

            Optional<MissingCategory> missing = validator.validate(statement, scope, utterance, context);
            if (missing.isPresent()) {
                return new StatementRun(null, (InsertStatement) statement, missing.get());
            }

            String note = null;
            if (statement instanceof InsertStatement insert && insert.table() == OwnedTable.EXPENSES) {
                String bookCurrency = insert.valueOf("categoryId").flatMap(SqlValue::text)
                        .flatMap(scope::categoryById)
                        .flatMap(scope::bookOf)
                        .map(Book::getCurrency)
                        .orElse(null);
                NormalizedInsert normalized = currencyNormalizer.normalize(insert, utterance, bookCurrency);
                statement = normalized.statement();
                note = normalized.note();
            }

            ClassifiedStatement scoped = rewriter.rewrite(statement, scope);
            RenderedStatement rendered = renderer.render(scoped);

            if (rendered.kind() == StatementKind.SELECT) {
                return StatementRun.of(StatementOutcome.selected(rendered.table(), executor.query(rendered)));
            }
            int count = executor.update(rendered);
            if (scoped instanceof InsertStatement executed) {
                return new StatementRun(StatementOutcome.inserted(executed, count, note), executed, null);
            }
            return StatementRun.of(StatementOutcome.updated(rendered.table(), count));
        } catch (GatewayException e) {
            log.warn("Statement rejected ({}): {} | {}", e.getErrorCode(), e.getMessage(), sql);
            return StatementRun.of(StatementOutcome.failed(declared, e.getErrorCode(), e.getMessage()));
        }
    }
}
