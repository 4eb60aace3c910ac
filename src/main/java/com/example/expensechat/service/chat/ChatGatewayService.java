package com.example.expensechat.service.chat;

import com.example.expensechat.config.ErrorConfig;
import com.example.expensechat.dto.ConversationMessageDto;
import com.example.expensechat.dto.OutcomeDto;
import com.example.expensechat.dto.request.ChatRequest;
import com.example.expensechat.dto.response.ChatResponse;
import com.example.expensechat.entity.Book;
import com.example.expensechat.exception.AppException;
import com.example.expensechat.exception.SecurityViolationException;
import com.example.expensechat.exception.UpstreamUnavailableException;
import com.example.expensechat.service.context.CategoryResolution;
import com.example.expensechat.service.context.ConversationContext;
import com.example.expensechat.service.context.ConversationContextStore;
import com.example.expensechat.service.context.EntityRef;
import com.example.expensechat.service.context.PendingExpense;
import com.example.expensechat.service.context.ProceedPhraseMatcher;
import com.example.expensechat.service.currency.CurrencyDetector;
import com.example.expensechat.service.currency.DetectedAmount;
import com.example.expensechat.service.format.ConfirmationScrubber;
import com.example.expensechat.service.format.ResponseFormatter;
import com.example.expensechat.service.history.ConversationHistoryService;
import com.example.expensechat.service.implement.ChatGatewayServiceImpl;
import com.example.expensechat.service.llm.LlmService;
import com.example.expensechat.service.prompt.PromptService;
import com.example.expensechat.service.scope.UserScope;
import com.example.expensechat.service.scope.UserScopeLoader;
import com.example.expensechat.service.sql.classify.StatementClassifier;
import com.example.expensechat.service.sql.dto.ExtractionResult;
import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.OwnedTable;
import com.example.expensechat.service.sql.dto.SqlValue;
import com.example.expensechat.service.sql.dto.StatementKind;
import com.example.expensechat.service.sql.dto.StatementOutcome;
import com.example.expensechat.service.sql.extract.StatementExtractor;
import com.example.expensechat.service.sql.screen.SecurityScreener;
import com.example.expensechat.service.sql.validate.MissingCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatGatewayService implements ChatGatewayServiceImpl {

    static final String LLM_UNAVAILABLE_REPLY = "⚠️ The assistant is temporarily unavailable. Please try again in a moment.";
    static final String DECLINED_REPLY = "Okay, I won't add that expense.";
    static final String ONE_PENDING_ONLY = "Only one expense can wait for a new category at a time. Please add the other one again afterwards.";

    private static final Pattern CREATION_REQUEST = Pattern.compile("\\b(add|create)\\b");
    private static final Pattern DATA_REQUEST = Pattern.compile("\\b(sql|query|database|report|show|list)\\b");

    private final UserScopeLoader scopeLoader;
    private final ConversationHistoryService historyService;
    private final PromptService promptService;
    private final LlmService llmService;
    private final StatementExtractor extractor;
    private final SecurityScreener screener;
    private final StatementPipeline pipeline;
    private final ResponseFormatter formatter;
    private final ConfirmationScrubber scrubber;
    private final ProceedPhraseMatcher proceedMatcher;
    private final ConversationContextStore contextStore;
    private final CurrencyDetector currencyDetector;

    @Override
    public ChatResponse chat(String userId, ChatRequest request) {
        String message = request.getMessage();
        if (message == null || message.trim().isEmpty()) {
            throw new AppException(ErrorConfig.BAD_REQUEST, "Message is empty");
        }
        // ngữ cảnh do client gửi kèm (nếu có) được ưu tiên, mặc định dùng ngữ cảnh đã lưu
        ConversationContext context = request.getContext() != null
                ? ConversationContext.sanitize(request.getContext())
                : contextStore.load(userId);

        Turn turn;
        if (context.hasPending()) {
            turn = continuePending(userId, message, context, request.getConversationHistory());
        } else {
            turn = converse(userId, message, context, request.getConversationHistory());
        }

        historyService.recordExchange(userId, message, turn.text());
        contextStore.save(userId, turn.context());
        PendingExpense pending = turn.context().pendingExpense();
        boolean requiresConfirmation = pending != null
                && (pending.is(CategoryResolution.AWAITING_CONFIRMATION) || pending.is(CategoryResolution.READY));
        return ChatResponse.builder()
                .status("OK")
                .response(turn.text())
                .requiresConfirmation(requiresConfirmation)
                .context(turn.context())
                .outcomes(turn.outcomes().stream().map(OutcomeDto::from).toList())
                .build();
    }

    /* ===================== Pending expense ===================== */

    private Turn continuePending(String userId, String message, ConversationContext context,
                                 List<ConversationMessageDto> clientHistory) {
        PendingExpense pending = context.pendingExpense();
        boolean awaiting = pending.is(CategoryResolution.AWAITING_CONFIRMATION);
        boolean ready = pending.is(CategoryResolution.READY);

        if ((awaiting || ready) && proceedMatcher.isProceed(message)) {
            UserScope scope = scopeLoader.load(userId);
            return awaiting ? createPendingCategory(scope, pending, context) : insertPendingExpense(userId, scope, pending, context);
        }
        if ((awaiting || ready) && proceedMatcher.isDecline(message)) {
            log.info("User {} declined pending expense \"{}\"", userId, pending.description());
            return new Turn(DECLINED_REPLY, context.clearPending(), List.of());
        }

        // đổi chủ đề: bỏ pending rồi xử lý như bình thường
        if (!pending.is(CategoryResolution.ABANDONED)) {
            log.info("Pending expense \"{}\" abandoned by user {}", pending.abandoned().description(), userId);
        }
        return converse(userId, message, context.clearPending(), clientHistory);
    }

    private Turn createPendingCategory(UserScope scope, PendingExpense pending, ConversationContext context) {
        String sql = "INSERT INTO categories (name, bookId) VALUES (%s, %s)"
                .formatted(SqlValue.quote(pending.categoryName()), SqlValue.quote(pending.book().id()));
        StatementRun run = pipeline.run(sql, scope, pending.sourceText(), context);
        StatementOutcome outcome = run.outcome();

        EntityRef category;
        if (outcome.succeeded()) {
            String id = run.insert().valueOf("id").flatMap(SqlValue::text).orElseThrow();
            category = new EntityRef(id, pending.categoryName());
        } else if (ErrorConfig.DUPLICATE_ENTITY.equals(outcome.errorCode())) {
            // đã có trong đúng book đó (vd tạo từ tab khác): dùng lại
            category = scope.categoryByName(pending.book().id(), pending.categoryName())
                    .map(c -> new EntityRef(c.getId(), c.getName()))
                    .orElse(null);
        } else {
            category = null;
        }

        if (category == null) {
            log.warn("Could not create category \"{}\" in book {}: {}", pending.categoryName(), pending.book().id(),
                    outcome.message());
            return new Turn(formatter.line(outcome, scope), context.clearPending(), List.of(outcome));
        }

        PendingExpense next = pending.ready(category);
        String text = "✅ Created category \"%s\" in \"%s\". Shall I add the expense of %s%s now? (yes/no)".formatted(
                category.name(), pending.book().name(), amountText(pending, scope),
                pending.description() == null || pending.description().isBlank() ? "" : " for \"" + pending.description() + "\"");
        ConversationContext nextContext = context.withPending(next)
                .withLastBook(pending.book())
                .withLastCategory(category);
        return new Turn(text, nextContext, outcome.succeeded() ? List.of(outcome) : List.of());
    }

    private Turn insertPendingExpense(String userId, UserScope scope, PendingExpense pending, ConversationContext context) {
        List<String> columns = new ArrayList<>(List.of("amount", "categoryId"));
        List<String> values = new ArrayList<>(List.of(pending.amount().toPlainString(), SqlValue.quote(pending.category().id())));
        if (pending.description() != null) {
            columns.add("description");
            values.add(SqlValue.quote(pending.description()));
        }
        if (pending.paymentMethod() != null) {
            columns.add("paymentMethod");
            values.add(SqlValue.quote(pending.paymentMethod()));
        }
        if (pending.date() != null) {
            columns.add("date");
            values.add(SqlValue.quote(pending.date()));
        }
        String sql = "INSERT INTO expenses (%s) VALUES (%s)".formatted(String.join(", ", columns), String.join(", ", values));

        StatementRun run = pipeline.run(sql, scope, pending.sourceText(), context);
        log.info("Pending expense for user {} finished with {}", userId, run.outcome().status());
        ConversationContext next = context.clearPending();
        if (run.outcome().succeeded()) {
            next = next.withLastBook(pending.book()).withLastCategory(pending.category());
        }
        return new Turn(formatter.line(run.outcome(), scope), next, List.of(run.outcome()));
    }

    /** Số tiền theo tiền tệ người dùng đã nói; quy đổi sang tiền của book diễn ra khi INSERT. */
    private String amountText(PendingExpense pending, UserScope scope) {
        BigDecimal amount = pending.amount() == null ? BigDecimal.ZERO : pending.amount();
        String currency = currencyDetector.detect(pending.sourceText())
                .map(DetectedAmount::currency)
                .or(() -> scope.bookById(pending.book().id()).map(Book::getCurrency))
                .orElse("USD");
        return ResponseFormatter.money(amount, currency);
    }

    /* ===================== Normal turn ===================== */

    private Turn converse(String userId, String message, ConversationContext context,
                          List<ConversationMessageDto> clientHistory) {
        UserScope scope = scopeLoader.load(userId);
        List<ConversationMessageDto> history = historyService.forPrompt(userId, clientHistory);
        List<ConversationMessageDto> prompt = promptService.build(message, history, scope, context);

        String reply;
        try {
            reply = llmService.complete(prompt);
        } catch (UpstreamUnavailableException e) {
            log.error("LLM unavailable for user {}: {}", userId, e.getMessage(), e);
            return new Turn(LLM_UNAVAILABLE_REPLY, context, List.of());
        }

        ExtractionResult extraction = extractor.extract(reply);
        log.info("Extracted {} statement(s) for user {}", extraction.statements().size(), userId);

        // screen toàn bộ trước: một câu vi phạm thì không câu nào được chạy
        try {
            for (String sql : extraction.statements()) {
                screener.screen(sql, StatementClassifier.kindOf(sql));
            }
        } catch (SecurityViolationException e) {
            StatementOutcome rejected = StatementOutcome.failed(StatementKind.UNSUPPORTED, e.getErrorCode(), e.getMessage());
            return new Turn("❌ The generated SQL was rejected for safety reasons (%s). Nothing was executed."
                    .formatted(e.getMessage()), context, List.of(rejected));
        }

        if (!extraction.hasStatements()) {
            return new Turn(withoutStatements(message, extraction.residualText()), context, List.of());
        }

        List<StatementOutcome> outcomes = new ArrayList<>();
        ConversationContext current = context;
        UserScope currentScope = scope;
        for (String sql : extraction.statements()) {
            StatementRun run = pipeline.run(sql, currentScope, message, current);
            if (run.missing() != null) {
                if (current.hasPending()) {
                    outcomes.add(StatementOutcome.failed(StatementKind.INSERT, ErrorConfig.VALIDATION_ERROR, ONE_PENDING_ONLY));
                    continue;
                }
                PendingExpense pending = pendingFrom(run.insert(), run.missing(), message);
                current = current.withPending(pending).withLastBook(pending.book());
                outcomes.add(StatementOutcome.needsCategory(
                        "🤔 The category \"%s\" doesn't exist in your book \"%s\". Would you like me to create it? (yes/no)"
                                .formatted(pending.categoryName(), pending.book().name())));
                continue;
            }
            outcomes.add(run.outcome());
            if (run.outcome().succeeded() && run.outcome().kind() != StatementKind.SELECT) {
                currentScope = scopeLoader.load(userId);
                current = remember(current, run.insert(), currentScope);
            }
        }

        String text = formatter.format(outcomes, currentScope);
        if (outcomes.stream().noneMatch(StatementOutcome::succeeded)) {
            String residual = scrubber.scrub(extraction.residualText()).trim();
            if (scrubber.containsConfirmation(residual)) {
                log.error("Confirmation text survived although nothing was executed for user {}: {}", userId, residual);
                residual = ResponseFormatter.NO_OPERATION_WARNING;
            }
            if (!residual.isEmpty()) text = residual + "\n\n" + text;
        }
        return new Turn(text, current, outcomes);
    }

    private String withoutStatements(String message, String residual) {
        String lower = message.toLowerCase(Locale.ROOT);
        boolean faked = scrubber.containsConfirmation(residual);
        String text = scrubber.scrub(residual).trim();
        if (faked && CREATION_REQUEST.matcher(lower).find()) {
            log.warn("Model claimed success without SQL for \"{}\"", message);
            return ResponseFormatter.NO_OPERATION_WARNING;
        }
        if (DATA_REQUEST.matcher(lower).find()) {
            text = text.isEmpty() ? ResponseFormatter.NO_SQL_HINT : text + "\n\n" + ResponseFormatter.NO_SQL_HINT;
        }
        if (scrubber.containsConfirmation(text)) {
            log.error("Confirmation text survived scrubbing for \"{}\"", message);
            return ResponseFormatter.NO_OPERATION_WARNING;
        }
        return text.isEmpty() ? ResponseFormatter.NO_SQL_HINT : text;
    }

    private static PendingExpense pendingFrom(InsertStatement insert, MissingCategory missing, String utterance) {
        BigDecimal amount = insert.valueOf("amount").flatMap(SqlValue::number).orElse(BigDecimal.ZERO);
        String description = insert.valueOf("description").flatMap(SqlValue::text).orElse(null);
        String paymentMethod = insert.valueOf("paymentMethod").flatMap(SqlValue::text).orElse(null);
        String date = insert.valueOf("date").flatMap(SqlValue::text).orElse(null);
        EntityRef book = new EntityRef(missing.book().getId(), missing.book().getName());
        return PendingExpense.resolving(amount, description, paymentMethod, date, book, missing.categoryName(), utterance)
                .needsCategory()
                .awaitingConfirmation();
    }

    /** Cập nhật lastBook/lastCategory từ câu INSERT vừa chạy. */
    private static ConversationContext remember(ConversationContext context, InsertStatement insert, UserScope scope) {
        if (insert == null) return context;
        String id = insert.valueOf("id").flatMap(SqlValue::text).orElse(null);
        if (insert.table() == OwnedTable.BOOKS) {
            return scope.bookById(id).map(b -> context.withLastBook(new EntityRef(b.getId(), b.getName()))).orElse(context);
        }
        if (insert.table() == OwnedTable.CATEGORIES) {
            return scope.categoryById(id).map(c -> {
                ConversationContext next = context.withLastCategory(new EntityRef(c.getId(), c.getName()));
                return scope.bookOf(c).map(b -> next.withLastBook(new EntityRef(b.getId(), b.getName()))).orElse(next);
            }).orElse(context);
        }
        return insert.valueOf("categoryId").flatMap(SqlValue::text).flatMap(scope::categoryById).map(c -> {
            ConversationContext next = context.withLastCategory(new EntityRef(c.getId(), c.getName()));
            return scope.bookOf(c).map(b -> next.withLastBook(new EntityRef(b.getId(), b.getName()))).orElse(next);
        }).orElse(context);
    }

    private record Turn(String text, ConversationContext context, List<StatementOutcome> outcomes) {
    }
}
