package com.example.expensechat.service.llm;

import com.example.expensechat.config.LlmConfig;
import com.example.expensechat.dto.ConversationMessageDto;
import com.example.expensechat.exception.UpstreamUnavailableException;
import com.example.expensechat.service.implement.LlmServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
public class LlmService implements LlmServiceImpl {
    private final WebClient llmWebClient;
    private final LlmConfig llmConfig;

    public LlmService(@Qualifier("llmWebClient") WebClient llmWebClient, LlmConfig llmConfig) {
        this.llmWebClient = llmWebClient;
        this.llmConfig = llmConfig;
    }

    @Override
    public String complete(List<ConversationMessageDto> messages) {
        try {
            return call(llmConfig.model(), messages);
        } catch (LlmCallException e) {
            if (e.rateLimited() && llmConfig.fallbackModel() != null && !llmConfig.fallbackModel().isBlank()) {
                log.warn("Model {} rate-limited, retrying once with {}", llmConfig.model(), llmConfig.fallbackModel());
                try {
                    return call(llmConfig.fallbackModel(), messages);
                } catch (LlmCallException fallback) {
                    throw new UpstreamUnavailableException("llm", "Fallback model failed: " + fallback.getMessage(), fallback);
                }
            }
            throw new UpstreamUnavailableException("llm", "Language model call failed: " + e.getMessage(), e);
        }
    }

    private String call(String model, List<ConversationMessageDto> messages) {
        // Body OpenAI-compatible: model, messages, temperature, max_tokens
        var body = Map.of(
                "model", model,
                "temperature", llmConfig.temperature(),
                "max_tokens", llmConfig.maxTokens(),
                "messages", messages.stream()
                        .map(m -> Map.of("role", m.getRole(), "content", m.getContent()))
                        .toList()
        );

        Map<?, ?> resp;
        try {
            resp = llmWebClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, errorResp ->
                            errorResp.bodyToMono(String.class).defaultIfEmpty("").flatMap(err -> {
                                log.error("LLM {} ({}): {}", errorResp.statusCode(), model, err);
                                boolean limited = errorResp.statusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                                        || err.toLowerCase(Locale.ROOT).contains("rate limit");
                                return Mono.error(new LlmCallException(errorResp.statusCode() + " " + err, limited, null));
                            })
                    )
                    .bodyToMono(Map.class) // nhận về Map để bóc thủ công
                    .block(llmConfig.timeout());
        } catch (LlmCallException e) {
            throw e;
        } catch (RuntimeException e) {
            String msg = String.valueOf(e.getMessage());
            log.error("LLM call to {} failed", model, e);
            throw new LlmCallException(msg, msg.toLowerCase(Locale.ROOT).contains("rate limit"), e);
        }

        if (resp == null) return "";
        if (resp.get("error") instanceof Map<?, ?> err) {
            String msg = String.valueOf(err.get("message"));
            throw new LlmCallException(msg, msg.toLowerCase(Locale.ROOT).contains("rate limit"), null);
        }

        // Bóc text chuẩn: choices[0].message.content
        Object choices = resp.get("choices");
        if (!(choices instanceof List<?> cl) || cl.isEmpty()) return "";
        Object first = cl.get(0);
        if (!(first instanceof Map<?, ?> choice)) return "";
        Object message = choice.get("message");
        if (!(message instanceof Map<?, ?> mm)) return "";
        Object content = mm.get("content");
        return content == null ? "" : content.toString();
    }

    /** Lỗi nội bộ của một lần gọi; {@code rateLimited} quyết định có thử model dự phòng hay không. */
    static final class LlmCallException extends RuntimeException {
        private final boolean rateLimited;

        LlmCallException(String message, boolean rateLimited, Throwable cause) {
            super(message, cause);
            this.rateLimited = rateLimited;
        }

        boolean rateLimited() {
            return rateLimited;
        }
    }
}
