package com.example.expensechat.service.llm;

import com.example.expensechat.config.LlmConfig;
import com.example.expensechat.dto.ConversationMessageDto;
import com.example.expensechat.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmServiceTest {

    private static final String OK_BODY = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"```sql\\nSELECT 1\\n```\"}}]}";

    private final AtomicInteger calls = new AtomicInteger();
    private final List<ConversationMessageDto> messages = List.of(
            ConversationMessageDto.of("system", "rules"),
            ConversationMessageDto.of("user", "show my books"));

    private record Reply(HttpStatus status, String body) {
    }

    private LlmService service(Reply... replies) {
        Deque<Reply> queue = new ArrayDeque<>(List.of(replies));
        WebClient client = WebClient.builder()
                .baseUrl("http://llm.test/api/v1")
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    Reply r = queue.size() > 1 ? queue.poll() : queue.peek();
                    return Mono.just(ClientResponse.create(r.status())
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(r.body())
                            .build());
                })
                .build();
        LlmConfig config = new LlmConfig("http://llm.test/api/v1", "key", "primary", "fallback", 0.1, 500,
                Duration.ofSeconds(2));
        return new LlmService(client, config);
    }

    @Test
    void returnsFirstChoiceContent() {
        assertThat(service(new Reply(HttpStatus.OK, OK_BODY)).complete(messages)).isEqualTo("```sql\nSELECT 1\n```");
        assertThat(calls).hasValue(1);
    }

    @Test
    void rateLimitFallsBackExactlyOnce() {
        LlmService service = service(
                new Reply(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":{\"message\":\"slow down\"}}"),
                new Reply(HttpStatus.OK, OK_BODY));

        assertThat(service.complete(messages)).contains("SELECT 1");
        assertThat(calls).hasValue(2);
    }

    @Test
    void rateLimitMentionedInBodyAlsoFallsBack() {
        LlmService service = service(
                new Reply(HttpStatus.OK, "{\"error\":{\"message\":\"Rate limit exceeded for model\"}}"),
                new Reply(HttpStatus.OK, OK_BODY));

        assertThat(service.complete(messages)).contains("SELECT 1");
        assertThat(calls).hasValue(2);
    }

    @Test
    void fallbackFailureIsUpstreamUnavailable() {
        LlmService service = service(new Reply(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"rate limit\"}"));

        assertThatThrownBy(() -> service.complete(messages)).isInstanceOf(UpstreamUnavailableException.class);
        assertThat(calls).hasValue(2);
    }

    @Test
    void otherErrorsDoNotRetry() {
        LlmService service = service(new Reply(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}"));

        assertThatThrownBy(() -> service.complete(messages))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("Language model call failed");
        assertThat(calls).hasValue(1);
    }

    @Test
    void emptyChoicesGiveEmptyText() {
        assertThat(service(new Reply(HttpStatus.OK, "{\"choices\":[]}")).complete(messages)).isEmpty();
    }
}
