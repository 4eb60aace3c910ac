package com.example.expensechat.service.currency;

import com.example.expensechat.config.ExchangeRateConfig;
import com.example.expensechat.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExchangeRateServiceTest {

    private final List<String> requested = new ArrayList<>();

    private ExchangeRateService service(HttpStatus status, String body) {
        WebClient client = WebClient.builder()
                .baseUrl("http://fx.test/v6")
                .exchangeFunction(request -> {
                    requested.add(request.url().getPath());
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new ExchangeRateService(client, new ExchangeRateConfig("http://fx.test/v6", Duration.ofSeconds(2)));
    }

    @Test
    void readsRateForTarget() {
        ExchangeRateService service = service(HttpStatus.OK, "{\"result\":\"success\",\"rates\":{\"USD\":1.08,\"GBP\":0.85}}");

        assertThat(service.rate("eur", "usd")).isEqualByComparingTo(new BigDecimal("1.08"));
        assertThat(requested).containsExactly("/v6/latest/EUR");
    }

    @Test
    void sameCurrencyNeedsNoLookup() {
        ExchangeRateService service = service(HttpStatus.OK, "{}");

        assertThat(service.rate("USD", "usd")).isEqualByComparingTo(BigDecimal.ONE);
        assertThat(requested).isEmpty();
    }

    @Test
    void missingRateIsUpstreamFailure() {
        ExchangeRateService service = service(HttpStatus.OK, "{\"rates\":{\"GBP\":0.85}}");

        assertThatThrownBy(() -> service.rate("EUR", "USD"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("EUR -> USD");
    }

    @Test
    void errorStatusIsUpstreamFailureWithSingleAttempt() {
        ExchangeRateService service = service(HttpStatus.BAD_GATEWAY, "{\"error\":\"down\"}");

        assertThatThrownBy(() -> service.rate("EUR", "USD"))
                .isInstanceOf(UpstreamUnavailableException.class);
        assertThat(requested).hasSize(1);
    }
}
