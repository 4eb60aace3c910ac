package com.example.expensechat.service.currency;

import com.example.expensechat.config.ExchangeRateConfig;
import com.example.expensechat.exception.UpstreamUnavailableException;
import com.example.expensechat.service.implement.ExchangeRateServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
public class ExchangeRateService implements ExchangeRateServiceImpl {
    private final WebClient rateWebClient;
    private final ExchangeRateConfig exchangeRateConfig;

    public ExchangeRateService(@Qualifier("rateWebClient") WebClient rateWebClient, ExchangeRateConfig exchangeRateConfig) {
        this.rateWebClient = rateWebClient;
        this.exchangeRateConfig = exchangeRateConfig;
    }

    @Override
    public BigDecimal rate(String from, String to) {
        String base = from.toUpperCase(Locale.ROOT);
        String target = to.toUpperCase(Locale.ROOT);
        if (base.equals(target)) return BigDecimal.ONE;

        Map<?, ?> resp;
        try {
            // GET /latest/{base} -> {"rates": {...}}; một lần gọi duy nhất, không retry
            resp = rateWebClient.get()
                    .uri("/latest/{base}", base)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, errorResp ->
                            errorResp.bodyToMono(String.class).flatMap(err -> {
                                log.error("Rate service {}: {}", errorResp.statusCode(), err);
                                return Mono.error(new UpstreamUnavailableException("rates", "Rate service returned " + errorResp.statusCode()));
                            })
                    )
                    .bodyToMono(Map.class)
                    .block(exchangeRateConfig.timeout());
        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Rate lookup {}->{} failed", base, target, e);
            throw new UpstreamUnavailableException("rates", "Exchange rate service is unavailable", e);
        }

        if (resp == null || !(resp.get("rates") instanceof Map<?, ?> rates)) {
            throw new UpstreamUnavailableException("rates", "Empty exchange rate response");
        }
        Object value = rates.get(target);
        if (!(value instanceof Number n)) {
            throw new UpstreamUnavailableException("rates", "No rate for " + base + " -> " + target);
        }
        BigDecimal rate = new BigDecimal(n.toString());
        log.info("Rate {}->{} = {}", base, target, rate);
        return rate;
    }
}
