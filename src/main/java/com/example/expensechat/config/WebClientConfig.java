package com.example.expensechat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    WebClient llmWebClient(LlmConfig llmConfig) {
        return WebClient.builder()
                .baseUrl(llmConfig.baseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + llmConfig.apiKey())
                .defaultHeader("X-Title", "Manage My Expenses")
                .build();
    }

    @Bean
    WebClient rateWebClient(ExchangeRateConfig exchangeRateConfig) {
        return WebClient.builder()
                .baseUrl(exchangeRateConfig.baseUrl())
                .build();
    }
}
