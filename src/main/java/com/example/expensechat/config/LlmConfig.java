package com.example.expensechat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Cấu hình gọi LLM (bất biến, bind 1 lần khi khởi động).
 *
 * @param baseUrl       endpoint OpenAI-compatible, vd: https://openrouter.ai/api/v1
 * @param apiKey        lấy từ ENV/Secret
 * @param model         model chính
 * @param fallbackModel model dự phòng khi model chính bị rate-limit
 * @param temperature   nhiệt
 * @param maxTokens     giới hạn token output
 * @param timeout       timeout cho mỗi lần gọi
 */
@ConfigurationProperties(prefix = "llm")
public record LlmConfig(String baseUrl,
                        String apiKey,
                        String model,
                        String fallbackModel,
                        double temperature,
                        int maxTokens,
                        Duration timeout) {

    public LlmConfig {
        if (timeout == null) timeout = Duration.ofSeconds(30);
        if (maxTokens <= 0) maxTokens = 1000;
    }
}
