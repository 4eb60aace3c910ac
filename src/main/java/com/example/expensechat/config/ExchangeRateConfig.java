package com.example.expensechat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Cấu hình dịch vụ tỷ giá.
 *
 * @param baseUrl vd: https://open.er-api.com/v6
 * @param timeout timeout cho lần gọi duy nhất
 */
@ConfigurationProperties(prefix = "fx")
public record ExchangeRateConfig(String baseUrl, Duration timeout) {

    public ExchangeRateConfig {
        if (timeout == null) timeout = Duration.ofSeconds(5);
    }
}
