package com.example.expensechat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Giới hạn của gateway.
 *
 * @param maxSelectRows  LIMIT tối đa cho SELECT do LLM sinh ra
 * @param historyLimit   số lượt hội thoại tối đa gửi kèm cho LLM
 * @param historyPageSize số tin nhắn trả về ở API lịch sử
 */
@ConfigurationProperties(prefix = "gateway")
public record GatewayConfig(int maxSelectRows, int historyLimit, int historyPageSize) {

    public GatewayConfig {
        if (maxSelectRows <= 0) maxSelectRows = 100;
        if (historyLimit <= 0) historyLimit = 20;
        if (historyPageSize <= 0) historyPageSize = 50;
    }
}
