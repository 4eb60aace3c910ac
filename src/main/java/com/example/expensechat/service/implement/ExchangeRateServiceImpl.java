package com.example.expensechat.service.implement;

import java.math.BigDecimal;

public interface ExchangeRateServiceImpl {
    /**
     * Tỷ giá quy đổi 1 đơn vị {@code from} sang {@code to}.
     * Cùng tiền tệ trả về 1 mà không gọi ra ngoài.
     *
     * @throws com.example.expensechat.exception.UpstreamUnavailableException nếu dịch vụ tỷ giá lỗi/timeout
     */
    BigDecimal rate(String from, String to);
}
