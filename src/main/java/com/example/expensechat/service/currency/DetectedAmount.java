package com.example.expensechat.service.currency;

import java.math.BigDecimal;

public record DetectedAmount(BigDecimal amount, String currency) {
}
