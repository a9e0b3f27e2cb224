package com.tradewise.common.domain;

import java.math.BigDecimal;
import java.time.Instant;

public record Account(String accountId, String name, BigDecimal balance, String currency, Instant createdAt) {
}
