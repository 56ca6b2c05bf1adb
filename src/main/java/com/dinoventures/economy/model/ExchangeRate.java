package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Directional rate: one unit of {@code baseCurrencyId} buys {@code rate} units of
 * {@code quoteCurrencyId}. The reverse direction is a separate row, if configured at all.
 */
@Data
@Builder
public class ExchangeRate {
    private Long baseCurrencyId;
    private Long quoteCurrencyId;
    private BigDecimal rate;
    private OffsetDateTime updatedAt;
}
