package com.dinoventures.economy.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of an exchange. {@code credited} is {@code floor(debited * rate)}; the
 * fractional remainder is not credited anywhere.
 */
@Value
public class ExchangeResult {
    long accountId;
    long fromCurrencyId;
    long toCurrencyId;
    long debited;
    long credited;
    BigDecimal rate;
}
