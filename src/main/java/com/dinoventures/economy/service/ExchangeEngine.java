package com.dinoventures.economy.service;

import com.dinoventures.economy.repository.ExchangeRateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over admin-configured rates.
 *
 * Only the configured direction of a rate is honoured: no reciprocal is inferred and no
 * multi-hop path is searched. Rates change only through {@link CurrencyRegistry}.
 */
@Service
@RequiredArgsConstructor
public class ExchangeEngine {

    private final ExchangeRateRepository rateRepo;

    public Optional<BigDecimal> rateFor(long groupId, long baseCurrencyId, long quoteCurrencyId) {
        return rateRepo.findRate(groupId, baseCurrencyId, quoteCurrencyId);
    }

    /**
     * Every rate in the group that converts into {@code quoteCurrencyId}, keyed by base currency.
     */
    public Map<Long, BigDecimal> ratesInto(long groupId, long quoteCurrencyId) {
        return rateRepo.findRatesInto(groupId, quoteCurrencyId);
    }

    /**
     * {@code floor(amount * rate)}. Balances are whole units, so the fractional part of
     * a conversion cannot be credited and is dropped.
     */
    public static long convertFloor(long amount, BigDecimal rate) {
        try {
            return convertExact(amount, rate).setScale(0, RoundingMode.FLOOR).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Converted amount is out of range: " + amount + " x " + rate.toPlainString(), e);
        }
    }

    public static BigDecimal convertExact(long amount, BigDecimal rate) {
        return BigDecimal.valueOf(amount).multiply(rate);
    }
}
