package com.dinoventures.economy.service;

import com.dinoventures.economy.exception.CurrencyNotFoundException;
import com.dinoventures.economy.exception.DuplicateCurrencyException;
import com.dinoventures.economy.exception.RateNotFoundException;
import com.dinoventures.economy.model.Currency;
import com.dinoventures.economy.model.ExchangeRate;
import com.dinoventures.economy.repository.CurrencyRepository;
import com.dinoventures.economy.repository.ExchangeRateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Sole writer of currencies, the per-group primary flag and exchange rates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrencyRegistry {

    private static final int MAX_NAME_LENGTH = 64;

    // exchange_rates.rate is NUMERIC(38, 12)
    static final int MAX_RATE_FRACTION_DIGITS = 12;
    static final int MAX_RATE_INTEGER_DIGITS  = 26;

    private final CurrencyRepository     currencyRepo;
    private final ExchangeRateRepository rateRepo;
    private final GroupService           groupService;
    private final UnitOfWork             unitOfWork;

    /**
     * Creates a currency in the group. The first currency of a group becomes its
     * primary currency.
     *
     * The group row is locked for the duration, so two concurrent "first" currencies
     * cannot both be flagged primary and duplicate names are caught before insert.
     */
    public Currency createCurrency(long groupId, String displayName) {
        String name = validateName(displayName);
        groupService.requireGroup(groupId);

        Currency currency = unitOfWork.execute(() -> {
            groupService.lockGroup(groupId);
            if (currencyRepo.findByName(groupId, name).isPresent()) {
                throw new DuplicateCurrencyException(groupId, name);
            }
            boolean first = currencyRepo.countByGroup(groupId) == 0;
            return currencyRepo.save(groupId, name, first);
        });

        log.info("Created currency: id={}, groupId={}, name='{}', primary={}",
                currency.getId(), groupId, name, currency.isPrimary());
        return currency;
    }

    public Currency setPrimaryCurrency(long groupId, long currencyId) {
        groupService.requireGroup(groupId);
        Currency currency = requireCurrencyInGroup(groupId, currencyId);
        if (currency.isPrimary()) {
            return currency;
        }

        unitOfWork.run(() -> {
            groupService.lockGroup(groupId);
            currencyRepo.movePrimary(groupId, currencyId);
        });
        log.info("Primary currency of group {} is now {}", groupId, currencyId);
        return currencyRepo.findById(currencyId).orElseThrow(() -> new CurrencyNotFoundException(currencyId));
    }

    public Optional<Currency> primaryCurrency(long groupId) {
        return currencyRepo.findPrimary(groupId);
    }

    public List<Currency> currenciesOf(long groupId) {
        groupService.requireGroup(groupId);
        return currencyRepo.findByGroup(groupId);
    }

    public Currency requireCurrency(long currencyId) {
        return currencyRepo.findById(currencyId).orElseThrow(() -> new CurrencyNotFoundException(currencyId));
    }

    public Currency requireCurrencyInGroup(long groupId, long currencyId) {
        Currency currency = requireCurrency(currencyId);
        if (currency.getGroupId() != groupId) {
            throw new CurrencyNotFoundException(currencyId, groupId);
        }
        return currency;
    }

    /**
     * Creates or replaces the directional rate base → quote. Only this direction
     * becomes usable; the reverse needs its own call.
     *
     * A rate is stored exactly or not at all: more than 12 fractional or 26 integer
     * digits is rejected rather than rounded.
     */
    public ExchangeRate setExchangeRate(long groupId, long baseCurrencyId, long quoteCurrencyId, BigDecimal rate) {
        validateRate(rate);
        if (baseCurrencyId == quoteCurrencyId) {
            throw new IllegalArgumentException("Base and quote currency must differ");
        }
        groupService.requireGroup(groupId);
        requireCurrencyInGroup(groupId, baseCurrencyId);
        requireCurrencyInGroup(groupId, quoteCurrencyId);

        unitOfWork.run(() -> rateRepo.upsert(baseCurrencyId, quoteCurrencyId, rate));
        log.info("Exchange rate set: group={}, {} -> {} = {}", groupId, baseCurrencyId, quoteCurrencyId, rate.toPlainString());

        return ExchangeRate.builder()
                .baseCurrencyId(baseCurrencyId)
                .quoteCurrencyId(quoteCurrencyId)
                .rate(rate)
                .build();
    }

    public void removeExchangeRate(long groupId, long baseCurrencyId, long quoteCurrencyId) {
        requireCurrencyInGroup(groupId, baseCurrencyId);
        requireCurrencyInGroup(groupId, quoteCurrencyId);
        int removed = unitOfWork.execute(() -> rateRepo.delete(baseCurrencyId, quoteCurrencyId));
        if (removed == 0) {
            throw new RateNotFoundException(baseCurrencyId, quoteCurrencyId);
        }
        log.info("Exchange rate removed: group={}, {} -> {}", groupId, baseCurrencyId, quoteCurrencyId);
    }

    public List<ExchangeRate> ratesOf(long groupId) {
        groupService.requireGroup(groupId);
        return rateRepo.findByGroup(groupId);
    }

    private static void validateRate(BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("Exchange rate must be greater than zero");
        }
        BigDecimal normalized = rate.stripTrailingZeros();
        if (normalized.scale() > MAX_RATE_FRACTION_DIGITS) {
            throw new IllegalArgumentException(
                    "Exchange rate must have at most " + MAX_RATE_FRACTION_DIGITS + " decimal places");
        }
        if (normalized.precision() - normalized.scale() > MAX_RATE_INTEGER_DIGITS) {
            throw new IllegalArgumentException(
                    "Exchange rate must have at most " + MAX_RATE_INTEGER_DIGITS + " integer digits");
        }
    }

    private static String validateName(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Currency name must not be blank");
        }
        String name = displayName.trim();
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Currency name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return name;
    }
}
