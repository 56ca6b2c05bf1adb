package com.dinoventures.economy.service;

import com.dinoventures.economy.exception.CurrencyNotFoundException;
import com.dinoventures.economy.model.Currency;
import com.dinoventures.economy.model.Holding;
import com.dinoventures.economy.model.Leaderboard;
import com.dinoventures.economy.model.LeaderboardEntry;
import com.dinoventures.economy.repository.WalletRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks the accounts of a group by their holdings expressed in one target currency.
 *
 * Reads committed balances at call time. No snapshot is held across the wallet and
 * rate reads, so a ranking taken during concurrent mutations may mix before and after
 * states.
 */
@Service
@Slf4j
public class LeaderboardService {

    static final int MAX_LIMIT = 100;

    private final WalletRepository walletRepo;
    private final CurrencyRegistry currencyRegistry;
    private final ExchangeEngine   exchangeEngine;
    private final GroupService     groupService;
    private final int              defaultLimit;

    public LeaderboardService(WalletRepository walletRepo,
                              CurrencyRegistry currencyRegistry,
                              ExchangeEngine exchangeEngine,
                              GroupService groupService,
                              @Value("${economy.leaderboard.default-limit:5}") int defaultLimit) {
        this.walletRepo = walletRepo;
        this.currencyRegistry = currencyRegistry;
        this.exchangeEngine = exchangeEngine;
        this.groupService = groupService;
        this.defaultLimit = defaultLimit;
    }

    /**
     * @param targetCurrencyId currency to rank in; the group's primary currency when null
     * @param limit            number of entries; the configured default when null or below 1
     */
    public Leaderboard top(long groupId, Long targetCurrencyId, Integer limit) {
        groupService.requireGroup(groupId);
        Currency target = targetCurrencyId != null
                ? currencyRegistry.requireCurrencyInGroup(groupId, targetCurrencyId)
                : currencyRegistry.primaryCurrency(groupId)
                        .orElseThrow(() -> CurrencyNotFoundException.noPrimary(groupId));

        int effectiveLimit = (limit == null || limit < 1) ? defaultLimit : Math.min(limit, MAX_LIMIT);

        List<Holding> holdings = walletRepo.findHoldingsInGroup(groupId);
        Map<Long, BigDecimal> rates = exchangeEngine.ratesInto(groupId, target.getId());

        List<LeaderboardEntry> entries = rank(holdings, target.getId(), rates, effectiveLimit);
        log.debug("Leaderboard computed: group={}, target={}, holdings={}, entries={}",
                groupId, target.getId(), holdings.size(), entries.size());
        return new Leaderboard(groupId, target, entries);
    }

    /**
     * Sums each account's holdings converted into the target currency and returns the
     * top {@code limit} by total, descending. Holdings in a currency without a rate into
     * the target count as zero. Equal totals are ordered by account creation, earliest
     * first.
     *
     * @param holdings wallets of the group, ordered by account creation then account id
     * @param rates    directional rates into the target, keyed by base currency
     */
    static List<LeaderboardEntry> rank(List<Holding> holdings, long targetCurrencyId,
                                       Map<Long, BigDecimal> rates, int limit) {
        // insertion order = account creation order, which the stable sort keeps for ties
        Map<Long, Totals> byAccount = new LinkedHashMap<>();
        for (Holding holding : holdings) {
            Totals totals = byAccount.computeIfAbsent(holding.getAccountId(),
                    id -> new Totals(id, holding.getExternalId()));
            totals.add(contribution(holding, targetCurrencyId, rates));
        }

        List<Totals> sorted = new ArrayList<>(byAccount.values());
        sorted.sort(Comparator.comparing((Totals t) -> t.total).reversed());

        List<LeaderboardEntry> entries = new ArrayList<>(Math.min(limit, sorted.size()));
        for (int i = 0; i < sorted.size() && i < limit; i++) {
            Totals t = sorted.get(i);
            entries.add(new LeaderboardEntry(i + 1, t.accountId, t.externalId, t.total));
        }
        return entries;
    }

    private static BigDecimal contribution(Holding holding, long targetCurrencyId, Map<Long, BigDecimal> rates) {
        if (holding.getCurrencyId() == targetCurrencyId) {
            return BigDecimal.valueOf(holding.getBalance());
        }
        BigDecimal rate = rates.get(holding.getCurrencyId());
        return rate == null ? BigDecimal.ZERO : ExchangeEngine.convertExact(holding.getBalance(), rate);
    }

    private static final class Totals {
        private final long accountId;
        private final String externalId;
        private BigDecimal total = BigDecimal.ZERO;

        private Totals(long accountId, String externalId) {
            this.accountId = accountId;
            this.externalId = externalId;
        }

        private void add(BigDecimal amount) {
            total = total.add(amount);
        }
    }
}
