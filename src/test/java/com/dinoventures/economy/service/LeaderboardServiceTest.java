package com.dinoventures.economy.service;

import com.dinoventures.economy.exception.CurrencyNotFoundException;
import com.dinoventures.economy.model.Currency;
import com.dinoventures.economy.model.EconomyGroup;
import com.dinoventures.economy.model.GroupKind;
import com.dinoventures.economy.model.Holding;
import com.dinoventures.economy.model.Leaderboard;
import com.dinoventures.economy.model.LeaderboardEntry;
import com.dinoventures.economy.repository.WalletRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeaderboardServiceTest {

    private static final long GROUP_ID = 7L;
    private static final long GOLD     = 1L;
    private static final long GEMS     = 2L;
    private static final long SHELLS   = 3L;

    private static final OffsetDateTime T0 = OffsetDateTime.parse("2024-01-01T00:00:00Z");

    @Mock private WalletRepository walletRepo;
    @Mock private CurrencyRegistry currencyRegistry;
    @Mock private ExchangeEngine   exchangeEngine;
    @Mock private GroupService     groupService;

    private LeaderboardService service;

    @BeforeEach
    void setUp() {
        service = new LeaderboardService(walletRepo, currencyRegistry, exchangeEngine, groupService, 5);
    }

    // =========================================================================
    // Ranking
    // =========================================================================

    @Test
    void rank_sortsDescendingAndBreaksTiesByCreationOrder() {
        List<Holding> holdings = List.of(
                holding(1, 0, GOLD, 5),
                holding(2, 1, GOLD, 20),
                holding(3, 2, GOLD, 20),
                holding(4, 3, GOLD, 1));

        List<LeaderboardEntry> entries = LeaderboardService.rank(holdings, GOLD, Map.of(), 10);

        assertThat(entries).extracting(LeaderboardEntry::getAccountId).containsExactly(2L, 3L, 1L, 4L);
        assertThat(entries).extracting(LeaderboardEntry::getRank).containsExactly(1, 2, 3, 4);
        assertThat(entries.get(0).getConvertedBalance()).isEqualByComparingTo("20");

        assertThat(LeaderboardService.rank(holdings, GOLD, Map.of(), 3))
                .extracting(LeaderboardEntry::getAccountId)
                .containsExactly(2L, 3L, 1L);
    }

    @Test
    void rank_convertsThroughDirectionalRatesAndSumsPerAccount() {
        List<Holding> holdings = List.of(
                holding(1, 0, GOLD, 4),
                holding(1, 0, GEMS, 10),
                holding(2, 1, GOLD, 18));

        List<LeaderboardEntry> entries = LeaderboardService.rank(
                holdings, GOLD, Map.of(GEMS, new BigDecimal("1.5")), 10);

        assertThat(entries).extracting(LeaderboardEntry::getAccountId).containsExactly(1L, 2L);
        assertThat(entries.get(0).getConvertedBalance()).isEqualByComparingTo("19");
    }

    @Test
    void rank_holdingsWithoutRateContributeZero() {
        List<Holding> holdings = List.of(
                holding(1, 0, SHELLS, 1_000_000),
                holding(2, 1, GOLD, 1));

        List<LeaderboardEntry> entries = LeaderboardService.rank(holdings, GOLD, Map.of(GEMS, BigDecimal.TEN), 10);

        assertThat(entries).extracting(LeaderboardEntry::getAccountId).containsExactly(2L, 1L);
        assertThat(entries.get(1).getConvertedBalance()).isEqualByComparingTo("0");
    }

    @Test
    void rank_keepsFractionsOfConvertedBalances() {
        List<LeaderboardEntry> entries = LeaderboardService.rank(
                List.of(holding(1, 0, GEMS, 3)), GOLD, Map.of(GEMS, new BigDecimal("0.5")), 10);

        assertThat(entries.get(0).getConvertedBalance()).isEqualByComparingTo("1.5");
    }

    @Test
    void rank_truncatesToLimit() {
        List<Holding> holdings = List.of(
                holding(1, 0, GOLD, 1),
                holding(2, 1, GOLD, 2),
                holding(3, 2, GOLD, 3));

        assertThat(LeaderboardService.rank(holdings, GOLD, Map.of(), 2))
                .extracting(LeaderboardEntry::getAccountId)
                .containsExactly(3L, 2L);
    }

    @Test
    void rank_emptyGroupGivesEmptyBoard() {
        assertThat(LeaderboardService.rank(List.of(), GOLD, Map.of(), 5)).isEmpty();
    }

    // =========================================================================
    // top()
    // =========================================================================

    @Test
    void top_defaultsToPrimaryCurrencyAndDefaultLimit() {
        Currency gold = currency(GOLD, true);
        when(groupService.requireGroup(GROUP_ID)).thenReturn(group());
        when(currencyRegistry.primaryCurrency(GROUP_ID)).thenReturn(Optional.of(gold));
        when(exchangeEngine.ratesInto(GROUP_ID, GOLD)).thenReturn(Map.of());
        when(walletRepo.findHoldingsInGroup(GROUP_ID)).thenReturn(List.of(
                holding(1, 0, GOLD, 1), holding(2, 1, GOLD, 2), holding(3, 2, GOLD, 3),
                holding(4, 3, GOLD, 4), holding(5, 4, GOLD, 5), holding(6, 5, GOLD, 6)));

        Leaderboard board = service.top(GROUP_ID, null, null);

        assertThat(board.getTargetCurrency()).isEqualTo(gold);
        assertThat(board.getEntries()).hasSize(5);
        assertThat(board.getEntries().get(0).getAccountId()).isEqualTo(6L);
    }

    @Test
    void top_nonPositiveLimitFallsBackToDefault() {
        when(groupService.requireGroup(GROUP_ID)).thenReturn(group());
        when(currencyRegistry.requireCurrencyInGroup(GROUP_ID, GEMS)).thenReturn(currency(GEMS, false));
        when(exchangeEngine.ratesInto(GROUP_ID, GEMS)).thenReturn(Map.of());
        when(walletRepo.findHoldingsInGroup(GROUP_ID)).thenReturn(List.of(
                holding(1, 0, GEMS, 1), holding(2, 1, GEMS, 2), holding(3, 2, GEMS, 3),
                holding(4, 3, GEMS, 4), holding(5, 4, GEMS, 5), holding(6, 5, GEMS, 6)));

        assertThat(service.top(GROUP_ID, GEMS, 0).getEntries()).hasSize(5);
        verify(currencyRegistry, never()).primaryCurrency(GROUP_ID);
    }

    @Test
    void top_withoutPrimaryCurrencyFails() {
        when(groupService.requireGroup(GROUP_ID)).thenReturn(group());
        when(currencyRegistry.primaryCurrency(GROUP_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.top(GROUP_ID, null, 3))
                .isInstanceOf(CurrencyNotFoundException.class);
    }

    private static Holding holding(long accountId, int createdOffsetMinutes, long currencyId, long balance) {
        return Holding.builder()
                .accountId(accountId)
                .externalId("user-" + accountId)
                .accountCreatedAt(T0.plusMinutes(createdOffsetMinutes))
                .currencyId(currencyId)
                .balance(balance)
                .build();
    }

    private static Currency currency(long id, boolean primary) {
        return Currency.builder().id(id).groupId(GROUP_ID).name("c" + id).primary(primary).build();
    }

    private static EconomyGroup group() {
        return EconomyGroup.builder().id(GROUP_ID).kind(GroupKind.LOCAL).name("traders").build();
    }
}
