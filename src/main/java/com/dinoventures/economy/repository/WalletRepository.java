package com.dinoventures.economy.repository;

import com.dinoventures.economy.model.Holding;
import com.dinoventures.economy.model.Wallet;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class WalletRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<Wallet> ROW_MAPPER = (rs, rowNum) -> Wallet.builder()
            .id(rs.getLong("id"))
            .accountId(rs.getLong("account_id"))
            .currencyId(rs.getLong("currency_id"))
            .balance(rs.getLong("balance"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    private static final RowMapper<Holding> HOLDING_ROW_MAPPER = (rs, rowNum) -> Holding.builder()
            .accountId(rs.getLong("account_id"))
            .externalId(rs.getString("external_id"))
            .accountCreatedAt(rs.getObject("account_created_at", OffsetDateTime.class))
            .currencyId(rs.getLong("currency_id"))
            .balance(rs.getLong("balance"))
            .build();

    /**
     * Idempotently get or create the wallet for (accountId, currencyId).
     * Uses INSERT ON CONFLICT DO NOTHING so concurrent first credits are safe.
     * Must be called within a transaction.
     */
    public Wallet getOrCreate(long accountId, long currencyId) {
        namedJdbc.update(
                "INSERT INTO wallets (account_id, currency_id) VALUES (:accountId, :currencyId) " +
                "ON CONFLICT (account_id, currency_id) DO NOTHING",
                new MapSqlParameterSource(Map.of("accountId", accountId, "currencyId", currencyId))
        );

        return namedJdbc.query(
                "SELECT id, account_id, currency_id, balance, created_at FROM wallets " +
                "WHERE account_id = :accountId AND currency_id = :currencyId",
                new MapSqlParameterSource(Map.of("accountId", accountId, "currencyId", currencyId)),
                ROW_MAPPER
        ).stream().findFirst().orElseThrow(() ->
                new IllegalStateException("Wallet should exist after getOrCreate")
        );
    }

    /**
     * Acquires row-level locks on the given wallets in ASCENDING ID ORDER and returns
     * their balances as seen under the lock.
     *
     * Locking in one global order means two transactions touching the same pair of
     * wallets can never wait on each other in a cycle.
     *
     * Must be called within a transaction.
     */
    public Map<Long, Long> lockForUpdate(List<Long> sortedWalletIds) {
        Map<Long, Long> balances = new HashMap<>();
        namedJdbc.query(
                "SELECT id, balance FROM wallets WHERE id IN (:ids) ORDER BY id ASC FOR UPDATE",
                new MapSqlParameterSource("ids", sortedWalletIds),
                rs -> {
                    balances.put(rs.getLong("id"), rs.getLong("balance"));
                }
        );
        return balances;
    }

    /**
     * Adds {@code delta} (negative for debits) to a wallet. Must be called within a
     * transaction that holds the wallet lock and has already checked the balance; the
     * balance CHECK constraint is only a backstop.
     */
    public void adjustBalance(long walletId, long delta) {
        namedJdbc.update(
                "UPDATE wallets SET balance = balance + :delta WHERE id = :id",
                new MapSqlParameterSource(Map.of("id", walletId, "delta", delta))
        );
    }

    public List<Wallet> findByAccount(long accountId) {
        return namedJdbc.query(
                "SELECT id, account_id, currency_id, balance, created_at FROM wallets " +
                "WHERE account_id = :accountId ORDER BY currency_id",
                new MapSqlParameterSource("accountId", accountId),
                ROW_MAPPER
        );
    }

    public long getBalance(long accountId, long currencyId) {
        List<Long> results = namedJdbc.queryForList(
                "SELECT balance FROM wallets WHERE account_id = :accountId AND currency_id = :currencyId",
                new MapSqlParameterSource(Map.of("accountId", accountId, "currencyId", currencyId)),
                Long.class
        );
        return results.isEmpty() ? 0L : results.get(0);
    }

    /**
     * Every wallet whose currency belongs to the group, with the owning account's
     * creation time for tie-breaking. Reads committed balances at call time.
     */
    public List<Holding> findHoldingsInGroup(long groupId) {
        return namedJdbc.query(
                "SELECT w.account_id, a.external_id, a.created_at AS account_created_at, " +
                "       w.currency_id, w.balance " +
                "FROM wallets w " +
                "JOIN currencies c ON c.id = w.currency_id " +
                "JOIN accounts a   ON a.id = w.account_id " +
                "WHERE c.group_id = :groupId " +
                "ORDER BY a.created_at, a.id",
                new MapSqlParameterSource("groupId", groupId),
                HOLDING_ROW_MAPPER
        );
    }

    /**
     * Sum of balances for one currency across all wallets. Used by conservation checks.
     */
    public long totalSupply(long currencyId) {
        Long total = namedJdbc.queryForObject(
                "SELECT COALESCE(SUM(balance), 0) FROM wallets WHERE currency_id = :currencyId",
                new MapSqlParameterSource("currencyId", currencyId),
                Long.class
        );
        return total != null ? total : 0L;
    }
}
