package com.dinoventures.economy.repository;

import com.dinoventures.economy.model.ExchangeRate;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ExchangeRateRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<ExchangeRate> ROW_MAPPER = (rs, rowNum) -> ExchangeRate.builder()
            .baseCurrencyId(rs.getLong("base_currency_id"))
            .quoteCurrencyId(rs.getLong("quote_currency_id"))
            .rate(rs.getBigDecimal("rate"))
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
            .build();

    /**
     * Create or replace the directional rate base → quote.
     */
    public void upsert(long baseCurrencyId, long quoteCurrencyId, BigDecimal rate) {
        namedJdbc.update(
                "INSERT INTO exchange_rates (base_currency_id, quote_currency_id, rate) " +
                "VALUES (:base, :quote, :rate) " +
                "ON CONFLICT (base_currency_id, quote_currency_id) " +
                "DO UPDATE SET rate = EXCLUDED.rate, updated_at = now()",
                new MapSqlParameterSource(Map.of("base", baseCurrencyId, "quote", quoteCurrencyId, "rate", rate))
        );
    }

    public int delete(long baseCurrencyId, long quoteCurrencyId) {
        return namedJdbc.update(
                "DELETE FROM exchange_rates WHERE base_currency_id = :base AND quote_currency_id = :quote",
                new MapSqlParameterSource(Map.of("base", baseCurrencyId, "quote", quoteCurrencyId))
        );
    }

    /**
     * Rate base → quote, only if both currencies belong to {@code groupId}.
     */
    public Optional<BigDecimal> findRate(long groupId, long baseCurrencyId, long quoteCurrencyId) {
        List<BigDecimal> results = namedJdbc.queryForList(
                "SELECT r.rate FROM exchange_rates r " +
                "JOIN currencies b ON b.id = r.base_currency_id " +
                "JOIN currencies q ON q.id = r.quote_currency_id " +
                "WHERE r.base_currency_id = :base AND r.quote_currency_id = :quote " +
                "  AND b.group_id = :groupId AND q.group_id = :groupId",
                new MapSqlParameterSource(Map.of("groupId", groupId, "base", baseCurrencyId, "quote", quoteCurrencyId)),
                BigDecimal.class
        );
        return results.stream().findFirst();
    }

    /**
     * All rates in the group that quote into {@code quoteCurrencyId}, keyed by base currency.
     */
    public Map<Long, BigDecimal> findRatesInto(long groupId, long quoteCurrencyId) {
        Map<Long, BigDecimal> rates = new HashMap<>();
        namedJdbc.query(
                "SELECT r.base_currency_id, r.rate FROM exchange_rates r " +
                "JOIN currencies b ON b.id = r.base_currency_id " +
                "WHERE r.quote_currency_id = :quote AND b.group_id = :groupId",
                new MapSqlParameterSource(Map.of("groupId", groupId, "quote", quoteCurrencyId)),
                rs -> {
                    rates.put(rs.getLong("base_currency_id"), rs.getBigDecimal("rate"));
                }
        );
        return rates;
    }

    public List<ExchangeRate> findByGroup(long groupId) {
        return namedJdbc.query(
                "SELECT r.base_currency_id, r.quote_currency_id, r.rate, r.updated_at " +
                "FROM exchange_rates r " +
                "JOIN currencies b ON b.id = r.base_currency_id " +
                "WHERE b.group_id = :groupId " +
                "ORDER BY r.base_currency_id, r.quote_currency_id",
                new MapSqlParameterSource("groupId", groupId),
                ROW_MAPPER
        );
    }
}
