package com.dinoventures.economy.repository;

import com.dinoventures.economy.model.AuditEvent;
import com.dinoventures.economy.model.AuditEventKind;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class AuditEventRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<AuditEvent> ROW_MAPPER = (rs, rowNum) -> AuditEvent.builder()
            .eventId(rs.getObject("event_id", UUID.class))
            .kind(AuditEventKind.valueOf(rs.getString("kind")))
            .actorAccountId(rs.getLong("actor_account_id"))
            .counterpartAccountId(rs.getObject("counterpart_account_id", Long.class))
            .currencyId(rs.getLong("currency_id"))
            .amount(rs.getLong("amount"))
            .counterCurrencyId(rs.getObject("counter_currency_id", Long.class))
            .counterAmount(rs.getObject("counter_amount", Long.class))
            .occurredAt(rs.getTimestamp("occurred_at").toInstant())
            .build();

    /**
     * Batch insert. Rows whose event_id is already stored are skipped, so a batch
     * re-delivered after a partial failure does not duplicate entries.
     */
    public int[] insertAll(List<AuditEvent> events) {
        SqlParameterSource[] batch = events.stream()
                .map(e -> new MapSqlParameterSource()
                        .addValue("eventId", e.getEventId())
                        .addValue("kind", e.getKind().name())
                        .addValue("actorAccountId", e.getActorAccountId())
                        .addValue("counterpartAccountId", e.getCounterpartAccountId(), Types.BIGINT)
                        .addValue("currencyId", e.getCurrencyId())
                        .addValue("amount", e.getAmount())
                        .addValue("counterCurrencyId", e.getCounterCurrencyId(), Types.BIGINT)
                        .addValue("counterAmount", e.getCounterAmount(), Types.BIGINT)
                        .addValue("occurredAt", Timestamp.from(e.getOccurredAt())))
                .toArray(SqlParameterSource[]::new);

        return namedJdbc.batchUpdate(
                "INSERT INTO audit_events (event_id, kind, actor_account_id, counterpart_account_id, " +
                "                          currency_id, amount, counter_currency_id, counter_amount, occurred_at) " +
                "VALUES (:eventId, :kind, :actorAccountId, :counterpartAccountId, " +
                "        :currencyId, :amount, :counterCurrencyId, :counterAmount, :occurredAt) " +
                "ON CONFLICT (event_id) DO NOTHING",
                batch
        );
    }

    /**
     * Events where the account is either actor or counterpart, newest first.
     */
    public List<AuditEvent> findByAccount(long accountId, int limit) {
        return namedJdbc.query(
                "SELECT event_id, kind, actor_account_id, counterpart_account_id, currency_id, amount, " +
                "       counter_currency_id, counter_amount, occurred_at " +
                "FROM audit_events " +
                "WHERE actor_account_id = :accountId OR counterpart_account_id = :accountId " +
                "ORDER BY occurred_at DESC, id DESC " +
                "LIMIT :limit",
                new MapSqlParameterSource(Map.of("accountId", accountId, "limit", limit)),
                ROW_MAPPER
        );
    }
}
