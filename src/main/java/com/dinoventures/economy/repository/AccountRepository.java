package com.dinoventures.economy.repository;

import com.dinoventures.economy.model.Account;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<Account> ROW_MAPPER = (rs, rowNum) -> Account.builder()
            .id(rs.getLong("id"))
            .externalId(rs.getString("external_id"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    /**
     * Idempotently get or create the account bound to an external user id.
     * INSERT ON CONFLICT DO NOTHING makes concurrent first interactions safe.
     */
    public Account getOrCreate(String externalId) {
        namedJdbc.update(
                "INSERT INTO accounts (external_id) VALUES (:externalId) " +
                "ON CONFLICT (external_id) DO NOTHING",
                new MapSqlParameterSource("externalId", externalId)
        );
        return findByExternalId(externalId).orElseThrow(() ->
                new IllegalStateException("Account should exist after getOrCreate"));
    }

    public Optional<Account> findById(long id) {
        List<Account> results = namedJdbc.query(
                "SELECT id, external_id, created_at FROM accounts WHERE id = :id",
                new MapSqlParameterSource("id", id),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    public Optional<Account> findByExternalId(String externalId) {
        List<Account> results = namedJdbc.query(
                "SELECT id, external_id, created_at FROM accounts WHERE external_id = :externalId",
                new MapSqlParameterSource("externalId", externalId),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }
}
