package com.dinoventures.economy.repository;

import com.dinoventures.economy.model.Currency;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class CurrencyRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final String COLUMNS = "id, group_id, name, is_primary, created_at";

    private static final RowMapper<Currency> ROW_MAPPER = (rs, rowNum) -> Currency.builder()
            .id(rs.getLong("id"))
            .groupId(rs.getLong("group_id"))
            .name(rs.getString("name"))
            .primary(rs.getBoolean("is_primary"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    public Currency save(long groupId, String name, boolean primary) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        namedJdbc.update(
                "INSERT INTO currencies (group_id, name, is_primary) VALUES (:groupId, :name, :primary)",
                new MapSqlParameterSource(Map.of("groupId", groupId, "name", name, "primary", primary)),
                keyHolder,
                new String[]{"id"}
        );
        long id = keyHolder.getKey().longValue();
        return findById(id).orElseThrow();
    }

    public Optional<Currency> findById(long id) {
        List<Currency> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM currencies WHERE id = :id",
                new MapSqlParameterSource("id", id),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    public Optional<Currency> findByName(long groupId, String name) {
        List<Currency> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM currencies WHERE group_id = :groupId AND name = :name",
                new MapSqlParameterSource(Map.of("groupId", groupId, "name", name)),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    public List<Currency> findByGroup(long groupId) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM currencies WHERE group_id = :groupId ORDER BY id",
                new MapSqlParameterSource("groupId", groupId),
                ROW_MAPPER
        );
    }

    public Optional<Currency> findPrimary(long groupId) {
        List<Currency> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM currencies WHERE group_id = :groupId AND is_primary",
                new MapSqlParameterSource("groupId", groupId),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    public long countByGroup(long groupId) {
        Long count = namedJdbc.queryForObject(
                "SELECT COUNT(*) FROM currencies WHERE group_id = :groupId",
                new MapSqlParameterSource("groupId", groupId),
                Long.class
        );
        return count != null ? count : 0L;
    }

    /**
     * Moves the primary flag to {@code currencyId}. The clear runs first so the
     * one-primary-per-group unique index never sees two flagged rows.
     * Must be called within a transaction holding the group lock.
     */
    public void movePrimary(long groupId, long currencyId) {
        namedJdbc.update(
                "UPDATE currencies SET is_primary = FALSE WHERE group_id = :groupId AND is_primary",
                new MapSqlParameterSource("groupId", groupId)
        );
        namedJdbc.update(
                "UPDATE currencies SET is_primary = TRUE WHERE id = :id AND group_id = :groupId",
                new MapSqlParameterSource(Map.of("id", currencyId, "groupId", groupId))
        );
    }
}
