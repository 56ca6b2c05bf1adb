package com.dinoventures.economy.repository;

import com.dinoventures.economy.model.EconomyGroup;
import com.dinoventures.economy.model.GroupKind;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class GroupRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final String COLUMNS = "id, kind, name, owner_guild_id, created_at";

    private static final RowMapper<EconomyGroup> ROW_MAPPER = (rs, rowNum) -> EconomyGroup.builder()
            .id(rs.getLong("id"))
            .kind(GroupKind.valueOf(rs.getString("kind")))
            .name(rs.getString("name"))
            .ownerGuildId(rs.getObject("owner_guild_id", Long.class))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    public EconomyGroup save(GroupKind kind, String name, Long ownerGuildId) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        namedJdbc.update(
                "INSERT INTO economy_groups (kind, name, owner_guild_id) VALUES (:kind, :name, :ownerGuildId)",
                new MapSqlParameterSource()
                        .addValue("kind", kind.name())
                        .addValue("name", name)
                        .addValue("ownerGuildId", ownerGuildId, Types.BIGINT),
                keyHolder,
                new String[]{"id"}
        );
        long id = keyHolder.getKey().longValue();
        return findById(id).orElseThrow();
    }

    public Optional<EconomyGroup> findById(long id) {
        List<EconomyGroup> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM economy_groups WHERE id = :id",
                new MapSqlParameterSource("id", id),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    public Optional<EconomyGroup> findGlobal() {
        List<EconomyGroup> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM economy_groups WHERE kind = 'GLOBAL'",
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    public Optional<EconomyGroup> findSingleOf(long guildId) {
        List<EconomyGroup> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM economy_groups WHERE kind = 'SINGLE' AND owner_guild_id = :guildId",
                new MapSqlParameterSource("guildId", guildId),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    /**
     * Row-locks the group for the rest of the transaction. Used to serialize
     * currency creation and primary-flag moves within one group.
     */
    public void lockForUpdate(long groupId) {
        namedJdbc.query(
                "SELECT id FROM economy_groups WHERE id = :id FOR UPDATE",
                new MapSqlParameterSource("id", groupId),
                rs -> {}
        );
    }
}
