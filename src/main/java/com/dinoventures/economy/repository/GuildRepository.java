package com.dinoventures.economy.repository;

import com.dinoventures.economy.model.GroupKind;
import com.dinoventures.economy.model.Guild;
import com.dinoventures.economy.model.GuildMembership;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class GuildRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<Guild> ROW_MAPPER = (rs, rowNum) -> Guild.builder()
            .id(rs.getLong("id"))
            .externalId(rs.getString("external_id"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    private static final RowMapper<GuildMembership> MEMBERSHIP_ROW_MAPPER = (rs, rowNum) -> GuildMembership.builder()
            .guildId(rs.getLong("guild_id"))
            .groupId(rs.getLong("group_id"))
            .groupKind(GroupKind.valueOf(rs.getString("kind")))
            .groupName(rs.getString("name"))
            .joinedAt(rs.getObject("joined_at", OffsetDateTime.class))
            .build();

    /**
     * Inserts the guild if it is new. Returns 1 when this call created it, 0 when it
     * already existed; the caller onboards only on 1.
     */
    public int insertIfNew(String externalId) {
        return namedJdbc.update(
                "INSERT INTO guilds (external_id) VALUES (:externalId) ON CONFLICT (external_id) DO NOTHING",
                new MapSqlParameterSource("externalId", externalId)
        );
    }

    public Optional<Guild> findByExternalId(String externalId) {
        List<Guild> results = namedJdbc.query(
                "SELECT id, external_id, created_at FROM guilds WHERE external_id = :externalId",
                new MapSqlParameterSource("externalId", externalId),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    /** @return 1 if the membership was added, 0 if the guild was already a member */
    public int addMembership(long guildId, long groupId) {
        return namedJdbc.update(
                "INSERT INTO guild_memberships (guild_id, group_id) VALUES (:guildId, :groupId) " +
                "ON CONFLICT (guild_id, group_id) DO NOTHING",
                new MapSqlParameterSource(Map.of("guildId", guildId, "groupId", groupId))
        );
    }

    public int removeMembership(long guildId, long groupId) {
        return namedJdbc.update(
                "DELETE FROM guild_memberships WHERE guild_id = :guildId AND group_id = :groupId",
                new MapSqlParameterSource(Map.of("guildId", guildId, "groupId", groupId))
        );
    }

    public List<GuildMembership> findMemberships(long guildId) {
        return namedJdbc.query(
                "SELECT m.guild_id, m.group_id, g.kind, g.name, m.joined_at " +
                "FROM guild_memberships m " +
                "JOIN economy_groups g ON g.id = m.group_id " +
                "WHERE m.guild_id = :guildId " +
                "ORDER BY m.joined_at, m.group_id",
                new MapSqlParameterSource("guildId", guildId),
                MEMBERSHIP_ROW_MAPPER
        );
    }
}
