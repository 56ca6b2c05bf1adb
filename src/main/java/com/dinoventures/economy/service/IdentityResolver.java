package com.dinoventures.economy.service;

import com.dinoventures.economy.exception.AccountNotFoundException;
import com.dinoventures.economy.model.Account;
import com.dinoventures.economy.model.EconomyGroup;
import com.dinoventures.economy.model.GroupKind;
import com.dinoventures.economy.model.Guild;
import com.dinoventures.economy.repository.AccountRepository;
import com.dinoventures.economy.repository.GroupRepository;
import com.dinoventures.economy.repository.GuildRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Maps chat-platform identifiers to internal accounts and guilds, creating them on
 * first economic interaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityResolver {

    private final AccountRepository accountRepo;
    private final GuildRepository   guildRepo;
    private final GroupRepository   groupRepo;
    private final UnitOfWork        unitOfWork;

    public Account resolveAccount(String externalUserId) {
        requireExternalId(externalUserId);
        return unitOfWork.execute(() -> accountRepo.getOrCreate(externalUserId));
    }

    public Optional<Account> findAccount(String externalUserId) {
        return accountRepo.findByExternalId(externalUserId);
    }

    public Account requireAccount(long accountId) {
        return accountRepo.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Resolves a guild, onboarding it on first sight.
     *
     * Onboarding creates, in one unit of work: the guild row, its SINGLE group, and
     * memberships in that group and in the GLOBAL group. Concurrent first calls for the
     * same guild are safe: only the caller whose insert created the row onboards.
     */
    public Guild resolveGuild(String externalGuildId) {
        requireExternalId(externalGuildId);
        return unitOfWork.execute(() -> {
            int created = guildRepo.insertIfNew(externalGuildId);
            Guild guild = guildRepo.findByExternalId(externalGuildId).orElseThrow(() ->
                    new IllegalStateException("Guild should exist after insert"));

            if (created == 1) {
                EconomyGroup single = groupRepo.save(GroupKind.SINGLE, "guild-" + externalGuildId, guild.getId());
                guildRepo.addMembership(guild.getId(), single.getId());
                guildRepo.addMembership(guild.getId(), globalGroup().getId());
                log.info("Onboarded guild: externalId={}, guildId={}, singleGroupId={}",
                        externalGuildId, guild.getId(), single.getId());
            }
            return guild;
        });
    }

    public EconomyGroup singleGroupOf(Guild guild) {
        return groupRepo.findSingleOf(guild.getId()).orElseThrow(() ->
                new IllegalStateException("Guild " + guild.getId() + " has no single group"));
    }

    public EconomyGroup globalGroup() {
        return groupRepo.findGlobal().orElseThrow(() ->
                new IllegalStateException("Global group is missing; schema initialization did not run"));
    }

    private static void requireExternalId(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("External id must not be blank");
        }
    }
}
