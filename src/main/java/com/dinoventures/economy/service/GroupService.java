package com.dinoventures.economy.service;

import com.dinoventures.economy.exception.GroupNotFoundException;
import com.dinoventures.economy.model.EconomyGroup;
import com.dinoventures.economy.model.GroupKind;
import com.dinoventures.economy.model.Guild;
import com.dinoventures.economy.model.GuildMembership;
import com.dinoventures.economy.repository.GroupRepository;
import com.dinoventures.economy.repository.GuildRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Guild ↔ group membership. Groups and guilds reference each other only through ids;
 * the membership table is the join.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupService {

    private final GroupRepository  groupRepo;
    private final GuildRepository  guildRepo;
    private final IdentityResolver identityResolver;
    private final UnitOfWork       unitOfWork;

    public EconomyGroup requireGroup(long groupId) {
        return groupRepo.findById(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    /**
     * Row-locks the group until the surrounding unit of work ends. Must be called
     * within a unit of work.
     */
    void lockGroup(long groupId) {
        groupRepo.lockForUpdate(groupId);
    }

    /**
     * Creates a LOCAL group owned by the given guild, which joins it immediately.
     */
    public EconomyGroup createLocalGroup(String ownerExternalGuildId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name must not be blank");
        }
        Guild owner = identityResolver.resolveGuild(ownerExternalGuildId);
        EconomyGroup group = unitOfWork.execute(() -> {
            EconomyGroup created = groupRepo.save(GroupKind.LOCAL, name.trim(), owner.getId());
            guildRepo.addMembership(owner.getId(), created.getId());
            return created;
        });
        log.info("Created local group: groupId={}, name='{}', ownerGuildId={}", group.getId(), group.getName(), owner.getId());
        return group;
    }

    /**
     * Adds the guild to a LOCAL group. Joining a group the guild is already in is a no-op.
     */
    public boolean joinGroup(long groupId, String externalGuildId) {
        EconomyGroup group = requireGroup(groupId);
        if (group.getKind() != GroupKind.LOCAL) {
            throw new IllegalStateException("Only local groups can be joined; group " + groupId + " is " + group.getKind());
        }
        Guild guild = identityResolver.resolveGuild(externalGuildId);
        boolean joined = unitOfWork.execute(() -> guildRepo.addMembership(guild.getId(), groupId)) == 1;
        if (joined) {
            log.info("Guild {} joined group {}", guild.getId(), groupId);
        }
        return joined;
    }

    /**
     * Removes the guild from a LOCAL group. A guild can never leave its own single
     * group or the global group.
     */
    public boolean leaveGroup(long groupId, String externalGuildId) {
        EconomyGroup group = requireGroup(groupId);
        if (group.getKind() != GroupKind.LOCAL) {
            throw new IllegalStateException("Cannot leave a " + group.getKind() + " group");
        }
        Guild guild = identityResolver.resolveGuild(externalGuildId);
        boolean left = unitOfWork.execute(() -> guildRepo.removeMembership(guild.getId(), groupId)) == 1;
        if (left) {
            log.info("Guild {} left group {}", guild.getId(), groupId);
        }
        return left;
    }

    public List<GuildMembership> groupsOf(String externalGuildId) {
        Guild guild = identityResolver.resolveGuild(externalGuildId);
        return guildRepo.findMemberships(guild.getId());
    }
}
