package com.dinoventures.economy.controller;

import com.dinoventures.economy.model.EconomyGroup;
import com.dinoventures.economy.model.Guild;
import com.dinoventures.economy.model.GuildMembership;
import com.dinoventures.economy.model.dto.CreateGroupRequest;
import com.dinoventures.economy.model.dto.MembershipRequest;
import com.dinoventures.economy.model.dto.MembershipResponse;
import com.dinoventures.economy.model.dto.OnboardGuildRequest;
import com.dinoventures.economy.service.GroupService;
import com.dinoventures.economy.service.IdentityResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class GroupController {

    private final IdentityResolver identityResolver;
    private final GroupService     groupService;

    /**
     * POST /api/v1/guilds
     * Onboards a guild: its single group plus membership in the global group.
     * Calling it again for a known guild returns the existing guild.
     */
    @PostMapping("/api/v1/guilds")
    public ResponseEntity<Guild> onboardGuild(@Valid @RequestBody OnboardGuildRequest req) {
        return ResponseEntity.ok(identityResolver.resolveGuild(req.getGuildId()));
    }

    /**
     * GET /api/v1/guilds/{externalId}/groups
     */
    @GetMapping("/api/v1/guilds/{externalId}/groups")
    public ResponseEntity<List<GuildMembership>> groupsOf(@PathVariable String externalId) {
        return ResponseEntity.ok(groupService.groupsOf(externalId));
    }

    /**
     * POST /api/v1/groups
     * Creates a local group shared between guilds.
     */
    @PostMapping("/api/v1/groups")
    public ResponseEntity<EconomyGroup> createGroup(@Valid @RequestBody CreateGroupRequest req) {
        EconomyGroup group = groupService.createLocalGroup(req.getOwnerGuildId(), req.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(group);
    }

    @GetMapping("/api/v1/groups/{groupId}")
    public ResponseEntity<EconomyGroup> getGroup(@PathVariable long groupId) {
        return ResponseEntity.ok(groupService.requireGroup(groupId));
    }

    /**
     * POST /api/v1/groups/{groupId}/members
     */
    @PostMapping("/api/v1/groups/{groupId}/members")
    public ResponseEntity<MembershipResponse> join(@PathVariable long groupId,
                                                   @Valid @RequestBody MembershipRequest req) {
        boolean joined = groupService.joinGroup(groupId, req.getGuildId());
        return ResponseEntity.ok(new MembershipResponse(groupId, req.getGuildId(), joined));
    }

    /**
     * DELETE /api/v1/groups/{groupId}/members/{guildId}
     */
    @DeleteMapping("/api/v1/groups/{groupId}/members/{guildId}")
    public ResponseEntity<MembershipResponse> leave(@PathVariable long groupId, @PathVariable String guildId) {
        boolean left = groupService.leaveGroup(groupId, guildId);
        return ResponseEntity.ok(new MembershipResponse(groupId, guildId, left));
    }
}
