package com.guildgate.permissions;

import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.GuildChannel;
import com.guildgate.permissions.model.GuildId;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.PartialMember;
import com.guildgate.permissions.model.Permission;
import com.guildgate.permissions.model.PermissionOverwrite;
import com.guildgate.permissions.model.Permissions;
import com.guildgate.permissions.model.Role;
import com.guildgate.permissions.model.RoleId;
import com.guildgate.permissions.model.UserId;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes a member's effective permissions in a guild, optionally narrowed to
 * one channel.
 *
 * <p>
 * Resolution order, each level more specific than the last:
 * <ol>
 * <li>guild owner: everything</li>
 * <li>@everyone role permissions</li>
 * <li>union of the member's role permissions</li>
 * <li>administrator: everything, overwrites ignored</li>
 * <li>no channel: stop here</li>
 * <li>@everyone channel overwrite</li>
 * <li>union of the member's role overwrites</li>
 * <li>the member's own overwrite</li>
 * </ol>
 * Every overwrite step clears its deny bits before setting its allow bits.
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public class PermissionCalculator {

    private final PermissionDiagnostics diagnostics;

    public PermissionCalculator(PermissionDiagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Effective permissions of {@code member} in {@code guild}, narrowed to
     * {@code channel} when one is given.
     *
     * @param channel {@code null} for guild-level permissions
     */
    public Permissions resolvePermissions(Member member, Guild guild, GuildChannel channel) {
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(guild, "guild");
        return calculate(guild, member.userId(), member.roles(), channel);
    }

    /** Guild-level permissions of a member. */
    public Permissions memberPermissions(Guild guild, Member member) {
        return resolvePermissions(member, guild, null);
    }

    /** Permissions of a member in one channel. */
    public Permissions userPermissionsIn(Guild guild, GuildChannel channel, Member member) {
        Objects.requireNonNull(channel, "channel");
        return resolvePermissions(member, guild, channel);
    }

    /**
     * Permissions of a partial member in one channel.
     *
     * @throws IllegalArgumentException if the partial member embeds a user ID
     *                                  other than {@code userId}
     */
    public Permissions partialMemberPermissionsIn(Guild guild, GuildChannel channel, UserId userId,
            PartialMember member) {
        Objects.requireNonNull(guild, "guild");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(member, "member");
        if (member.userId() != null && !member.userId().equals(userId)) {
            throw new IllegalArgumentException(
                    "Partial member user " + member.userId() + " does not match " + userId);
        }
        return calculate(guild, userId, member.roles(), channel);
    }

    private Permissions calculate(Guild guild, UserId userId, Set<RoleId> roleIds, GuildChannel channel) {
        if (guild.isOwner(userId)) {
            return Permissions.all();
        }

        GuildId guildId = guild.id();
        RoleId everyoneId = guild.everyoneRoleId();

        long base;
        Optional<Role> everyone = guild.roles().get(everyoneId);
        if (everyone.isPresent()) {
            base = everyone.get().permissions().bits();
        } else {
            diagnostics.everyoneRoleMissing(guildId);
            base = 0L;
        }

        for (RoleId roleId : roleIds) {
            Optional<Role> role = guild.roles().get(roleId);
            if (role.isPresent()) {
                base |= role.get().permissions().bits();
            } else {
                diagnostics.danglingRole(guildId, userId, roleId);
            }
        }

        if ((base & Permission.ADMINISTRATOR.bit()) != 0) {
            return Permissions.all();
        }

        if (channel == null) {
            return new Permissions(base);
        }

        long everyoneAllow = 0L;
        long everyoneDeny = 0L;
        long rolesAllow = 0L;
        long rolesDeny = 0L;
        long memberAllow = 0L;
        long memberDeny = 0L;

        // Later overwrites for the same target replace earlier ones.
        for (PermissionOverwrite overwrite : channel.overwrites()) {
            switch (overwrite.type()) {
                case MEMBER -> {
                    if (overwrite.targetsMember(userId)) {
                        memberAllow = overwrite.allow().bits();
                        memberDeny = overwrite.deny().bits();
                    }
                }
                case ROLE -> {
                    if (overwrite.targetsRole(everyoneId)) {
                        everyoneAllow = overwrite.allow().bits();
                        everyoneDeny = overwrite.deny().bits();
                    } else if (roleIds.contains(new RoleId(overwrite.targetId()))) {
                        rolesAllow |= overwrite.allow().bits();
                        rolesDeny |= overwrite.deny().bits();
                    }
                }
            }
        }

        base &= ~everyoneDeny;
        base |= everyoneAllow;

        base &= ~rolesDeny;
        base |= rolesAllow;

        base &= ~memberDeny;
        base |= memberAllow;

        return new Permissions(base);
    }
}
