package com.guildgate.permissions;

import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.Permission;
import com.guildgate.permissions.model.Permissions;
import com.guildgate.permissions.model.Role;
import com.guildgate.permissions.model.RoleId;
import com.guildgate.permissions.model.UserId;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether one member may perform a moderation action against another,
 * combining guild permissions with the member hierarchy. Only answers the
 * question; issuing the action is up to the caller.
 */
public class ModerationGate {

    public static final String REASON_NOT_A_MEMBER = "not-a-member";
    public static final String REASON_SELF_TARGET = "self-target";
    public static final String REASON_TARGET_IS_OWNER = "target-is-owner";
    public static final String REASON_MISSING_PERMISSIONS = "missing-permissions";
    public static final String REASON_HIERARCHY = "hierarchy";

    private final PermissionCalculator calculator;
    private final HierarchyComparator hierarchy;
    private final RoleHierarchy roleHierarchy;

    public ModerationGate(PermissionCalculator calculator, HierarchyComparator hierarchy,
            RoleHierarchy roleHierarchy) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
        this.roleHierarchy = Objects.requireNonNull(roleHierarchy, "roleHierarchy");
    }

    public enum ModerationAction {
        KICK(Permission.KICK_MEMBERS),
        BAN(Permission.BAN_MEMBERS),
        EDIT_ROLES(Permission.MANAGE_ROLES),
        TIMEOUT(Permission.MODERATE_MEMBERS),
        MANAGE_NICKNAME(Permission.MANAGE_NICKNAMES);

        private final Permission required;

        ModerationAction(Permission required) {
            this.required = required;
        }

        public Permission required() {
            return required;
        }
    }

    /**
     * @param reason  {@code null} when allowed
     * @param missing display names of missing permissions, empty unless the
     *                reason is {@code missing-permissions}
     */
    public record ModerationDecision(boolean allowed, String reason, List<String> missing) {

        public static ModerationDecision allow() {
            return new ModerationDecision(true, null, List.of());
        }

        public static ModerationDecision deny(String reason) {
            return new ModerationDecision(false, reason, List.of());
        }
    }

    public ModerationDecision check(Guild guild, UserId actorId, UserId targetId, ModerationAction action) {
        Optional<Member> actor = guild.member(actorId);
        if (actor.isEmpty() || guild.member(targetId).isEmpty()) {
            return ModerationDecision.deny(REASON_NOT_A_MEMBER);
        }
        if (actorId.equals(targetId)) {
            return ModerationDecision.deny(REASON_SELF_TARGET);
        }
        if (guild.isOwner(targetId)) {
            return ModerationDecision.deny(REASON_TARGET_IS_OWNER);
        }
        if (guild.isOwner(actorId)) {
            return ModerationDecision.allow();
        }

        Permissions granted = calculator.memberPermissions(guild, actor.get());
        if (!granted.contains(action.required())) {
            return new ModerationDecision(false, REASON_MISSING_PERMISSIONS,
                    List.of(action.required().displayName()));
        }

        Optional<UserId> greater = hierarchy.compareHierarchy(guild, actorId, targetId);
        if (greater.isEmpty() || !greater.get().equals(actorId)) {
            return ModerationDecision.deny(REASON_HIERARCHY);
        }
        return ModerationDecision.allow();
    }

    /**
     * Whether the actor may assign, remove or edit the given role: the owner
     * always may; anyone else needs MANAGE_ROLES and a highest role ranked above
     * it.
     */
    public boolean canManageRole(Guild guild, UserId actorId, RoleId roleId) {
        Optional<Role> role = guild.role(roleId);
        Optional<Member> actor = guild.member(actorId);
        if (role.isEmpty() || actor.isEmpty()) {
            return false;
        }
        if (guild.isOwner(actorId)) {
            return true;
        }
        if (!calculator.memberPermissions(guild, actor.get()).contains(Permission.MANAGE_ROLES)) {
            return false;
        }
        return roleHierarchy.memberHighestRole(guild, actor.get())
                .map(highest -> RoleHierarchy.outranks(highest, role.get()))
                .orElse(false);
    }
}
