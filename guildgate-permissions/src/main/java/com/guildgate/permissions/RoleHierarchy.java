package com.guildgate.permissions;

import com.guildgate.permissions.model.EntityStore;
import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.Role;
import com.guildgate.permissions.model.RoleId;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Finds a member's highest-ranked role.
 *
 * <p>
 * Ranking: a higher {@code position} outranks a lower one; on equal positions
 * the numerically smaller (older) role ID outranks the larger one.
 */
public class RoleHierarchy {

    /** Orders roles by rank, greatest last. */
    public static final Comparator<Role> RANKING = Comparator
            .comparingInt(Role::position)
            .thenComparing(Role::id, Comparator.reverseOrder());

    private final PermissionDiagnostics diagnostics;

    public RoleHierarchy(PermissionDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Optional<Role> memberHighestRole(Guild guild, Member member) {
        return memberHighestRole(member, guild.roles());
    }

    /**
     * The member's highest resolvable role, or empty when none of its role IDs
     * resolve.
     */
    public Optional<Role> memberHighestRole(Member member, EntityStore<RoleId, Role> roles) {
        Role highest = null;
        for (RoleId roleId : member.roles()) {
            Optional<Role> resolved = roles.get(roleId);
            if (resolved.isEmpty()) {
                diagnostics.unresolvedRole(member.userId(), roleId);
                continue;
            }
            Role role = resolved.get();
            if (highest == null || outranks(role, highest)) {
                highest = role;
            }
        }
        return Optional.ofNullable(highest);
    }

    /**
     * Like {@link #memberHighestRole(Member, EntityStore)}, but tells apart a
     * member that never had roles from one whose roles have all vanished.
     */
    public HighestRoleLookup lookup(Member member, EntityStore<RoleId, Role> roles) {
        Set<RoleId> unresolved = new LinkedHashSet<>();
        for (RoleId roleId : member.roles()) {
            if (!roles.contains(roleId)) {
                unresolved.add(roleId);
            }
        }
        Role highest = memberHighestRole(member, roles).orElse(null);
        HighestRoleStatus status;
        if (highest != null) {
            status = HighestRoleStatus.RESOLVED;
        } else if (member.roles().isEmpty()) {
            status = HighestRoleStatus.NO_ROLES_ASSIGNED;
        } else {
            status = HighestRoleStatus.ROLES_UNRESOLVED;
        }
        return new HighestRoleLookup(status, highest, Set.copyOf(unresolved));
    }

    /**
     * Whether {@code candidate} strictly outranks {@code current}.
     */
    public static boolean outranks(Role candidate, Role current) {
        return RANKING.compare(candidate, current) > 0;
    }

    /**
     * Why a highest-role lookup produced what it did.
     */
    public enum HighestRoleStatus {
        /** At least one role resolved. */
        RESOLVED,
        /** The member carries no role IDs at all. */
        NO_ROLES_ASSIGNED,
        /** The member carries role IDs, but none exist in the snapshot. */
        ROLES_UNRESOLVED
    }

    /**
     * @param highest    {@code null} unless status is {@code RESOLVED}
     * @param unresolved role IDs the snapshot could not resolve
     */
    public record HighestRoleLookup(HighestRoleStatus status, Role highest, Set<RoleId> unresolved) {

        public Optional<Role> highestRole() {
            return Optional.ofNullable(highest);
        }
    }
}
