package com.guildgate.permissions;

import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.Role;
import com.guildgate.permissions.model.RoleId;
import com.guildgate.permissions.model.UserId;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides which of two guild members outranks the other, as used to gate
 * kicks, bans and role edits.
 */
public class HierarchyComparator {

    /** Stand-in for a member without any resolvable role; lower than any real role. */
    static final RoleId SENTINEL_ROLE_ID = new RoleId(1L);
    static final int SENTINEL_POSITION = 0;

    private final RoleHierarchy roleHierarchy;

    public HierarchyComparator(RoleHierarchy roleHierarchy) {
        this.roleHierarchy = Objects.requireNonNull(roleHierarchy, "roleHierarchy");
    }

    /**
     * The user that outranks the other, or empty when either is not a member,
     * both are the same user, or neither outranks the other.
     */
    public Optional<UserId> compareHierarchy(Guild guild, UserId userA, UserId userB) {
        Optional<Member> a = guild.member(userA);
        Optional<Member> b = guild.member(userB);
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        return compare(
                roleHierarchy.memberHighestRole(guild, a.get()).orElse(null),
                roleHierarchy.memberHighestRole(guild, b.get()).orElse(null),
                guild.ownerId(), userA, userB);
    }

    /**
     * Compare two users given their already resolved highest roles.
     *
     * @param highestA {@code null} when {@code userA} has no resolvable role
     * @param highestB {@code null} when {@code userB} has no resolvable role
     */
    static Optional<UserId> compare(Role highestA, Role highestB, UserId ownerId, UserId userA, UserId userB) {
        if (userA.equals(userB)) {
            return Optional.empty();
        }

        if (userA.equals(ownerId)) {
            return Optional.of(userA);
        }
        if (userB.equals(ownerId)) {
            return Optional.of(userB);
        }

        RoleId idA = highestA != null ? highestA.id() : SENTINEL_ROLE_ID;
        int positionA = highestA != null ? highestA.position() : SENTINEL_POSITION;
        RoleId idB = highestB != null ? highestB.id() : SENTINEL_ROLE_ID;
        int positionB = highestB != null ? highestB.position() : SENTINEL_POSITION;

        if ((positionA == 0 && positionB == 0) || idA.equals(idB)) {
            return Optional.empty();
        }

        if (positionA > positionB) {
            return Optional.of(userA);
        }
        if (positionB > positionA) {
            return Optional.of(userB);
        }

        return idA.compareTo(idB) < 0 ? Optional.of(userA) : Optional.of(userB);
    }
}
