package com.guildgate.permissions.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A guild member. Role IDs may reference roles that no longer exist in the
 * guild's role store.
 *
 * @param discriminator legacy four-digit tag, {@code null} for accounts without one
 * @param nick          guild nickname, {@code null} when unset
 */
public record Member(UserId userId, String username, Integer discriminator, String nick, Set<RoleId> roles) {

    public Member {
        Objects.requireNonNull(userId, "userId");
        username = username != null ? username : "";
        roles = roles != null ? Set.copyOf(roles) : Set.of();
    }

    public static Member of(long userId, long... roleIds) {
        Set<RoleId> roles = Arrays.stream(roleIds).mapToObj(RoleId::new).collect(Collectors.toSet());
        return new Member(new UserId(userId), "", null, null, roles);
    }

    public boolean hasRole(RoleId roleId) {
        return roles.contains(roleId);
    }

    /** Nickname when set, otherwise the username. */
    public String displayName() {
        return nick != null ? nick : username;
    }
}
