package com.guildgate.permissions.model;

import java.util.Set;

/**
 * Member fragment delivered alongside interactions: role IDs and, sometimes,
 * the user ID.
 *
 * @param userId {@code null} when the payload did not embed the user
 */
public record PartialMember(UserId userId, Set<RoleId> roles) {

    public PartialMember {
        roles = roles != null ? Set.copyOf(roles) : Set.of();
    }
}
