package com.guildgate.permissions.model;

import java.util.Objects;

/**
 * A guild role. {@code position} ranks roles within a guild and is not unique.
 */
public record Role(RoleId id, String name, int position, Permissions permissions) {

    public Role {
        Objects.requireNonNull(id, "id");
        name = name != null ? name : "";
        permissions = permissions != null ? permissions : Permissions.EMPTY;
    }

    public static Role of(long id, int position, Permission... flags) {
        return new Role(new RoleId(id), "", position, Permissions.of(flags));
    }
}
