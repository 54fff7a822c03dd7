package com.guildgate.permissions.model;

import java.util.Objects;

/**
 * Channel-scoped allow/deny delta aimed at a role or a single member.
 * {@code allow} and {@code deny} may overlap; within one precedence step the
 * resolver applies deny first, so the overlap ends up allowed.
 */
public record PermissionOverwrite(OverwriteType type, long targetId, Permissions allow, Permissions deny) {

    public PermissionOverwrite {
        Objects.requireNonNull(type, "type");
        allow = allow != null ? allow : Permissions.EMPTY;
        deny = deny != null ? deny : Permissions.EMPTY;
    }

    public static PermissionOverwrite forRole(RoleId roleId, Permissions allow, Permissions deny) {
        return new PermissionOverwrite(OverwriteType.ROLE, roleId.value(), allow, deny);
    }

    public static PermissionOverwrite forMember(UserId userId, Permissions allow, Permissions deny) {
        return new PermissionOverwrite(OverwriteType.MEMBER, userId.value(), allow, deny);
    }

    public boolean targetsRole(RoleId roleId) {
        return type == OverwriteType.ROLE && targetId == roleId.value();
    }

    public boolean targetsMember(UserId userId) {
        return type == OverwriteType.MEMBER && targetId == userId.value();
    }
}
