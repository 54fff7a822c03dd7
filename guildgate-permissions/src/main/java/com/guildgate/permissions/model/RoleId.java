package com.guildgate.permissions.model;

/**
 * Snowflake identifier of a role. Ordering is numeric: a smaller ID is an older
 * role and wins position ties in the hierarchy.
 */
public record RoleId(long value) implements Comparable<RoleId> {

    /**
     * Parse the decimal string form used by the chat service.
     *
     * @throws IllegalArgumentException if the text is not an unsigned 64-bit integer
     */
    public static RoleId parse(String raw) {
        return new RoleId(Snowflakes.parse(raw, "role"));
    }

    /**
     * The implicit @everyone role of the given guild.
     */
    public static RoleId everyone(GuildId guildId) {
        return guildId.everyoneRoleId();
    }

    public boolean isEveryoneOf(GuildId guildId) {
        return value == guildId.value();
    }

    @Override
    public int compareTo(RoleId other) {
        return Long.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
