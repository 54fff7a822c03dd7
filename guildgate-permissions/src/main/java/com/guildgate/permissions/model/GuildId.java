package com.guildgate.permissions.model;

/**
 * Snowflake identifier of a guild.
 */
public record GuildId(long value) implements Comparable<GuildId> {

    /**
     * Parse the decimal string form used by the chat service.
     *
     * @throws IllegalArgumentException if the text is not an unsigned 64-bit integer
     */
    public static GuildId parse(String raw) {
        return new GuildId(Snowflakes.parse(raw, "guild"));
    }

    /**
     * ID of the implicit @everyone role, which shares the guild's snowflake.
     */
    public RoleId everyoneRoleId() {
        return new RoleId(value);
    }

    @Override
    public int compareTo(GuildId other) {
        return Long.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
