package com.guildgate.permissions.model;

/**
 * Snowflake identifier of a user.
 */
public record UserId(long value) implements Comparable<UserId> {

    /**
     * Parse the decimal string form used by the chat service.
     *
     * @throws IllegalArgumentException if the text is not an unsigned 64-bit integer
     */
    public static UserId parse(String raw) {
        return new UserId(Snowflakes.parse(raw, "user"));
    }

    @Override
    public int compareTo(UserId other) {
        return Long.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
