package com.guildgate.permissions.model;

/**
 * Snowflake identifier of a channel.
 */
public record ChannelId(long value) implements Comparable<ChannelId> {

    /**
     * Parse the decimal string form used by the chat service.
     *
     * @throws IllegalArgumentException if the text is not an unsigned 64-bit integer
     */
    public static ChannelId parse(String raw) {
        return new ChannelId(Snowflakes.parse(raw, "channel"));
    }

    @Override
    public int compareTo(ChannelId other) {
        return Long.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
