package com.guildgate.permissions.model;

final class Snowflakes {

    private Snowflakes() {
    }

    static long parse(String raw, String kind) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Empty " + kind + " id");
        }
        try {
            return Long.parseUnsignedLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + kind + " id: " + raw, e);
        }
    }
}
