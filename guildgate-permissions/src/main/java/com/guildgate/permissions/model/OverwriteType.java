package com.guildgate.permissions.model;

/**
 * Target kind of a channel permission overwrite, with the wire code the chat
 * service uses for it.
 */
public enum OverwriteType {
    ROLE(0),
    MEMBER(1);

    private final int code;

    OverwriteType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static OverwriteType fromCode(int code) {
        return switch (code) {
            case 0 -> ROLE;
            case 1 -> MEMBER;
            default -> throw new IllegalArgumentException("Unknown overwrite type: " + code);
        };
    }
}
