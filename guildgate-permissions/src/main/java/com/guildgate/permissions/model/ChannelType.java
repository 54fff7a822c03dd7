package com.guildgate.permissions.model;

/**
 * Guild channel kinds with their wire codes.
 */
public enum ChannelType {
    TEXT(0),
    VOICE(2),
    CATEGORY(4),
    NEWS(5),
    NEWS_THREAD(10),
    PUBLIC_THREAD(11),
    PRIVATE_THREAD(12),
    STAGE(13),
    DIRECTORY(14),
    FORUM(15),
    MEDIA(16),
    UNKNOWN(-1);

    private final int code;

    ChannelType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ChannelType fromCode(int code) {
        for (ChannelType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public boolean isThread() {
        return this == NEWS_THREAD || this == PUBLIC_THREAD || this == PRIVATE_THREAD;
    }
}
