package com.guildgate.permissions.model;

import java.util.List;
import java.util.Objects;

/**
 * A guild channel with its ordered permission overwrites.
 */
public record GuildChannel(ChannelId id, String name, ChannelType kind, int position,
        List<PermissionOverwrite> overwrites) {

    public GuildChannel {
        Objects.requireNonNull(id, "id");
        name = name != null ? name : "";
        kind = kind != null ? kind : ChannelType.TEXT;
        overwrites = overwrites != null ? List.copyOf(overwrites) : List.of();
    }

    public static GuildChannel text(long id, String name, PermissionOverwrite... overwrites) {
        return new GuildChannel(new ChannelId(id), name, ChannelType.TEXT, 0, List.of(overwrites));
    }

    public boolean isCategory() {
        return kind == ChannelType.CATEGORY;
    }
}
