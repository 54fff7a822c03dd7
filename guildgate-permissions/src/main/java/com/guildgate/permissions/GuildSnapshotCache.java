package com.guildgate.permissions;

import com.guildgate.permissions.model.ChannelId;
import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.GuildChannel;
import com.guildgate.permissions.model.GuildId;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.Permissions;
import com.guildgate.permissions.model.UserId;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest snapshot per guild. The synchronization layer swaps whole snapshots
 * in; readers get one consistent snapshot per call and never observe a
 * half-applied update.
 */
@Slf4j
public class GuildSnapshotCache {

    private final Map<GuildId, Guild> snapshots = new ConcurrentHashMap<>();
    private final PermissionCalculator calculator;
    private final HierarchyComparator hierarchy;

    public GuildSnapshotCache(PermissionCalculator calculator, HierarchyComparator hierarchy) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    }

    /**
     * Install {@code guild} as the current snapshot for its ID.
     *
     * @return the snapshot it replaced
     */
    public Optional<Guild> replace(Guild guild) {
        Objects.requireNonNull(guild, "guild");
        Guild previous = snapshots.put(guild.id(), guild);
        log.debug("Replaced snapshot for guild {} ({} roles, {} members, {} channels)",
                guild.id(), guild.roles().size(), guild.members().size(), guild.channels().size());
        return Optional.ofNullable(previous);
    }

    public Optional<Guild> get(GuildId guildId) {
        return Optional.ofNullable(snapshots.get(guildId));
    }

    public Optional<Guild> remove(GuildId guildId) {
        return Optional.ofNullable(snapshots.remove(guildId));
    }

    public Set<GuildId> guildIds() {
        return Set.copyOf(snapshots.keySet());
    }

    public int size() {
        return snapshots.size();
    }

    public void clear() {
        snapshots.clear();
    }

    /**
     * Resolve against the current snapshot. Empty when the guild, member or
     * requested channel is unknown.
     *
     * @param channelId {@code null} for guild-level permissions
     */
    public Optional<Permissions> resolvePermissions(GuildId guildId, UserId userId, ChannelId channelId) {
        Guild guild = snapshots.get(guildId);
        if (guild == null) {
            return Optional.empty();
        }
        Optional<Member> member = guild.member(userId);
        if (member.isEmpty()) {
            return Optional.empty();
        }
        if (channelId == null) {
            return Optional.of(calculator.memberPermissions(guild, member.get()));
        }
        Optional<GuildChannel> channel = guild.channel(channelId);
        return channel.map(c -> calculator.userPermissionsIn(guild, c, member.get()));
    }

    public Optional<UserId> compareHierarchy(GuildId guildId, UserId userA, UserId userB) {
        Guild guild = snapshots.get(guildId);
        if (guild == null) {
            return Optional.empty();
        }
        return hierarchy.compareHierarchy(guild, userA, userB);
    }
}
