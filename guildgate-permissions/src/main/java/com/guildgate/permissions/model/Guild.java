package com.guildgate.permissions.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a guild's entity graph: roles, members and channels.
 * Snapshots are replaced wholesale by the synchronization layer, never edited in
 * place.
 */
public record Guild(GuildId id, String name, UserId ownerId,
        EntityStore<RoleId, Role> roles,
        EntityStore<UserId, Member> members,
        EntityStore<ChannelId, GuildChannel> channels) {

    public Guild {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerId, "ownerId");
        name = name != null ? name : "";
        roles = roles != null ? roles : EntityStore.empty();
        members = members != null ? members : EntityStore.empty();
        channels = channels != null ? channels : EntityStore.empty();
    }

    public static Builder builder(long guildId, long ownerId) {
        return new Builder(new GuildId(guildId), new UserId(ownerId));
    }

    public RoleId everyoneRoleId() {
        return id.everyoneRoleId();
    }

    /** The @everyone role, if the snapshot carries it. */
    public Optional<Role> everyoneRole() {
        return roles.get(everyoneRoleId());
    }

    public Optional<Role> role(RoleId roleId) {
        return roles.get(roleId);
    }

    public Optional<Member> member(UserId userId) {
        return members.get(userId);
    }

    public Optional<GuildChannel> channel(ChannelId channelId) {
        return channels.get(channelId);
    }

    public boolean isOwner(UserId userId) {
        return ownerId.equals(userId);
    }

    /**
     * Accumulates entities and freezes them into a {@link Guild}.
     */
    public static final class Builder {
        private final GuildId id;
        private final UserId ownerId;
        private String name;
        private final List<Role> roles = new ArrayList<>();
        private final List<Member> members = new ArrayList<>();
        private final List<GuildChannel> channels = new ArrayList<>();

        private Builder(GuildId id, UserId ownerId) {
            this.id = id;
            this.ownerId = ownerId;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Add the @everyone role with the given permissions. */
        public Builder everyone(Permissions permissions) {
            roles.add(new Role(id.everyoneRoleId(), "@everyone", 0, permissions));
            return this;
        }

        public Builder role(Role role) {
            roles.add(role);
            return this;
        }

        public Builder roles(Role... roles) {
            this.roles.addAll(Arrays.asList(roles));
            return this;
        }

        public Builder member(Member member) {
            members.add(member);
            return this;
        }

        public Builder members(Member... members) {
            this.members.addAll(Arrays.asList(members));
            return this;
        }

        public Builder channel(GuildChannel channel) {
            channels.add(channel);
            return this;
        }

        public Builder channels(GuildChannel... channels) {
            this.channels.addAll(Arrays.asList(channels));
            return this;
        }

        public Guild build() {
            return new Guild(id, name, ownerId,
                    EntityStore.of(roles, Role::id),
                    EntityStore.of(members, Member::userId),
                    EntityStore.of(channels, GuildChannel::id));
        }
    }
}
