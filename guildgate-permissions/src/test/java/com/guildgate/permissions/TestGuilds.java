package com.guildgate.permissions;

import com.guildgate.permissions.model.ChannelId;
import com.guildgate.permissions.model.ChannelType;
import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.GuildChannel;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.Permission;
import com.guildgate.permissions.model.PermissionOverwrite;
import com.guildgate.permissions.model.Permissions;
import com.guildgate.permissions.model.Role;
import com.guildgate.permissions.model.RoleId;
import com.guildgate.permissions.model.UserId;

import java.util.List;
import java.util.Set;

/**
 * Snapshot fixtures shared by the engine tests.
 */
final class TestGuilds {

    static final long GUILD = 1000L;
    static final long OWNER = 1L;

    private TestGuilds() {
    }

    static PermissionCalculator calculator() {
        return new PermissionCalculator(PermissionDiagnostics.defaults());
    }

    static RoleHierarchy roleHierarchy() {
        return new RoleHierarchy(PermissionDiagnostics.defaults());
    }

    static HierarchyComparator comparator() {
        return new HierarchyComparator(roleHierarchy());
    }

    static Guild.Builder guild() {
        return Guild.builder(GUILD, OWNER);
    }

    static Member member(long userId, long... roleIds) {
        return Member.of(userId, roleIds);
    }

    static Member named(long userId, String username, Integer discriminator, String nick, long... roleIds) {
        Member base = Member.of(userId, roleIds);
        return new Member(base.userId(), username, discriminator, nick, base.roles());
    }

    static Role role(long id, int position, Permission... flags) {
        return Role.of(id, position, flags);
    }

    static Role role(long id, String name, int position, Permission... flags) {
        return new Role(new RoleId(id), name, position, Permissions.of(flags));
    }

    static Permissions perms(Permission... flags) {
        return Permissions.of(flags);
    }

    static PermissionOverwrite roleOverwrite(long roleId, Permissions allow, Permissions deny) {
        return PermissionOverwrite.forRole(new RoleId(roleId), allow, deny);
    }

    static PermissionOverwrite memberOverwrite(long userId, Permissions allow, Permissions deny) {
        return PermissionOverwrite.forMember(new UserId(userId), allow, deny);
    }

    static PermissionOverwrite everyoneOverwrite(Permissions allow, Permissions deny) {
        return roleOverwrite(GUILD, allow, deny);
    }

    static GuildChannel channel(long id, PermissionOverwrite... overwrites) {
        return GuildChannel.text(id, "channel-" + id, overwrites);
    }

    static GuildChannel category(long id, PermissionOverwrite... overwrites) {
        return new GuildChannel(new ChannelId(id), "category-" + id, ChannelType.CATEGORY, 0, List.of(overwrites));
    }

    static UserId user(long id) {
        return new UserId(id);
    }

    static Set<RoleId> roleIds(long... ids) {
        return Member.of(0L, ids).roles();
    }
}
