package com.guildgate.permissions.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Identifier parsing, the @everyone derivation and entity normalization.
 */
class GuildModelTest {

    @Test
    void everyoneRoleId_sharesGuildSnowflake() {
        GuildId guildId = GuildId.parse("81384788765712384");
        RoleId everyone = guildId.everyoneRoleId();

        assertEquals(81384788765712384L, everyone.value());
        assertEquals(everyone, RoleId.everyone(guildId));
        assertTrue(everyone.isEveryoneOf(guildId));
        assertFalse(new RoleId(5L).isEveryoneOf(guildId));
    }

    @Test
    void parse_rejectsInvalidSnowflakes() {
        assertThrows(IllegalArgumentException.class, () -> UserId.parse("not-a-number"));
        assertThrows(IllegalArgumentException.class, () -> RoleId.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> ChannelId.parse(null));
    }

    @Test
    void roleIds_compareNumerically() {
        assertTrue(new RoleId(100L).compareTo(new RoleId(200L)) < 0);
        assertTrue(RoleId.parse("18446744073709551615").compareTo(new RoleId(1L)) > 0);
        assertEquals("18446744073709551615", RoleId.parse("18446744073709551615").toString());
    }

    @Test
    void member_copiesRolesAndDefaultsName() {
        Member member = new Member(new UserId(1L), null, null, null, null);
        assertEquals("", member.username());
        assertEquals(Set.of(), member.roles());
        assertEquals("", member.displayName());

        Member nicked = new Member(new UserId(2L), "alice", null, "Ally", Set.of(new RoleId(3L)));
        assertEquals("Ally", nicked.displayName());
        assertTrue(nicked.hasRole(new RoleId(3L)));
    }

    @Test
    void overwrite_targetsMatchKindAndId() {
        PermissionOverwrite roleOverwrite = PermissionOverwrite.forRole(new RoleId(7L), null, null);
        PermissionOverwrite memberOverwrite = PermissionOverwrite.forMember(new UserId(7L), null, null);

        assertTrue(roleOverwrite.targetsRole(new RoleId(7L)));
        assertFalse(roleOverwrite.targetsMember(new UserId(7L)));
        assertTrue(memberOverwrite.targetsMember(new UserId(7L)));
        assertFalse(memberOverwrite.targetsRole(new RoleId(7L)));
        assertEquals(Permissions.EMPTY, roleOverwrite.allow());
    }

    @Test
    void overwriteType_wireCodes() {
        assertEquals(OverwriteType.ROLE, OverwriteType.fromCode(0));
        assertEquals(OverwriteType.MEMBER, OverwriteType.fromCode(1));
        assertThrows(IllegalArgumentException.class, () -> OverwriteType.fromCode(2));
    }

    @Test
    void channelType_fromCode() {
        assertEquals(ChannelType.CATEGORY, ChannelType.fromCode(4));
        assertEquals(ChannelType.UNKNOWN, ChannelType.fromCode(99));
        assertTrue(ChannelType.PUBLIC_THREAD.isThread());
        assertFalse(ChannelType.TEXT.isThread());
    }

    @Test
    void guildBuilder_buildsStores() {
        Guild guild = Guild.builder(10L, 1L)
                .name("test")
                .everyone(Permissions.of(Permission.VIEW_CHANNEL))
                .role(Role.of(11L, 1))
                .member(Member.of(2L, 11L))
                .channel(GuildChannel.text(20L, "general"))
                .build();

        assertEquals(new RoleId(10L), guild.everyoneRoleId());
        assertTrue(guild.everyoneRole().isPresent());
        assertEquals(2, guild.roles().size());
        assertTrue(guild.member(new UserId(2L)).isPresent());
        assertTrue(guild.channel(new ChannelId(20L)).isPresent());
        assertTrue(guild.isOwner(new UserId(1L)));
        assertEquals(List.of(), guild.channel(new ChannelId(20L)).orElseThrow().overwrites());
    }
}
