package com.guildgate.permissions;

import com.guildgate.permissions.RoleHierarchy.HighestRoleLookup;
import com.guildgate.permissions.RoleHierarchy.HighestRoleStatus;
import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.Permissions;
import com.guildgate.permissions.model.RoleId;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.guildgate.permissions.TestGuilds.*;
import static org.junit.jupiter.api.Assertions.*;

class RoleHierarchyTest {

    private final RoleHierarchy hierarchy = roleHierarchy();

    private final Guild guild = guild()
            .everyone(Permissions.EMPTY)
            .role(role(100L, "mods", 5))
            .role(role(200L, "helpers", 5))
            .role(role(300L, "admins", 9))
            .role(role(400L, "members", 1))
            .build();

    @Test
    void highestPosition_wins() {
        Member member = member(2L, 400L, 300L, 100L);
        assertEquals(new RoleId(300L), hierarchy.memberHighestRole(guild, member).orElseThrow().id());
    }

    @Test
    void equalPosition_smallerIdWins() {
        Member member = member(2L, 200L, 100L);
        assertEquals(new RoleId(100L), hierarchy.memberHighestRole(guild, member).orElseThrow().id());

        Member reversed = member(3L, 100L, 200L);
        assertEquals(new RoleId(100L), hierarchy.memberHighestRole(guild, reversed).orElseThrow().id());
    }

    @Test
    void noResolvableRoles_isEmpty() {
        assertTrue(hierarchy.memberHighestRole(guild, member(2L)).isEmpty());
        assertTrue(hierarchy.memberHighestRole(guild, member(2L, 999L, 998L)).isEmpty());
    }

    @Test
    void danglingRoles_areSkipped() {
        Member member = member(2L, 999L, 400L);
        assertEquals(new RoleId(400L), hierarchy.memberHighestRole(guild, member).orElseThrow().id());
    }

    @Test
    void outranks_isStrict() {
        assertTrue(RoleHierarchy.outranks(role(300L, 9), role(100L, 5)));
        assertTrue(RoleHierarchy.outranks(role(100L, 5), role(200L, 5)));
        assertFalse(RoleHierarchy.outranks(role(200L, 5), role(100L, 5)));
        assertFalse(RoleHierarchy.outranks(role(100L, 5), role(100L, 5)));
    }

    @Test
    void lookup_resolved() {
        HighestRoleLookup lookup = hierarchy.lookup(member(2L, 999L, 100L), guild.roles());

        assertEquals(HighestRoleStatus.RESOLVED, lookup.status());
        assertEquals(new RoleId(100L), lookup.highestRole().orElseThrow().id());
        assertEquals(Set.of(new RoleId(999L)), lookup.unresolved());
    }

    @Test
    void lookup_noRolesAssigned() {
        HighestRoleLookup lookup = hierarchy.lookup(member(2L), guild.roles());

        assertEquals(HighestRoleStatus.NO_ROLES_ASSIGNED, lookup.status());
        assertTrue(lookup.highestRole().isEmpty());
        assertTrue(lookup.unresolved().isEmpty());
    }

    @Test
    void lookup_rolesUnresolved() {
        HighestRoleLookup lookup = hierarchy.lookup(member(2L, 998L, 999L), guild.roles());

        assertEquals(HighestRoleStatus.ROLES_UNRESOLVED, lookup.status());
        assertNull(lookup.highest());
        assertEquals(roleIds(998L, 999L), lookup.unresolved());
    }
}
