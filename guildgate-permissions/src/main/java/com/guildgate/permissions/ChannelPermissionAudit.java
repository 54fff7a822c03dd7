package com.guildgate.permissions;

import com.guildgate.common.logging.SubsystemLogger;
import com.guildgate.permissions.model.ChannelId;
import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.GuildChannel;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.Permissions;
import com.guildgate.permissions.model.UserId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks that a member holds a required set of permissions in each of a list
 * of channels, typically the bot's own member before it starts posting.
 */
public class ChannelPermissionAudit {

    private static final SubsystemLogger log = SubsystemLogger.create("permissions/audit");

    public static final List<String> DEFAULT_REQUIRED_PERMISSIONS = List.of("ViewChannel", "SendMessages");

    private final PermissionCalculator calculator;
    private final Permissions required;

    public ChannelPermissionAudit(PermissionCalculator calculator) {
        this(calculator, DEFAULT_REQUIRED_PERMISSIONS);
    }

    /**
     * @throws IllegalArgumentException if a required permission name is unknown
     */
    public ChannelPermissionAudit(PermissionCalculator calculator, Collection<String> requiredPermissions) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.required = Permissions.fromNames(requiredPermissions);
    }

    public record ChannelPermissionsEntry(
            ChannelId channelId,
            boolean ok,
            List<String> missing,
            String error) {
    }

    public record ChannelPermissionsAudit(
            boolean ok,
            int checkedChannels,
            int unresolvedChannels,
            List<ChannelPermissionsEntry> channels,
            long elapsedMs) {
    }

    public Permissions getRequired() {
        return required;
    }

    public ChannelPermissionsAudit audit(Guild guild, UserId userId, Collection<ChannelId> channelIds) {
        long start = System.currentTimeMillis();
        Optional<Member> member = guild.member(userId);
        List<ChannelPermissionsEntry> entries = new ArrayList<>();
        int unresolved = 0;

        for (ChannelId channelId : channelIds) {
            Optional<GuildChannel> channel = guild.channel(channelId);
            if (channel.isEmpty()) {
                unresolved++;
                entries.add(new ChannelPermissionsEntry(channelId, false, List.of(), "channel not found"));
                continue;
            }
            if (member.isEmpty()) {
                entries.add(new ChannelPermissionsEntry(channelId, false, List.of(), "member not found"));
                continue;
            }
            Permissions effective = calculator.userPermissionsIn(guild, channel.get(), member.get());
            List<String> missing = required.difference(effective).names();
            entries.add(new ChannelPermissionsEntry(channelId, missing.isEmpty(), missing, null));
        }

        boolean ok = entries.stream().allMatch(ChannelPermissionsEntry::ok);
        if (!ok) {
            log.info("channel audit found problems", Map.of(
                    "guildId", guild.id(),
                    "userId", userId,
                    "failed", entries.stream().filter(e -> !e.ok()).count()));
        }
        return new ChannelPermissionsAudit(ok, entries.size(), unresolved, List.copyOf(entries),
                System.currentTimeMillis() - start);
    }
}
