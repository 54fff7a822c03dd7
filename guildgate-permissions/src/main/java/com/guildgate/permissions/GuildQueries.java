package com.guildgate.permissions;

import com.guildgate.permissions.model.Guild;
import com.guildgate.permissions.model.GuildChannel;
import com.guildgate.permissions.model.Member;
import com.guildgate.permissions.model.Permission;
import com.guildgate.permissions.model.Role;
import com.guildgate.permissions.model.UserId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Read-only lookups over a guild snapshot: default channels, roles by name and
 * member search.
 */
public class GuildQueries {

    private final PermissionCalculator calculator;

    public GuildQueries(PermissionCalculator calculator) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
    }

    /**
     * A member search hit together with the name that matched.
     */
    public record MemberMatch(Member member, String matchedName) {
    }

    // =========================================================================
    // Channels
    // =========================================================================

    /**
     * First non-category channel the user can view, or empty if the user is not
     * a member or can view nothing.
     */
    public Optional<GuildChannel> defaultChannel(Guild guild, UserId userId) {
        Optional<Member> member = guild.member(userId);
        if (member.isEmpty()) {
            return Optional.empty();
        }
        return guild.channels().find(channel -> !channel.isCategory()
                && calculator.userPermissionsIn(guild, channel, member.get()).contains(Permission.VIEW_CHANNEL));
    }

    /**
     * First non-category channel every member can view. Costs one resolution
     * per member per channel.
     */
    public Optional<GuildChannel> defaultChannelGuaranteed(Guild guild) {
        return guild.channels().find(channel -> !channel.isCategory()
                && guild.members().stream().allMatch(member -> calculator
                        .userPermissionsIn(guild, channel, member).contains(Permission.VIEW_CHANNEL)));
    }

    // =========================================================================
    // Roles
    // =========================================================================

    /** Role whose name equals {@code name} exactly. */
    public Optional<Role> roleByName(Guild guild, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return guild.roles().find(role -> name.equals(role.name()));
    }

    // =========================================================================
    // Members
    // =========================================================================

    /**
     * Member matching {@code username} or {@code username#discriminator}; falls
     * back to an exact nickname match on the whole input.
     */
    public Optional<Member> memberNamed(Guild guild, String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        String username = name;
        Integer discriminator = null;
        int hash = name.lastIndexOf('#');
        if (hash > 0) {
            Integer parsed = parseDiscriminator(name.substring(hash + 1));
            if (parsed != null) {
                username = name.substring(0, hash);
                discriminator = parsed;
            }
        }

        for (Member member : guild.members().values()) {
            if (member.username().equals(username)
                    && (discriminator == null || discriminator.equals(member.discriminator()))) {
                return Optional.of(member);
            }
        }
        return guild.members().find(member -> name.equals(member.nick()));
    }

    /**
     * Members whose username, or failing that nickname, starts with
     * {@code prefix}.
     */
    public List<MemberMatch> membersStartingWith(Guild guild, String prefix, boolean caseSensitive,
            boolean sorted) {
        return searchUsernameThenNick(guild, prefix, caseSensitive, sorted, String::startsWith);
    }

    /**
     * Members whose username, or failing that nickname, contains
     * {@code substring}.
     */
    public List<MemberMatch> membersContaining(Guild guild, String substring, boolean caseSensitive,
            boolean sorted) {
        return searchUsernameThenNick(guild, substring, caseSensitive, sorted, String::contains);
    }

    /** Members whose username contains {@code substring}. */
    public List<MemberMatch> membersUsernameContaining(Guild guild, String substring, boolean caseSensitive,
            boolean sorted) {
        List<MemberMatch> matches = new ArrayList<>();
        for (Member member : guild.members().values()) {
            if (matches(member.username(), substring, caseSensitive, String::contains)) {
                matches.add(new MemberMatch(member, member.username()));
            }
        }
        return sortIfRequested(matches, substring, sorted);
    }

    /** Members whose nickname (username when unset) contains {@code substring}. */
    public List<MemberMatch> membersNickContaining(Guild guild, String substring, boolean caseSensitive,
            boolean sorted) {
        List<MemberMatch> matches = new ArrayList<>();
        for (Member member : guild.members().values()) {
            String nick = member.displayName();
            if (matches(nick, substring, caseSensitive, String::contains)) {
                matches.add(new MemberMatch(member, nick));
            }
        }
        return sortIfRequested(matches, substring, sorted);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private List<MemberMatch> searchUsernameThenNick(Guild guild, String needle, boolean caseSensitive,
            boolean sorted, BiPredicate<String, String> test) {
        List<MemberMatch> matches = new ArrayList<>();
        for (Member member : guild.members().values()) {
            if (matches(member.username(), needle, caseSensitive, test)) {
                matches.add(new MemberMatch(member, member.username()));
            } else if (member.nick() != null && matches(member.nick(), needle, caseSensitive, test)) {
                matches.add(new MemberMatch(member, member.nick()));
            }
        }
        return sortIfRequested(matches, needle, sorted);
    }

    private static boolean matches(String haystack, String needle, boolean caseSensitive,
            BiPredicate<String, String> test) {
        if (caseSensitive) {
            return test.test(haystack, needle);
        }
        return test.test(haystack.toLowerCase(Locale.ROOT), needle.toLowerCase(Locale.ROOT));
    }

    private static List<MemberMatch> sortIfRequested(List<MemberMatch> matches, String origin, boolean sorted) {
        if (sorted) {
            matches.sort(Comparator.comparingInt(m -> closenessToOrigin(origin, m.matchedName())));
        }
        return matches;
    }

    /**
     * Sort key: where {@code origin} first occurs plus the name's length. Names
     * not containing {@code origin} sort last.
     */
    static int closenessToOrigin(String origin, String name) {
        int index = name.indexOf(origin);
        if (index < 0) {
            return Integer.MAX_VALUE;
        }
        return index + name.length();
    }

    private static Integer parseDiscriminator(String raw) {
        if (raw.isEmpty() || raw.length() > 4) {
            return null;
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        return Integer.valueOf(raw);
    }
}
