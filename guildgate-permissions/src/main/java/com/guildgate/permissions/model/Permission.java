package com.guildgate.permissions.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named permission flags with their bit positions in the chat service's
 * permission integer.
 */
public enum Permission {

    CREATE_INSTANT_INVITE(0, "CreateInstantInvite"),
    KICK_MEMBERS(1, "KickMembers"),
    BAN_MEMBERS(2, "BanMembers"),
    ADMINISTRATOR(3, "Administrator"),
    MANAGE_CHANNELS(4, "ManageChannels"),
    MANAGE_GUILD(5, "ManageGuild"),
    ADD_REACTIONS(6, "AddReactions"),
    VIEW_AUDIT_LOG(7, "ViewAuditLog"),
    PRIORITY_SPEAKER(8, "PrioritySpeaker"),
    STREAM(9, "Stream"),
    VIEW_CHANNEL(10, "ViewChannel"),
    SEND_MESSAGES(11, "SendMessages"),
    SEND_TTS_MESSAGES(12, "SendTTSMessages"),
    MANAGE_MESSAGES(13, "ManageMessages"),
    EMBED_LINKS(14, "EmbedLinks"),
    ATTACH_FILES(15, "AttachFiles"),
    READ_MESSAGE_HISTORY(16, "ReadMessageHistory"),
    MENTION_EVERYONE(17, "MentionEveryone"),
    USE_EXTERNAL_EMOJIS(18, "UseExternalEmojis"),
    VIEW_GUILD_INSIGHTS(19, "ViewGuildInsights"),
    CONNECT(20, "Connect"),
    SPEAK(21, "Speak"),
    MUTE_MEMBERS(22, "MuteMembers"),
    DEAFEN_MEMBERS(23, "DeafenMembers"),
    MOVE_MEMBERS(24, "MoveMembers"),
    USE_VAD(25, "UseVAD"),
    CHANGE_NICKNAME(26, "ChangeNickname"),
    MANAGE_NICKNAMES(27, "ManageNicknames"),
    MANAGE_ROLES(28, "ManageRoles"),
    MANAGE_WEBHOOKS(29, "ManageWebhooks"),
    MANAGE_GUILD_EXPRESSIONS(30, "ManageGuildExpressions"),
    USE_APPLICATION_COMMANDS(31, "UseApplicationCommands"),
    REQUEST_TO_SPEAK(32, "RequestToSpeak"),
    MANAGE_EVENTS(33, "ManageEvents"),
    MANAGE_THREADS(34, "ManageThreads"),
    CREATE_PUBLIC_THREADS(35, "CreatePublicThreads"),
    CREATE_PRIVATE_THREADS(36, "CreatePrivateThreads"),
    USE_EXTERNAL_STICKERS(37, "UseExternalStickers"),
    SEND_MESSAGES_IN_THREADS(38, "SendMessagesInThreads"),
    USE_EMBEDDED_ACTIVITIES(39, "UseEmbeddedActivities"),
    MODERATE_MEMBERS(40, "ModerateMembers"),
    VIEW_CREATOR_MONETIZATION_ANALYTICS(41, "ViewCreatorMonetizationAnalytics"),
    USE_SOUNDBOARD(42, "UseSoundboard"),
    CREATE_GUILD_EXPRESSIONS(43, "CreateGuildExpressions"),
    CREATE_EVENTS(44, "CreateEvents"),
    USE_EXTERNAL_SOUNDS(45, "UseExternalSounds"),
    SEND_VOICE_MESSAGES(46, "SendVoiceMessages"),
    SEND_POLLS(49, "SendPolls"),
    USE_EXTERNAL_APPS(50, "UseExternalApps");

    private static final Map<String, Permission> BY_NAME = new HashMap<>();

    static {
        for (Permission p : values()) {
            BY_NAME.put(p.displayName.toLowerCase(Locale.ROOT), p);
            BY_NAME.put(p.name().toLowerCase(Locale.ROOT), p);
        }
    }

    private final int bitIndex;
    private final long bit;
    private final String displayName;

    Permission(int bitIndex, String displayName) {
        this.bitIndex = bitIndex;
        this.bit = 1L << bitIndex;
        this.displayName = displayName;
    }

    public int bitIndex() {
        return bitIndex;
    }

    public long bit() {
        return bit;
    }

    /** PascalCase name, e.g. {@code ViewChannel}. */
    public String displayName() {
        return displayName;
    }

    /**
     * Look up a flag by display name ({@code SendMessages}) or constant name
     * ({@code SEND_MESSAGES}), ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Permission fromName(String name) {
        Permission p = name != null ? BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)) : null;
        if (p == null) {
            throw new IllegalArgumentException("Unknown permission: " + name);
        }
        return p;
    }
}
