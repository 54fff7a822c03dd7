package com.guildgate.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for GuildGate.
 */
@Data
public class GuildGateConfig {

    /** Logging settings. */
    private LoggingConfig logging;

    /** Permission engine settings. */
    private PermissionsConfig permissions;

    // --- Nested config types ---

    @Data
    public static class LoggingConfig {
        /** Minimum level name ("debug", "info", ...). */
        private String level = "info";
        /** Subsystem prefixes allowed to log; empty means all. */
        private List<String> subsystems = new ArrayList<>();
    }

    @Data
    public static class PermissionsConfig {
        /** Level used when a guild's @everyone role is missing from its snapshot. */
        private String integrityLevel = "error";
        /** Raise dangling role references from debug to warn. */
        private boolean reportDanglingRoles = false;
        /** Permission display names a channel audit requires. */
        private List<String> requiredChannelPermissions = new ArrayList<>(
                List.of("ViewChannel", "SendMessages"));
    }
}
