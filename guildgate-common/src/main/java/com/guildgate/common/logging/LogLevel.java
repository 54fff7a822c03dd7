package com.guildgate.common.logging;

import java.util.Map;

/**
 * Log levels understood by configuration and {@link SubsystemLogger}.
 * Provides normalization of user-supplied names and SLF4J level mapping.
 */
public enum LogLevel {
    SILENT,
    FATAL,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.ofEntries(
            Map.entry("silent", SILENT),
            Map.entry("off", SILENT),
            Map.entry("fatal", FATAL),
            Map.entry("error", ERROR),
            Map.entry("warn", WARN),
            Map.entry("warning", WARN),
            Map.entry("info", INFO),
            Map.entry("debug", DEBUG),
            Map.entry("trace", TRACE));

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase());
        return resolved != null ? resolved : fallback;
    }

    /**
     * Normalize with default fallback of INFO.
     */
    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * SLF4J / Logback level name.
     */
    public String toSlf4jLevel() {
        return switch (this) {
            case SILENT -> "OFF";
            case FATAL -> "ERROR";
            default -> name();
        };
    }

    /**
     * Numeric priority, lower is more severe. SILENT sorts after everything.
     */
    public int priority() {
        return switch (this) {
            case FATAL -> 0;
            case ERROR -> 1;
            case WARN -> 2;
            case INFO -> 3;
            case DEBUG -> 4;
            case TRACE -> 5;
            case SILENT -> Integer.MAX_VALUE;
        };
    }

    /**
     * A message at this level is enabled when its priority does not exceed the
     * configured minimum's.
     */
    public boolean isEnabledFor(LogLevel minLevel) {
        if (minLevel == SILENT || this == SILENT) {
            return false;
        }
        return this.priority() <= minLevel.priority();
    }
}
