package com.guildgate.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Subsystem-aware logger that wraps SLF4J and adds structured subsystem
 * context.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("permissions/resolver");
 * log.warn("Member has unknown role", Map.of("userId", 42L, "roleId", 7L));
 * SubsystemLogger child = log.child("overwrites");
 * child.debug("Applying role overwrites");
 * </pre>
 */
public class SubsystemLogger {

    public static final String LOGGER_PREFIX = "guildgate.";
    static final String MDC_SUBSYSTEM = "subsystem";

    private static final List<String> subsystemFilters = new CopyOnWriteArrayList<>();
    private static volatile LogLevel minimumLevel = LogLevel.TRACE;

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        // Subsystem doubles as the SLF4J logger name for per-subsystem control in
        // logback.xml
        this.logger = LoggerFactory.getLogger(LOGGER_PREFIX + subsystem.replace('/', '.'));
    }

    /**
     * Create a subsystem logger.
     */
    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Create a child logger with extended subsystem path.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void trace(String message) {
        trace(message, null);
    }

    public void trace(String message, Map<String, Object> meta) {
        log(LogLevel.TRACE, message, meta);
    }

    public void debug(String message) {
        debug(message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        log(LogLevel.DEBUG, message, meta);
    }

    public void info(String message) {
        info(message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        log(LogLevel.INFO, message, meta);
    }

    public void warn(String message) {
        warn(message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        log(LogLevel.WARN, message, meta);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message, null);
    }

    public void error(String message, Map<String, Object> meta) {
        log(LogLevel.ERROR, message, meta);
    }

    public void error(String message, Throwable t) {
        if (!LogLevel.ERROR.isEnabledFor(minimumLevel) || !shouldLog())
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            logger.error(formatMessage(message, null), t);
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    /**
     * Emit at a level chosen at runtime, e.g. from configuration.
     */
    public void log(LogLevel level, String message, Map<String, Object> meta) {
        if (!level.isEnabledFor(minimumLevel) || !shouldLog())
            return;
        if (!isEnabled(level))
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case INFO -> logger.info(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR, FATAL -> logger.error(formatted);
                default -> logger.info(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    /**
     * Whether the underlying SLF4J logger accepts the given level.
     */
    public boolean isEnabled(LogLevel level) {
        return switch (level) {
            case TRACE -> logger.isTraceEnabled();
            case DEBUG -> logger.isDebugEnabled();
            case INFO -> logger.isInfoEnabled();
            case WARN -> logger.isWarnEnabled();
            case ERROR, FATAL -> logger.isErrorEnabled();
            case SILENT -> false;
        };
    }

    // -----------------------------------------------------------------------
    // Subsystem filter
    // -----------------------------------------------------------------------

    /**
     * Set subsystem filters. Only subsystems matching one of the prefixes will log.
     * Pass null or empty to clear filters (all subsystems log).
     */
    public static void setSubsystemFilter(String... filters) {
        subsystemFilters.clear();
        if (filters != null) {
            Arrays.stream(filters)
                    .filter(s -> s != null)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(subsystemFilters::add);
        }
    }

    /**
     * Set the minimum level for all subsystem loggers. Null resets to TRACE.
     */
    public static void setMinimumLevel(LogLevel level) {
        minimumLevel = level != null ? level : LogLevel.TRACE;
    }

    public static LogLevel getMinimumLevel() {
        return minimumLevel;
    }

    /**
     * Check if this subsystem should log based on current filters.
     */
    public boolean shouldLog() {
        if (subsystemFilters.isEmpty()) {
            return true;
        }
        return subsystemFilters.stream().anyMatch(
                prefix -> subsystem.equals(prefix) || subsystem.startsWith(prefix + "/"));
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public String getSubsystem() {
        return subsystem;
    }

    public Logger getSlf4jLogger() {
        return logger;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    String formatMessage(String message, Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "[" + subsystem + "] " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
