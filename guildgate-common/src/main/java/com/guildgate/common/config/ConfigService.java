package com.guildgate.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.guildgate.common.logging.LogLevel;
import com.guildgate.common.logging.SubsystemLogger;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches GuildGate configuration.
 */
@Slf4j
public class ConfigService {

    public static final String DEFAULT_CONFIG_PATH = "~/.guildgate/guildgate.json";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, GuildGateConfig> cache;
    private final Path configPath;
    private final Function<String, String> envLookup;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this(configPath, cacheTtl, System::getenv);
    }

    ConfigService(Path configPath, Duration cacheTtl, Function<String, String> envLookup) {
        this.configPath = expandHome(configPath);
        this.envLookup = envLookup;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public GuildGateConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public GuildGateConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Get the config file path.
     */
    public Path getConfigPath() {
        return configPath;
    }

    private GuildGateConfig doLoadConfig() {
        GuildGateConfig config;
        try {
            if (!Files.exists(configPath)) {
                log.warn("Config file not found: {}, using defaults", configPath);
                config = applyDefaults(new GuildGateConfig());
            } else {
                String raw = Files.readString(configPath);
                raw = substituteEnvVars(raw);
                config = objectMapper.readValue(raw, GuildGateConfig.class);
                if (config == null) {
                    config = new GuildGateConfig();
                }
                config = applyDefaults(config);
                log.info("Config loaded from: {}", configPath);
            }
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            config = applyDefaults(new GuildGateConfig());
        }
        applyLogging(config.getLogging());
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = envLookup.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config fields.
     */
    GuildGateConfig applyDefaults(GuildGateConfig config) {
        if (config.getLogging() == null) {
            config.setLogging(new GuildGateConfig.LoggingConfig());
        }
        if (config.getPermissions() == null) {
            config.setPermissions(new GuildGateConfig.PermissionsConfig());
        }
        GuildGateConfig.PermissionsConfig permissions = config.getPermissions();
        if (permissions.getIntegrityLevel() == null || permissions.getIntegrityLevel().isBlank()) {
            permissions.setIntegrityLevel("error");
        }
        if (permissions.getRequiredChannelPermissions() == null) {
            permissions.setRequiredChannelPermissions(
                    new GuildGateConfig.PermissionsConfig().getRequiredChannelPermissions());
        }
        return config;
    }

    private void applyLogging(GuildGateConfig.LoggingConfig logging) {
        if (logging == null) {
            SubsystemLogger.setMinimumLevel(LogLevel.INFO);
            SubsystemLogger.setSubsystemFilter();
            return;
        }
        SubsystemLogger.setMinimumLevel(LogLevel.normalize(logging.getLevel()));
        if (logging.getSubsystems() == null) {
            SubsystemLogger.setSubsystemFilter();
        } else {
            SubsystemLogger.setSubsystemFilter(logging.getSubsystems().toArray(new String[0]));
        }
    }

    static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }
}
