package com.guildgate.common.config;

import com.guildgate.common.logging.LogLevel;
import com.guildgate.common.logging.SubsystemLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("guildgate.json");
    }

    @AfterEach
    void resetLogging() {
        SubsystemLogger.setSubsystemFilter();
        SubsystemLogger.setMinimumLevel(null);
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "logging": { "level": "debug" },
                  "permissions": {
                    "integrityLevel": "warn",
                    "reportDanglingRoles": true,
                    "requiredChannelPermissions": ["ViewChannel", "AttachFiles"]
                  }
                }
                """;
        Files.writeString(configPath, json);

        ConfigService service = new ConfigService(configPath);
        GuildGateConfig config = service.loadConfig();

        assertEquals("debug", config.getLogging().getLevel());
        assertEquals("warn", config.getPermissions().getIntegrityLevel());
        assertTrue(config.getPermissions().isReportDanglingRoles());
        assertEquals(List.of("ViewChannel", "AttachFiles"),
                config.getPermissions().getRequiredChannelPermissions());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("nonexistent.json"));
        GuildGateConfig config = service.loadConfig();

        assertNotNull(config.getLogging());
        assertEquals("error", config.getPermissions().getIntegrityLevel());
        assertFalse(config.getPermissions().isReportDanglingRoles());
        assertEquals(List.of("ViewChannel", "SendMessages"),
                config.getPermissions().getRequiredChannelPermissions());
    }

    @Test
    void loadConfig_invalidJson_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        GuildGateConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getPermissions());
        assertEquals("error", config.getPermissions().getIntegrityLevel());
    }

    @Test
    void loadConfig_partialSection_fillsMissingFields() throws IOException {
        Files.writeString(configPath, """
                { "permissions": { "integrityLevel": "", "requiredChannelPermissions": null } }
                """);

        GuildGateConfig config = new ConfigService(configPath).loadConfig();

        assertEquals("error", config.getPermissions().getIntegrityLevel());
        assertEquals(List.of("ViewChannel", "SendMessages"),
                config.getPermissions().getRequiredChannelPermissions());
        assertNotNull(config.getLogging());
    }

    @Test
    void loadConfig_unknownPropertiesIgnored() throws IOException {
        Files.writeString(configPath, """
                { "gateway": { "port": 4000 }, "permissions": { "reportDanglingRoles": true } }
                """);

        GuildGateConfig config = new ConfigService(configPath).loadConfig();

        assertTrue(config.getPermissions().isReportDanglingRoles());
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{}");

        ConfigService service = new ConfigService(configPath);
        GuildGateConfig first = service.loadConfig();
        GuildGateConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, """
                { "permissions": { "integrityLevel": "warn" } }
                """);
        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(5));
        assertEquals("warn", service.loadConfig().getPermissions().getIntegrityLevel());

        Files.writeString(configPath, """
                { "permissions": { "integrityLevel": "info" } }
                """);
        assertEquals("warn", service.loadConfig().getPermissions().getIntegrityLevel());
        assertEquals("info", service.reloadConfig().getPermissions().getIntegrityLevel());
    }

    @Test
    void loadConfig_appliesLoggingSettings() throws IOException {
        Files.writeString(configPath, """
                { "logging": { "level": "warning", "subsystems": ["permissions/audit"] } }
                """);

        new ConfigService(configPath).loadConfig();

        assertEquals(LogLevel.WARN, SubsystemLogger.getMinimumLevel());
        assertTrue(SubsystemLogger.create("permissions/audit").shouldLog());
        assertFalse(SubsystemLogger.create("permissions/resolver").shouldLog());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_withDefault_usesDefault() {
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), name -> null);
        assertEquals("fallback", service.substituteEnvVars("${GUILDGATE_LEVEL:-fallback}"));
        assertEquals("", service.substituteEnvVars("${GUILDGATE_LEVEL}"));
    }

    @Test
    void substituteEnvVars_resolvesFromEnvironment() throws IOException {
        Map<String, String> env = Map.of("GG_INTEGRITY", "debug");
        Files.writeString(configPath, """
                { "permissions": { "integrityLevel": "${GG_INTEGRITY:-error}" } }
                """);

        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), env::get);

        assertEquals("debug", service.loadConfig().getPermissions().getIntegrityLevel());
    }

    @Test
    void constructor_expandsHomeDirectory() {
        ConfigService service = new ConfigService(Path.of(ConfigService.DEFAULT_CONFIG_PATH));
        assertTrue(service.getConfigPath().startsWith(System.getProperty("user.home")));
        assertTrue(service.getConfigPath().endsWith(Path.of(".guildgate", "guildgate.json")));
    }
}
