package com.guildgate.permissions;

import com.guildgate.common.config.ConfigService;
import com.guildgate.common.config.GuildGateConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the permission engine beans.
 */
@Slf4j
@Configuration
public class PermissionsBeanConfig {

    @Value("${guildgate.config.path:" + ConfigService.DEFAULT_CONFIG_PATH + "}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public PermissionDiagnostics permissionDiagnostics(ConfigService configService) {
        GuildGateConfig config = configService.loadConfig();
        PermissionDiagnostics diagnostics = PermissionDiagnostics.fromConfig(config.getPermissions());
        log.debug("Permission diagnostics: integrity={}, dangling={}",
                diagnostics.getIntegrityLevel(), diagnostics.getDanglingLevel());
        return diagnostics;
    }

    @Bean
    public RoleHierarchy roleHierarchy(PermissionDiagnostics diagnostics) {
        return new RoleHierarchy(diagnostics);
    }

    @Bean
    public PermissionCalculator permissionCalculator(PermissionDiagnostics diagnostics) {
        return new PermissionCalculator(diagnostics);
    }

    @Bean
    public HierarchyComparator hierarchyComparator(RoleHierarchy roleHierarchy) {
        return new HierarchyComparator(roleHierarchy);
    }

    @Bean
    public GuildQueries guildQueries(PermissionCalculator calculator) {
        return new GuildQueries(calculator);
    }

    @Bean
    public ChannelPermissionAudit channelPermissionAudit(ConfigService configService,
            PermissionCalculator calculator) {
        GuildGateConfig.PermissionsConfig permissions = configService.loadConfig().getPermissions();
        return new ChannelPermissionAudit(calculator, permissions.getRequiredChannelPermissions());
    }

    @Bean
    public ModerationGate moderationGate(PermissionCalculator calculator, HierarchyComparator hierarchy,
            RoleHierarchy roleHierarchy) {
        return new ModerationGate(calculator, hierarchy, roleHierarchy);
    }

    @Bean
    public GuildSnapshotCache guildSnapshotCache(PermissionCalculator calculator, HierarchyComparator hierarchy) {
        return new GuildSnapshotCache(calculator, hierarchy);
    }
}
