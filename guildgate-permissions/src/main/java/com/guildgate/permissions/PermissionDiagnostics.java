package com.guildgate.permissions;

import com.guildgate.common.config.GuildGateConfig;
import com.guildgate.common.logging.LogLevel;
import com.guildgate.common.logging.SubsystemLogger;
import com.guildgate.permissions.model.GuildId;
import com.guildgate.permissions.model.RoleId;
import com.guildgate.permissions.model.UserId;

import java.util.Map;

/**
 * Reports snapshot integrity problems met while resolving permissions. None of
 * them abort a computation.
 */
public class PermissionDiagnostics {

    static final SubsystemLogger LOG = SubsystemLogger.create("permissions/integrity");

    private final LogLevel integrityLevel;
    private final LogLevel danglingLevel;

    public PermissionDiagnostics(LogLevel integrityLevel, boolean reportDanglingRoles) {
        this.integrityLevel = integrityLevel != null ? integrityLevel : LogLevel.ERROR;
        this.danglingLevel = reportDanglingRoles ? LogLevel.WARN : LogLevel.DEBUG;
    }

    public static PermissionDiagnostics defaults() {
        return new PermissionDiagnostics(LogLevel.ERROR, false);
    }

    public static PermissionDiagnostics fromConfig(GuildGateConfig.PermissionsConfig config) {
        if (config == null) {
            return defaults();
        }
        return new PermissionDiagnostics(
                LogLevel.normalize(config.getIntegrityLevel(), LogLevel.ERROR),
                config.isReportDanglingRoles());
    }

    /** The guild's @everyone role is absent from its snapshot. */
    public void everyoneRoleMissing(GuildId guildId) {
        LOG.log(integrityLevel, "@everyone role missing", Map.of("guildId", guildId));
    }

    /** A member references a role the snapshot does not contain. */
    public void danglingRole(GuildId guildId, UserId userId, RoleId roleId) {
        if (!LOG.isEnabled(danglingLevel)) {
            return;
        }
        LOG.log(danglingLevel, "member has non-existent role",
                Map.of("guildId", guildId, "userId", userId, "roleId", roleId));
    }

    /** A role ID skipped while looking for a member's highest role. */
    public void unresolvedRole(UserId userId, RoleId roleId) {
        if (!LOG.isEnabled(danglingLevel)) {
            return;
        }
        LOG.log(danglingLevel, "skipping unresolvable role",
                Map.of("userId", userId, "roleId", roleId));
    }

    public LogLevel getIntegrityLevel() {
        return integrityLevel;
    }

    public LogLevel getDanglingLevel() {
        return danglingLevel;
    }
}
