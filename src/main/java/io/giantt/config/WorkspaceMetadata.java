package io.giantt.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkspaceMetadata(String schema, Integer backupRetention) {
    public static final String SCHEMA = "giantt/1";

    public static WorkspaceMetadata defaults() {
        return new WorkspaceMetadata(SCHEMA, GianttConfig.DEFAULT_BACKUP_RETENTION);
    }

    public WorkspaceMetadata withBackupRetention(int value) {
        return new WorkspaceMetadata(schema, value);
    }
}
