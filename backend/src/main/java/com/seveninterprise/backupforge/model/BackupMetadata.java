package com.seveninterprise.backupforge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Descritor gravado ao lado de cada artefato ({@code <artefato>.meta.json})
 *
 * Conjunto fechado de formatos: um por tipo de artefato, discriminado pelo
 * campo {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY,
              property = "type", visible = true)
@JsonSubTypes({
    @JsonSubTypes.Type(value = DatabaseBackupMetadata.class, name = "database"),
    @JsonSubTypes.Type(value = FilesBackupMetadata.class, name = "files")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class BackupMetadata {

    public static final String CURRENT_VERSION = "1.0";

    private Instant timestamp;
    private String version = CURRENT_VERSION;
    private String backupPath;
    private String checksum;

    public abstract BackupType getType();

    // Necessário para desserialização com a propriedade visível
    public void setType(BackupType type) {
        if (type != getType()) {
            throw new IllegalArgumentException("Tipo de metadados incompatível: " + type);
        }
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getBackupPath() {
        return backupPath;
    }

    public void setBackupPath(String backupPath) {
        this.backupPath = backupPath;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }
}
