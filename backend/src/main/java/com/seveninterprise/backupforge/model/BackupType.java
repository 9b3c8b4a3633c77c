package com.seveninterprise.backupforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tipos de artefato produzidos pelo motor de backup
 */
public enum BackupType {
    DATABASE("database", ".db.zip", ".db"),
    FILES("files", ".zip", ".zip");

    public static final String SIDECAR_SUFFIX = ".meta.json";

    private final String id;
    private final String compressedExtension;
    private final String rawExtension;

    BackupType(String id, String compressedExtension, String rawExtension) {
        this.id = id;
        this.compressedExtension = compressedExtension;
        this.rawExtension = rawExtension;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getFilePrefix() {
        return id + "_backup_";
    }

    public String extension(boolean compressed) {
        return compressed ? compressedExtension : rawExtension;
    }

    /**
     * Indica se o nome de arquivo pertence a um artefato deste tipo (sidecars não contam)
     */
    public boolean matchesArtifactName(String fileName) {
        if (!fileName.startsWith(getFilePrefix()) || fileName.endsWith(SIDECAR_SUFFIX)) {
            return false;
        }
        return fileName.endsWith(compressedExtension) || fileName.endsWith(rawExtension);
    }

    @JsonCreator
    public static BackupType fromId(String value) {
        for (BackupType type : values()) {
            if (type.id.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Tipo de backup desconhecido: " + value);
    }
}
