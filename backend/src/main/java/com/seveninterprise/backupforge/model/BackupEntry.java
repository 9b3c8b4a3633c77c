package com.seveninterprise.backupforge.model;

import java.time.Instant;

/**
 * Item da listagem de backups existentes no diretório de armazenamento
 */
public class BackupEntry {

    private String path;
    private String name;
    private BackupType type;
    private long size;
    private Instant created;
    private BackupMetadata metadata; // null quando o sidecar está ausente ou ilegível

    public BackupEntry() {}

    public BackupEntry(String path, String name, BackupType type, long size, Instant created, BackupMetadata metadata) {
        this.path = path;
        this.name = name;
        this.type = type;
        this.size = size;
        this.created = created;
        this.metadata = metadata;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public BackupType getType() {
        return type;
    }

    public void setType(BackupType type) {
        this.type = type;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public Instant getCreated() {
        return created;
    }

    public void setCreated(Instant created) {
        this.created = created;
    }

    public BackupMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(BackupMetadata metadata) {
        this.metadata = metadata;
    }
}
