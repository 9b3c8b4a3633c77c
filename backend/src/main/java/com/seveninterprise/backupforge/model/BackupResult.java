package com.seveninterprise.backupforge.model;

/**
 * Resultado de uma execução de produtor (banco ou arquivos)
 */
public class BackupResult {

    private String artifactPath;
    private long size;
    private long durationMs;
    private int fileCount;
    private BackupMetadata metadata;

    public BackupResult() {}

    public BackupResult(String artifactPath, long size, long durationMs, int fileCount, BackupMetadata metadata) {
        this.artifactPath = artifactPath;
        this.size = size;
        this.durationMs = durationMs;
        this.fileCount = fileCount;
        this.metadata = metadata;
    }

    public String getArtifactPath() {
        return artifactPath;
    }

    public void setArtifactPath(String artifactPath) {
        this.artifactPath = artifactPath;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public int getFileCount() {
        return fileCount;
    }

    public void setFileCount(int fileCount) {
        this.fileCount = fileCount;
    }

    public BackupMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(BackupMetadata metadata) {
        this.metadata = metadata;
    }
}
