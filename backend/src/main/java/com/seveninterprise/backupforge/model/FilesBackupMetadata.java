package com.seveninterprise.backupforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Metadados de um backup de arquivos
 */
public class FilesBackupMetadata extends BackupMetadata {

    private List<String> directories = new ArrayList<>();
    private List<String> exclusions = new ArrayList<>();
    private int fileCount;
    private long totalSize;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> skippedFiles = new ArrayList<>();

    @Override
    public BackupType getType() {
        return BackupType.FILES;
    }

    public List<String> getDirectories() {
        return directories;
    }

    public void setDirectories(List<String> directories) {
        this.directories = directories;
    }

    public List<String> getExclusions() {
        return exclusions;
    }

    public void setExclusions(List<String> exclusions) {
        this.exclusions = exclusions;
    }

    public int getFileCount() {
        return fileCount;
    }

    public void setFileCount(int fileCount) {
        this.fileCount = fileCount;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public void setTotalSize(long totalSize) {
        this.totalSize = totalSize;
    }

    public List<String> getSkippedFiles() {
        return skippedFiles;
    }

    public void setSkippedFiles(List<String> skippedFiles) {
        this.skippedFiles = skippedFiles;
    }
}
