package com.seveninterprise.backupforge.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Estatísticas agregadas dos artefatos armazenados
 */
public class BackupStats {

    private TypeStats database = new TypeStats();
    private TypeStats files = new TypeStats();
    private int totalCount;
    private long totalSizeBytes;
    private List<BackupJobStatus> jobs = new ArrayList<>();

    public static class TypeStats {
        private int count;
        private long totalSizeBytes;
        private String totalSize;
        private Instant oldestBackup;
        private Instant newestBackup;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public long getTotalSizeBytes() {
            return totalSizeBytes;
        }

        public void setTotalSizeBytes(long totalSizeBytes) {
            this.totalSizeBytes = totalSizeBytes;
        }

        public String getTotalSize() {
            return totalSize;
        }

        public void setTotalSize(String totalSize) {
            this.totalSize = totalSize;
        }

        public Instant getOldestBackup() {
            return oldestBackup;
        }

        public void setOldestBackup(Instant oldestBackup) {
            this.oldestBackup = oldestBackup;
        }

        public Instant getNewestBackup() {
            return newestBackup;
        }

        public void setNewestBackup(Instant newestBackup) {
            this.newestBackup = newestBackup;
        }
    }

    public TypeStats getDatabase() {
        return database;
    }

    public void setDatabase(TypeStats database) {
        this.database = database;
    }

    public TypeStats getFiles() {
        return files;
    }

    public void setFiles(TypeStats files) {
        this.files = files;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(int totalCount) {
        this.totalCount = totalCount;
    }

    public long getTotalSizeBytes() {
        return totalSizeBytes;
    }

    public void setTotalSizeBytes(long totalSizeBytes) {
        this.totalSizeBytes = totalSizeBytes;
    }

    public List<BackupJobStatus> getJobs() {
        return jobs;
    }

    public void setJobs(List<BackupJobStatus> jobs) {
        this.jobs = jobs;
    }
}
