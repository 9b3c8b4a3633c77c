package com.seveninterprise.backupforge.model;

import java.time.Instant;

/**
 * Visão de saúde do subsistema de backup
 */
public class BackupHealth {

    private String status; // "healthy" ou "degraded"
    private Instant timestamp;
    private boolean schedulerInitialized;
    private int activeJobs;
    private int totalJobs;
    private int errorJobs;
    private boolean databaseBackupEnabled;
    private boolean filesBackupEnabled;
    private boolean notificationsEnabled;
    private String backupDirectory;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public boolean isSchedulerInitialized() {
        return schedulerInitialized;
    }

    public void setSchedulerInitialized(boolean schedulerInitialized) {
        this.schedulerInitialized = schedulerInitialized;
    }

    public int getActiveJobs() {
        return activeJobs;
    }

    public void setActiveJobs(int activeJobs) {
        this.activeJobs = activeJobs;
    }

    public int getTotalJobs() {
        return totalJobs;
    }

    public void setTotalJobs(int totalJobs) {
        this.totalJobs = totalJobs;
    }

    public int getErrorJobs() {
        return errorJobs;
    }

    public void setErrorJobs(int errorJobs) {
        this.errorJobs = errorJobs;
    }

    public boolean isDatabaseBackupEnabled() {
        return databaseBackupEnabled;
    }

    public void setDatabaseBackupEnabled(boolean databaseBackupEnabled) {
        this.databaseBackupEnabled = databaseBackupEnabled;
    }

    public boolean isFilesBackupEnabled() {
        return filesBackupEnabled;
    }

    public void setFilesBackupEnabled(boolean filesBackupEnabled) {
        this.filesBackupEnabled = filesBackupEnabled;
    }

    public boolean isNotificationsEnabled() {
        return notificationsEnabled;
    }

    public void setNotificationsEnabled(boolean notificationsEnabled) {
        this.notificationsEnabled = notificationsEnabled;
    }

    public String getBackupDirectory() {
        return backupDirectory;
    }

    public void setBackupDirectory(String backupDirectory) {
        this.backupDirectory = backupDirectory;
    }
}
