package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupHealth;
import com.seveninterprise.backupforge.model.BackupJobStatus;
import com.seveninterprise.backupforge.model.BackupResult;
import com.seveninterprise.backupforge.model.BackupStats;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.CleanupResult;
import com.seveninterprise.backupforge.model.JobRunOutcome;
import com.seveninterprise.backupforge.model.JobState;
import com.seveninterprise.backupforge.model.RestoreResult;
import com.seveninterprise.backupforge.model.VerificationResult;
import com.seveninterprise.backupforge.scheduler.IBackupScheduler;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Serviço de gerenciamento de backups
 *
 * Funcionalidades:
 * - Backup manual do banco e dos arquivos
 * - Listagem, verificação e restauração
 * - Limpeza por política de retenção
 * - Controle dos jobs agendados
 * - Estatísticas e saúde do sistema
 */
@Service
public class BackupManagementService implements IBackupManagementService {

    private final BackupProperties properties;
    private final IDatabaseBackupService databaseBackupService;
    private final IFilesBackupService filesBackupService;
    private final IRestoreService restoreService;
    private final IRetentionService retentionService;
    private final IBackupIntegrityService integrityService;
    private final IBackupScheduler scheduler;
    private final Clock clock;

    public BackupManagementService(BackupProperties properties,
                                   IDatabaseBackupService databaseBackupService,
                                   IFilesBackupService filesBackupService,
                                   IRestoreService restoreService,
                                   IRetentionService retentionService,
                                   IBackupIntegrityService integrityService,
                                   IBackupScheduler scheduler,
                                   Clock clock) {
        this.properties = properties;
        this.databaseBackupService = databaseBackupService;
        this.filesBackupService = filesBackupService;
        this.restoreService = restoreService;
        this.retentionService = retentionService;
        this.integrityService = integrityService;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public BackupResult createDatabaseBackup() {
        return databaseBackupService.createBackup();
    }

    @Override
    public BackupResult createFilesBackup() {
        return filesBackupService.createBackup();
    }

    @Override
    public List<BackupEntry> listBackups(BackupType type) {
        if (type == BackupType.DATABASE) {
            return databaseBackupService.listBackups();
        }
        if (type == BackupType.FILES) {
            return filesBackupService.listBackups();
        }
        List<BackupEntry> all = new ArrayList<>(databaseBackupService.listBackups());
        all.addAll(filesBackupService.listBackups());
        all.sort(Comparator.comparing(BackupEntry::getCreated).reversed());
        return all;
    }

    @Override
    public RestoreResult restoreDatabase(String artifactPath) {
        requirePath(artifactPath);
        return restoreService.restoreDatabase(artifactPath);
    }

    @Override
    public RestoreResult restoreFiles(String artifactPath, String targetDir) {
        requirePath(artifactPath);
        return restoreService.restoreFiles(artifactPath, targetDir);
    }

    @Override
    public VerificationResult verifyBackup(String artifactPath, BackupType type) {
        requirePath(artifactPath);
        return integrityService.verify(Paths.get(artifactPath), type);
    }

    @Override
    public List<CleanupResult> cleanup(BackupType type) {
        if (type == null) {
            return retentionService.cleanupAll();
        }
        List<CleanupResult> results = new ArrayList<>();
        results.add(retentionService.cleanup(type));
        return results;
    }

    @Override
    public List<BackupJobStatus> getSchedulerStatus() {
        return scheduler.getAllJobStatuses();
    }

    @Override
    public JobRunOutcome triggerJob(String jobName) {
        return scheduler.triggerJob(jobName);
    }

    @Override
    public void startJob(String jobName) {
        scheduler.startJob(jobName);
    }

    @Override
    public void stopJob(String jobName) {
        scheduler.stopJob(jobName);
    }

    @Override
    public BackupStats getStats() {
        BackupStats stats = new BackupStats();
        stats.setDatabase(typeStats(databaseBackupService.listBackups()));
        stats.setFiles(typeStats(filesBackupService.listBackups()));
        stats.setTotalCount(stats.getDatabase().getCount() + stats.getFiles().getCount());
        stats.setTotalSizeBytes(stats.getDatabase().getTotalSizeBytes() + stats.getFiles().getTotalSizeBytes());
        stats.setJobs(scheduler.getAllJobStatuses());
        return stats;
    }

    @Override
    public BackupHealth getHealth() {
        List<BackupJobStatus> jobs = scheduler.getAllJobStatuses();
        int activeJobs = 0;
        int errorJobs = 0;
        for (BackupJobStatus job : jobs) {
            if (job.isActive()) {
                activeJobs++;
            }
            if (job.getStatus() == JobState.ERROR) {
                errorJobs++;
            }
        }

        BackupHealth health = new BackupHealth();
        health.setStatus(errorJobs == 0 ? "healthy" : "degraded");
        health.setTimestamp(clock.instant());
        health.setSchedulerInitialized(scheduler.isInitialized());
        health.setActiveJobs(activeJobs);
        health.setTotalJobs(jobs.size());
        health.setErrorJobs(errorJobs);
        health.setDatabaseBackupEnabled(properties.getDatabase().isEnabled());
        health.setFilesBackupEnabled(properties.getFiles().isEnabled());
        health.setNotificationsEnabled(properties.getNotifications().isEnabled());
        health.setBackupDirectory(properties.getStoragePath().toString());
        return health;
    }

    private static BackupStats.TypeStats typeStats(List<BackupEntry> entries) {
        BackupStats.TypeStats stats = new BackupStats.TypeStats();
        long totalSize = 0;
        for (BackupEntry entry : entries) {
            totalSize += entry.getSize();
        }
        stats.setCount(entries.size());
        stats.setTotalSizeBytes(totalSize);
        stats.setTotalSize(BackupSizeFormatter.format(totalSize));
        if (!entries.isEmpty()) {
            // Listagem vem do mais recente para o mais antigo
            stats.setNewestBackup(entries.get(0).getCreated());
            stats.setOldestBackup(entries.get(entries.size() - 1).getCreated());
        }
        return stats;
    }

    private static void requirePath(String artifactPath) {
        if (artifactPath == null || artifactPath.isBlank()) {
            throw new BackupException(BackupErrorCode.NOT_FOUND, "Caminho do backup não informado");
        }
    }
}
