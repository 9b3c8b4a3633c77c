package com.seveninterprise.backupforge.scheduler;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupEvent;
import com.seveninterprise.backupforge.model.BackupJobStatus;
import com.seveninterprise.backupforge.model.BackupResult;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.CleanupResult;
import com.seveninterprise.backupforge.model.JobRunOutcome;
import com.seveninterprise.backupforge.services.BackupSizeFormatter;
import com.seveninterprise.backupforge.services.IBackupNotifier;
import com.seveninterprise.backupforge.services.IDatabaseBackupService;
import com.seveninterprise.backupforge.services.IFilesBackupService;
import com.seveninterprise.backupforge.services.IRetentionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Agendador dos jobs de backup e limpeza
 *
 * Cada disparo roda em uma thread do pool do {@link TaskScheduler}; um job
 * lento não atrasa os demais. Falhas de execução nunca escapam: ficam
 * registradas no estado do job e seguem para o notificador.
 */
public class BackupScheduler implements IBackupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(BackupScheduler.class);

    public static final String DATABASE_BACKUP_JOB = "database-backup";
    public static final String FILES_BACKUP_JOB = "files-backup";
    public static final String DATABASE_CLEANUP_JOB = "database-cleanup";
    public static final String FILES_CLEANUP_JOB = "files-cleanup";

    private final BackupProperties properties;
    private final IDatabaseBackupService databaseBackupService;
    private final IFilesBackupService filesBackupService;
    private final IRetentionService retentionService;
    private final IBackupNotifier notifier;
    private final TaskScheduler taskScheduler;
    private final Executor notificationExecutor;
    private final Clock clock;

    private final Map<String, ScheduledBackupJob> jobs = new LinkedHashMap<>();
    private volatile boolean initialized = false;

    public BackupScheduler(BackupProperties properties,
                           IDatabaseBackupService databaseBackupService,
                           IFilesBackupService filesBackupService,
                           IRetentionService retentionService,
                           IBackupNotifier notifier,
                           TaskScheduler taskScheduler,
                           Executor notificationExecutor,
                           Clock clock) {
        this.properties = properties;
        this.databaseBackupService = databaseBackupService;
        this.filesBackupService = filesBackupService;
        this.retentionService = retentionService;
        this.notifier = notifier;
        this.taskScheduler = taskScheduler;
        this.notificationExecutor = notificationExecutor;
        this.clock = clock;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            logger.warn("⚠️ Agendador de backup já inicializado");
            return;
        }

        if (properties.getDatabase().isEnabled()) {
            registerJob(DATABASE_BACKUP_JOB, properties.getDatabase().getSchedule(), () -> {
                BackupResult result = databaseBackupService.createBackup();
                return "Backup do banco criado: " + Paths.get(result.getArtifactPath()).getFileName()
                    + " (" + BackupSizeFormatter.format(result.getSize()) + ")";
            });
        }
        if (properties.getFiles().isEnabled()) {
            registerJob(FILES_BACKUP_JOB, properties.getFiles().getSchedule(), () -> {
                BackupResult result = filesBackupService.createBackup();
                return "Backup de arquivos criado: " + Paths.get(result.getArtifactPath()).getFileName()
                    + " (" + result.getFileCount() + " arquivos, " + BackupSizeFormatter.format(result.getSize()) + ")";
            });
        }
        registerJob(DATABASE_CLEANUP_JOB, properties.getCleanup().getDatabaseSchedule(),
            () -> describeCleanup(retentionService.cleanup(BackupType.DATABASE)));
        registerJob(FILES_CLEANUP_JOB, properties.getCleanup().getFilesSchedule(),
            () -> describeCleanup(retentionService.cleanup(BackupType.FILES)));

        for (String name : jobs.keySet()) {
            startJob(name);
        }
        initialized = true;
        logger.info("✅ Agendador de backup inicializado com {} job(s)", jobs.size());
    }

    @Override
    public synchronized void registerJob(String name, String schedule, ScheduledBackupJob.JobBody body) {
        ScheduledBackupJob job;
        try {
            job = new ScheduledBackupJob(name, schedule, body);
        } catch (IllegalArgumentException e) {
            throw new BackupException(BackupErrorCode.CONFIG_INVALID,
                "Expressão cron inválida para o job " + name + ": " + schedule, e);
        }

        ScheduledBackupJob previous = jobs.put(name, job);
        if (previous != null) {
            cancel(previous, false);
            logger.info("Job {} substituído", name);
        }
        logger.debug("Job {} registrado ({})", name, schedule);
    }

    @Override
    public synchronized void startJob(String name) {
        ScheduledBackupJob job = requireJob(name);
        if (job.isActive()) {
            logger.debug("Job {} já está ativo", name);
            return;
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> runJob(job),
            new CronTrigger(job.getNormalizedSchedule(), properties.getScheduler().getZoneId()));
        job.setFuture(future);
        logger.info("Job {} agendado ({})", name, job.getSchedule());
    }

    @Override
    public synchronized void stopJob(String name) {
        ScheduledBackupJob job = requireJob(name);
        cancel(job, false);
        logger.info("Job {} parado", name);
    }

    @Override
    public synchronized void restartJob(String name) {
        stopJob(name);
        startJob(name);
    }

    @Override
    public JobRunOutcome triggerJob(String name) {
        ScheduledBackupJob job;
        synchronized (this) {
            job = requireJob(name);
        }
        logger.info("Execução manual do job {}", name);
        return runJob(job);
    }

    @Override
    public synchronized Optional<BackupJobStatus> getJobStatus(String name) {
        ScheduledBackupJob job = jobs.get(name);
        return job == null ? Optional.empty() : Optional.of(job.snapshot(clock.instant(), properties.getScheduler().getZoneId()));
    }

    @Override
    public synchronized List<BackupJobStatus> getAllJobStatuses() {
        Instant now = clock.instant();
        List<BackupJobStatus> statuses = new ArrayList<>();
        for (ScheduledBackupJob job : jobs.values()) {
            statuses.add(job.snapshot(now, properties.getScheduler().getZoneId()));
        }
        return statuses;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public synchronized void shutdown() {
        for (ScheduledBackupJob job : jobs.values()) {
            cancel(job, true);
        }
        jobs.clear();
        initialized = false;
        logger.info("Agendador de backup finalizado");
    }

    /**
     * Executa o job respeitando o lock por job. Nunca propaga exceções.
     */
    JobRunOutcome runJob(ScheduledBackupJob job) {
        Instant startedAt = clock.instant();
        if (!job.tryBeginRun(startedAt)) {
            logger.info("⏭️ Job {} já está em execução, ignorando disparo", job.getName());
            return JobRunOutcome.SKIPPED;
        }

        long start = System.currentTimeMillis();
        String summary;
        try {
            summary = job.getBody().run();
        } catch (BackupException e) {
            if (e.getErrorCode() == BackupErrorCode.ALREADY_RUNNING) {
                job.skipRun(System.currentTimeMillis() - start);
                logger.info("⏭️ Job {} ignorado: {}", job.getName(), e.getMessage());
                return JobRunOutcome.SKIPPED;
            }
            return fail(job, start, e);
        } catch (Exception e) {
            return fail(job, start, e);
        } catch (Error e) {
            // O estado do job e o lock precisam ser liberados mesmo em erros da JVM
            return fail(job, start, e);
        }

        job.completeRun(System.currentTimeMillis() - start);
        logger.info("✅ Job {} concluído em {}ms", job.getName(), System.currentTimeMillis() - start);
        if (properties.getNotifications().isOnSuccess()) {
            dispatch(new BackupEvent(BackupEvent.EventType.SUCCESS, job.getName(), summary, clock.instant()));
        }
        return JobRunOutcome.COMPLETED;
    }

    private JobRunOutcome fail(ScheduledBackupJob job, long start, Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        job.failRun(System.currentTimeMillis() - start, message);
        logger.error("❌ Job {} falhou: {}", job.getName(), message, e);
        if (properties.getNotifications().isOnFailure()) {
            dispatch(new BackupEvent(BackupEvent.EventType.FAILURE, job.getName(),
                "Falha no job " + job.getName() + ": " + message, clock.instant()));
        }
        return JobRunOutcome.FAILED;
    }

    private void dispatch(BackupEvent event) {
        if (!properties.getNotifications().isEnabled()) {
            return;
        }
        try {
            notificationExecutor.execute(() -> {
                try {
                    notifier.notify(event);
                } catch (Exception e) {
                    logger.warn("⚠️ Falha ao enviar notificação do job {}: {}", event.getJobName(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("⚠️ Notificação do job {} descartada: executor indisponível", event.getJobName());
        }
    }

    private void cancel(ScheduledBackupJob job, boolean interrupt) {
        ScheduledFuture<?> future = job.getFuture();
        if (future != null) {
            future.cancel(interrupt);
            job.setFuture(null);
        }
    }

    private ScheduledBackupJob requireJob(String name) {
        ScheduledBackupJob job = jobs.get(name);
        if (job == null) {
            throw new BackupException(BackupErrorCode.JOB_NOT_FOUND, "Job não encontrado: " + name);
        }
        return job;
    }

    private static String describeCleanup(CleanupResult result) {
        String summary = "Limpeza de " + result.getType().getId() + ": " + result.getDeletedCount() + " backup(s) removido(s)";
        if (!result.getErrors().isEmpty()) {
            summary += ", " + result.getErrors().size() + " erro(s)";
        }
        return summary;
    }
}
