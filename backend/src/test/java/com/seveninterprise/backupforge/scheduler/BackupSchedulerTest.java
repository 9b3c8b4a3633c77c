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
import com.seveninterprise.backupforge.model.JobState;
import com.seveninterprise.backupforge.services.IBackupNotifier;
import com.seveninterprise.backupforge.services.IDatabaseBackupService;
import com.seveninterprise.backupforge.services.IFilesBackupService;
import com.seveninterprise.backupforge.services.IRetentionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Testes unitários para BackupScheduler
 *
 * Testa funcionalidades de:
 * - Registro e agendamento dos jobs
 * - Máquina de estados IDLE → RUNNING → IDLE/ERROR
 * - Pulo de execução concorrente
 * - Isolamento de falhas do notificador
 */
@ExtendWith(MockitoExtension.class)
class BackupSchedulerTest {

    @Mock
    private IDatabaseBackupService databaseBackupService;

    @Mock
    private IFilesBackupService filesBackupService;

    @Mock
    private IRetentionService retentionService;

    @Mock
    private IBackupNotifier notifier;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    private BackupProperties properties;
    private BackupScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new BackupProperties();
        properties.getScheduler().setZone("UTC");
        scheduler = newScheduler(taskScheduler);
    }

    @Test
    void testInitialize_RegistersAndStartsAllJobs() {
        // Arrange
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

        // Act
        scheduler.initialize();

        // Assert
        assertTrue(scheduler.isInitialized());
        List<BackupJobStatus> statuses = scheduler.getAllJobStatuses();
        assertEquals(List.of("database-backup", "files-backup", "database-cleanup", "files-cleanup"),
            statuses.stream().map(BackupJobStatus::getName).toList());
        for (BackupJobStatus status : statuses) {
            assertTrue(status.isActive());
            assertEquals(JobState.IDLE, status.getStatus());
            assertNotNull(status.getNextRun());
            assertNull(status.getLastRun());
        }
        verify(taskScheduler, times(4)).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Test
    void testInitialize_SkipsDisabledProducers() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        properties.getFiles().setEnabled(false);

        scheduler.initialize();

        assertEquals(3, scheduler.getAllJobStatuses().size());
        assertTrue(scheduler.getJobStatus("files-backup").isEmpty());
    }

    @Test
    void testGetJobStatus_NextRunFollowsCron() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        scheduler.registerJob("nightly", "0 2 * * *", () -> "ok");
        scheduler.startJob("nightly");

        BackupJobStatus status = scheduler.getJobStatus("nightly").orElseThrow();

        assertEquals(Instant.parse("2024-01-02T02:00:00Z"), status.getNextRun());
    }

    @Test
    void testStartJob_IsNoOpWhenActive() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        scheduler.registerJob("nightly", "0 2 * * *", () -> "ok");

        scheduler.startJob("nightly");
        scheduler.startJob("nightly");

        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Test
    void testStopJob_CancelsWithoutInterrupting() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        scheduler.registerJob("nightly", "0 2 * * *", () -> "ok");
        scheduler.startJob("nightly");

        scheduler.stopJob("nightly");

        verify(future).cancel(false);
        BackupJobStatus status = scheduler.getJobStatus("nightly").orElseThrow();
        assertFalse(status.isActive());
        assertNull(status.getNextRun());
    }

    @Test
    void testTriggerJob_UnknownJob() {
        BackupException exception = assertThrows(BackupException.class, () -> scheduler.triggerJob("inexistente"));

        assertEquals(BackupErrorCode.JOB_NOT_FOUND, exception.getErrorCode());
        assertThrows(BackupException.class, () -> scheduler.stopJob("inexistente"));
        assertTrue(scheduler.getJobStatus("inexistente").isEmpty());
    }

    @Test
    void testRegisterJob_InvalidCron() {
        BackupException exception = assertThrows(BackupException.class,
            () -> scheduler.registerJob("quebrado", "não é cron", () -> "ok"));

        assertEquals(BackupErrorCode.CONFIG_INVALID, exception.getErrorCode());
    }

    @Test
    void testTriggerJob_Success() {
        // Arrange
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        when(databaseBackupService.createBackup())
            .thenReturn(new BackupResult("/backups/database_backup_2024-01-01_02-00-00.db.zip", 2048, 15, 1, null));
        scheduler.initialize();

        // Act
        JobRunOutcome outcome = scheduler.triggerJob("database-backup");

        // Assert
        assertEquals(JobRunOutcome.COMPLETED, outcome);
        BackupJobStatus status = scheduler.getJobStatus("database-backup").orElseThrow();
        assertEquals(JobState.IDLE, status.getStatus());
        assertEquals(Instant.parse("2024-01-01T12:00:00Z"), status.getLastRun());
        assertNotNull(status.getDurationMs());
        assertNull(status.getLastError());
        assertEquals(1, status.getRunCount());
        verifyNoInteractions(notifier);
    }

    @Test
    void testTriggerJob_SuccessNotificationWhenEnabled() {
        properties.getNotifications().setOnSuccess(true);
        when(retentionService.cleanup(BackupType.DATABASE)).thenReturn(new CleanupResult(BackupType.DATABASE));
        scheduler.registerJob("database-cleanup", "0 1 * * *",
            () -> retentionService.cleanup(BackupType.DATABASE).getDeletedCount() + " removidos");

        scheduler.triggerJob("database-cleanup");

        ArgumentCaptor<BackupEvent> event = ArgumentCaptor.forClass(BackupEvent.class);
        verify(notifier).notify(event.capture());
        assertEquals(BackupEvent.EventType.SUCCESS, event.getValue().getEventType());
        assertEquals("0 removidos", event.getValue().getSummary());
    }

    @Test
    void testTriggerJob_FailureSetsErrorAndNotifies() {
        // Arrange
        scheduler.registerJob("database-backup", "0 2 * * *", () -> {
            throw new BackupException(BackupErrorCode.IO_FAILURE, "disco cheio");
        });

        // Act
        JobRunOutcome outcome = scheduler.triggerJob("database-backup");

        // Assert
        assertEquals(JobRunOutcome.FAILED, outcome);
        BackupJobStatus status = scheduler.getJobStatus("database-backup").orElseThrow();
        assertEquals(JobState.ERROR, status.getStatus());
        assertEquals("disco cheio", status.getLastError());

        ArgumentCaptor<BackupEvent> event = ArgumentCaptor.forClass(BackupEvent.class);
        verify(notifier).notify(event.capture());
        assertEquals(BackupEvent.EventType.FAILURE, event.getValue().getEventType());
        assertEquals("database-backup", event.getValue().getJobName());
        assertTrue(event.getValue().getSummary().contains("disco cheio"));
    }

    @Test
    void testTriggerJob_JvmErrorIsRecordedAndReleasesLock() throws Exception {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        scheduler.registerJob("database-backup", "0 2 * * *", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("boom");
            }
            return "ok";
        });

        // Act
        JobRunOutcome outcome = assertDoesNotThrow(() -> scheduler.triggerJob("database-backup"));
        BackupJobStatus afterError = scheduler.getJobStatus("database-backup").orElseThrow();
        JobRunOutcome fromOtherThread = CompletableFuture
            .supplyAsync(() -> scheduler.triggerJob("database-backup"))
            .get(5, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobRunOutcome.FAILED, outcome);
        assertEquals(JobState.ERROR, afterError.getStatus());
        assertEquals("boom", afterError.getLastError());
        assertEquals(JobRunOutcome.COMPLETED, fromOtherThread);
        assertEquals(0, scheduler.getJobStatus("database-backup").orElseThrow().getSkippedCount());
        verify(notifier).notify(any(BackupEvent.class));
    }

    @Test
    void testTriggerJob_ErrorStateClearsOnNextSuccess() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.registerJob("flaky", "0 2 * * *", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("primeira falha");
            }
            return "ok";
        });

        assertEquals(JobRunOutcome.FAILED, scheduler.triggerJob("flaky"));
        assertEquals(JobRunOutcome.COMPLETED, scheduler.triggerJob("flaky"));

        BackupJobStatus status = scheduler.getJobStatus("flaky").orElseThrow();
        assertEquals(JobState.IDLE, status.getStatus());
        assertNull(status.getLastError());
        assertEquals(2, status.getRunCount());
    }

    @Test
    void testTriggerJob_NotifierFailureIsIsolated() {
        doThrow(new RuntimeException("smtp indisponível")).when(notifier).notify(any(BackupEvent.class));
        scheduler.registerJob("database-backup", "0 2 * * *", () -> {
            throw new BackupException(BackupErrorCode.IO_FAILURE, "falhou");
        });

        JobRunOutcome outcome = assertDoesNotThrow(() -> scheduler.triggerJob("database-backup"));

        assertEquals(JobRunOutcome.FAILED, outcome);
        assertEquals(JobState.ERROR, scheduler.getJobStatus("database-backup").orElseThrow().getStatus());
    }

    @Test
    void testTriggerJob_NotificationsDisabled() {
        properties.getNotifications().setEnabled(false);
        scheduler.registerJob("database-backup", "0 2 * * *", () -> {
            throw new BackupException(BackupErrorCode.IO_FAILURE, "falhou");
        });

        scheduler.triggerJob("database-backup");

        verifyNoInteractions(notifier);
    }

    @Test
    void testTriggerJob_ConcurrentInvocationIsSkipped() throws Exception {
        // Arrange
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scheduler.registerJob("slow", "0 2 * * *", () -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "ok";
        });
        CompletableFuture<JobRunOutcome> first = CompletableFuture.supplyAsync(() -> scheduler.triggerJob("slow"));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        // Act
        JobRunOutcome second = scheduler.triggerJob("slow");
        BackupJobStatus whileRunning = scheduler.getJobStatus("slow").orElseThrow();
        release.countDown();

        // Assert
        assertEquals(JobRunOutcome.SKIPPED, second);
        assertEquals(JobState.RUNNING, whileRunning.getStatus());
        assertEquals(JobRunOutcome.COMPLETED, first.get(5, TimeUnit.SECONDS));
        BackupJobStatus status = scheduler.getJobStatus("slow").orElseThrow();
        assertEquals(1, status.getRunCount());
        assertEquals(1, status.getSkippedCount());
        assertEquals(JobState.IDLE, status.getStatus());
    }

    @Test
    void testTriggerJob_TypeLockConflictIsSkipNotError() {
        when(filesBackupService.createBackup())
            .thenThrow(new BackupException(BackupErrorCode.ALREADY_RUNNING, "restauração em andamento"));
        scheduler.registerJob("files-backup", "0 3 * * 0", () -> filesBackupService.createBackup().getArtifactPath());

        JobRunOutcome outcome = scheduler.triggerJob("files-backup");

        assertEquals(JobRunOutcome.SKIPPED, outcome);
        BackupJobStatus status = scheduler.getJobStatus("files-backup").orElseThrow();
        assertEquals(JobState.IDLE, status.getStatus());
        assertEquals(1, status.getSkippedCount());
        assertEquals(0, status.getRunCount());
        verifyNoInteractions(notifier);
    }

    @Test
    void testShutdown_CancelsWithInterruptAndClears() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        scheduler.initialize();

        scheduler.shutdown();

        verify(future, times(4)).cancel(true);
        assertFalse(scheduler.isInitialized());
        assertTrue(scheduler.getAllJobStatuses().isEmpty());
    }

    @Test
    void testCronFiring_RunsOnPoolThread() throws Exception {
        // Arrange
        ThreadPoolTaskScheduler pool = new ThreadPoolTaskScheduler();
        pool.setPoolSize(2);
        pool.setThreadNamePrefix("backup-job-test-");
        pool.initialize();
        BackupScheduler realScheduler = newScheduler(pool);
        CountDownLatch fired = new CountDownLatch(1);
        String[] threadName = new String[1];
        realScheduler.registerJob("every-second", "* * * * * *", () -> {
            threadName[0] = Thread.currentThread().getName();
            fired.countDown();
            return "ok";
        });

        try {
            // Act
            realScheduler.startJob("every-second");

            // Assert
            assertTrue(fired.await(5, TimeUnit.SECONDS));
            assertTrue(threadName[0].startsWith("backup-job-test-"));
        } finally {
            realScheduler.shutdown();
            pool.shutdown();
        }
    }

    private BackupScheduler newScheduler(TaskScheduler taskScheduler) {
        return new BackupScheduler(properties, databaseBackupService, filesBackupService, retentionService,
            notifier, taskScheduler, Runnable::run, Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC));
    }
}
