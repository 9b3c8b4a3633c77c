package com.seveninterprise.backupforge.scheduler;

import com.seveninterprise.backupforge.model.BackupJobStatus;
import com.seveninterprise.backupforge.model.JobState;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Job agendado e seu estado de execução
 *
 * Máquina de estados: IDLE → RUNNING → (IDLE | ERROR). O {@code runLock}
 * garante no máximo uma execução simultânea por job.
 */
public class ScheduledBackupJob {

    /**
     * Corpo do job; retorna um resumo legível da execução
     */
    @FunctionalInterface
    public interface JobBody {
        String run() throws Exception;
    }

    private final String name;
    private final String schedule;
    private final CronExpression cron;
    private final JobBody body;
    private final ReentrantLock runLock = new ReentrantLock();

    private volatile JobState status = JobState.IDLE;
    private volatile Instant lastRun;
    private volatile Long durationMs;
    private volatile String lastError;
    private volatile ScheduledFuture<?> future;
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong skippedCount = new AtomicLong();

    public ScheduledBackupJob(String name, String schedule, JobBody body) {
        this.name = name;
        this.schedule = schedule;
        this.cron = CronSchedules.parse(schedule);
        this.body = body;
    }

    boolean tryBeginRun(Instant startedAt) {
        if (!runLock.tryLock()) {
            skippedCount.incrementAndGet();
            return false;
        }
        status = JobState.RUNNING;
        lastRun = startedAt;
        runCount.incrementAndGet();
        return true;
    }

    void completeRun(long duration) {
        finishRun(JobState.IDLE, duration, null);
    }

    void failRun(long duration, String error) {
        finishRun(JobState.ERROR, duration, error);
    }

    // Operação recusada pelo lock do tipo de artefato: conta como pulo, não como erro
    void skipRun(long duration) {
        skippedCount.incrementAndGet();
        runCount.decrementAndGet();
        finishRun(JobState.IDLE, duration, null);
    }

    private void finishRun(JobState newStatus, long duration, String error) {
        try {
            durationMs = duration;
            lastError = error;
            status = newStatus;
        } finally {
            runLock.unlock();
        }
    }

    public BackupJobStatus snapshot(Instant now, ZoneId zone) {
        BackupJobStatus snapshot = new BackupJobStatus();
        snapshot.setName(name);
        snapshot.setSchedule(schedule);
        snapshot.setActive(isActive());
        snapshot.setStatus(status);
        snapshot.setLastRun(lastRun);
        snapshot.setDurationMs(durationMs);
        snapshot.setLastError(lastError);
        snapshot.setRunCount(runCount.get());
        snapshot.setSkippedCount(skippedCount.get());
        if (isActive()) {
            ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(now, zone));
            snapshot.setNextRun(next != null ? next.toInstant() : null);
        }
        return snapshot;
    }

    public boolean isActive() {
        ScheduledFuture<?> current = future;
        return current != null && !current.isCancelled();
    }

    public String getName() {
        return name;
    }

    public String getSchedule() {
        return schedule;
    }

    public String getNormalizedSchedule() {
        return CronSchedules.normalize(schedule);
    }

    public JobBody getBody() {
        return body;
    }

    public JobState getStatus() {
        return status;
    }

    ScheduledFuture<?> getFuture() {
        return future;
    }

    void setFuture(ScheduledFuture<?> future) {
        this.future = future;
    }
}
