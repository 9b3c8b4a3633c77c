package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.CleanupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Política de retenção dos artefatos
 *
 * Modo padrão: remove tudo que for mais antigo que {@code agora - retention.daily dias}.
 * Com {@code backup.cleanup.tiered=true} também preserva o artefato mais
 * recente de cada semana ISO (últimas {@code weekly} semanas) e de cada mês
 * (últimos {@code monthly} meses).
 */
@Service
public class RetentionService implements IRetentionService {

    private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);

    private final BackupProperties properties;
    private final BackupCatalog catalog;
    private final BackupLockRegistry locks;
    private final Clock clock;

    public RetentionService(BackupProperties properties,
                            BackupCatalog catalog,
                            BackupLockRegistry locks,
                            Clock clock) {
        this.properties = properties;
        this.catalog = catalog;
        this.locks = locks;
        this.clock = clock;
    }

    @Override
    public CleanupResult cleanup(BackupType type) {
        locks.acquire(type, "limpeza", BackupErrorCode.ALREADY_RUNNING);
        try {
            return doCleanup(type);
        } finally {
            locks.release(type);
        }
    }

    @Override
    public List<CleanupResult> cleanupAll() {
        List<CleanupResult> results = new ArrayList<>();
        for (BackupType type : BackupType.values()) {
            try {
                results.add(cleanup(type));
            } catch (BackupException e) {
                logger.warn("⚠️ Limpeza de {} não executada: {}", type.getId(), e.getMessage());
                CleanupResult result = new CleanupResult(type);
                result.recordError(e.getMessage());
                results.add(result);
            }
        }
        return results;
    }

    private CleanupResult doCleanup(BackupType type) {
        CleanupResult result = new CleanupResult(type);
        Instant now = clock.instant();
        int retentionDays = dailyRetention(type);
        Instant cutoff = now.minus(retentionDays, ChronoUnit.DAYS);

        List<BackupEntry> entries = catalog.listBackups(type);
        Set<String> keep = properties.getCleanup().isTiered()
            ? tieredKeepers(entries, now, clock.getZone())
            : new HashSet<>();

        for (BackupEntry entry : entries) {
            if (!entry.getCreated().isBefore(cutoff) || keep.contains(entry.getPath())) {
                continue;
            }
            Path artifact = Paths.get(entry.getPath());
            try {
                Files.deleteIfExists(artifact);
                Files.deleteIfExists(BackupFileNames.sidecarPath(artifact));
                result.recordDeletion();
                logger.debug("Backup antigo removido: {}", entry.getName());
            } catch (IOException e) {
                logger.warn("⚠️ Erro ao remover backup {}: {}", entry.getName(), e.getMessage());
                result.recordError(entry.getName() + ": " + e.getMessage());
            }
        }

        if (result.getDeletedCount() > 0 || !result.getErrors().isEmpty()) {
            logger.info("✅ Limpeza de backups de {} concluída: {} removido(s), {} erro(s)",
                type.getId(), result.getDeletedCount(), result.getErrors().size());
        }
        return result;
    }

    private int dailyRetention(BackupType type) {
        int databaseDaily = properties.getDatabase().getRetention().getDaily();
        if (type == BackupType.FILES) {
            Integer filesDaily = properties.getFiles().getRetention().getDaily();
            return filesDaily != null ? filesDaily : databaseDaily;
        }
        return databaseDaily;
    }

    /**
     * Caminhos preservados pelas camadas semanal e mensal. Espera a lista
     * ordenada do mais recente para o mais antigo.
     */
    Set<String> tieredKeepers(List<BackupEntry> newestFirst, Instant now, ZoneId zone) {
        BackupProperties.Retention retention = properties.getDatabase().getRetention();
        LocalDate today = now.atZone(zone).toLocalDate();
        LocalDate currentWeek = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        YearMonth currentMonth = YearMonth.from(today);

        Map<LocalDate, String> newestPerWeek = new HashMap<>();
        Map<YearMonth, String> newestPerMonth = new HashMap<>();
        for (BackupEntry entry : newestFirst) {
            LocalDate day = entry.getCreated().atZone(zone).toLocalDate();
            newestPerWeek.putIfAbsent(day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)), entry.getPath());
            newestPerMonth.putIfAbsent(YearMonth.from(day), entry.getPath());
        }

        Set<String> keep = new HashSet<>();
        newestPerWeek.forEach((weekStart, path) -> {
            if (ChronoUnit.WEEKS.between(weekStart, currentWeek) < retention.getWeekly()) {
                keep.add(path);
            }
        });
        newestPerMonth.forEach((month, path) -> {
            if (ChronoUnit.MONTHS.between(month, currentMonth) < retention.getMonthly()) {
                keep.add(path);
            }
        });
        return keep;
    }
}
