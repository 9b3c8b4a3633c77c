package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.CleanupResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Testes unitários para RetentionService
 *
 * Testa funcionalidades de:
 * - Corte diário simples
 * - Retenção própria dos backups de arquivos e fallback para a do banco
 * - Retenção em camadas (semanal/mensal)
 */
class RetentionServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    @TempDir
    Path storageDir;

    private BackupProperties properties;
    private BackupLockRegistry locks;
    private RetentionService retentionService;

    @BeforeEach
    void setUp() {
        properties = new BackupProperties();
        properties.getStorage().getLocal().setPath(storageDir.toString());
        properties.getDatabase().getRetention().setDaily(7);

        BackupIntegrityService integrityService = new BackupIntegrityService();
        locks = new BackupLockRegistry();
        retentionService = new RetentionService(properties, new BackupCatalog(properties, integrityService),
            locks, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testCleanup_DeletesArtifactsOlderThanCutoff() throws IOException {
        // Arrange
        Path tenDays = artifact("database_backup_2024-06-05_02-00-00.db.zip", NOW.minus(Duration.ofDays(10)));
        Path eightDays = artifact("database_backup_2024-06-07_02-00-00.db.zip", NOW.minus(Duration.ofDays(8)));
        Path sixDays = artifact("database_backup_2024-06-09_02-00-00.db.zip", NOW.minus(Duration.ofDays(6)));
        Path oneDay = artifact("database_backup_2024-06-14_02-00-00.db.zip", NOW.minus(Duration.ofDays(1)));

        // Act
        CleanupResult result = retentionService.cleanup(BackupType.DATABASE);

        // Assert
        assertEquals(BackupType.DATABASE, result.getType());
        assertEquals(2, result.getDeletedCount());
        assertTrue(result.getErrors().isEmpty());
        assertFalse(Files.exists(tenDays));
        assertFalse(Files.exists(BackupFileNames.sidecarPath(tenDays)));
        assertFalse(Files.exists(eightDays));
        assertTrue(Files.exists(sixDays));
        assertTrue(Files.exists(BackupFileNames.sidecarPath(sixDays)));
        assertTrue(Files.exists(oneDay));
    }

    @Test
    void testCleanup_OnlyTouchesRequestedType() throws IOException {
        Path oldDatabase = artifact("database_backup_2024-05-01_02-00-00.db.zip", NOW.minus(Duration.ofDays(45)));
        Path oldFiles = artifact("files_backup_2024-05-01_03-00-00.zip", NOW.minus(Duration.ofDays(45)));

        CleanupResult result = retentionService.cleanup(BackupType.FILES);

        assertEquals(1, result.getDeletedCount());
        assertTrue(Files.exists(oldDatabase));
        assertFalse(Files.exists(oldFiles));
    }

    @Test
    void testCleanup_FilesUseOwnRetentionWhenSet() throws IOException {
        // Arrange
        properties.getFiles().getRetention().setDaily(2);
        Path threeDays = artifact("files_backup_2024-06-12_03-00-00.zip", NOW.minus(Duration.ofDays(3)));
        Path oneDay = artifact("files_backup_2024-06-14_03-00-00.zip", NOW.minus(Duration.ofDays(1)));

        // Act
        CleanupResult result = retentionService.cleanup(BackupType.FILES);

        // Assert
        assertEquals(1, result.getDeletedCount());
        assertFalse(Files.exists(threeDays));
        assertTrue(Files.exists(oneDay));
    }

    @Test
    void testCleanup_FilesFallBackToDatabaseRetention() throws IOException {
        Path threeDays = artifact("files_backup_2024-06-12_03-00-00.zip", NOW.minus(Duration.ofDays(3)));

        CleanupResult result = retentionService.cleanup(BackupType.FILES);

        assertEquals(0, result.getDeletedCount());
        assertTrue(Files.exists(threeDays));
    }

    @Test
    void testCleanup_TieredKeepsNewestPerWeekAndMonth() throws IOException {
        // Arrange
        properties.getCleanup().setTiered(true);
        properties.getDatabase().getRetention().setDaily(1);
        properties.getDatabase().getRetention().setWeekly(2);
        properties.getDatabase().getRetention().setMonthly(2);

        Path recent = artifact("database_backup_2024-06-15_00-00-00.db.zip", Instant.parse("2024-06-15T00:00:00Z"));
        Path sameWeek = artifact("database_backup_2024-06-12_02-00-00.db.zip", Instant.parse("2024-06-12T02:00:00Z"));
        Path lastWeekNewest = artifact("database_backup_2024-06-08_02-00-00.db.zip", Instant.parse("2024-06-08T02:00:00Z"));
        Path lastWeekOlder = artifact("database_backup_2024-06-04_02-00-00.db.zip", Instant.parse("2024-06-04T02:00:00Z"));
        Path mayNewest = artifact("database_backup_2024-05-20_02-00-00.db.zip", Instant.parse("2024-05-20T02:00:00Z"));
        Path mayOlder = artifact("database_backup_2024-05-10_02-00-00.db.zip", Instant.parse("2024-05-10T02:00:00Z"));
        Path april = artifact("database_backup_2024-04-30_02-00-00.db.zip", Instant.parse("2024-04-30T02:00:00Z"));

        // Act
        CleanupResult result = retentionService.cleanup(BackupType.DATABASE);

        // Assert
        assertEquals(4, result.getDeletedCount());
        assertTrue(Files.exists(recent));
        assertTrue(Files.exists(lastWeekNewest));
        assertTrue(Files.exists(mayNewest));
        assertFalse(Files.exists(sameWeek));
        assertFalse(Files.exists(lastWeekOlder));
        assertFalse(Files.exists(mayOlder));
        assertFalse(Files.exists(april));
    }

    @Test
    void testCleanup_EmptyStorage() {
        CleanupResult result = retentionService.cleanup(BackupType.DATABASE);

        assertEquals(0, result.getDeletedCount());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void testCleanup_ConflictWithRunningOperation() throws Exception {
        artifact("database_backup_2024-05-01_02-00-00.db.zip", NOW.minus(Duration.ofDays(45)));

        try (LockHolder ignored = new LockHolder(locks, BackupType.DATABASE)) {
            BackupException exception = assertThrows(BackupException.class,
                () -> retentionService.cleanup(BackupType.DATABASE));
            assertEquals(BackupErrorCode.ALREADY_RUNNING, exception.getErrorCode());

            List<CleanupResult> all = retentionService.cleanupAll();
            assertEquals(2, all.size());
            assertEquals(1, all.get(0).getErrors().size());
        }
    }

    private Path artifact(String name, Instant modified) throws IOException {
        Path artifact = storageDir.resolve(name);
        Files.writeString(artifact, "conteúdo " + name);
        Files.setLastModifiedTime(artifact, FileTime.from(modified));
        Path sidecar = BackupFileNames.sidecarPath(artifact);
        Files.writeString(sidecar, "{}");
        return artifact;
    }
}
