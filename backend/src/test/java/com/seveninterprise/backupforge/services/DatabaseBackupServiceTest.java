package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupResult;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.DatabaseBackupMetadata;
import com.seveninterprise.backupforge.model.VerificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Testes unitários para DatabaseBackupService com um banco SQLite real
 */
class DatabaseBackupServiceTest {

    @TempDir
    Path tempDir;

    private Path databaseFile;
    private Path storageDir;
    private BackupProperties properties;
    private BackupIntegrityService integrityService;
    private BackupLockRegistry locks;
    private Clock clock;
    private DatabaseBackupService databaseBackupService;

    @BeforeEach
    void setUp() throws IOException {
        databaseFile = tempDir.resolve("data/app.db");
        storageDir = tempDir.resolve("backups");
        SqliteTestDatabase.create(databaseFile);

        properties = new BackupProperties();
        properties.getDatabase().setFile(databaseFile.toString());
        properties.getStorage().getLocal().setPath(storageDir.toString());

        integrityService = new BackupIntegrityService();
        locks = new BackupLockRegistry();
        clock = Clock.fixed(Instant.parse("2024-03-10T02:00:00Z"), ZoneOffset.UTC);
        databaseBackupService = newService(new SqliteDatabaseStore(SqliteTestDatabase.jdbcTemplate(databaseFile), properties));
    }

    @Test
    void testCreateBackup_RecordsTablesAndCounts() throws IOException {
        // Act
        BackupResult result = databaseBackupService.createBackup();

        // Assert
        Path artifact = Path.of(result.getArtifactPath());
        assertEquals("database_backup_2024-03-10_02-00-00.db.zip", artifact.getFileName().toString());
        assertTrue(result.getSize() > 0);
        assertEquals(1, result.getFileCount());

        DatabaseBackupMetadata metadata = (DatabaseBackupMetadata) result.getMetadata();
        assertEquals(Map.of("users", 3L, "products", 5L), metadata.getRecordCounts());
        assertEquals(List.of("products", "users"), metadata.getTables());
        assertTrue(metadata.getChecksum().matches("[0-9a-f]{64}"));
        assertEquals(Instant.parse("2024-03-10T02:00:00Z"), metadata.getTimestamp());

        DatabaseBackupMetadata sidecar = (DatabaseBackupMetadata) integrityService.readSidecar(artifact).orElseThrow();
        assertEquals(metadata.getChecksum(), sidecar.getChecksum());
        assertEquals(3L, sidecar.getRecordCounts().get("users"));
    }

    @Test
    void testCreateBackup_SingleDatabaseEntry() throws IOException {
        BackupResult result = databaseBackupService.createBackup();

        try (ZipFile zip = new ZipFile(result.getArtifactPath())) {
            List<? extends ZipEntry> entries = Collections.list(zip.entries());
            assertEquals(1, entries.size());
            assertEquals("database_backup_2024-03-10_02-00-00.db", entries.get(0).getName());
        }
        VerificationResult verification = integrityService.verify(Path.of(result.getArtifactPath()), BackupType.DATABASE);
        assertTrue(verification.isValid());
        assertEquals(Boolean.TRUE, verification.getChecksumMatch());
    }

    @Test
    void testCreateBackup_WithoutCompression() {
        properties.getDatabase().setCompression(false);

        BackupResult result = databaseBackupService.createBackup();

        assertTrue(result.getArtifactPath().endsWith("database_backup_2024-03-10_02-00-00.db"));
        assertEquals(3L, SqliteTestDatabase.count(Path.of(result.getArtifactPath()), "users"));
        assertTrue(integrityService.verify(Path.of(result.getArtifactPath()), BackupType.DATABASE).isValid());
    }

    @Test
    void testCreateBackup_MissingDatabaseFile() {
        properties.getDatabase().setFile(tempDir.resolve("nao-existe.db").toString());

        BackupException exception = assertThrows(BackupException.class, () -> databaseBackupService.createBackup());

        assertEquals(BackupErrorCode.SOURCE_UNAVAILABLE, exception.getErrorCode());
    }

    @Test
    void testCreateBackup_SnapshotFailureLeavesNoPartialArtifact() throws IOException {
        // Arrange
        IDatabaseStore failingStore = mock(IDatabaseStore.class);
        when(failingStore.getDatabaseFile()).thenReturn(databaseFile);
        doThrow(new BackupException(BackupErrorCode.IO_FAILURE, "database is locked"))
            .when(failingStore).snapshotTo(any(Path.class));
        DatabaseBackupService service = newService(failingStore);

        // Act
        BackupException exception = assertThrows(BackupException.class, service::createBackup);

        // Assert
        assertEquals(BackupErrorCode.IO_FAILURE, exception.getErrorCode());
        try (Stream<Path> files = Files.list(storageDir)) {
            assertEquals(0, files.count());
        }
        verify(failingStore, never()).countRecords(any(Path.class));
    }

    @Test
    void testListBackups_NewestFirst() throws IOException {
        BackupResult first = databaseBackupService.createBackup();
        Files.setLastModifiedTime(Path.of(first.getArtifactPath()),
            FileTime.from(Instant.parse("2024-03-01T02:00:00Z")));
        BackupResult second = databaseBackupService.createBackup();

        List<BackupEntry> backups = databaseBackupService.listBackups();

        assertEquals(2, backups.size());
        assertEquals(second.getArtifactPath(), backups.get(0).getPath());
        assertEquals(first.getArtifactPath(), backups.get(1).getPath());
    }

    private DatabaseBackupService newService(IDatabaseStore store) {
        return new DatabaseBackupService(properties, store, integrityService,
            new BackupCatalog(properties, integrityService), locks, clock);
    }
}
