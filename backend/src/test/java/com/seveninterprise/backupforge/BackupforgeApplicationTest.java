package com.seveninterprise.backupforge;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupHealth;
import com.seveninterprise.backupforge.model.BackupResult;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.DatabaseBackupMetadata;
import com.seveninterprise.backupforge.model.VerificationResult;
import com.seveninterprise.backupforge.scheduler.IBackupScheduler;
import com.seveninterprise.backupforge.services.IBackupManagementService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Teste de contexto: configuração JSON + application.properties, validação,
 * inicialização do agendador e um backup real pelo DataSource da aplicação
 */
@SpringBootTest
class BackupforgeApplicationTest {

    @TempDir
    static Path tempDir;

    @Autowired
    private BackupProperties properties;

    @Autowired
    private IBackupScheduler scheduler;

    @Autowired
    private IBackupManagementService managementService;

    @DynamicPropertySource
    static void backupProperties(DynamicPropertyRegistry registry) {
        registry.add("backup.database.file", () -> tempDir.resolve("data/app.db").toString());
        registry.add("backup.storage.local.path", () -> tempDir.resolve("backups").toString());
        registry.add("backup.files.base-directory", () -> tempDir.resolve("app").toString());
    }

    @BeforeAll
    static void createDatabase() throws IOException {
        Path databaseFile = tempDir.resolve("data/app.db");
        Files.createDirectories(databaseFile.getParent());
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + databaseFile);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT)");
        jdbcTemplate.update("INSERT INTO users (name) VALUES ('admin')");

        Path uploads = Files.createDirectories(tempDir.resolve("app/uploads"));
        Files.writeString(uploads.resolve("logo.png"), "png");
    }

    @Test
    void testContext_BindsJsonDefaultsAndOverrides() {
        assertEquals("0 2 * * *", properties.getDatabase().getSchedule());
        assertEquals("0 1 * * *", properties.getCleanup().getDatabaseSchedule());
        assertEquals(List.of("uploads", "logs", "config"), properties.getFiles().getDirectories());
        assertFalse(properties.getNotifications().isOnSuccess());
        assertEquals(tempDir.resolve("backups").toAbsolutePath().normalize(), properties.getStoragePath());
    }

    @Test
    void testContext_SchedulerStartedWithAllJobs() {
        assertTrue(scheduler.isInitialized());
        assertEquals(4, scheduler.getAllJobStatuses().size());

        BackupHealth health = managementService.getHealth();
        assertEquals("healthy", health.getStatus());
        assertEquals(4, health.getActiveJobs());
    }

    @Test
    void testContext_DatabaseAndFilesBackupThroughFacade() {
        BackupResult database = managementService.createDatabaseBackup();
        BackupResult files = managementService.createFilesBackup();

        DatabaseBackupMetadata metadata = (DatabaseBackupMetadata) database.getMetadata();
        assertEquals(1L, metadata.getRecordCounts().get("users"));
        assertEquals(1, files.getFileCount());

        VerificationResult verification = managementService.verifyBackup(database.getArtifactPath(), BackupType.DATABASE);
        assertTrue(verification.isValid());
        assertEquals(Boolean.TRUE, verification.getChecksumMatch());

        List<BackupEntry> backups = managementService.listBackups(null);
        assertTrue(backups.size() >= 2);
    }
}
