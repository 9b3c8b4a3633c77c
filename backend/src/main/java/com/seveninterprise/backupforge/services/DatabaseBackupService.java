package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupResult;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.DatabaseBackupMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Serviço de backup do banco de dados
 *
 * Fluxo: snapshot via VACUUM INTO → contagem de registros no snapshot →
 * compressão (entrada única {@code <nome>.db}) → checksum → sidecar.
 * Qualquer falha remove snapshot temporário, artefato parcial e sidecar.
 */
@Service
public class DatabaseBackupService implements IDatabaseBackupService {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseBackupService.class);

    private final BackupProperties properties;
    private final IDatabaseStore databaseStore;
    private final IBackupIntegrityService integrityService;
    private final BackupCatalog catalog;
    private final BackupLockRegistry locks;
    private final Clock clock;

    public DatabaseBackupService(BackupProperties properties,
                                 IDatabaseStore databaseStore,
                                 IBackupIntegrityService integrityService,
                                 BackupCatalog catalog,
                                 BackupLockRegistry locks,
                                 Clock clock) {
        this.properties = properties;
        this.databaseStore = databaseStore;
        this.integrityService = integrityService;
        this.catalog = catalog;
        this.locks = locks;
        this.clock = clock;
    }

    @Override
    public BackupResult createBackup() {
        locks.acquire(BackupType.DATABASE, "backup do banco", BackupErrorCode.ALREADY_RUNNING);
        try {
            return doCreateBackup();
        } finally {
            locks.release(BackupType.DATABASE);
        }
    }

    private BackupResult doCreateBackup() {
        long startTime = System.currentTimeMillis();
        Path databaseFile = databaseStore.getDatabaseFile();
        if (!Files.isRegularFile(databaseFile)) {
            throw new BackupException(BackupErrorCode.SOURCE_UNAVAILABLE,
                "Arquivo do banco de dados não encontrado: " + databaseFile);
        }

        Path storageDir = prepareStorage();
        boolean compression = properties.getDatabase().isCompression();
        Instant timestamp = clock.instant();
        Path artifact = BackupFileNames.newArtifactPath(storageDir, BackupType.DATABASE, compression,
                                                        timestamp, clock.getZone());
        String baseName = BackupFileNames.stripExtension(artifact, BackupType.DATABASE, compression);
        Path snapshot = storageDir.resolve("." + baseName + ".snapshot.tmp");

        logger.info("💾 Iniciando backup do banco de dados: {}", artifact.getFileName());
        try {
            Files.deleteIfExists(snapshot);
            BackupStreams.checkCancelled();
            databaseStore.snapshotTo(snapshot);

            Map<String, Long> recordCounts = databaseStore.countRecords(snapshot);
            BackupStreams.checkCancelled();

            if (compression) {
                compressSnapshot(snapshot, artifact, baseName + ".db");
            } else {
                BackupStreams.moveReplacing(snapshot, artifact);
            }

            String checksum = integrityService.calculateChecksum(artifact);

            DatabaseBackupMetadata metadata = new DatabaseBackupMetadata();
            metadata.setTimestamp(timestamp);
            metadata.setBackupPath(artifact.toString());
            metadata.setChecksum(checksum);
            metadata.setTables(new ArrayList<>(recordCounts.keySet()));
            metadata.setRecordCounts(recordCounts);
            integrityService.writeSidecar(artifact, metadata);

            long size = Files.size(artifact);
            long duration = System.currentTimeMillis() - startTime;
            logger.info("✅ Backup do banco concluído: {} ({}, {} tabelas, {} registros, {}ms)",
                artifact.getFileName(), BackupSizeFormatter.format(size),
                recordCounts.size(), metadata.getTotalRecords(), duration);

            return new BackupResult(artifact.toString(), size, duration, 1, metadata);

        } catch (BackupException e) {
            discardPartial(artifact);
            logger.error("❌ Falha no backup do banco: {}", e.getMessage());
            throw e;
        } catch (IOException e) {
            discardPartial(artifact);
            logger.error("❌ Falha no backup do banco: {}", e.getMessage());
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro de E/S durante backup do banco: " + e.getMessage(), e);
        } finally {
            BackupStreams.deleteQuietly(snapshot);
        }
    }

    @Override
    public List<BackupEntry> listBackups() {
        return catalog.listBackups(BackupType.DATABASE);
    }

    private Path prepareStorage() {
        Path storageDir = properties.getStoragePath();
        try {
            Files.createDirectories(storageDir);
        } catch (IOException e) {
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao criar diretório de backups " + storageDir + ": " + e.getMessage(), e);
        }
        return storageDir;
    }

    private void compressSnapshot(Path snapshot, Path artifact, String entryName) throws IOException {
        try (InputStream in = Files.newInputStream(snapshot);
             OutputStream out = Files.newOutputStream(artifact);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.setLevel(Deflater.BEST_COMPRESSION);
            ZipEntry entry = new ZipEntry(entryName);
            entry.setTime(Files.getLastModifiedTime(snapshot).toMillis());
            zip.putNextEntry(entry);
            BackupStreams.copy(in, zip);
            zip.closeEntry();
        }
    }

    private void discardPartial(Path artifact) {
        boolean removed = BackupStreams.deleteQuietly(artifact)
            & BackupStreams.deleteQuietly(BackupFileNames.sidecarPath(artifact));
        if (!removed) {
            logger.warn("⚠️ Não foi possível remover artefato parcial {}", artifact);
        }
    }
}
