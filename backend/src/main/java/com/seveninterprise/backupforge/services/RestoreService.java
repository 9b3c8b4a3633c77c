package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.RestoreResult;
import com.seveninterprise.backupforge.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Serviço de restauração
 *
 * Toda restauração é verificada antes de tocar nos dados em uso e grava
 * primeiro em arquivo temporário no mesmo diretório do destino, trocando
 * por rename atômico.
 */
@Service
public class RestoreService implements IRestoreService {

    private static final Logger logger = LoggerFactory.getLogger(RestoreService.class);

    private static final String[] SQLITE_SIDE_FILES = {"-wal", "-shm", "-journal"};

    private final BackupProperties properties;
    private final IDatabaseStore databaseStore;
    private final IBackupIntegrityService integrityService;
    private final BackupLockRegistry locks;

    public RestoreService(BackupProperties properties,
                          IDatabaseStore databaseStore,
                          IBackupIntegrityService integrityService,
                          BackupLockRegistry locks) {
        this.properties = properties;
        this.databaseStore = databaseStore;
        this.integrityService = integrityService;
        this.locks = locks;
    }

    @Override
    public RestoreResult restoreDatabase(String artifactPath) {
        locks.acquire(BackupType.DATABASE, "restauração do banco", BackupErrorCode.RESTORE_CONFLICT);
        try {
            Path artifact = Paths.get(artifactPath);
            verifyOrThrow(artifact, BackupType.DATABASE);

            Path live = databaseStore.getDatabaseFile();
            logger.info("💾 Restaurando banco de dados {} a partir de {}", live, artifact.getFileName());
            replaceDatabase(artifact, live);

            logger.info("✅ Banco de dados restaurado a partir de {} - reinicie a aplicação", artifact.getFileName());
            return RestoreResult.database("Banco restaurado a partir de " + artifact.getFileName()
                + ". Reinicie a aplicação para reabrir as conexões.");
        } finally {
            locks.release(BackupType.DATABASE);
        }
    }

    @Override
    public RestoreResult restoreFiles(String artifactPath, String targetDir) {
        locks.acquire(BackupType.FILES, "restauração de arquivos", BackupErrorCode.RESTORE_CONFLICT);
        try {
            Path artifact = Paths.get(artifactPath);
            verifyOrThrow(artifact, BackupType.FILES);

            Path target = targetDir != null && !targetDir.isBlank()
                ? Paths.get(targetDir).toAbsolutePath().normalize()
                : properties.getFiles().getBasePath();
            Files.createDirectories(target);

            logger.info("💾 Restaurando arquivos de {} em {}", artifact.getFileName(), target);
            int extracted = 0;
            int skipped = 0;

            try (ZipFile zip = new ZipFile(artifact.toFile())) {
                Enumeration<? extends ZipEntry> entries = zip.entries();
                while (entries.hasMoreElements()) {
                    BackupStreams.checkCancelled();
                    ZipEntry entry = entries.nextElement();
                    Path destination = target.resolve(entry.getName()).normalize();

                    if (!destination.startsWith(target) || destination.equals(target)) {
                        logger.warn("⚠️ Entrada fora do diretório de destino ignorada: {}", entry.getName());
                        skipped++;
                        continue;
                    }
                    if (entry.isDirectory()) {
                        if (!createDirectoryEntry(entry, destination)) {
                            skipped++;
                        }
                        continue;
                    }
                    if (extractEntry(zip, entry, destination)) {
                        extracted++;
                    } else {
                        skipped++;
                    }
                }
            }

            logger.info("✅ Restauração de arquivos concluída: {} extraído(s), {} ignorado(s)", extracted, skipped);
            return RestoreResult.files(extracted, skipped,
                extracted + " arquivo(s) restaurado(s) em " + target);

        } catch (IOException e) {
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao restaurar arquivos: " + e.getMessage(), e);
        } finally {
            locks.release(BackupType.FILES);
        }
    }

    private void verifyOrThrow(Path artifact, BackupType type) {
        VerificationResult verification = integrityService.verify(artifact, type);
        if (!verification.isValid()) {
            logger.error("❌ Backup inválido para restauração {}: {}", artifact, verification.getError());
            throw new BackupException(verification.getErrorCode(), verification.getError());
        }
    }

    private void replaceDatabase(Path artifact, Path live) {
        Path directory = live.getParent();
        Path staged = directory.resolve(live.getFileName() + ".restore.tmp");
        Path safetyCopy = directory.resolve(live.getFileName() + ".pre-restore");

        try {
            Files.createDirectories(directory);
            stageSnapshot(artifact, staged);
            if (!BackupIntegrityService.hasSqliteHeader(staged)) {
                throw new BackupException(BackupErrorCode.CORRUPT_ARCHIVE,
                    "Conteúdo do backup não é um banco SQLite: " + artifact.getFileName());
            }
        } catch (IOException e) {
            BackupStreams.deleteQuietly(staged);
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao extrair snapshot: " + e.getMessage(), e);
        } catch (BackupException e) {
            BackupStreams.deleteQuietly(staged);
            throw e;
        }

        boolean hadLiveFile = Files.exists(live);
        try {
            if (hadLiveFile) {
                Files.copy(live, safetyCopy, StandardCopyOption.REPLACE_EXISTING);
            }
            BackupStreams.moveReplacing(staged, live);
            for (String suffix : SQLITE_SIDE_FILES) {
                Files.deleteIfExists(live.resolveSibling(live.getFileName() + suffix));
            }
        } catch (IOException e) {
            boolean rolledBack = rollback(safetyCopy, live, hadLiveFile);
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao substituir banco de dados: " + e.getMessage(), e, rolledBack, rolledBack);
        } finally {
            BackupStreams.deleteQuietly(staged);
            BackupStreams.deleteQuietly(safetyCopy);
        }
    }

    private void stageSnapshot(Path artifact, Path staged) throws IOException {
        if (!artifact.getFileName().toString().endsWith(".zip")) {
            Files.copy(artifact, staged, StandardCopyOption.REPLACE_EXISTING);
            return;
        }
        try (ZipFile zip = new ZipFile(artifact.toFile())) {
            ZipEntry dbEntry = null;
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!entry.isDirectory() && entry.getName().endsWith(".db")) {
                    dbEntry = entry;
                    break;
                }
            }
            if (dbEntry == null) {
                throw new BackupException(BackupErrorCode.CORRUPT_ARCHIVE,
                    "Nenhum arquivo .db encontrado em " + artifact.getFileName());
            }
            try (InputStream in = zip.getInputStream(dbEntry);
                 OutputStream out = Files.newOutputStream(staged)) {
                BackupStreams.copy(in, out);
            }
        }
    }

    private boolean rollback(Path safetyCopy, Path live, boolean hadLiveFile) {
        if (!hadLiveFile) {
            return BackupStreams.deleteQuietly(live);
        }
        if (!Files.exists(safetyCopy)) {
            // A cópia de segurança falhou antes de qualquer troca
            return true;
        }
        try {
            BackupStreams.moveReplacing(safetyCopy, live);
            logger.warn("⚠️ Restauração revertida: banco original recolocado em {}", live);
            return true;
        } catch (IOException e) {
            logger.error("❌ Não foi possível reverter o banco original {}: {}", live, e.getMessage());
            return false;
        }
    }

    private boolean createDirectoryEntry(ZipEntry entry, Path destination) {
        try {
            Files.createDirectories(destination);
            return true;
        } catch (IOException e) {
            logger.warn("⚠️ Diretório ignorado {}: {}", entry.getName(), e.getMessage());
            return false;
        }
    }

    /**
     * Extrai uma entrada via arquivo temporário + rename. Retorna false se a
     * entrada estiver corrompida ou não puder ser gravada.
     */
    private boolean extractEntry(ZipFile zip, ZipEntry entry, Path destination) {
        Path temp = null;
        try {
            Files.createDirectories(destination.getParent());
            temp = Files.createTempFile(destination.getParent(), ".restore-", ".tmp");
            try (InputStream in = zip.getInputStream(entry);
                 OutputStream out = Files.newOutputStream(temp)) {
                BackupStreams.copy(in, out);
            }
            BackupStreams.moveReplacing(temp, destination);
            if (entry.getTime() > 0) {
                Files.setLastModifiedTime(destination, FileTime.fromMillis(entry.getTime()));
            }
            return true;
        } catch (IOException e) {
            logger.warn("⚠️ Entrada corrompida ignorada {}: {}", entry.getName(), e.getMessage());
            BackupStreams.deleteQuietly(temp);
            return false;
        } catch (BackupException e) {
            BackupStreams.deleteQuietly(temp);
            throw e;
        }
    }
}
