package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupResult;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.FilesBackupMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Serviço de backup de arquivos
 *
 * Percorre os diretórios configurados (relativos a {@code files.base-directory}),
 * ignora entradas ocultas e exclusões, e grava um zip com nomes de entrada
 * relativos à raiz. A coleta é deduplicada e ordenada, então o mesmo
 * conteúdo sempre produz a mesma sequência de entradas.
 */
@Service
public class FilesBackupService implements IFilesBackupService {

    private static final Logger logger = LoggerFactory.getLogger(FilesBackupService.class);

    private static final int DEFAULT_COMPRESSION_LEVEL = 6;

    private final BackupProperties properties;
    private final IBackupIntegrityService integrityService;
    private final BackupCatalog catalog;
    private final BackupLockRegistry locks;
    private final Clock clock;

    public FilesBackupService(BackupProperties properties,
                              IBackupIntegrityService integrityService,
                              BackupCatalog catalog,
                              BackupLockRegistry locks,
                              Clock clock) {
        this.properties = properties;
        this.integrityService = integrityService;
        this.catalog = catalog;
        this.locks = locks;
        this.clock = clock;
    }

    @Override
    public BackupResult createBackup() {
        locks.acquire(BackupType.FILES, "backup de arquivos", BackupErrorCode.ALREADY_RUNNING);
        try {
            return doCreateBackup();
        } finally {
            locks.release(BackupType.FILES);
        }
    }

    private BackupResult doCreateBackup() {
        long startTime = System.currentTimeMillis();
        BackupProperties.FileTree config = properties.getFiles();

        SortedMap<String, Path> files = collectFiles();

        Path storageDir = properties.getStoragePath();
        boolean compression = config.isCompression();
        Instant timestamp = clock.instant();
        Path artifact;
        try {
            Files.createDirectories(storageDir);
            artifact = BackupFileNames.newArtifactPath(storageDir, BackupType.FILES, compression,
                                                       timestamp, clock.getZone());
        } catch (IOException e) {
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao criar diretório de backups " + storageDir + ": " + e.getMessage(), e);
        }

        logger.info("💾 Iniciando backup de arquivos: {} ({} arquivos encontrados)",
            artifact.getFileName(), files.size());
        try {
            ArchiveStats stats = writeArchive(files, artifact, compression);
            String checksum = integrityService.calculateChecksum(artifact);

            FilesBackupMetadata metadata = new FilesBackupMetadata();
            metadata.setTimestamp(timestamp);
            metadata.setBackupPath(artifact.toString());
            metadata.setChecksum(checksum);
            metadata.setDirectories(new ArrayList<>(config.getDirectories()));
            metadata.setExclusions(new ArrayList<>(config.getExclusions()));
            metadata.setFileCount(stats.getFileCount());
            metadata.setTotalSize(stats.getTotalSize());
            metadata.setSkippedFiles(stats.getSkippedFiles());
            integrityService.writeSidecar(artifact, metadata);

            long size = Files.size(artifact);
            long duration = System.currentTimeMillis() - startTime;
            if (!stats.getSkippedFiles().isEmpty()) {
                logger.warn("⚠️ Backup de arquivos concluído com {} arquivo(s) ignorado(s)",
                    stats.getSkippedFiles().size());
            }
            logger.info("✅ Backup de arquivos concluído: {} ({}, {} arquivos, {}ms)",
                artifact.getFileName(), BackupSizeFormatter.format(size), stats.getFileCount(), duration);

            return new BackupResult(artifact.toString(), size, duration, stats.getFileCount(), metadata);

        } catch (BackupException e) {
            discardPartial(artifact);
            logger.error("❌ Falha no backup de arquivos: {}", e.getMessage());
            throw e;
        } catch (IOException e) {
            discardPartial(artifact);
            logger.error("❌ Falha no backup de arquivos: {}", e.getMessage());
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro de E/S durante backup de arquivos: " + e.getMessage(), e);
        }
    }

    @Override
    public List<BackupEntry> listBackups() {
        return catalog.listBackups(BackupType.FILES);
    }

    /**
     * Coleta os arquivos a arquivar, indexados pelo nome da entrada no zip
     */
    SortedMap<String, Path> collectFiles() {
        BackupProperties.FileTree config = properties.getFiles();
        Path base = config.getBasePath();
        ExclusionMatcher exclusions = new ExclusionMatcher(config.getExclusions());
        SortedMap<String, Path> files = new TreeMap<>();

        int available = 0;
        for (String directory : config.getDirectories()) {
            Path root = base.resolve(directory).normalize();
            if (!Files.isDirectory(root)) {
                logger.warn("⚠️ Diretório não encontrado, ignorando: {}", root);
                continue;
            }
            available++;
            try {
                Files.walkFileTree(root, new CollectingVisitor(base, root, exclusions, files));
            } catch (IOException e) {
                throw new BackupException(BackupErrorCode.IO_FAILURE,
                    "Erro ao percorrer diretório " + root + ": " + e.getMessage(), e);
            }
        }

        if (available == 0) {
            throw new BackupException(BackupErrorCode.SOURCE_UNAVAILABLE,
                "Nenhum dos diretórios configurados existe: " + config.getDirectories());
        }
        return files;
    }

    /**
     * Grava o zip. Arquivo que não abre é registrado como ignorado; falha no
     * meio da leitura ou da escrita aborta o backup.
     */
    ArchiveStats writeArchive(SortedMap<String, Path> files, Path artifact, boolean compression) throws IOException {
        ArchiveStats stats = new ArchiveStats();
        try (OutputStream out = Files.newOutputStream(artifact);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.setLevel(compression ? DEFAULT_COMPRESSION_LEVEL : Deflater.NO_COMPRESSION);

            for (Map.Entry<String, Path> item : files.entrySet()) {
                BackupStreams.checkCancelled();
                Path file = item.getValue();

                FileTime modified;
                InputStream in;
                try {
                    modified = Files.getLastModifiedTime(file);
                    in = Files.newInputStream(file);
                } catch (IOException e) {
                    logger.warn("⚠️ Arquivo ignorado {}: {}", item.getKey(), e.getMessage());
                    stats.getSkippedFiles().add(item.getKey());
                    continue;
                }

                try (InputStream source = in) {
                    ZipEntry entry = new ZipEntry(item.getKey());
                    entry.setTime(modified.toMillis());
                    zip.putNextEntry(entry);
                    long copied = BackupStreams.copy(source, zip);
                    zip.closeEntry();
                    stats.recordFile(copied);
                }
            }
        }
        return stats;
    }

    private void discardPartial(Path artifact) {
        boolean removed = BackupStreams.deleteQuietly(artifact)
            & BackupStreams.deleteQuietly(BackupFileNames.sidecarPath(artifact));
        if (!removed) {
            logger.warn("⚠️ Não foi possível remover artefato parcial {}", artifact);
        }
    }

    /**
     * Nome da entrada: caminho relativo à raiz, separado por "/". Diretórios
     * fora da raiz usam o próprio nome como prefixo.
     */
    static String entryName(Path base, Path root, Path file) {
        Path relative;
        if (file.startsWith(base)) {
            relative = base.relativize(file);
        } else {
            relative = root.getFileName().resolve(root.relativize(file));
        }
        StringBuilder name = new StringBuilder();
        for (Path segment : relative) {
            if (name.length() > 0) {
                name.append('/');
            }
            name.append(segment.toString());
        }
        return name.toString();
    }

    private static boolean isHidden(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }

    private static class CollectingVisitor extends SimpleFileVisitor<Path> {
        private final Path base;
        private final Path root;
        private final ExclusionMatcher exclusions;
        private final SortedMap<String, Path> files;

        CollectingVisitor(Path base, Path root, ExclusionMatcher exclusions, SortedMap<String, Path> files) {
            this.base = base;
            this.root = root;
            this.exclusions = exclusions;
            this.files = files;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            if (isHidden(dir) || exclusions.matches(root.relativize(dir))) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            BackupStreams.checkCancelled();
            if (!attrs.isRegularFile() || isHidden(file) || exclusions.matches(root.relativize(file))) {
                return FileVisitResult.CONTINUE;
            }
            files.putIfAbsent(entryName(base, root, file), file);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            logger.warn("⚠️ Não foi possível acessar {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }
    }

    /**
     * Contadores de uma gravação de arquivo
     */
    static class ArchiveStats {
        private int fileCount;
        private long totalSize;
        private final List<String> skippedFiles = new ArrayList<>();

        void recordFile(long size) {
            fileCount++;
            totalSize += size;
        }

        int getFileCount() {
            return fileCount;
        }

        long getTotalSize() {
            return totalSize;
        }

        List<String> getSkippedFiles() {
            return skippedFiles;
        }
    }
}
