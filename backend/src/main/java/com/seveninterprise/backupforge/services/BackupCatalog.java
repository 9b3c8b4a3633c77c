package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Listagem dos artefatos presentes no diretório de armazenamento
 */
@Component
public class BackupCatalog {

    private static final Logger logger = LoggerFactory.getLogger(BackupCatalog.class);

    private final BackupProperties properties;
    private final IBackupIntegrityService integrityService;

    public BackupCatalog(BackupProperties properties, IBackupIntegrityService integrityService) {
        this.properties = properties;
        this.integrityService = integrityService;
    }

    /**
     * Lista os artefatos do tipo, mais recentes primeiro (por data de modificação)
     */
    public List<BackupEntry> listBackups(BackupType type) {
        Path storageDir = properties.getStoragePath();
        List<BackupEntry> entries = new ArrayList<>();
        if (!Files.isDirectory(storageDir)) {
            return entries;
        }

        try (Stream<Path> files = Files.list(storageDir)) {
            files.filter(Files::isRegularFile)
                 .filter(path -> type.matchesArtifactName(path.getFileName().toString()))
                 .forEach(path -> {
                     try {
                         BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                         entries.add(new BackupEntry(
                             path.toString(),
                             path.getFileName().toString(),
                             type,
                             attrs.size(),
                             attrs.lastModifiedTime().toInstant(),
                             integrityService.readSidecar(path).orElse(null)));
                     } catch (IOException e) {
                         // Removido entre a listagem e a leitura
                         logger.debug("Artefato {} indisponível durante listagem: {}", path, e.getMessage());
                     }
                 });
        } catch (IOException e) {
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao listar backups em " + storageDir + ": " + e.getMessage(), e);
        }

        entries.sort(Comparator.comparing(BackupEntry::getCreated).reversed()
                               .thenComparing(BackupEntry::getName, Comparator.reverseOrder()));
        return entries;
    }
}
