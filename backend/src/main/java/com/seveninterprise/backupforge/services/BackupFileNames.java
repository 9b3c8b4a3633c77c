package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.BackupType;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Convenção de nomes dos artefatos: {@code {tipo}_backup_{yyyy-MM-dd}_{HH-mm-ss}{ext}}
 */
public final class BackupFileNames {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private BackupFileNames() {
    }

    public static String baseName(BackupType type, Instant timestamp, ZoneId zone) {
        return type.getFilePrefix() + TIMESTAMP_FORMAT.format(timestamp.atZone(zone));
    }

    /**
     * Caminho ainda inexistente para um novo artefato. Dois backups do mesmo
     * tipo no mesmo segundo recebem sufixo {@code -N}.
     */
    public static Path newArtifactPath(Path storageDir, BackupType type, boolean compressed,
                                       Instant timestamp, ZoneId zone) {
        String base = baseName(type, timestamp, zone);
        String extension = type.extension(compressed);
        Path candidate = storageDir.resolve(base + extension);
        int counter = 1;
        while (Files.exists(candidate) || Files.exists(sidecarPath(candidate))) {
            candidate = storageDir.resolve(base + "-" + counter + extension);
            counter++;
        }
        return candidate;
    }

    public static Path sidecarPath(Path artifact) {
        return artifact.resolveSibling(artifact.getFileName().toString() + BackupType.SIDECAR_SUFFIX);
    }

    /**
     * Nome do artefato sem a extensão do tipo (ex.: database_backup_2024-01-01_02-00-00)
     */
    public static String stripExtension(Path artifact, BackupType type, boolean compressed) {
        String name = artifact.getFileName().toString();
        String extension = type.extension(compressed);
        return name.endsWith(extension) ? name.substring(0, name.length() - extension.length()) : name;
    }
}
