package com.seveninterprise.backupforge.config;

import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.scheduler.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Validação antecipada da configuração de backup
 *
 * Uma expressão cron inválida ou um diretório de armazenamento sem permissão
 * de escrita devem impedir a inicialização do processo, em vez de falhar
 * silenciosamente no primeiro disparo.
 */
@Component
public class BackupConfigValidator {

    private static final Logger logger = LoggerFactory.getLogger(BackupConfigValidator.class);

    public void validate(BackupProperties properties) {
        try {
            BackupProperties.Database database = properties.getDatabase();
            BackupProperties.FileTree files = properties.getFiles();

            if (database.isEnabled()) {
                requireCron("backup.database.schedule", database.getSchedule());
            }
            if (files.isEnabled()) {
                requireCron("backup.files.schedule", files.getSchedule());
                if (files.getDirectories() == null || files.getDirectories().isEmpty()) {
                    throw invalid("backup.files.directories não pode ser vazio com o backup de arquivos habilitado");
                }
            }
            requireCron("backup.cleanup.database-schedule", properties.getCleanup().getDatabaseSchedule());
            requireCron("backup.cleanup.files-schedule", properties.getCleanup().getFilesSchedule());

            if (database.getRetention().getDaily() < 1) {
                throw invalid("Retenção diária deve ser no mínimo 1");
            }
            Integer filesDaily = files.getRetention().getDaily();
            if (filesDaily != null && filesDaily < 1) {
                throw invalid("Retenção diária de arquivos deve ser no mínimo 1");
            }
            if (filesDaily == null) {
                logger.warn("⚠️ backup.files.retention.daily não definido - limpeza de arquivos usará a retenção diária do banco ({} dias)",
                    database.getRetention().getDaily());
            }

            properties.getScheduler().getZoneId();

            ensureWritableStorage(properties.getStoragePath());

            logger.info("✅ Configuração de backup validada (armazenamento: {})", properties.getStoragePath());

        } catch (BackupException e) {
            logger.error("❌ Configuração de backup inválida: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.error("❌ Configuração de backup inválida: {}", e.getMessage());
            throw new BackupException(BackupErrorCode.CONFIG_INVALID, e.getMessage(), e);
        }
    }

    private void requireCron(String key, String expression) {
        if (!CronSchedules.isValid(expression)) {
            throw invalid("Expressão cron inválida em " + key + ": " + expression);
        }
    }

    private void ensureWritableStorage(Path storagePath) {
        try {
            Files.createDirectories(storagePath);
        } catch (IOException e) {
            throw new BackupException(BackupErrorCode.CONFIG_INVALID,
                "Não foi possível criar o diretório de backups: " + storagePath, e);
        }
        if (!Files.isDirectory(storagePath) || !Files.isWritable(storagePath)) {
            throw invalid("Diretório de backups sem permissão de escrita: " + storagePath);
        }
    }

    private static BackupException invalid(String message) {
        return new BackupException(BackupErrorCode.CONFIG_INVALID, message);
    }
}
