package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupHealth;
import com.seveninterprise.backupforge.model.BackupJobStatus;
import com.seveninterprise.backupforge.model.BackupResult;
import com.seveninterprise.backupforge.model.BackupStats;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.CleanupResult;
import com.seveninterprise.backupforge.model.JobRunOutcome;
import com.seveninterprise.backupforge.model.RestoreResult;
import com.seveninterprise.backupforge.model.VerificationResult;

import java.util.List;

/**
 * Interface para gerenciamento de backups
 *
 * Ponto de entrada síncrono usado pela camada de requisições (rotas de
 * administração). Todas as operações lançam
 * {@link com.seveninterprise.backupforge.exceptions.BackupException} com o
 * código de erro correspondente.
 */
public interface IBackupManagementService {

    /**
     * Cria backup manual do banco de dados
     */
    BackupResult createDatabaseBackup();

    /**
     * Cria backup manual dos arquivos
     */
    BackupResult createFilesBackup();

    /**
     * Lista backups existentes
     *
     * @param type Tipo de backup; nulo lista ambos
     * @return Backups ordenados do mais recente para o mais antigo
     */
    List<BackupEntry> listBackups(BackupType type);

    RestoreResult restoreDatabase(String artifactPath);

    /**
     * @param targetDir Diretório de destino; nulo usa o diretório base configurado
     */
    RestoreResult restoreFiles(String artifactPath, String targetDir);

    /**
     * Verifica a integridade de um backup
     */
    VerificationResult verifyBackup(String artifactPath, BackupType type);

    /**
     * Aplica a política de retenção
     *
     * @param type Tipo de backup; nulo limpa ambos
     */
    List<CleanupResult> cleanup(BackupType type);

    List<BackupJobStatus> getSchedulerStatus();

    JobRunOutcome triggerJob(String jobName);

    void startJob(String jobName);

    void stopJob(String jobName);

    /**
     * Estatísticas dos backups armazenados e dos jobs
     */
    BackupStats getStats();

    /**
     * Saúde do sistema de backup: "healthy" sem jobs em erro, senão "degraded"
     */
    BackupHealth getHealth();
}
