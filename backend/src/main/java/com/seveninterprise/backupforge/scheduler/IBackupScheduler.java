package com.seveninterprise.backupforge.scheduler;

import com.seveninterprise.backupforge.model.BackupJobStatus;
import com.seveninterprise.backupforge.model.JobRunOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Interface do agendador de jobs de backup e limpeza
 */
public interface IBackupScheduler {

    /**
     * Registra e inicia os jobs habilitados pela configuração
     */
    void initialize();

    /**
     * Registra (ou substitui) um job com a expressão cron informada, sem iniciá-lo
     *
     * @throws com.seveninterprise.backupforge.exceptions.BackupException CONFIG_INVALID se o cron for inválido
     */
    void registerJob(String name, String schedule, ScheduledBackupJob.JobBody body);

    /**
     * Inicia o agendamento do job; não faz nada se já estiver ativo
     */
    void startJob(String name);

    /**
     * Cancela disparos futuros sem interromper uma execução em andamento
     */
    void stopJob(String name);

    void restartJob(String name);

    /**
     * Executa o job imediatamente, na thread chamadora
     *
     * @return SKIPPED se o job já estiver em execução
     */
    JobRunOutcome triggerJob(String name);

    Optional<BackupJobStatus> getJobStatus(String name);

    List<BackupJobStatus> getAllJobStatuses();

    boolean isInitialized();

    /**
     * Cancela todos os jobs (interrompendo execuções em andamento) e limpa o estado
     */
    void shutdown();
}
