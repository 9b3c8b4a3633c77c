package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.BackupEvent;

/**
 * Colaborador de notificações dos jobs de backup
 *
 * Implementações podem lançar exceções; o agendador as captura e registra
 * sem afetar o estado do job.
 */
public interface IBackupNotifier {

    void notify(BackupEvent event);
}
