package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupResult;

import java.util.List;

/**
 * Interface para snapshots do banco de dados
 */
public interface IDatabaseBackupService {

    /**
     * Cria um snapshot consistente do banco, comprimido e selado com checksum
     *
     * @return Resultado com caminho, tamanho, duração e metadados
     * @throws com.seveninterprise.backupforge.exceptions.BackupException
     *         IO_FAILURE, SOURCE_UNAVAILABLE, ALREADY_RUNNING ou CANCELLED
     */
    BackupResult createBackup();

    /**
     * Lista os snapshots existentes, mais recentes primeiro
     */
    List<BackupEntry> listBackups();
}
