package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.BackupEntry;
import com.seveninterprise.backupforge.model.BackupResult;

import java.util.List;

/**
 * Interface para backup da árvore de arquivos (uploads, logs, configuração)
 */
public interface IFilesBackupService {

    /**
     * Arquiva os diretórios configurados, respeitando os padrões de exclusão
     *
     * Diretórios ausentes são ignorados com aviso; arquivos que não puderem ser
     * abertos entram em {@code skippedFiles} sem interromper o backup.
     *
     * @return Resultado com caminho, tamanho, duração, quantidade e metadados
     * @throws com.seveninterprise.backupforge.exceptions.BackupException
     *         SOURCE_UNAVAILABLE se nenhum diretório existir, IO_FAILURE,
     *         ALREADY_RUNNING ou CANCELLED
     */
    BackupResult createBackup();

    /**
     * Lista os backups de arquivos existentes, mais recentes primeiro
     */
    List<BackupEntry> listBackups();
}
