package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.CleanupResult;

import java.util.List;

/**
 * Interface para aplicação da política de retenção
 */
public interface IRetentionService {

    /**
     * Remove artefatos do tipo mais antigos que o corte de retenção, junto com seus sidecars
     *
     * Falhas por item são acumuladas em {@link CleanupResult#getErrors()}.
     *
     * @param type Tipo de artefato
     * @return Quantidade removida e erros
     */
    CleanupResult cleanup(BackupType type);

    /**
     * Executa a limpeza para todos os tipos
     */
    List<CleanupResult> cleanupAll();
}
