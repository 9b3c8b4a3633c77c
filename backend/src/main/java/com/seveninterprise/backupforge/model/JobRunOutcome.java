package com.seveninterprise.backupforge.model;

/**
 * Desfecho de uma invocação de job
 */
public enum JobRunOutcome {
    COMPLETED,  // Corpo executado com sucesso
    FAILED,     // Corpo lançou exceção (status do job = ERROR)
    SKIPPED     // Outra invocação do mesmo job já estava em andamento
}
