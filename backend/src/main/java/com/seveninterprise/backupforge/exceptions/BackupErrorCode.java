package com.seveninterprise.backupforge.exceptions;

/**
 * Categorias de falha do motor de backup
 */
public enum BackupErrorCode {
    CONFIG_INVALID,       // Configuração inválida (fatal na inicialização)
    SOURCE_UNAVAILABLE,   // Diretório ou tabela de origem ausente
    IO_FAILURE,           // Disco cheio, permissão negada, banco ocupado
    CHECKSUM_MISMATCH,    // Checksum do sidecar não confere
    CORRUPT_ARCHIVE,      // Arquivo não pode ser aberto/enumerado
    ALREADY_RUNNING,      // Operação do mesmo tipo já em andamento
    RESTORE_CONFLICT,     // Restauração concorrente com backup ou outra restauração
    NOT_FOUND,            // Artefato inexistente
    EMPTY,                // Artefato com zero bytes
    CANCELLED,            // Cancelado pelo host (ex.: shutdown)
    JOB_NOT_FOUND         // Job desconhecido no agendador
}
