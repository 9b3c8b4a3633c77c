package com.seveninterprise.backupforge.exceptions;

/**
 * Exception customizada para operações de backup e restauração
 *
 * Além da mensagem, informa se o trabalho parcial foi desfeito e se o
 * armazenamento de dados continua consistente, para que a camada de
 * requisição possa reportar a falha ao operador.
 */
public class BackupException extends RuntimeException {

    private final BackupErrorCode errorCode;
    private final boolean rolledBack;
    private final boolean dataStoreConsistent;

    public BackupException(BackupErrorCode errorCode, String message) {
        this(errorCode, message, null, true, true);
    }

    public BackupException(BackupErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true, true);
    }

    public BackupException(BackupErrorCode errorCode, String message, Throwable cause,
                           boolean rolledBack, boolean dataStoreConsistent) {
        super(message, cause);
        this.errorCode = errorCode;
        this.rolledBack = rolledBack;
        this.dataStoreConsistent = dataStoreConsistent;
    }

    public BackupErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    public boolean isDataStoreConsistent() {
        return dataStoreConsistent;
    }
}
