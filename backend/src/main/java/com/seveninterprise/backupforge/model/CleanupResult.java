package com.seveninterprise.backupforge.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Resultado da limpeza por política de retenção
 */
public class CleanupResult {

    private BackupType type;
    private int deletedCount;
    private List<String> errors = new ArrayList<>();

    public CleanupResult() {}

    public CleanupResult(BackupType type) {
        this.type = type;
    }

    public void recordDeletion() {
        deletedCount++;
    }

    public void recordError(String error) {
        errors.add(error);
    }

    public BackupType getType() {
        return type;
    }

    public void setType(BackupType type) {
        this.type = type;
    }

    public int getDeletedCount() {
        return deletedCount;
    }

    public void setDeletedCount(int deletedCount) {
        this.deletedCount = deletedCount;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = errors;
    }
}
