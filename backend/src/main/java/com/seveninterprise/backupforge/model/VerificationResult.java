package com.seveninterprise.backupforge.model;

import com.seveninterprise.backupforge.exceptions.BackupErrorCode;

/**
 * Resultado da verificação de integridade de um artefato
 *
 * {@code checksumMatch} fica nulo quando não há sidecar para comparar
 * (estado degradado, mas válido).
 */
public class VerificationResult {

    private boolean valid;
    private Boolean checksumMatch;
    private Integer fileCount;
    private boolean sidecarPresent;
    private BackupErrorCode errorCode;
    private String error;

    public static VerificationResult invalid(BackupErrorCode errorCode, String error) {
        VerificationResult result = new VerificationResult();
        result.setValid(false);
        result.setErrorCode(errorCode);
        result.setError(error);
        return result;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public Boolean getChecksumMatch() {
        return checksumMatch;
    }

    public void setChecksumMatch(Boolean checksumMatch) {
        this.checksumMatch = checksumMatch;
    }

    public Integer getFileCount() {
        return fileCount;
    }

    public void setFileCount(Integer fileCount) {
        this.fileCount = fileCount;
    }

    public boolean isSidecarPresent() {
        return sidecarPresent;
    }

    public void setSidecarPresent(boolean sidecarPresent) {
        this.sidecarPresent = sidecarPresent;
    }

    public BackupErrorCode getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(BackupErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
