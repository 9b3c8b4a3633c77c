package com.seveninterprise.backupforge.model;

/**
 * Resultado de uma restauração
 */
public class RestoreResult {

    private boolean success;
    private boolean requiresProcessRestart;
    private int extractedFileCount;
    private int skippedEntries;
    private String message;

    public static RestoreResult database(String message) {
        RestoreResult result = new RestoreResult();
        result.setSuccess(true);
        result.setRequiresProcessRestart(true);
        result.setExtractedFileCount(1);
        result.setMessage(message);
        return result;
    }

    public static RestoreResult files(int extracted, int skipped, String message) {
        RestoreResult result = new RestoreResult();
        result.setSuccess(true);
        result.setRequiresProcessRestart(false);
        result.setExtractedFileCount(extracted);
        result.setSkippedEntries(skipped);
        result.setMessage(message);
        return result;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public boolean isRequiresProcessRestart() {
        return requiresProcessRestart;
    }

    public void setRequiresProcessRestart(boolean requiresProcessRestart) {
        this.requiresProcessRestart = requiresProcessRestart;
    }

    public int getExtractedFileCount() {
        return extractedFileCount;
    }

    public void setExtractedFileCount(int extractedFileCount) {
        this.extractedFileCount = extractedFileCount;
    }

    public int getSkippedEntries() {
        return skippedEntries;
    }

    public void setSkippedEntries(int skippedEntries) {
        this.skippedEntries = skippedEntries;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
