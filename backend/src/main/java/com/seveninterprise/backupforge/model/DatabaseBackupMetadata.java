package com.seveninterprise.backupforge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadados de um snapshot do banco: tabelas e contagem de registros
 */
public class DatabaseBackupMetadata extends BackupMetadata {

    private List<String> tables = new ArrayList<>();
    private Map<String, Long> recordCounts = new LinkedHashMap<>();

    @Override
    public BackupType getType() {
        return BackupType.DATABASE;
    }

    public List<String> getTables() {
        return tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables;
    }

    public Map<String, Long> getRecordCounts() {
        return recordCounts;
    }

    public void setRecordCounts(Map<String, Long> recordCounts) {
        this.recordCounts = recordCounts;
    }

    @JsonIgnore
    public long getTotalRecords() {
        return recordCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
