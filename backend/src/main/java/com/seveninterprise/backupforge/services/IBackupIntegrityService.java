package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.BackupMetadata;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.VerificationResult;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Interface para checksum, sidecars e verificação de integridade de artefatos
 */
public interface IBackupIntegrityService {

    /**
     * Calcula o SHA-256 do artefato inteiro
     *
     * @param artifact Caminho do artefato
     * @return Digest em hexadecimal minúsculo (64 caracteres)
     */
    String calculateChecksum(Path artifact);

    /**
     * Grava o sidecar {@code <artefato>.meta.json}
     */
    void writeSidecar(Path artifact, BackupMetadata metadata);

    /**
     * Lê o sidecar do artefato; vazio se ausente ou ilegível
     */
    Optional<BackupMetadata> readSidecar(Path artifact);

    /**
     * Verifica integridade do artefato
     *
     * Falhas possíveis (em {@link VerificationResult#getErrorCode()}):
     * NOT_FOUND, EMPTY, CHECKSUM_MISMATCH, CORRUPT_ARCHIVE.
     * Sem sidecar, apenas a validação estrutural é feita.
     *
     * @param artifact Caminho do artefato
     * @param type Tipo esperado do artefato
     * @return Resultado da verificação
     */
    VerificationResult verify(Path artifact, BackupType type);
}
