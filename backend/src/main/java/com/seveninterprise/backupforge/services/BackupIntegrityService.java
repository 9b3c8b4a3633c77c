package com.seveninterprise.backupforge.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupMetadata;
import com.seveninterprise.backupforge.model.BackupType;
import com.seveninterprise.backupforge.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Checksum SHA-256, leitura/escrita de sidecars e verificação de artefatos
 *
 * SHA-256 em vez de um hash não criptográfico: a verificação precisa detectar
 * adulteração, não apenas corrupção acidental.
 */
@Service
public class BackupIntegrityService implements IBackupIntegrityService {

    private static final Logger logger = LoggerFactory.getLogger(BackupIntegrityService.class);

    private static final int BUFFER_SIZE = 64 * 1024;
    static final byte[] SQLITE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

    private final ObjectMapper objectMapper;

    public BackupIntegrityService() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String calculateChecksum(Path artifact) {
        try (InputStream is = Files.newInputStream(artifact)) {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = is.read(buffer)) != -1) {
                md.update(buffer, 0, read);
            }
            return toHex(md.digest());

        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponível na JVM", e);
        } catch (IOException e) {
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao calcular checksum de " + artifact + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void writeSidecar(Path artifact, BackupMetadata metadata) {
        Path sidecar = BackupFileNames.sidecarPath(artifact);
        try {
            objectMapper.writeValue(sidecar.toFile(), metadata);
            logger.debug("Metadados do backup salvos em {}", sidecar);
        } catch (IOException e) {
            BackupStreams.deleteQuietly(sidecar);
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao salvar metadados do backup " + sidecar + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<BackupMetadata> readSidecar(Path artifact) {
        Path sidecar = BackupFileNames.sidecarPath(artifact);
        if (!Files.isRegularFile(sidecar)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(sidecar.toFile(), BackupMetadata.class));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("⚠️ Sidecar ilegível {}: {}", sidecar, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public VerificationResult verify(Path artifact, BackupType type) {
        try {
            if (artifact == null || !Files.isRegularFile(artifact)) {
                return VerificationResult.invalid(BackupErrorCode.NOT_FOUND, "Arquivo de backup não encontrado: " + artifact);
            }
            if (Files.size(artifact) == 0) {
                return VerificationResult.invalid(BackupErrorCode.EMPTY, "Arquivo de backup vazio: " + artifact);
            }

            boolean sidecarExists = Files.exists(BackupFileNames.sidecarPath(artifact));
            Optional<BackupMetadata> metadata = readSidecar(artifact);
            Boolean checksumMatch = null;

            // Sidecar presente mas ilegível ou sem checksum: o artefato não é confiável
            if (sidecarExists && metadata.isEmpty()) {
                return untrusted("Sidecar ilegível para " + artifact.getFileName());
            }

            if (metadata.isPresent()) {
                BackupMetadata meta = metadata.get();
                if (type != null && meta.getType() != type) {
                    return untrusted("Metadados indicam backup do tipo " + meta.getType().getId()
                        + ", esperado " + type.getId());
                }
                if (meta.getChecksum() == null || meta.getChecksum().isBlank()) {
                    return untrusted("Sidecar sem checksum para " + artifact.getFileName());
                }
                String current = calculateChecksum(artifact);
                checksumMatch = current.equalsIgnoreCase(meta.getChecksum());
                if (!checksumMatch) {
                    VerificationResult result = VerificationResult.invalid(BackupErrorCode.CHECKSUM_MISMATCH,
                        "Checksum não confere - backup pode estar corrompido");
                    result.setChecksumMatch(false);
                    result.setSidecarPresent(true);
                    return result;
                }
            }

            int fileCount;
            try {
                fileCount = countEntries(artifact, type);
            } catch (IOException e) {
                VerificationResult result = VerificationResult.invalid(BackupErrorCode.CORRUPT_ARCHIVE,
                    "Arquivo de backup corrompido: " + e.getMessage());
                result.setChecksumMatch(checksumMatch);
                result.setSidecarPresent(metadata.isPresent());
                return result;
            }

            VerificationResult result = new VerificationResult();
            result.setValid(true);
            result.setChecksumMatch(checksumMatch);
            result.setFileCount(fileCount);
            result.setSidecarPresent(metadata.isPresent());
            if (metadata.isEmpty()) {
                logger.warn("⚠️ Backup {} sem sidecar - apenas validação estrutural aplicada", artifact.getFileName());
            }
            return result;

        } catch (BackupException e) {
            return VerificationResult.invalid(e.getErrorCode(), e.getMessage());
        } catch (IOException e) {
            return VerificationResult.invalid(BackupErrorCode.IO_FAILURE, e.getMessage());
        }
    }

    private VerificationResult untrusted(String message) {
        logger.warn("⚠️ {}", message);
        VerificationResult result = VerificationResult.invalid(BackupErrorCode.CORRUPT_ARCHIVE, message);
        result.setSidecarPresent(true);
        return result;
    }

    /**
     * Conta entradas de arquivo (diretórios não contam). Um .db sem compressão
     * conta como uma entrada desde que tenha o cabeçalho SQLite.
     */
    private int countEntries(Path artifact, BackupType type) throws IOException {
        String name = artifact.getFileName().toString();
        if (type == BackupType.DATABASE && !name.endsWith(".zip")) {
            if (!hasSqliteHeader(artifact)) {
                throw new IOException("cabeçalho SQLite ausente");
            }
            return 1;
        }

        int count = 0;
        try (ZipFile zip = new ZipFile(artifact.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                if (!entries.nextElement().isDirectory()) {
                    count++;
                }
            }
        }
        return count;
    }

    static boolean hasSqliteHeader(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file)) {
            byte[] header = is.readNBytes(SQLITE_HEADER.length);
            return Arrays.equals(header, SQLITE_HEADER);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
