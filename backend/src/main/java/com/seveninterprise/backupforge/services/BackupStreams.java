package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Operações de E/S compartilhadas pelos produtores e pela restauração
 */
public final class BackupStreams {

    private static final int BUFFER_SIZE = 64 * 1024;

    private BackupStreams() {
    }

    /**
     * Copia o stream verificando cancelamento (interrupção da thread) a cada bloco.
     *
     * @return número de bytes copiados
     */
    public static long copy(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            checkCancelled();
            out.write(buffer, 0, read);
            total += read;
        }
        return total;
    }

    public static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new BackupException(BackupErrorCode.CANCELLED, "Operação cancelada pelo host");
        }
    }

    /**
     * Move substituindo o destino; atômico quando o sistema de arquivos suporta.
     */
    public static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Remove arquivo parcial sem propagar erro; retorna false se não conseguiu.
     */
    public static boolean deleteQuietly(Path path) {
        if (path == null) {
            return true;
        }
        try {
            Files.deleteIfExists(path);
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
