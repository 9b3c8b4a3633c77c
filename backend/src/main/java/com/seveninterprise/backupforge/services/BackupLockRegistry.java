package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import com.seveninterprise.backupforge.model.BackupType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock exclusivo por tipo de artefato
 *
 * Backup, limpeza e restauração de um mesmo tipo nunca rodam em paralelo.
 * A aquisição nunca espera: se o lock estiver ocupado a operação falha com o
 * código de conflito informado pelo chamador. Uso:
 *
 * <pre>
 * locks.acquire(type, "restauração", BackupErrorCode.RESTORE_CONFLICT);
 * try { ... } finally { locks.release(type); }
 * </pre>
 */
@Component
public class BackupLockRegistry {

    private final Map<BackupType, ReentrantLock> locks = new EnumMap<>(BackupType.class);
    private final Map<BackupType, String> holders = new ConcurrentHashMap<>();

    public BackupLockRegistry() {
        for (BackupType type : BackupType.values()) {
            locks.put(type, new ReentrantLock());
        }
    }

    public void acquire(BackupType type, String operation, BackupErrorCode conflictCode) {
        ReentrantLock lock = locks.get(type);
        if (!lock.tryLock()) {
            String holder = holders.getOrDefault(type, "outra operação");
            throw new BackupException(conflictCode,
                "Não foi possível iniciar " + operation + ": " + holder + " em andamento para " + type.getId());
        }
        if (lock.getHoldCount() == 1) {
            holders.put(type, operation);
        }
    }

    public void release(BackupType type) {
        ReentrantLock lock = locks.get(type);
        if (lock.getHoldCount() == 1) {
            holders.remove(type);
        }
        lock.unlock();
    }

    public boolean isLocked(BackupType type) {
        return locks.get(type).isLocked();
    }

    public Optional<String> currentOperation(BackupType type) {
        return Optional.ofNullable(holders.get(type));
    }
}
