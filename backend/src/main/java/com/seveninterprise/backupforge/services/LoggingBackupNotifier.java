package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.BackupEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Notificador padrão: apenas registra o evento no log
 */
@Component
public class LoggingBackupNotifier implements IBackupNotifier {

    private static final Logger logger = LoggerFactory.getLogger(LoggingBackupNotifier.class);

    @Override
    public void notify(BackupEvent event) {
        if (event.getEventType() == BackupEvent.EventType.FAILURE) {
            logger.error("❌ [{}] {}", event.getJobName(), event.getSummary());
        } else {
            logger.info("✅ [{}] {}", event.getJobName(), event.getSummary());
        }
    }
}
