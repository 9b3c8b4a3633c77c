package com.seveninterprise.backupforge.config;

import com.seveninterprise.backupforge.scheduler.BackupScheduler;
import com.seveninterprise.backupforge.services.IBackupNotifier;
import com.seveninterprise.backupforge.services.IDatabaseBackupService;
import com.seveninterprise.backupforge.services.IFilesBackupService;
import com.seveninterprise.backupforge.services.IRetentionService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Beans de infraestrutura do sistema de backup
 */
@Configuration
@EnableConfigurationProperties(BackupProperties.class)
public class BackupConfiguration {

    @Bean
    public Clock backupClock(BackupProperties properties) {
        return Clock.system(properties.getScheduler().getZoneId());
    }

    @Bean
    public ThreadPoolTaskScheduler backupTaskScheduler(BackupProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("backup-job-");
        scheduler.setRemoveOnCancelPolicy(true);
        // Jobs em andamento são interrompidos no desligamento
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor backupNotificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("backup-notify-");
        return executor;
    }

    @Bean(destroyMethod = "shutdown")
    public BackupScheduler backupScheduler(BackupProperties properties,
                                           BackupConfigValidator validator,
                                           IDatabaseBackupService databaseBackupService,
                                           IFilesBackupService filesBackupService,
                                           IRetentionService retentionService,
                                           IBackupNotifier notifier,
                                           ThreadPoolTaskScheduler backupTaskScheduler,
                                           @Qualifier("backupNotificationExecutor") ThreadPoolTaskExecutor notificationExecutor,
                                           Clock backupClock) {
        validator.validate(properties);

        BackupScheduler scheduler = new BackupScheduler(properties, databaseBackupService, filesBackupService,
            retentionService, notifier, backupTaskScheduler, notificationExecutor, backupClock);
        if (properties.getScheduler().isAutoStart()) {
            scheduler.initialize();
        }
        return scheduler;
    }
}
