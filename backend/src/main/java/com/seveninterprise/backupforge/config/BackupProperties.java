package com.seveninterprise.backupforge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuração do sistema de backup (prefixo {@code backup})
 *
 * Carregada uma vez na inicialização a partir do backup-config.json,
 * application.properties e variáveis de ambiente (ex.: BACKUP_DATABASE_SCHEDULE).
 * Os valores padrão abaixo espelham o backup-config.json distribuído.
 */
@Validated
@ConfigurationProperties(prefix = "backup")
public class BackupProperties {

    @Valid
    private Database database = new Database();

    @Valid
    private FileTree files = new FileTree();

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Notifications notifications = new Notifications();

    @Valid
    private Cleanup cleanup = new Cleanup();

    @Valid
    private Scheduler scheduler = new Scheduler();

    public static class Database {
        private boolean enabled = true;

        @NotBlank
        private String schedule = "0 2 * * *"; // Diariamente às 2h

        @Valid
        private Retention retention = new Retention();

        private boolean compression = true;

        @NotBlank
        private String file = "data/app.db";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public Retention getRetention() {
            return retention;
        }

        public void setRetention(Retention retention) {
            this.retention = retention;
        }

        public boolean isCompression() {
            return compression;
        }

        public void setCompression(boolean compression) {
            this.compression = compression;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }

    public static class Retention {
        @Min(1)
        private int daily = 7;

        @Min(0)
        private int weekly = 4;

        @Min(0)
        private int monthly = 12;

        public int getDaily() {
            return daily;
        }

        public void setDaily(int daily) {
            this.daily = daily;
        }

        public int getWeekly() {
            return weekly;
        }

        public void setWeekly(int weekly) {
            this.weekly = weekly;
        }

        public int getMonthly() {
            return monthly;
        }

        public void setMonthly(int monthly) {
            this.monthly = monthly;
        }
    }

    public static class FileTree {
        private boolean enabled = true;

        @NotBlank
        private String schedule = "0 3 * * 0"; // Semanalmente, domingo às 3h

        @NotNull
        private List<String> directories = new ArrayList<>(List.of("uploads", "logs", "config"));

        @NotNull
        private List<String> exclusions = new ArrayList<>(
            List.of("*.log", "*.tmp", "node_modules", ".git", "coverage", "dist"));

        private boolean compression = true;

        // Raiz para os nomes das entradas do arquivo e destino padrão da restauração
        private String baseDirectory = System.getProperty("user.dir");

        @Valid
        private FilesRetention retention = new FilesRetention();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public List<String> getDirectories() {
            return directories;
        }

        public void setDirectories(List<String> directories) {
            this.directories = directories;
        }

        public List<String> getExclusions() {
            return exclusions;
        }

        public void setExclusions(List<String> exclusions) {
            this.exclusions = exclusions;
        }

        public boolean isCompression() {
            return compression;
        }

        public void setCompression(boolean compression) {
            this.compression = compression;
        }

        public String getBaseDirectory() {
            return baseDirectory;
        }

        public void setBaseDirectory(String baseDirectory) {
            this.baseDirectory = baseDirectory;
        }

        public Path getBasePath() {
            return Paths.get(baseDirectory).toAbsolutePath().normalize();
        }

        public FilesRetention getRetention() {
            return retention;
        }

        public void setRetention(FilesRetention retention) {
            this.retention = retention;
        }
    }

    /**
     * Retenção própria dos backups de arquivos. Quando {@code daily} não é
     * definido, a limpeza usa a retenção diária do banco.
     */
    public static class FilesRetention {
        @Min(1)
        private Integer daily;

        public Integer getDaily() {
            return daily;
        }

        public void setDaily(Integer daily) {
            this.daily = daily;
        }
    }

    public static class Storage {
        @Valid
        private Local local = new Local();

        public Local getLocal() {
            return local;
        }

        public void setLocal(Local local) {
            this.local = local;
        }
    }

    public static class Local {
        @NotBlank
        private String path = "backups";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Notifications {
        private boolean enabled = true;
        private boolean onSuccess = false; // Evita spam em caso de sucesso
        private boolean onFailure = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isOnSuccess() {
            return onSuccess;
        }

        public void setOnSuccess(boolean onSuccess) {
            this.onSuccess = onSuccess;
        }

        public boolean isOnFailure() {
            return onFailure;
        }

        public void setOnFailure(boolean onFailure) {
            this.onFailure = onFailure;
        }
    }

    public static class Cleanup {
        @NotBlank
        private String databaseSchedule = "0 1 * * *";

        @NotBlank
        private String filesSchedule = "30 1 * * *";

        // Retenção avô-pai-filho (diária/semanal/mensal) em vez do corte diário simples
        private boolean tiered = false;

        public String getDatabaseSchedule() {
            return databaseSchedule;
        }

        public void setDatabaseSchedule(String databaseSchedule) {
            this.databaseSchedule = databaseSchedule;
        }

        public String getFilesSchedule() {
            return filesSchedule;
        }

        public void setFilesSchedule(String filesSchedule) {
            this.filesSchedule = filesSchedule;
        }

        public boolean isTiered() {
            return tiered;
        }

        public void setTiered(boolean tiered) {
            this.tiered = tiered;
        }
    }

    public static class Scheduler {
        @Min(1)
        private int poolSize = 4;

        private String zone;

        private boolean autoStart = true;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public ZoneId getZoneId() {
            return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public Path getStoragePath() {
        return Paths.get(storage.getLocal().getPath()).toAbsolutePath().normalize();
    }

    public Database getDatabase() {
        return database;
    }

    public void setDatabase(Database database) {
        this.database = database;
    }

    public FileTree getFiles() {
        return files;
    }

    public void setFiles(FileTree files) {
        this.files = files;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public void setCleanup(Cleanup cleanup) {
        this.cleanup = cleanup;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }
}
