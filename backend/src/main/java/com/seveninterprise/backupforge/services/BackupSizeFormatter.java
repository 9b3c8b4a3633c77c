package com.seveninterprise.backupforge.services;

/**
 * Formata tamanhos de backup para logs e estatísticas
 */
public final class BackupSizeFormatter {

    private static final String[] UNITS = {"Bytes", "KB", "MB", "GB", "TB"};

    private BackupSizeFormatter() {
    }

    public static String format(long bytes) {
        if (bytes <= 0) {
            return "0 Bytes";
        }
        int unit = Math.min((int) (Math.log(bytes) / Math.log(1024)), UNITS.length - 1);
        double size = bytes / Math.pow(1024, unit);
        double rounded = Math.round(size * 100) / 100.0;
        if (rounded == Math.rint(rounded)) {
            return (long) rounded + " " + UNITS[unit];
        }
        return rounded + " " + UNITS[unit];
    }
}
