package com.seveninterprise.backupforge.scheduler;

import org.springframework.scheduling.support.CronExpression;

/**
 * Utilitários para expressões cron
 *
 * Aceita o formato Unix de 5 campos (m h dom mon dow) além do formato
 * Spring de 6 campos; o primeiro é normalizado com segundos = 0.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expressão cron vazia");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        return String.join(" ", fields);
    }

    /**
     * @throws IllegalArgumentException se a expressão for inválida
     */
    public static CronExpression parse(String expression) {
        return CronExpression.parse(normalize(expression));
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
