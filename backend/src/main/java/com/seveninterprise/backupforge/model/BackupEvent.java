package com.seveninterprise.backupforge.model;

import java.time.Instant;

/**
 * Evento entregue ao colaborador de notificações
 */
public class BackupEvent {

    public enum EventType {
        SUCCESS,
        FAILURE
    }

    private final EventType eventType;
    private final String jobName;
    private final String summary;
    private final Instant timestamp;

    public BackupEvent(EventType eventType, String jobName, String summary, Instant timestamp) {
        this.eventType = eventType;
        this.jobName = jobName;
        this.summary = summary;
        this.timestamp = timestamp;
    }

    public EventType getEventType() {
        return eventType;
    }

    public String getJobName() {
        return jobName;
    }

    public String getSummary() {
        return summary;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "BackupEvent{" + eventType + ", job=" + jobName + ", summary=" + summary + "}";
    }
}
