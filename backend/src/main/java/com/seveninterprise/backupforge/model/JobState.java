package com.seveninterprise.backupforge.model;

public enum JobState {
    IDLE,
    RUNNING,
    ERROR
}
