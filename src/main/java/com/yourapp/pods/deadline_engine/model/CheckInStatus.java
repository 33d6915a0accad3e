package com.yourapp.pods.deadline_engine.model;

public enum CheckInStatus {
    COMPLETED,
    MISSED,
    SKIPPED
}
