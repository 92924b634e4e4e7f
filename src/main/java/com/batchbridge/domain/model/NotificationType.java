package com.batchbridge.domain.model;

/**
 * Domain events that can be delivered to webhook subscribers.
 */
public enum NotificationType {
    SETTLEMENT_UPSERTED("settlement.upserted"),
    DISPUTE_UPSERTED("dispute.upserted"),
    CONFIG_SNAPSHOT_CAPTURED("config.snapshot.captured"),
    INGEST_JOB_COMPLETED("ingest.job.completed"),
    INGEST_JOB_FAILED("ingest.job.failed");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static NotificationType fromWireName(String name) {
        for (NotificationType type : values()) {
            if (type.wireName.equals(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + name);
    }
}
