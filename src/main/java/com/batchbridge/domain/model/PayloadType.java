package com.batchbridge.domain.model;

/**
 * Closed set of payload variants a dropped file can carry.
 */
public enum PayloadType {
    SETTLEMENT,
    DISPUTE,
    CONFIG_SNAPSHOT,
    UNKNOWN
}
