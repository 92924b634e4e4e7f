package com.batchbridge.domain.model;

public enum UpsertOutcome {
    /** Row inserted or changed. */
    APPLIED,
    /** Identical or older content; nothing written. */
    UNCHANGED
}
