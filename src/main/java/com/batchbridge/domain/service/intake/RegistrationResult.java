package com.batchbridge.domain.service.intake;

public enum RegistrationResult {
    /** Stored, recorded and announced by this caller. */
    REGISTERED,
    /** Checksum already known; nothing was published. */
    DUPLICATE
}
