package com.safejob.matching.dto.enums;

/**
 * Result of a partner confirming a couple application.
 */
public enum ConfirmationOutcome {
    /** First confirmation recorded, waiting for the other partner. */
    AWAITING_PARTNER,
    /** Both partners confirmed before the deadline; applications are visible to the employer. */
    SUBMITTED,
    /** The deadline passed before this confirmation landed. */
    EXPIRED,
    /** Another event (timeout sweep, cancellation, earlier confirmation) already decided the record. */
    ALREADY_RESOLVED
}
