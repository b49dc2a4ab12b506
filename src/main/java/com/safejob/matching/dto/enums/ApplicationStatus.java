package com.safejob.matching.dto.enums;

public enum ApplicationStatus {
    DRAFT,
    AWAITING_PARTNER,
    SUBMITTED,
    VIEWED,
    IN_REVIEW,
    INTERVIEW_SCHEDULED,
    OFFERED,
    ACCEPTED,
    REJECTED,
    WITHDRAWN;

    public boolean isTerminal() {
        return this == ACCEPTED || this == REJECTED || this == WITHDRAWN;
    }
}
