package com.safejob.matching.dto.enums;

public enum CoupleApplicationStatus {
    DRAFT,
    AWAITING_PARTNER,
    SUBMITTED,
    BOTH_ACCEPTED,
    BOTH_REJECTED,
    SPLIT_DECISION,
    WITHDRAWN;

    public boolean isTerminal() {
        return this == BOTH_ACCEPTED || this == BOTH_REJECTED || this == SPLIT_DECISION || this == WITHDRAWN;
    }
}
