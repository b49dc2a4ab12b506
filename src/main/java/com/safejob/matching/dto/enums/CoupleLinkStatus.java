package com.safejob.matching.dto.enums;

public enum CoupleLinkStatus {
    NONE,
    PENDING_LINK,
    LINKED
}
