package com.safejob.matching.dto.enums;

public enum JobStatus {
    DRAFT,
    PUBLISHED,
    PAUSED,
    CLOSED,
    ARCHIVED
}
