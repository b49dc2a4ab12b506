package com.safejob.matching.dto.enums;

public enum SubjectType {
    CANDIDATE,
    COUPLE
}
