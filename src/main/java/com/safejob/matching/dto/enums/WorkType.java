package com.safejob.matching.dto.enums;

public enum WorkType {
    FULL_TIME,
    PART_TIME,
    SEASONAL,
    TEMPORARY,
    FREELANCE,
    INTERNSHIP
}
