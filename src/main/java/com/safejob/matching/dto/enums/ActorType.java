package com.safejob.matching.dto.enums;

public enum ActorType {
    CANDIDATE,
    EMPLOYER,
    SYSTEM
}
