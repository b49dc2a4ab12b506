package com.safejob.matching.dto.enums;

/**
 * Whether a couple satisfies a skill requirement when either partner holds it, or only when both do.
 */
public enum OverlapMode {
    EITHER,
    BOTH
}
