package com.safejob.matching.dto.events;

import com.safejob.matching.dto.enums.CoupleApplicationStatus;

import java.time.Instant;
import java.util.UUID;

public record CoupleApplicationResolved(UUID coupleApplicationId, CoupleApplicationStatus outcome,
                                        Instant occurredAt) implements MatchingEvent {

    @Override
    public String key() {
        return coupleApplicationId.toString();
    }

    @Override
    public String eventType() {
        return "CoupleApplicationResolved";
    }
}
