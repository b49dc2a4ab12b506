package com.safejob.matching.dto.events;

import java.time.Instant;
import java.util.UUID;

public record CoupleAwaitingPartner(UUID coupleApplicationId, UUID pendingPartnerId, Instant deadline,
                                    Instant occurredAt) implements MatchingEvent {

    @Override
    public String key() {
        return coupleApplicationId.toString();
    }

    @Override
    public String eventType() {
        return "CoupleAwaitingPartner";
    }
}
