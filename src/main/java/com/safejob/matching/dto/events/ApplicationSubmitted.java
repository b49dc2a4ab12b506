package com.safejob.matching.dto.events;

import java.time.Instant;
import java.util.UUID;

public record ApplicationSubmitted(UUID applicationId, UUID candidateId, UUID jobId, double score,
                                   Instant occurredAt) implements MatchingEvent {

    @Override
    public String key() {
        return applicationId.toString();
    }

    @Override
    public String eventType() {
        return "ApplicationSubmitted";
    }
}
