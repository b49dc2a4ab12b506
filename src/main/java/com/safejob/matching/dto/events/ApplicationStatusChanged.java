package com.safejob.matching.dto.events;

import com.safejob.matching.dto.enums.ActorType;
import com.safejob.matching.dto.enums.ApplicationStatus;

import java.time.Instant;
import java.util.UUID;

public record ApplicationStatusChanged(UUID applicationId, ApplicationStatus fromState, ApplicationStatus toState,
                                       String actor, ActorType actorType, Instant occurredAt) implements MatchingEvent {

    @Override
    public String key() {
        return applicationId.toString();
    }

    @Override
    public String eventType() {
        return "ApplicationStatusChanged";
    }
}
