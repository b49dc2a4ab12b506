package com.safejob.matching.dto.events;

import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.dto.enums.SubjectType;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record MatchComputed(UUID candidateOrCoupleId, SubjectType subjectType, UUID jobId, double overallScore,
                            Map<ScoreComponent, Double> componentScores, Instant occurredAt) implements MatchingEvent {

    @Override
    public String key() {
        return candidateOrCoupleId + ":" + jobId;
    }

    @Override
    public String eventType() {
        return "MatchComputed";
    }
}
