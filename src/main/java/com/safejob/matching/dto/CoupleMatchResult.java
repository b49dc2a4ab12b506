package com.safejob.matching.dto;

import com.safejob.matching.dto.enums.OverlapMode;
import com.safejob.matching.dto.enums.ScoreComponent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class CoupleMatchResult {
    private final UUID coupleId;
    private final UUID jobId;
    private final UUID candidateAId;
    private final UUID candidateBId;
    private final OverlapMode overlapMode;
    private final MatchResult partnerA;
    private final MatchResult partnerB;
    /** Components scored for the pair as a unit: skills, language, location and availability. */
    private final Map<ScoreComponent, Double> sharedComponentScores;
    private final double combinedScore;

    @EqualsAndHashCode.Exclude
    private final Instant computedAt;
}
