package com.safejob.matching.dto;

import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.dto.enums.SubjectType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Output of one scoring run. Never edited; any input change produces a new instance.
 */
@Data
@Builder
@AllArgsConstructor
public class MatchResult {
    private final UUID subjectId;
    private final SubjectType subjectType;
    private final UUID jobId;
    private final Map<ScoreComponent, Double> componentScores;
    private final double bonus;
    private final double overallScore;
    private final String configVersion;

    @EqualsAndHashCode.Exclude
    private final Instant computedAt;

    public double component(ScoreComponent component) {
        return componentScores.getOrDefault(component, 0.0);
    }
}
