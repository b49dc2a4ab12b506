package com.safejob.matching.processors;

import com.safejob.matching.config.ScoringWeights;
import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.CoupleMatchResult;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.MatchResult;
import com.safejob.matching.dto.SkillTaxonomy;
import com.safejob.matching.dto.enums.OverlapMode;
import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.dto.enums.SubjectType;
import com.safejob.matching.matcher.AvailabilityEvaluator;
import com.safejob.matching.matcher.ExperienceEvaluator;
import com.safejob.matching.matcher.LanguageEvaluator;
import com.safejob.matching.matcher.LocationEvaluator;
import com.safejob.matching.matcher.PreferenceEvaluator;
import com.safejob.matching.matcher.SkillMatchEvaluator;
import com.safejob.matching.utils.basic.BasicUtility;
import com.safejob.matching.utils.basic.ScoreUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Combines evaluator outputs into one bounded score. Pure with respect to its inputs: the same
 * candidate, job, taxonomy and weights always produce an equal {@link MatchResult}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchScorer {
    static final double COUPLE_FRIENDLY_BONUS = 5.0;
    static final double STRONG_COMPONENTS_BONUS = 5.0;
    static final double EXCELLENT_SKILLS_BONUS = 3.0;

    private static final double STRONG_COMPONENT_THRESHOLD = 80.0;
    private static final int STRONG_COMPONENT_COUNT = 3;
    private static final double EXCELLENT_SKILLS_THRESHOLD = 95.0;

    private final ScoringWeights weights;
    private final SkillMatchEvaluator skillEvaluator;
    private final LocationEvaluator locationEvaluator;
    private final LanguageEvaluator languageEvaluator;
    private final ExperienceEvaluator experienceEvaluator;
    private final AvailabilityEvaluator availabilityEvaluator;
    private final PreferenceEvaluator preferenceEvaluator;
    private final Clock clock;

    public MatchResult score(CandidateProfile candidate, JobPosting job, SkillTaxonomy taxonomy) {
        Map<ScoreComponent, Double> components = new EnumMap<>(ScoreComponent.class);
        components.put(ScoreComponent.SKILLS,
                skillEvaluator.evaluate(candidate.getSkills(), job.getSkillRequirements(), taxonomy));
        components.put(ScoreComponent.LOCATION, locationEvaluator.evaluate(candidate, job));
        components.put(ScoreComponent.EXPERIENCE, experienceEvaluator.evaluate(candidate, job));
        components.put(ScoreComponent.LANGUAGE, languageEvaluator.evaluate(candidate, job));
        components.put(ScoreComponent.AVAILABILITY, availabilityEvaluator.evaluate(candidate, job));
        components.put(ScoreComponent.PREFERENCES, preferenceEvaluator.evaluate(candidate, job));

        double bonus = componentBonus(components);
        if (job.isCoupleFriendly() && candidate.hasLinkedPartner()) {
            bonus += COUPLE_FRIENDLY_BONUS;
        }
        MatchResult result = build(candidate.getId(), SubjectType.CANDIDATE, job, components, bonus);
        log.debug("Scored candidateId={} jobId={} overall={}", candidate.getId(), job.getId(), result.getOverallScore());
        return result;
    }

    public CoupleMatchResult scoreCouple(CandidateProfile a, CandidateProfile b, JobPosting job, SkillTaxonomy taxonomy) {
        OverlapMode mode = job.getCoupleSkillOverlap() != null ? job.getCoupleSkillOverlap() : OverlapMode.EITHER;
        return scoreCouple(a, b, job, taxonomy, mode);
    }

    /**
     * Scores a couple against one job. Skills follow the overlap mode, language takes the better
     * partner per language, location and availability take the lower partner; experience and
     * preferences stay individual.
     */
    public CoupleMatchResult scoreCouple(CandidateProfile a, CandidateProfile b, JobPosting job,
                                         SkillTaxonomy taxonomy, OverlapMode mode) {
        Map<ScoreComponent, Double> shared = new EnumMap<>(ScoreComponent.class);
        shared.put(ScoreComponent.SKILLS, skillEvaluator.evaluateCouple(
                a.getSkills(), b.getSkills(), job.getSkillRequirements(), taxonomy, mode));
        shared.put(ScoreComponent.LANGUAGE, languageEvaluator.evaluateCouple(a, b, job));
        shared.put(ScoreComponent.LOCATION, locationEvaluator.evaluateCouple(a, b, job));
        shared.put(ScoreComponent.AVAILABILITY, availabilityEvaluator.evaluateCouple(a, b, job));

        MatchResult partnerA = partnerResult(a, job, shared);
        MatchResult partnerB = partnerResult(b, job, shared);

        double combined = (partnerA.getOverallScore() + partnerB.getOverallScore()) / 2.0;
        if (job.isCoupleFriendly()) {
            combined += COUPLE_FRIENDLY_BONUS;
        }
        combined = ScoreUtils.round2(ScoreUtils.clamp(combined));

        return CoupleMatchResult.builder()
                .coupleId(BasicUtility.coupleId(a.getId(), b.getId()))
                .jobId(job.getId())
                .candidateAId(a.getId())
                .candidateBId(b.getId())
                .overlapMode(mode)
                .partnerA(partnerA)
                .partnerB(partnerB)
                .sharedComponentScores(Collections.unmodifiableMap(shared))
                .combinedScore(combined)
                .computedAt(Instant.now(clock))
                .build();
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    private MatchResult partnerResult(CandidateProfile partner, JobPosting job, Map<ScoreComponent, Double> shared) {
        Map<ScoreComponent, Double> components = new EnumMap<>(shared);
        components.put(ScoreComponent.EXPERIENCE, experienceEvaluator.evaluate(partner, job));
        components.put(ScoreComponent.PREFERENCES, preferenceEvaluator.evaluate(partner, job));
        return build(partner.getId(), SubjectType.CANDIDATE, job, components, componentBonus(components));
    }

    private MatchResult build(UUID subjectId, SubjectType type, JobPosting job,
                              Map<ScoreComponent, Double> components, double bonus) {
        double weighted = 0.0;
        for (Map.Entry<ScoreComponent, Double> entry : components.entrySet()) {
            weighted += ScoreUtils.clamp(entry.getValue()) * weights.weight(entry.getKey());
        }
        double overall = ScoreUtils.round2(ScoreUtils.clamp(weighted + bonus));

        return MatchResult.builder()
                .subjectId(subjectId)
                .subjectType(type)
                .jobId(job.getId())
                .componentScores(Collections.unmodifiableMap(components))
                .bonus(bonus)
                .overallScore(overall)
                .configVersion(weights.version())
                .computedAt(Instant.now(clock))
                .build();
    }

    private double componentBonus(Map<ScoreComponent, Double> components) {
        double bonus = 0.0;
        long strong = components.values().stream().filter(v -> v > STRONG_COMPONENT_THRESHOLD).count();
        if (strong >= STRONG_COMPONENT_COUNT) {
            bonus += STRONG_COMPONENTS_BONUS;
        }
        if (components.getOrDefault(ScoreComponent.SKILLS, 0.0) >= EXCELLENT_SKILLS_THRESHOLD) {
            bonus += EXCELLENT_SKILLS_BONUS;
        }
        return bonus;
    }
}
