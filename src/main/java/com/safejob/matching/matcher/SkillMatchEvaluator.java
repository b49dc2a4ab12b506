package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateSkill;
import com.safejob.matching.dto.SkillRequirement;
import com.safejob.matching.dto.SkillTaxonomy;
import com.safejob.matching.dto.enums.OverlapMode;
import com.safejob.matching.dto.enums.ProficiencyLevel;
import com.safejob.matching.dto.enums.SkillImportance;
import com.safejob.matching.utils.basic.ScoreUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Weighted share of a job's skill requirements that a candidate, or a couple, satisfies.
 * <p>
 * Requirement weights come from the importance band (3.0 required, 2.0 preferred, 1.0 nice to have)
 * unless the posting sets its own 1-10 weight, which is rescaled linearly onto the same 1.0-3.0 range.
 * A skill held below the requested level earns partial credit in proportion to the level ranks.
 * Requirements referring to skills the taxonomy no longer knows are ignored on both sides of the ratio.
 * </p>
 */
@Slf4j
@Component
public class SkillMatchEvaluator {
    public static final double NO_REQUIREMENTS_SCORE = 80.0;

    private static final double MIN_BAND_WEIGHT = 1.0;
    private static final double MAX_BAND_WEIGHT = 3.0;
    private static final int MIN_OVERRIDE = 1;
    private static final int MAX_OVERRIDE = 10;

    public double evaluate(Collection<CandidateSkill> candidateSkills,
                           Collection<SkillRequirement> requirements,
                           SkillTaxonomy taxonomy) {
        Map<String, ProficiencyLevel> held = index(candidateSkills);
        return score(requirements, taxonomy, req -> credit(held, req));
    }

    public double evaluateCouple(Collection<CandidateSkill> skillsA,
                                 Collection<CandidateSkill> skillsB,
                                 Collection<SkillRequirement> requirements,
                                 SkillTaxonomy taxonomy,
                                 OverlapMode mode) {
        Map<String, ProficiencyLevel> heldA = index(skillsA);
        Map<String, ProficiencyLevel> heldB = index(skillsB);
        return score(requirements, taxonomy, req -> {
            double a = credit(heldA, req);
            double b = credit(heldB, req);
            return mode == OverlapMode.BOTH ? Math.min(a, b) : Math.max(a, b);
        });
    }

    static double weightOf(SkillRequirement requirement) {
        Integer override = requirement.getWeight();
        if (override != null) {
            int w = Math.max(MIN_OVERRIDE, Math.min(MAX_OVERRIDE, override));
            return MIN_BAND_WEIGHT + (w - MIN_OVERRIDE) * (MAX_BAND_WEIGHT - MIN_BAND_WEIGHT) / (MAX_OVERRIDE - MIN_OVERRIDE);
        }
        SkillImportance importance = requirement.getImportance() != null
                ? requirement.getImportance()
                : SkillImportance.NICE_TO_HAVE;
        return importance.getDefaultWeight();
    }

    private double score(Collection<SkillRequirement> requirements,
                         SkillTaxonomy taxonomy,
                         ToDoubleFunction<SkillRequirement> credit) {
        if (requirements == null || requirements.isEmpty()) {
            return NO_REQUIREMENTS_SCORE;
        }
        SkillTaxonomy tax = taxonomy != null ? taxonomy : SkillTaxonomy.permissive();

        double totalWeight = 0.0;
        double matchedWeight = 0.0;
        for (SkillRequirement req : requirements) {
            if (req == null || !tax.isKnown(req.getSkillId())) {
                log.debug("Ignoring requirement with unknown skill id {}", req != null ? req.getSkillId() : null);
                continue;
            }
            double weight = weightOf(req);
            totalWeight += weight;
            matchedWeight += weight * credit.applyAsDouble(req);
        }

        if (totalWeight <= 0.0) {
            return NO_REQUIREMENTS_SCORE;
        }
        return ScoreUtils.clamp(matchedWeight / totalWeight * 100.0);
    }

    private double credit(Map<String, ProficiencyLevel> held, SkillRequirement req) {
        if (!held.containsKey(req.getSkillId())) return 0.0;
        ProficiencyLevel candidateLevel = held.get(req.getSkillId());
        ProficiencyLevel requiredLevel = req.getLevel();
        if (requiredLevel == null) return 1.0;
        return Math.min(1.0, (double) candidateLevel.getRank() / requiredLevel.getRank());
    }

    private Map<String, ProficiencyLevel> index(Collection<CandidateSkill> skills) {
        Map<String, ProficiencyLevel> held = new HashMap<>();
        for (CandidateSkill skill : skills != null ? skills : List.<CandidateSkill>of()) {
            if (skill == null || skill.skillId() == null) continue;
            held.merge(skill.skillId(), skill.level() != null ? skill.level() : ProficiencyLevel.BEGINNER,
                    (x, y) -> x.getRank() >= y.getRank() ? x : y);
        }
        return held;
    }
}
