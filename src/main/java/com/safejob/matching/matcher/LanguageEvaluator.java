package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.enums.LanguageLevel;
import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.utils.basic.ScoreUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Blends per-language scores across a job's language requirements. The job's primary-market
 * language counts double.
 */
@Component
public class LanguageEvaluator implements AttributeEvaluator {
    public static final double NO_REQUIREMENTS_SCORE = 100.0;
    private static final double PRIMARY_LANGUAGE_WEIGHT = 2.0;
    private static final double SECONDARY_LANGUAGE_WEIGHT = 1.0;
    private static final double FLOOR = 20.0;
    private static final double SHORTFALL_CEILING = 80.0;

    @Override
    public ScoreComponent component() {
        return ScoreComponent.LANGUAGE;
    }

    @Override
    public double evaluate(CandidateProfile candidate, JobPosting job) {
        Map<String, LanguageLevel> spoken = candidate.getLanguages();
        return blend(job, lang -> levelOf(spoken, lang));
    }

    /**
     * For couples each language is scored against whichever partner speaks it better.
     */
    @Override
    public double evaluateCouple(CandidateProfile a, CandidateProfile b, JobPosting job) {
        return blend(job, lang -> {
            LanguageLevel la = levelOf(a.getLanguages(), lang);
            LanguageLevel lb = levelOf(b.getLanguages(), lang);
            return la.getScore() >= lb.getScore() ? la : lb;
        });
    }

    static double languageScore(LanguageLevel candidate, LanguageLevel required) {
        if (candidate.getScore() >= required.getScore()) return 100.0;
        return Math.max(FLOOR, (double) candidate.getScore() / required.getScore() * SHORTFALL_CEILING);
    }

    private double blend(JobPosting job, Function<String, LanguageLevel> levelFor) {
        Map<String, LanguageLevel> required = job.getLanguageRequirements();
        if (required == null || required.isEmpty()) {
            return NO_REQUIREMENTS_SCORE;
        }
        String primary = normalize(job.getPrimaryLanguage());

        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<String, LanguageLevel> entry : required.entrySet()) {
            if (entry.getKey() == null) continue;
            LanguageLevel requiredLevel = entry.getValue() != null ? entry.getValue() : LanguageLevel.NONE;
            String lang = normalize(entry.getKey());
            double weight = lang.equals(primary) ? PRIMARY_LANGUAGE_WEIGHT : SECONDARY_LANGUAGE_WEIGHT;
            weighted += weight * languageScore(levelFor.apply(lang), requiredLevel);
            totalWeight += weight;
        }
        return totalWeight > 0 ? ScoreUtils.clamp(weighted / totalWeight) : NO_REQUIREMENTS_SCORE;
    }

    private static LanguageLevel levelOf(Map<String, LanguageLevel> spoken, String lang) {
        if (spoken == null || spoken.isEmpty()) return LanguageLevel.NONE;
        for (Map.Entry<String, LanguageLevel> entry : spoken.entrySet()) {
            if (entry.getKey() != null && normalize(entry.getKey()).equals(lang) && entry.getValue() != null) {
                return entry.getValue();
            }
        }
        return LanguageLevel.NONE;
    }

    private static String normalize(String lang) {
        return lang == null ? "" : lang.trim().toLowerCase(Locale.ROOT);
    }
}
