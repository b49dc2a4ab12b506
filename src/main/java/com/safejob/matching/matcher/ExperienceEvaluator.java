package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.enums.ScoreComponent;
import org.springframework.stereotype.Component;

@Component
public class ExperienceEvaluator implements AttributeEvaluator {
    public static final double NEUTRAL_SCORE = 50.0;
    private static final double MAX_RATIO = 2.0;

    @Override
    public ScoreComponent component() {
        return ScoreComponent.EXPERIENCE;
    }

    @Override
    public double evaluate(CandidateProfile candidate, JobPosting job) {
        Double required = job.getRequiredExperienceYears();
        if (required == null || required <= 0.0) return 100.0;

        Double years = candidate.getExperienceYears();
        if (years == null || years < 0.0 || years.isNaN()) return NEUTRAL_SCORE;

        double ratio = years / required;
        if (ratio >= 1.0) {
            return Math.min(100.0, 80.0 + (Math.min(ratio, MAX_RATIO) - 1.0) * 20.0);
        }
        return Math.max(20.0, ratio * 80.0);
    }
}
