package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.enums.ScoreComponent;

/**
 * Scores one non-skill attribute of a candidate/job pair on the 0-100 scale. Implementations are
 * stateless and fall back to a neutral value when input fields are missing.
 */
public interface AttributeEvaluator {

    ScoreComponent component();

    double evaluate(CandidateProfile candidate, JobPosting job);

    /**
     * Score for a couple applying together. Defaults to the more restrictive of the two partners.
     */
    default double evaluateCouple(CandidateProfile a, CandidateProfile b, JobPosting job) {
        return Math.min(evaluate(a, job), evaluate(b, job));
    }
}
