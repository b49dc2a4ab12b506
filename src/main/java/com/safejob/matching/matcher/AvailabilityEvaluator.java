package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.dto.enums.WorkType;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class AvailabilityEvaluator implements AttributeEvaluator {
    public static final double NO_PREFERENCE_SCORE = 80.0;

    @Override
    public ScoreComponent component() {
        return ScoreComponent.AVAILABILITY;
    }

    @Override
    public double evaluate(CandidateProfile candidate, JobPosting job) {
        Set<WorkType> preferences = candidate.getWorkTypePreferences();
        WorkType offered = job.getWorkType();
        if (preferences == null || preferences.isEmpty() || offered == null) {
            return NO_PREFERENCE_SCORE;
        }
        return preferences.contains(offered) ? 100.0 : 40.0;
    }
}
