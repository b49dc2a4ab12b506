package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.enums.WorkType;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AvailabilityEvaluatorTest {

    private final AvailabilityEvaluator evaluator = new AvailabilityEvaluator();

    @Test
    void shouldScoreMatchingAndMismatchingWorkTypes() {
        CandidateProfile candidate = CandidateProfile.builder()
                .workTypePreferences(Set.of(WorkType.FULL_TIME))
                .build();

        assertEquals(100.0, evaluator.evaluate(candidate, JobPosting.builder().workType(WorkType.FULL_TIME).build()));
        assertEquals(40.0, evaluator.evaluate(candidate, JobPosting.builder().workType(WorkType.SEASONAL).build()));
    }

    @Test
    void shouldReturnNeutralWithoutPreferencesOrWorkType() {
        CandidateProfile noPreferences = CandidateProfile.builder().build();
        CandidateProfile withPreferences = CandidateProfile.builder()
                .workTypePreferences(Set.of(WorkType.FULL_TIME))
                .build();

        assertEquals(80.0, evaluator.evaluate(noPreferences, JobPosting.builder().workType(WorkType.FULL_TIME).build()));
        assertEquals(80.0, evaluator.evaluate(withPreferences, JobPosting.builder().build()));
    }

    @Test
    void shouldTakeLowerPartnerForCouples() {
        CandidateProfile a = CandidateProfile.builder().workTypePreferences(Set.of(WorkType.FULL_TIME)).build();
        CandidateProfile b = CandidateProfile.builder().workTypePreferences(Set.of(WorkType.SEASONAL)).build();
        JobPosting job = JobPosting.builder().workType(WorkType.FULL_TIME).build();

        assertEquals(40.0, evaluator.evaluateCouple(a, b, job));
    }
}
