package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.GeoPoint;
import com.safejob.matching.dto.JobPosting;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LocationEvaluatorTest {

    private final LocationEvaluator evaluator = new LocationEvaluator();

    @Test
    void shouldScoreNinetyForTwelveKilometres() {
        // 0.1079 degrees of latitude is roughly 12 km
        CandidateProfile candidate = CandidateProfile.builder()
                .location(new GeoPoint(52.0, 5.0))
                .acceptsRelocation(false)
                .build();
        JobPosting job = JobPosting.builder().location(new GeoPoint(52.1079, 5.0)).build();

        assertEquals(90.0, evaluator.evaluate(candidate, job), 1e-9);
    }

    @Test
    void shouldReturnNeutralWhenEitherLocationIsMissing() {
        CandidateProfile candidate = CandidateProfile.builder().build();
        JobPosting job = JobPosting.builder().location(new GeoPoint(52.0, 5.0)).build();

        assertEquals(LocationEvaluator.NEUTRAL_SCORE, evaluator.evaluate(candidate, job), 1e-9);
    }

    @Test
    void shouldReturnNeutralForInvalidCoordinates() {
        CandidateProfile candidate = CandidateProfile.builder().location(new GeoPoint(120.0, 5.0)).build();
        JobPosting job = JobPosting.builder().location(new GeoPoint(52.0, 5.0)).build();

        assertEquals(LocationEvaluator.NEUTRAL_SCORE, evaluator.evaluate(candidate, job), 1e-9);
    }

    @Test
    void shouldApplyDistanceBands() {
        assertEquals(100.0, LocationEvaluator.scoreForDistance(5.0, false));
        assertEquals(75.0, LocationEvaluator.scoreForDistance(29.9, false));
        assertEquals(60.0, LocationEvaluator.scoreForDistance(50.0, false));
        assertEquals(40.0, LocationEvaluator.scoreForDistance(100.0, false));
    }

    @Test
    void shouldPreferRelocatingCandidatesBeyondHundredKilometres() {
        assertEquals(20.0, LocationEvaluator.scoreForDistance(400.0, true));
        assertEquals(10.0, LocationEvaluator.scoreForDistance(400.0, false));
    }
}
