package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.GeoPoint;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.utils.geo.GeoUtils;
import org.springframework.stereotype.Component;

@Component
public class LocationEvaluator implements AttributeEvaluator {
    public static final double NEUTRAL_SCORE = 50.0;

    @Override
    public ScoreComponent component() {
        return ScoreComponent.LOCATION;
    }

    @Override
    public double evaluate(CandidateProfile candidate, JobPosting job) {
        GeoPoint from = candidate.getLocation();
        GeoPoint to = job.getLocation();
        if (from == null || to == null || !from.isValid() || !to.isValid()) {
            return NEUTRAL_SCORE;
        }
        return scoreForDistance(GeoUtils.haversineKm(from, to), candidate.isAcceptsRelocation());
    }

    static double scoreForDistance(double km, boolean acceptsRelocation) {
        if (km <= 5) return 100.0;
        if (km <= 15) return 90.0;
        if (km <= 30) return 75.0;
        if (km <= 50) return 60.0;
        if (km <= 100) return 40.0;
        return acceptsRelocation ? 20.0 : 10.0;
    }
}
