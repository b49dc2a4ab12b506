package com.safejob.matching.matcher;

import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.utils.basic.ScoreUtils;
import org.springframework.stereotype.Component;

/**
 * Soft preferences around transport, accommodation and remote work.
 */
@Component
public class PreferenceEvaluator implements AttributeEvaluator {
    private static final double BASE = 50.0;
    private static final double TRANSPORT_PROVIDED = 10.0;
    private static final double NO_TRANSPORT = -20.0;
    private static final double ACCOMMODATION_PROVIDED = 15.0;
    private static final double REMOTE_CAPABLE = 10.0;

    @Override
    public ScoreComponent component() {
        return ScoreComponent.PREFERENCES;
    }

    @Override
    public double evaluate(CandidateProfile candidate, JobPosting job) {
        double score = BASE;
        if (job.isProvidesTransport()) {
            score += TRANSPORT_PROVIDED;
        } else if (!candidate.isHasOwnTransport()) {
            score += NO_TRANSPORT;
        }
        if (job.isProvidesAccommodation()) score += ACCOMMODATION_PROVIDED;
        if (job.isRemoteCapable()) score += REMOTE_CAPABLE;
        return ScoreUtils.clamp(score);
    }
}
