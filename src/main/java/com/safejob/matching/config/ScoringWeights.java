package com.safejob.matching.config;

import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.exceptions.InvalidScoringConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validated weight vector used by the scorer. Weights must cover every component, be non-negative
 * and sum to 1.0; anything else is rejected, never normalised.
 */
public final class ScoringWeights {
    private static final double SUM_TOLERANCE = 1e-6;

    private final Map<ScoreComponent, Double> weights;
    private final String version;

    private ScoringWeights(Map<ScoreComponent, Double> weights) {
        this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
        this.version = this.weights.entrySet().stream()
                .map(e -> e.getKey().getKey() + "=" + String.format(Locale.ROOT, "%.4f", e.getValue()))
                .collect(Collectors.joining(","));
    }

    public static ScoringWeights defaults() {
        Map<ScoreComponent, Double> w = new EnumMap<>(ScoreComponent.class);
        w.put(ScoreComponent.SKILLS, 0.35);
        w.put(ScoreComponent.LOCATION, 0.20);
        w.put(ScoreComponent.EXPERIENCE, 0.15);
        w.put(ScoreComponent.LANGUAGE, 0.15);
        w.put(ScoreComponent.AVAILABILITY, 0.10);
        w.put(ScoreComponent.PREFERENCES, 0.05);
        return of(w);
    }

    public static ScoringWeights of(Map<ScoreComponent, Double> weights) {
        if (weights == null) {
            throw new InvalidScoringConfigurationException("Scoring weights are missing");
        }
        double sum = 0.0;
        for (ScoreComponent component : ScoreComponent.values()) {
            Double weight = weights.get(component);
            if (weight == null || weight.isNaN()) {
                throw new InvalidScoringConfigurationException("Missing weight for component " + component.getKey());
            }
            if (weight < 0.0) {
                throw new InvalidScoringConfigurationException(
                        "Negative weight " + weight + " for component " + component.getKey());
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidScoringConfigurationException("Scoring weights must sum to 1.0 but sum to " + sum);
        }
        return new ScoringWeights(weights);
    }

    public double weight(ScoreComponent component) {
        return weights.get(component);
    }

    public Map<ScoreComponent, Double> asMap() {
        return weights;
    }

    /** Stable textual fingerprint of the vector; part of every cache key. */
    public String version() {
        return version;
    }

    @Override
    public String toString() {
        return "ScoringWeights{" + version + "}";
    }
}
