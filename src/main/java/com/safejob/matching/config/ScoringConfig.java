package com.safejob.matching.config;

import com.safejob.matching.dto.enums.ScoreComponent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;


@Slf4j
@Configuration
public class ScoringConfig {

    @Value("${matching.weights.skills:0.35}")
    private double skills;

    @Value("${matching.weights.location:0.20}")
    private double location;

    @Value("${matching.weights.experience:0.15}")
    private double experience;

    @Value("${matching.weights.language:0.15}")
    private double language;

    @Value("${matching.weights.availability:0.10}")
    private double availability;

    @Value("${matching.weights.preferences:0.05}")
    private double preferences;

    @Bean
    public ScoringWeights scoringWeights() {
        Map<ScoreComponent, Double> weights = new EnumMap<>(ScoreComponent.class);
        weights.put(ScoreComponent.SKILLS, skills);
        weights.put(ScoreComponent.LOCATION, location);
        weights.put(ScoreComponent.EXPERIENCE, experience);
        weights.put(ScoreComponent.LANGUAGE, language);
        weights.put(ScoreComponent.AVAILABILITY, availability);
        weights.put(ScoreComponent.PREFERENCES, preferences);

        ScoringWeights validated = ScoringWeights.of(weights);
        log.info("Loaded scoring weights {}", validated.version());
        return validated;
    }
}
