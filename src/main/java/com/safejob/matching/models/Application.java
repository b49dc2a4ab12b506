package com.safejob.matching.models;

import com.safejob.matching.dto.enums.ApplicationStatus;
import com.safejob.matching.dto.enums.ScoreComponent;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Entity
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Table(name = "applications", indexes = {
        @Index(name = "idx_applications_candidate_id", columnList = "candidate_id"),
        @Index(name = "idx_applications_job_id", columnList = "job_id"),
        @Index(name = "idx_applications_couple_application_id", columnList = "couple_application_id")
})
public class Application {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "candidate_id", nullable = false)
    private UUID candidateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ApplicationStatus status;

    @Convert(converter = ComponentScoresConverter.class)
    @Column(name = "component_scores", length = 1024)
    private Map<ScoreComponent, Double> componentScores;

    @Column(name = "overall_score")
    private Double overallScore;

    @Column(name = "couple_application_id")
    private UUID coupleApplicationId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
