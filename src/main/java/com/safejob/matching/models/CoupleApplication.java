package com.safejob.matching.models;

import com.safejob.matching.dto.enums.CoupleApplicationStatus;
import com.safejob.matching.dto.enums.OverlapMode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Joint application of two linked candidates. {@code candidateAId} is the partner who started it.
 * The ordered pair columns carry the uniqueness of one record per job and unordered pair.
 */
@Data
@Entity
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Table(name = "couple_applications",
        uniqueConstraints = @UniqueConstraint(name = "uq_couple_application_job_pair",
                columnNames = {"job_id", "pair_low_id", "pair_high_id"}),
        indexes = @Index(name = "idx_couple_applications_status_deadline", columnList = "status,deadline"))
public class CoupleApplication {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "candidate_a_id", nullable = false)
    private UUID candidateAId;

    @Column(name = "candidate_b_id", nullable = false)
    private UUID candidateBId;

    @Column(name = "pair_low_id", nullable = false)
    private UUID pairLowId;

    @Column(name = "pair_high_id", nullable = false)
    private UUID pairHighId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private CoupleApplicationStatus status;

    @Column(name = "confirmed_by_a", nullable = false)
    private boolean confirmedByA;

    @Column(name = "confirmed_by_b", nullable = false)
    private boolean confirmedByB;

    @Column(name = "deadline")
    private Instant deadline;

    @Column(name = "combined_score")
    private Double combinedScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "overlap_mode", length = 16)
    private OverlapMode overlapMode;

    @Column(name = "application_a_id")
    private UUID applicationAId;

    @Column(name = "application_b_id")
    private UUID applicationBId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean involves(UUID candidateId) {
        return candidateAId.equals(candidateId) || candidateBId.equals(candidateId);
    }

    public boolean isPartnerA(UUID candidateId) {
        return candidateAId.equals(candidateId);
    }

    public UUID partnerOf(UUID candidateId) {
        return isPartnerA(candidateId) ? candidateBId : candidateAId;
    }
}
