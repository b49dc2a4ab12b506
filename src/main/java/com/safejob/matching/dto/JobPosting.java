package com.safejob.matching.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.safejob.matching.dto.enums.JobStatus;
import com.safejob.matching.dto.enums.LanguageLevel;
import com.safejob.matching.dto.enums.OverlapMode;
import com.safejob.matching.dto.enums.WorkType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of a job posting as served by the job service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobPosting {
    private UUID id;
    private long version;
    private String title;
    private List<SkillRequirement> skillRequirements;
    private GeoPoint location;
    private Map<String, LanguageLevel> languageRequirements;
    private String primaryLanguage;
    private Double requiredExperienceYears;
    private WorkType workType;
    private boolean providesTransport;
    private boolean providesAccommodation;
    private boolean remoteCapable;
    private boolean coupleFriendly;
    private boolean mustBeCouple;
    private OverlapMode coupleSkillOverlap;
    private Integer maxCouplePositions;
    private JobStatus status;

    @JsonIgnore
    public boolean isPublished() {
        return status == JobStatus.PUBLISHED;
    }

    public boolean acceptsCouples() {
        return coupleFriendly || mustBeCouple;
    }
}
