package com.safejob.matching.dto;

import com.safejob.matching.dto.enums.CoupleLinkStatus;
import com.safejob.matching.dto.enums.LanguageLevel;
import com.safejob.matching.dto.enums.WorkType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only snapshot of a candidate as served by the profile service.
 * Any field may be absent; evaluators fall back to neutral values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateProfile {
    private UUID id;
    private long version;
    private List<CandidateSkill> skills;
    private Map<String, LanguageLevel> languages;
    private GeoPoint location;
    private Double experienceYears;
    private LocalDate availableFrom;
    private List<String> preferredLocations;
    private Set<WorkType> workTypePreferences;
    private boolean acceptsRelocation;
    private boolean hasOwnTransport;
    private UUID partnerId;
    private CoupleLinkStatus coupleStatus;

    public boolean hasLinkedPartner() {
        return partnerId != null && coupleStatus == CoupleLinkStatus.LINKED;
    }
}
