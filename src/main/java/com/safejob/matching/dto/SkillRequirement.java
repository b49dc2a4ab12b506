package com.safejob.matching.dto;

import com.safejob.matching.dto.enums.ProficiencyLevel;
import com.safejob.matching.dto.enums.SkillImportance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillRequirement {
    private String skillId;
    private ProficiencyLevel level;
    private SkillImportance importance;

    /** Optional posting-specific weight on a 1-10 scale; overrides the importance band when set. */
    private Integer weight;
}
