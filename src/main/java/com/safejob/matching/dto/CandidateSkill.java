package com.safejob.matching.dto;

import com.safejob.matching.dto.enums.ProficiencyLevel;

public record CandidateSkill(String skillId, ProficiencyLevel level) {}
