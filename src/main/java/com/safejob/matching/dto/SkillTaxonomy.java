package com.safejob.matching.dto;

import java.util.Map;

/**
 * Snapshot of the skill taxonomy. An empty taxonomy means the taxonomy service had nothing to
 * offer, in which case every skill id is treated as known.
 */
public record SkillTaxonomy(String version, Map<String, String> skills) {

    private static final SkillTaxonomy PERMISSIVE = new SkillTaxonomy("none", Map.of());

    public static SkillTaxonomy permissive() {
        return PERMISSIVE;
    }

    public boolean isKnown(String skillId) {
        if (skillId == null) return false;
        return skills == null || skills.isEmpty() || skills.containsKey(skillId);
    }
}
