package com.safejob.matching.client;

import com.safejob.matching.dto.SkillTaxonomy;

public interface SkillTaxonomyClient {

    SkillTaxonomy fetch();
}
