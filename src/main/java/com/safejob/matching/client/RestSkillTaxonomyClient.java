package com.safejob.matching.client;

import com.safejob.matching.dto.SkillTaxonomy;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
public class RestSkillTaxonomyClient implements SkillTaxonomyClient {
    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestSkillTaxonomyClient(
            @Qualifier("snapshotRestTemplate") RestTemplate restTemplate,
            @Value("${clients.taxonomy-service.base-url:http://localhost:8083}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    @Retry(name = "taxonomyService")
    public SkillTaxonomy fetch() {
        SkillTaxonomy taxonomy = restTemplate.getForObject(baseUrl + "/internal/skills/taxonomy", SkillTaxonomy.class);
        return taxonomy != null ? taxonomy : SkillTaxonomy.permissive();
    }
}
