package com.safejob.matching.client;

import com.safejob.matching.dto.CandidateProfile;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
public class RestCandidateSnapshotClient implements CandidateSnapshotClient {
    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestCandidateSnapshotClient(
            @Qualifier("snapshotRestTemplate") RestTemplate restTemplate,
            @Value("${clients.profile-service.base-url:http://localhost:8081}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    @Retry(name = "profileService")
    public Optional<CandidateProfile> fetch(UUID candidateId) {
        try {
            CandidateProfile profile = restTemplate.getForObject(
                    baseUrl + "/internal/candidates/{id}/snapshot", CandidateProfile.class, candidateId);
            return Optional.ofNullable(profile);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Candidate snapshot not found for candidateId={}", candidateId);
            return Optional.empty();
        }
    }
}
