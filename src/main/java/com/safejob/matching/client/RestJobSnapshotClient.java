package com.safejob.matching.client;

import com.safejob.matching.dto.JobPosting;
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
public class RestJobSnapshotClient implements JobSnapshotClient {
    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestJobSnapshotClient(
            @Qualifier("snapshotRestTemplate") RestTemplate restTemplate,
            @Value("${clients.job-service.base-url:http://localhost:8082}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    @Retry(name = "jobService")
    public Optional<JobPosting> fetch(UUID jobId) {
        try {
            JobPosting job = restTemplate.getForObject(baseUrl + "/internal/jobs/{id}/snapshot", JobPosting.class, jobId);
            return Optional.ofNullable(job);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Job snapshot not found for jobId={}", jobId);
            return Optional.empty();
        }
    }
}
