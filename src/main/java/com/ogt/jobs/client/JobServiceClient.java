package com.ogt.jobs.client;

import com.ogt.jobs.dto.JobStatusResponse;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.UUID;

/**
 * Cliente HTTP mínimo para que otros servicios esperen un job de este servicio.
 */
public class JobServiceClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public JobServiceClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public JobStatusResponse getStatus(UUID jobId) {
        return restTemplate.getForObject(baseUrl + "/api/jobs/{id}", JobStatusResponse.class, jobId);
    }

    public PollOutcome awaitCompletion(UUID jobId, Duration maxWait) throws InterruptedException {
        return new JobStatusPoller(this::getStatus).await(jobId, maxWait);
    }
}
