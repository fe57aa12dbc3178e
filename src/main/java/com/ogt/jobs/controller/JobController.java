package com.ogt.jobs.controller;

import com.ogt.jobs.dto.*;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.service.ArtifactDownload;
import com.ogt.jobs.service.JobControlService;
import com.ogt.jobs.service.JobSubmissionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobSubmissionService submissionService;
    private final JobControlService controlService;

    @PostMapping
    public ResponseEntity<JobSubmissionResponse> submit(@Valid @RequestBody SubmitJobRequest request) {
        JobSubmissionResponse response = submissionService.submit(request);
        return response.getJob() != null
                ? ResponseEntity.ok(response)
                : ResponseEntity.accepted().body(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<JobStatusResponse> getStatus(@PathVariable UUID id) {
        return ResponseEntity.ok(controlService.getStatus(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<JobActionResponse> cancel(@PathVariable UUID id) {
        return ResponseEntity.ok(controlService.cancel(id));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<JobActionResponse> retry(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(controlService.retry(id));
    }

    @GetMapping("/{id}/artifact")
    public ResponseEntity<byte[]> downloadArtifact(@PathVariable UUID id) {
        ArtifactDownload artifact = controlService.getArtifact(id);
        MediaType contentType = artifact.getContentType() != null
                ? MediaType.parseMediaType(artifact.getContentType())
                : MediaType.APPLICATION_OCTET_STREAM;
        return ResponseEntity.ok()
                .contentType(contentType)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.getFileName()).build().toString())
                .body(artifact.getContent());
    }

    // ========== GESTIÓN ==========

    @GetMapping
    public ResponseEntity<Page<JobStatusResponse>> list(
            @RequestParam(value = "scopeId", required = false) String scopeId,
            @RequestParam(value = "type", required = false) JobType type,
            @RequestParam(value = "status", required = false) JobStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(controlService.list(scopeId, type, status, page, size));
    }

    @GetMapping("/active")
    public ResponseEntity<List<JobStatusResponse>> active(
            @RequestParam(value = "scopeId", required = false) String scopeId) {
        return ResponseEntity.ok(controlService.active(scopeId));
    }

    @GetMapping("/stats")
    public ResponseEntity<JobStatsDTO> stats(@RequestParam(value = "scopeId", required = false) String scopeId) {
        return ResponseEntity.ok(controlService.stats(scopeId));
    }
}
