package com.ogt.jobs.controller;

import com.ogt.jobs.dto.JobSubmissionResponse;
import com.ogt.jobs.dto.ValidationPreviewResponse;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.service.ImportService;
import com.ogt.jobs.service.SubmissionOptions;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/jobs/import")
@RequiredArgsConstructor
public class ImportController {

    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final ImportService importService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<JobSubmissionResponse> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam("type") JobType type,
            @RequestParam("scopeId") String scopeId,
            @RequestParam(value = "priority", required = false) Integer priority,
            @RequestParam(value = "async", required = false) Boolean async,
            @RequestParam(value = "createdBy", required = false) String createdBy
    ) {
        SubmissionOptions options = SubmissionOptions.builder()
                .priority(priority)
                .async(async)
                .createdBy(createdBy)
                .build();
        JobSubmissionResponse response = importService.importFile(file, type, scopeId, options);
        return response.getJob() != null
                ? ResponseEntity.ok(response)
                : ResponseEntity.accepted().body(response);
    }

    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ValidationPreviewResponse> validate(
            @RequestParam("file") MultipartFile file,
            @RequestParam("type") JobType type
    ) {
        return ResponseEntity.ok(importService.preview(file, type));
    }

    @GetMapping("/template")
    public ResponseEntity<byte[]> template(@RequestParam("type") JobType type) {
        String fileName = type.name().toLowerCase() + "-template.xlsx";
        return ResponseEntity.ok()
                .contentType(XLSX)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(fileName).build().toString())
                .body(importService.template(type));
    }
}
