package com.ogt.jobs.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatsDTO {

    private long total;

    @Builder.Default
    private Map<String, Long> byStatus = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> byType = new LinkedHashMap<>();

    @Builder.Default
    private List<JobStatusResponse> recent = new ArrayList<>();
}
