package com.ogt.jobs.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ArtifactDownload {

    private final String fileName;
    private final String contentType;
    private final byte[] content;
}
