package com.ogt.jobs.service;

import com.ogt.jobs.config.JobProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

@Slf4j
@Service
public class FileSystemArtifactStore implements ArtifactStore {

    private final Path baseDir;

    public FileSystemArtifactStore(JobProperties properties) {
        this.baseDir = Path.of(properties.getArtifacts().getDir()).toAbsolutePath().normalize();
    }

    @Override
    public String store(UUID jobId, String fileName, byte[] content) throws IOException {
        Path jobDir = baseDir.resolve(jobId.toString());
        if (!Files.exists(jobDir)) Files.createDirectories(jobDir);

        // Mismo nombre dentro del job: se reemplaza
        Path target = jobDir.resolve(Path.of(fileName).getFileName().toString());
        Files.write(target, content);

        log.info("💾 Artefacto guardado: {} ({} bytes)", target, content.length);
        return baseDir.relativize(target).toString().replace('\\', '/');
    }

    @Override
    public byte[] load(String artifactRef) throws IOException {
        return Files.readAllBytes(resolve(artifactRef));
    }

    @Override
    public void delete(String artifactRef) throws IOException {
        Path file = resolve(artifactRef);
        Files.deleteIfExists(file);
        Path parent = file.getParent();
        if (parent != null && !parent.equals(baseDir) && Files.isDirectory(parent)) {
            try (var entries = Files.list(parent)) {
                if (entries.findAny().isEmpty()) Files.deleteIfExists(parent);
            }
        }
    }

    private Path resolve(String artifactRef) throws IOException {
        Path file = baseDir.resolve(artifactRef).normalize();
        if (!file.startsWith(baseDir)) {
            throw new IOException("Artifact reference outside of the artifact directory: " + artifactRef);
        }
        return file;
    }
}
