package com.ogt.jobs.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.config.WorkerIdentity;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

import java.nio.file.Path;
import java.time.Instant;

@TestConfiguration
public class JobTestConfig {

    public static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    @Bean
    public MutableClock clock() {
        return new MutableClock(START);
    }

    @Bean
    public JobProperties jobProperties() {
        JobProperties properties = new JobProperties();
        properties.getArtifacts().setDir(Path.of(System.getProperty("java.io.tmpdir"),
                "ogt-job-artifacts-test").toString());
        return properties;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public WorkerIdentity workerIdentity() {
        return new WorkerIdentity("test-worker");
    }

    @Bean
    public LocalValidatorFactoryBean validator() {
        return new LocalValidatorFactoryBean();
    }
}
