package com.ogt.jobs.repository;

import com.ogt.jobs.entity.JobPayload;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface JobPayloadRepository extends JpaRepository<JobPayload, UUID> {
}
