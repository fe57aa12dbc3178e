package com.ogt.jobs.service;

import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.exception.InvalidJobTransitionException;
import com.ogt.jobs.repository.JobAttemptRepository;
import com.ogt.jobs.repository.JobRepository;
import com.ogt.jobs.support.JobTestConfig;
import com.ogt.jobs.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({JobTestConfig.class, JobStore.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JobStoreTest {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private JobAttemptRepository attemptRepository;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void cleanUp() {
        attemptRepository.deleteAll();
        jobRepository.deleteAll();
    }

    @Test
    void createdJobStartsPendingWithZeroProgress() {
        Job job = newJob(10);

        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getProcessedCount()).isZero();
        assertThat(job.getTotalCount()).isEqualTo(10);
        assertThat(job.getRetryCount()).isZero();
    }

    @Test
    void onlyOneClaimWinsAPendingJob() {
        Job job = newJob(5);

        Optional<JobLease> first = jobStore.claim(job.getId(), "worker-a:1");
        Optional<JobLease> second = jobStore.claim(job.getId(), "worker-b:1");

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        Job claimed = jobStore.get(job.getId());
        assertThat(claimed.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(claimed.getLeaseOwner()).isEqualTo("worker-a:1");
        assertThat(claimed.getLeaseExpiresAt()).isNotNull();
        assertThat(claimed.getStartedAt()).isNotNull();
    }

    @Test
    void claimNextPrefersLowerPriorityThenOlder() {
        Job older = newJob(1, 5);
        clock.advance(Duration.ofSeconds(1));
        Job urgent = newJob(1, 1);
        clock.advance(Duration.ofSeconds(1));
        newJob(1, 5);

        assertThat(jobStore.claimNext("w:1")).get().extracting(JobLease::getJobId).isEqualTo(urgent.getId());
        assertThat(jobStore.claimNext("w:2")).get().extracting(JobLease::getJobId).isEqualTo(older.getId());
        assertThat(jobStore.claimNext("w:3")).isPresent();
        assertThat(jobStore.claimNext("w:4")).isEmpty();
    }

    @Test
    void progressWritesRequireTheCurrentLease() {
        Job job = newJob(20);
        JobLease lease = jobStore.claim(job.getId(), "owner:1").orElseThrow();

        assertThat(jobStore.recordProgress(lease, 10, 9, 1, null)).isTrue();
        assertThat(jobStore.recordProgress(new JobLease(job.getId(), "intruder:1"), 15, 15, 0, null)).isFalse();

        Job current = jobStore.get(job.getId());
        assertThat(current.getProcessedCount()).isEqualTo(10);
        assertThat(current.getTotalCount()).isEqualTo(20);
    }

    @Test
    void progressNeverMovesBackwards() {
        Job job = newJob(20);
        JobLease lease = jobStore.claim(job.getId(), "owner:1").orElseThrow();
        jobStore.recordProgress(lease, 10, 10, 0, null);

        assertThat(jobStore.recordProgress(lease, 5, 5, 0, null)).isFalse();
        assertThat(jobStore.get(job.getId()).getProcessedCount()).isEqualTo(10);
    }

    @Test
    void renewalExtendsTheLease() {
        Job job = newJob(3);
        JobLease lease = jobStore.claim(job.getId(), "owner:1").orElseThrow();
        var firstExpiry = jobStore.get(job.getId()).getLeaseExpiresAt();

        clock.advance(Duration.ofSeconds(30));
        assertThat(jobStore.renewLease(lease)).isTrue();

        assertThat(jobStore.get(job.getId()).getLeaseExpiresAt()).isAfter(firstExpiry);
    }

    @Test
    void expiredLeaseIsRequeuedWithRetryCountUnchanged() {
        Job job = newJob(4);
        JobLease lease = jobStore.claim(job.getId(), "crashed:1").orElseThrow();
        jobStore.recordProgress(lease, 2, 2, 0, null);

        clock.advance(Duration.ofSeconds(59));
        assertThat(jobStore.requeueExpiredLeases()).isEmpty();

        clock.advance(Duration.ofSeconds(2));
        assertThat(jobStore.requeueExpiredLeases()).containsExactly(job.getId());

        Job requeued = jobStore.get(job.getId());
        assertThat(requeued.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(requeued.getRetryCount()).isZero();
        assertThat(requeued.getProcessedCount()).isZero();
        assertThat(requeued.getLeaseOwner()).isNull();
    }

    @Test
    void staleOwnerCannotCompleteAfterRequeue() {
        Job job = newJob(2);
        JobLease stale = jobStore.claim(job.getId(), "slow:1").orElseThrow();
        clock.advance(Duration.ofMinutes(2));
        jobStore.requeueExpiredLeases();
        JobLease fresh = jobStore.claim(job.getId(), "fresh:1").orElseThrow();

        assertThat(jobStore.complete(stale, 2, 2, 0, null, null, null)).isFalse();
        assertThat(jobStore.complete(fresh, 2, 2, 0, null, null, null)).isTrue();

        assertThat(jobStore.get(job.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void requeueNeverOverwritesATerminalState() {
        Job job = newJob(1);
        JobLease lease = jobStore.claim(job.getId(), "owner:1").orElseThrow();
        jobStore.complete(lease, 1, 1, 0, null, null, null);

        clock.advance(Duration.ofMinutes(5));

        assertThat(jobStore.requeueExpiredLeases()).isEmpty();
        assertThat(jobStore.get(job.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void cancelIsIdempotentAndBlocksTheOwner() {
        Job job = newJob(3);
        JobLease lease = jobStore.claim(job.getId(), "owner:1").orElseThrow();

        Job cancelled = jobStore.cancel(job.getId());
        Job again = jobStore.cancel(job.getId());

        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.getErrorMessage()).isEqualTo("Cancelled by user");
        assertThat(again.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(jobStore.renewLease(lease)).isFalse();
        assertThat(jobStore.complete(lease, 3, 3, 0, null, null, null)).isFalse();
        assertThat(jobStore.get(job.getId()).getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void cancellingACompletedJobIsAnInvalidTransition() {
        Job job = newJob(1);
        JobLease lease = jobStore.claim(job.getId(), "owner:1").orElseThrow();
        jobStore.complete(lease, 1, 1, 0, null, null, null);

        assertThatThrownBy(() -> jobStore.cancel(job.getId()))
                .isInstanceOf(InvalidJobTransitionException.class)
                .hasMessageContaining("COMPLETED");
    }

    @Test
    void retryArchivesTheAttemptAndResetsProgress() {
        Job job = newJob(6);
        JobLease lease = jobStore.claim(job.getId(), "owner:1").orElseThrow();
        jobStore.recordProgress(lease, 3, 2, 1, "[{\"rowNumber\":3,\"identifier\":\"x\",\"errors\":[\"boom\"]}]");
        jobStore.fail(lease, "Database unavailable");

        Job retried = jobStore.retry(job.getId());

        assertThat(retried.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(retried.getRetryCount()).isEqualTo(1);
        assertThat(retried.getProcessedCount()).isZero();
        assertThat(retried.getSuccessCount()).isZero();
        assertThat(retried.getFailureCount()).isZero();
        assertThat(retried.getErrorMessage()).isNull();
        assertThat(retried.getTotalCount()).isEqualTo(6);

        assertThat(jobStore.attempts(job.getId())).singleElement().satisfies(attempt -> {
            assertThat(attempt.getAttemptNumber()).isZero();
            assertThat(attempt.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(attempt.getProcessedCount()).isEqualTo(3);
            assertThat(attempt.getErrorMessage()).isEqualTo("Database unavailable");
        });
    }

    @Test
    void retryIsOnlyAllowedFromFailedOrCancelled() {
        Job pending = newJob(1);
        assertThatThrownBy(() -> jobStore.retry(pending.getId()))
                .isInstanceOf(InvalidJobTransitionException.class);

        JobLease lease = jobStore.claim(pending.getId(), "owner:1").orElseThrow();
        assertThatThrownBy(() -> jobStore.retry(pending.getId()))
                .isInstanceOf(InvalidJobTransitionException.class);

        jobStore.complete(lease, 1, 1, 0, null, null, null);
        assertThatThrownBy(() -> jobStore.retry(pending.getId()))
                .isInstanceOf(InvalidJobTransitionException.class);
        assertThat(jobStore.attempts(pending.getId())).isEmpty();
    }

    private Job newJob(int total) {
        return newJob(total, 5);
    }

    private Job newJob(int total, int priority) {
        return jobStore.create(Job.builder()
                .type(JobType.IMPORT_STUDENTS)
                .scopeId("inst-1")
                .payloadRef(UUID.randomUUID().toString())
                .totalCount(total)
                .priority(priority)
                .build());
    }
}
