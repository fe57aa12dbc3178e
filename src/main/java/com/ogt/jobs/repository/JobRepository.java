package com.ogt.jobs.repository;

import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Cada transición es un único UPDATE condicional (compare-and-set): el valor
 * devuelto es 1 si esta llamada ganó la transición y 0 si otra llegó antes.
 */
public interface JobRepository extends JpaRepository<Job, UUID>, JpaSpecificationExecutor<Job> {

    // Candidatos para el dispatcher: prioridad y luego FIFO
    @Query("""
            SELECT j.id
            FROM Job j
            WHERE j.status = :status
            ORDER BY j.priority ASC, j.createdAt ASC
            """)
    List<UUID> findIdsByStatusOrdered(@Param("status") JobStatus status, Pageable pageable);

    @Query("""
            SELECT j.id
            FROM Job j
            WHERE j.status = :status
              AND j.leaseExpiresAt < :now
            """)
    List<UUID> findIdsWithExpiredLease(@Param("status") JobStatus status, @Param("now") LocalDateTime now);

    List<Job> findByStatusInAndCompletedAtBefore(Collection<JobStatus> statuses, LocalDateTime cutoff);

    List<Job> findByStatusInOrderByCreatedAtDesc(Collection<JobStatus> statuses);

    List<Job> findByScopeIdAndStatusInOrderByCreatedAtDesc(String scopeId, Collection<JobStatus> statuses);

    List<Job> findTop5ByOrderByCreatedAtDesc();

    List<Job> findTop5ByScopeIdOrderByCreatedAtDesc(String scopeId);

    @Query("""
            SELECT j.status, COUNT(j)
            FROM Job j
            WHERE (:scopeId IS NULL OR j.scopeId = :scopeId)
            GROUP BY j.status
            """)
    List<Object[]> countByStatus(@Param("scopeId") String scopeId);

    @Query("""
            SELECT j.type, COUNT(j)
            FROM Job j
            WHERE (:scopeId IS NULL OR j.scopeId = :scopeId)
            GROUP BY j.type
            """)
    List<Object[]> countByType(@Param("scopeId") String scopeId);

    // ========== TRANSICIONES ==========

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :processing,
                j.leaseOwner = :owner,
                j.leaseExpiresAt = :leaseExpiresAt,
                j.startedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :pending
            """)
    int claim(@Param("id") UUID id,
              @Param("owner") String owner,
              @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
              @Param("now") LocalDateTime now,
              @Param("pending") JobStatus pending,
              @Param("processing") JobStatus processing);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.leaseExpiresAt = :leaseExpiresAt,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :processing
              AND j.leaseOwner = :owner
            """)
    int renewLease(@Param("id") UUID id,
                   @Param("owner") String owner,
                   @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
                   @Param("now") LocalDateTime now,
                   @Param("processing") JobStatus processing);

    // processedCount nunca retrocede mientras el job está en PROCESSING
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.processedCount = :processed,
                j.successCount = :success,
                j.failureCount = :failure,
                j.recordErrors = :recordErrors,
                j.leaseExpiresAt = :leaseExpiresAt,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :processing
              AND j.leaseOwner = :owner
              AND j.processedCount <= :processed
            """)
    int recordProgress(@Param("id") UUID id,
                       @Param("owner") String owner,
                       @Param("processed") int processed,
                       @Param("success") int success,
                       @Param("failure") int failure,
                       @Param("recordErrors") String recordErrors,
                       @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
                       @Param("now") LocalDateTime now,
                       @Param("processing") JobStatus processing);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :completed,
                j.processedCount = :processed,
                j.successCount = :success,
                j.failureCount = :failure,
                j.recordErrors = :recordErrors,
                j.artifactRef = :artifactRef,
                j.artifactContentType = :artifactContentType,
                j.leaseOwner = NULL,
                j.leaseExpiresAt = NULL,
                j.completedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :processing
              AND j.leaseOwner = :owner
            """)
    int complete(@Param("id") UUID id,
                 @Param("owner") String owner,
                 @Param("processed") int processed,
                 @Param("success") int success,
                 @Param("failure") int failure,
                 @Param("recordErrors") String recordErrors,
                 @Param("artifactRef") String artifactRef,
                 @Param("artifactContentType") String artifactContentType,
                 @Param("now") LocalDateTime now,
                 @Param("processing") JobStatus processing,
                 @Param("completed") JobStatus completed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :failed,
                j.errorMessage = :errorMessage,
                j.leaseOwner = NULL,
                j.leaseExpiresAt = NULL,
                j.completedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :processing
              AND j.leaseOwner = :owner
            """)
    int fail(@Param("id") UUID id,
             @Param("owner") String owner,
             @Param("errorMessage") String errorMessage,
             @Param("now") LocalDateTime now,
             @Param("processing") JobStatus processing,
             @Param("failed") JobStatus failed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :cancelled,
                j.errorMessage = :reason,
                j.leaseOwner = NULL,
                j.leaseExpiresAt = NULL,
                j.completedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :expected
            """)
    int cancel(@Param("id") UUID id,
               @Param("expected") JobStatus expected,
               @Param("reason") String reason,
               @Param("now") LocalDateTime now,
               @Param("cancelled") JobStatus cancelled);

    // Sólo toca filas PROCESSING: nunca pisa un estado terminal ya escrito por el dueño
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :pending,
                j.leaseOwner = NULL,
                j.leaseExpiresAt = NULL,
                j.processedCount = 0,
                j.successCount = 0,
                j.failureCount = 0,
                j.recordErrors = NULL,
                j.startedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :processing
              AND j.leaseExpiresAt < :now
            """)
    int requeueIfLeaseExpired(@Param("id") UUID id,
                              @Param("now") LocalDateTime now,
                              @Param("processing") JobStatus processing,
                              @Param("pending") JobStatus pending);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :pending,
                j.retryCount = j.retryCount + 1,
                j.processedCount = 0,
                j.successCount = 0,
                j.failureCount = 0,
                j.recordErrors = NULL,
                j.errorMessage = NULL,
                j.artifactRef = NULL,
                j.artifactContentType = NULL,
                j.leaseOwner = NULL,
                j.leaseExpiresAt = NULL,
                j.startedAt = NULL,
                j.completedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :expected
              AND j.retryCount = :expectedRetryCount
            """)
    int resetForRetry(@Param("id") UUID id,
                      @Param("expected") JobStatus expected,
                      @Param("expectedRetryCount") int expectedRetryCount,
                      @Param("now") LocalDateTime now,
                      @Param("pending") JobStatus pending);

}
