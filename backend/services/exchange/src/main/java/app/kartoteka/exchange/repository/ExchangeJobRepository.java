package app.kartoteka.exchange.repository;

import app.kartoteka.exchange.domain.DuplicateStrategy;
import app.kartoteka.exchange.domain.ExchangeJobEntity;
import app.kartoteka.exchange.domain.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExchangeJobRepository extends JpaRepository<ExchangeJobEntity, UUID> {

    Optional<ExchangeJobEntity> findByJobIdAndTenantId(UUID jobId, UUID tenantId);

    Page<ExchangeJobEntity> findByTenantIdOrderByCreatedAtDesc(UUID tenantId, Pageable pageable);

    @Query("select j.status from ExchangeJobEntity j where j.jobId = :jobId")
    Optional<JobStatus> findStatus(@Param("jobId") UUID jobId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ExchangeJobEntity j
            set j.status = :target,
                j.startedAt = coalesce(j.startedAt, :now),
                j.updatedAt = :now
            where j.jobId = :jobId
              and j.status in :sources
            """)
    int transition(@Param("jobId") UUID jobId,
                   @Param("sources") Collection<JobStatus> sources,
                   @Param("target") JobStatus target,
                   @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ExchangeJobEntity j
            set j.status = :target,
                j.errorMessage = coalesce(:errorMessage, j.errorMessage),
                j.completedAt = :now,
                j.lockedBy = null,
                j.lockedAt = null,
                j.updatedAt = :now
            where j.jobId = :jobId
              and j.status in :sources
            """)
    int finish(@Param("jobId") UUID jobId,
               @Param("sources") Collection<JobStatus> sources,
               @Param("target") JobStatus target,
               @Param("errorMessage") String errorMessage,
               @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ExchangeJobEntity j
            set j.totalItems = :total,
                j.processedItems = :processed,
                j.successfulItems = :successful,
                j.failedItems = :failed,
                j.skippedItems = :skipped,
                j.updatedAt = :now
            where j.jobId = :jobId
              and j.processedItems <= :processed
            """)
    int updateProgress(@Param("jobId") UUID jobId,
                       @Param("total") int total,
                       @Param("processed") int processed,
                       @Param("successful") int successful,
                       @Param("failed") int failed,
                       @Param("skipped") int skipped,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ExchangeJobEntity j set j.resultKey = :resultKey, j.updatedAt = :now where j.jobId = :jobId")
    int updateResultKey(@Param("jobId") UUID jobId,
                        @Param("resultKey") String resultKey,
                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ExchangeJobEntity j
            set j.queuedAt = :now,
                j.duplicateStrategy = :strategy,
                j.failOnValidation = :failOnValidation,
                j.updatedAt = :now
            where j.jobId = :jobId
              and j.status = app.kartoteka.exchange.domain.JobStatus.VALIDATING
              and j.queuedAt is null
            """)
    int enqueueValidated(@Param("jobId") UUID jobId,
                         @Param("strategy") DuplicateStrategy strategy,
                         @Param("failOnValidation") boolean failOnValidation,
                         @Param("now") Instant now);
}
