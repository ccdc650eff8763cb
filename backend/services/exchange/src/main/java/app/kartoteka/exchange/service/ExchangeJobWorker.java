package app.kartoteka.exchange.service;

import app.kartoteka.exchange.domain.ExchangeJobEntity;
import app.kartoteka.exchange.domain.JobKind;
import app.kartoteka.exchange.repository.ExchangeJobRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class ExchangeJobWorker {

    private static final Logger log = LoggerFactory.getLogger(ExchangeJobWorker.class);

    private final JdbcTemplate jdbcTemplate;
    private final ExchangeJobRepository jobRepository;
    private final ImportProcessor importProcessor;
    private final ExportProcessor exportProcessor;
    private final JobRegistry jobRegistry;
    private final String workerId;
    private final Duration lockTtl;
    private final Semaphore jobSlots;
    private final ExecutorService executor;
    private final ScheduledExecutorService heartbeatScheduler;

    public ExchangeJobWorker(JdbcTemplate jdbcTemplate,
                             ExchangeJobRepository jobRepository,
                             ImportProcessor importProcessor,
                             ExportProcessor exportProcessor,
                             JobRegistry jobRegistry,
                             @Value("${app.exchange.worker.worker-id:}") String workerId,
                             @Value("${app.exchange.worker.lock-ttl-seconds:600}") long lockTtlSeconds,
                             @Value("${app.exchange.worker.concurrent-jobs:2}") int concurrentJobs) {
        this.jdbcTemplate = jdbcTemplate;
        this.jobRepository = jobRepository;
        this.importProcessor = importProcessor;
        this.exportProcessor = exportProcessor;
        this.jobRegistry = jobRegistry;
        this.workerId = (workerId == null || workerId.isBlank()) ? defaultWorkerId() : workerId;
        this.lockTtl = Duration.ofSeconds(lockTtlSeconds);
        int slots = Math.max(concurrentJobs, 1);
        this.jobSlots = new Semaphore(slots);
        this.executor = Executors.newFixedThreadPool(slots, namedThreads("exchange-job-worker-"));
        this.heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("exchange-job-heartbeat-"));
    }

    @Scheduled(fixedDelayString = "${app.exchange.worker.poll-interval-ms:2000}")
    public void poll() {
        while (jobSlots.tryAcquire()) {
            Optional<ExchangeJobEntity> jobOpt = claimNextJob();
            if (jobOpt.isEmpty()) {
                jobSlots.release();
                return;
            }
            submitJob(jobOpt.get());
        }
    }

    void handleJob(ExchangeJobEntity job) {
        ScheduledFuture<?> heartbeat = scheduleLockHeartbeat(job.getJobId());
        try {
            if (job.getJobKind() == JobKind.EXPORT) {
                exportProcessor.process(job);
            } else {
                importProcessor.process(job);
            }
        } catch (Exception ex) {
            String error = summarizeError(ex);
            log.error(
                    "Exchange job failed: jobId={}, kind={}, tenantId={}, format={}, error={}",
                    job.getJobId(),
                    job.getJobKind(),
                    job.getTenantId(),
                    job.getSourceFormat(),
                    error,
                    ex
            );
            jobRegistry.fail(job, error);
        } finally {
            heartbeat.cancel(false);
        }
    }

    private void submitJob(ExchangeJobEntity job) {
        try {
            executor.execute(() -> {
                try {
                    handleJob(job);
                } finally {
                    jobSlots.release();
                }
            });
        } catch (RejectedExecutionException ex) {
            jobSlots.release();
            log.warn("Exchange job executor rejected jobId={}", job.getJobId());
            jobRegistry.fail(job, "Worker is shutting down");
        }
    }

    @Transactional
    public Optional<ExchangeJobEntity> claimNextJob() {
        UUID jobId = jdbcTemplate.query(
                """
                with next_job as (
                    select job_id
                    from app_exchange.exchange_jobs
                    where status in ('PENDING', 'VALIDATING')
                      and queued_at is not null
                      and (locked_at is null or locked_at < now() - (? * interval '1 second'))
                    order by queued_at asc
                    limit 1
                    for update skip locked
                )
                update app_exchange.exchange_jobs
                set locked_at = now(),
                    locked_by = ?,
                    updated_at = now()
                where job_id in (select job_id from next_job)
                returning job_id
                """,
                rs -> rs.next() ? UUID.fromString(rs.getString("job_id")) : null,
                lockTtl.getSeconds(),
                workerId
        );

        if (jobId == null) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    @PreDestroy
    public void shutdown() {
        heartbeatScheduler.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ScheduledFuture<?> scheduleLockHeartbeat(UUID jobId) {
        long intervalMs = Math.min(Math.max(lockTtl.toMillis() / 3L, 5_000L), 30_000L);
        return heartbeatScheduler.scheduleAtFixedRate(
                () -> touchLock(jobId),
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS
        );
    }

    private void touchLock(UUID jobId) {
        try {
            jdbcTemplate.update(
                    """
                    update app_exchange.exchange_jobs
                    set locked_at = now()
                    where job_id = ?
                      and locked_by = ?
                      and status in ('PENDING', 'VALIDATING', 'PROCESSING')
                    """,
                    jobId,
                    workerId
            );
        } catch (DataAccessException ex) {
            log.warn("Exchange job heartbeat failed jobId={} workerId={} error={}", jobId, workerId, ex.getMessage());
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private String defaultWorkerId() {
        String host = System.getenv("HOSTNAME");
        return (host == null || host.isBlank()) ? "exchange-worker" : host;
    }

    static String summarizeError(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        // a status exception carries the message meant for the caller, its causes do not
        Throwable root = throwable;
        while (true) {
            if (root instanceof ResponseStatusException status && status.getReason() != null) {
                return status.getReason();
            }
            if (root.getCause() == null || root.getCause() == root) {
                break;
            }
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        String fallback = throwable.getMessage();
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        return throwable.getClass().getSimpleName();
    }
}
