package app.kartoteka.exchange.service;

import app.kartoteka.exchange.audit.AuditPublisher;
import app.kartoteka.exchange.domain.ExchangeJobEntity;
import app.kartoteka.exchange.domain.JobRowErrorEntity;
import app.kartoteka.exchange.domain.JobStatus;
import app.kartoteka.exchange.repository.ExchangeJobRepository;
import app.kartoteka.exchange.repository.JobRowErrorRepository;
import app.kartoteka.exchange.service.validation.RowIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);
    private static final int MAX_ERROR_MESSAGE = 2000;
    private static final int MAX_RAW_VALUE = 1000;

    private final ExchangeJobRepository jobRepository;
    private final JobRowErrorRepository rowErrorRepository;
    private final AuditPublisher auditPublisher;

    public JobRegistry(ExchangeJobRepository jobRepository,
                       JobRowErrorRepository rowErrorRepository,
                       AuditPublisher auditPublisher) {
        this.jobRepository = jobRepository;
        this.rowErrorRepository = rowErrorRepository;
        this.auditPublisher = auditPublisher;
    }

    @Transactional
    public boolean moveTo(ExchangeJobEntity job, JobStatus target) {
        return moveTo(job, target, null);
    }

    @Transactional
    public boolean fail(ExchangeJobEntity job, String errorMessage) {
        return moveTo(job, JobStatus.FAILED, truncate(errorMessage, MAX_ERROR_MESSAGE));
    }

    @Transactional
    public ExchangeJobEntity cancel(UUID tenantId, UUID jobId) {
        ExchangeJobEntity job = jobRepository.findByJobIdAndTenantId(jobId, tenantId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found"));
        if (!job.getStatus().isCancellable()) {
            throw new JobStateException(jobId, job.getStatus(), "cancelled");
        }
        if (!moveTo(job, JobStatus.CANCELLED, null)) {
            JobStatus current = jobRepository.findStatus(jobId).orElse(job.getStatus());
            throw new JobStateException(jobId, current, "cancelled");
        }
        return jobRepository.findById(jobId).orElse(job);
    }

    @Transactional(readOnly = true)
    public boolean isCancelled(UUID jobId) {
        return jobRepository.findStatus(jobId)
                .map(status -> status == JobStatus.CANCELLED)
                .orElse(true);
    }

    @Transactional
    public void recordProgress(UUID jobId, JobCounters counters) {
        jobRepository.updateProgress(
                jobId,
                counters.total(),
                counters.processed(),
                counters.successful(),
                counters.failed(),
                counters.skipped(),
                Instant.now()
        );
    }

    @Transactional
    public void recordResult(UUID jobId, String resultKey) {
        jobRepository.updateResultKey(jobId, resultKey, Instant.now());
    }

    @Transactional
    public void recordRowErrors(UUID jobId, List<RowIssue> issues) {
        if (issues == null || issues.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        rowErrorRepository.saveAll(issues.stream()
                .map(issue -> new JobRowErrorEntity(
                        jobId,
                        issue.rowNumber(),
                        issue.fieldName(),
                        issue.kind(),
                        truncate(issue.message(), MAX_ERROR_MESSAGE),
                        truncate(issue.rawValue(), MAX_RAW_VALUE),
                        now
                ))
                .toList());
    }

    @Transactional
    public void clearRowErrors(UUID jobId) {
        rowErrorRepository.deleteByJobId(jobId);
    }

    private boolean moveTo(ExchangeJobEntity job, JobStatus target, String errorMessage) {
        Instant now = Instant.now();
        int updated = target.isTerminal()
                ? jobRepository.finish(job.getJobId(), JobStatus.sourcesOf(target), target, errorMessage, now)
                : jobRepository.transition(job.getJobId(), JobStatus.sourcesOf(target), target, now);
        if (updated == 0) {
            log.info("Job transition rejected jobId={} target={}", job.getJobId(), target);
            return false;
        }
        JobStatus from = job.getStatus();
        job.setStatus(target);
        log.info("Job transition jobId={} kind={} from={} to={}", job.getJobId(), job.getJobKind(), from, target);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", job.getJobKind());
        details.put("from", from);
        details.put("to", target);
        if (errorMessage != null) {
            details.put("error", errorMessage);
        }
        auditPublisher.publish("job.transition", job.getTenantId(), job.getOwnerId(), job.getJobId(), details);
        return true;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
