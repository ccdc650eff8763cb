package app.kartoteka.exchange.service;

import app.kartoteka.exchange.domain.JobStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class JobStateException extends ResponseStatusException {

    private final JobStatus status;

    public JobStateException(UUID jobId, JobStatus status, String action) {
        super(HttpStatus.CONFLICT, "Job " + jobId + " is " + status + " and cannot be " + action);
        this.status = status;
    }

    public JobStatus getJobStatus() {
        return status;
    }
}
