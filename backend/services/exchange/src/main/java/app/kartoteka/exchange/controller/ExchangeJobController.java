package app.kartoteka.exchange.controller;

import app.kartoteka.exchange.controller.dto.CreateExportJobRequest;
import app.kartoteka.exchange.controller.dto.CreateImportJobRequest;
import app.kartoteka.exchange.controller.dto.ImportSourceRequest;
import app.kartoteka.exchange.controller.dto.JobResponse;
import app.kartoteka.exchange.controller.dto.PageResponse;
import app.kartoteka.exchange.controller.dto.RowErrorResponse;
import app.kartoteka.exchange.controller.dto.UploadResponse;
import app.kartoteka.exchange.controller.dto.ValidationResponse;
import app.kartoteka.exchange.domain.SourceFormat;
import app.kartoteka.exchange.security.CallerContext;
import app.kartoteka.exchange.security.CurrentUserProvider;
import app.kartoteka.exchange.service.ExchangeJobService;
import app.kartoteka.exchange.service.ImportSourceService;
import app.kartoteka.exchange.service.JobArtifact;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping
public class ExchangeJobController {

    private final ExchangeJobService jobService;
    private final ImportSourceService sourceService;
    private final CurrentUserProvider currentUserProvider;

    public ExchangeJobController(ExchangeJobService jobService,
                                 ImportSourceService sourceService,
                                 CurrentUserProvider currentUserProvider) {
        this.jobService = jobService;
        this.sourceService = sourceService;
        this.currentUserProvider = currentUserProvider;
    }

    @PostMapping(value = "/uploads", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadResponse upload(@AuthenticationPrincipal Jwt jwt,
                                 @RequestParam(required = false) SourceFormat format,
                                 @RequestPart("file") MultipartFile file) {
        return sourceService.uploadSource(caller(jwt), file, format);
    }

    @PostMapping("/imports/validate")
    public ValidationResponse validate(@AuthenticationPrincipal Jwt jwt,
                                       @Valid @RequestBody ImportSourceRequest request) {
        return jobService.validateImport(caller(jwt), request);
    }

    @PostMapping("/jobs/import")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobResponse createImportJob(@AuthenticationPrincipal Jwt jwt,
                                       @Valid @RequestBody CreateImportJobRequest request) {
        return jobService.createImportJob(caller(jwt), request);
    }

    @PostMapping("/jobs/export")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobResponse createExportJob(@AuthenticationPrincipal Jwt jwt,
                                       @Valid @RequestBody CreateExportJobRequest request) {
        return jobService.createExportJob(caller(jwt), request);
    }

    @GetMapping("/jobs")
    public PageResponse<JobResponse> listJobs(@AuthenticationPrincipal Jwt jwt,
                                              @RequestParam(defaultValue = "0") int page,
                                              @RequestParam(defaultValue = "20") int size) {
        return jobService.listJobs(caller(jwt), page, size);
    }

    @GetMapping("/jobs/{jobId}")
    public JobResponse getJob(@AuthenticationPrincipal Jwt jwt,
                              @PathVariable UUID jobId) {
        return jobService.getJob(caller(jwt), jobId);
    }

    @GetMapping("/jobs/{jobId}/errors")
    public PageResponse<RowErrorResponse> getErrors(@AuthenticationPrincipal Jwt jwt,
                                                    @PathVariable UUID jobId,
                                                    @RequestParam(defaultValue = "0") int page,
                                                    @RequestParam(defaultValue = "50") int size) {
        return jobService.getErrors(caller(jwt), jobId, page, size);
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public JobResponse cancel(@AuthenticationPrincipal Jwt jwt,
                              @PathVariable UUID jobId) {
        return jobService.cancel(caller(jwt), jobId);
    }

    @GetMapping("/jobs/{jobId}/artifact")
    public ResponseEntity<byte[]> artifact(@AuthenticationPrincipal Jwt jwt,
                                           @PathVariable UUID jobId) {
        JobArtifact artifact = jobService.getArtifact(caller(jwt), jobId);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(artifact.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.fileName()).build().toString())
                .body(artifact.content());
    }

    private CallerContext caller(Jwt jwt) {
        try {
            return currentUserProvider.requireCaller(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }
}
