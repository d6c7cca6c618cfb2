package com.xksgroup.streamarchiver.controller;

import com.xksgroup.streamarchiver.model.Job.DownloadJob;
import com.xksgroup.streamarchiver.model.Job.HealthCheckResult;
import com.xksgroup.streamarchiver.model.Job.JobStatusSummary;
import com.xksgroup.streamarchiver.model.dto.AddJobRequest;
import com.xksgroup.streamarchiver.model.dto.JobCreatedDto;
import com.xksgroup.streamarchiver.model.dto.JobProgressDto;
import com.xksgroup.streamarchiver.service.JobRegistry;
import com.xksgroup.streamarchiver.service.JobService;
import com.xksgroup.streamarchiver.service.health.HealthCheckService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("stream-archiver/api/v1")
@RequiredArgsConstructor
@Tag(name = "Archive Jobs", description = "Create, inspect and control stream archival jobs")
public class JobController {

    private final JobRegistry jobRegistry;
    private final JobService jobService;
    private final HealthCheckService healthCheckService;

    @GetMapping("/jobs")
    @Operation(
        summary = "List visible jobs",
        description = "Returns every job except those finished longer ago than the configured retention, in display order: "
                + "new jobs first, then downloading, then waiting (latest scheduled start first), then ended jobs."
    )
    @ApiResponse(
        responseCode = "200",
        description = "Jobs retrieved",
        content = @Content(array = @ArraySchema(schema = @Schema(implementation = JobProgressDto.class)))
    )
    public List<JobProgressDto> listJobs() {
        return jobRegistry.visibleJobs().stream()
                .map(job -> JobProgressDto.fromSnapshot(job.snapshot()))
                .collect(Collectors.toList());
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get a job", description = "Full state of one job, including its message log and per-manifest progress.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Job found"),
        @ApiResponse(responseCode = "404", description = "Job not found")
    })
    public JobProgressDto getJob(@Parameter(description = "Job id") @PathVariable String jobId) {
        return JobProgressDto.fromSnapshot(jobRegistry.getJob(jobId).snapshot());
    }

    @GetMapping("/status")
    @Operation(summary = "Compact status of visible jobs", description = "Fragment counters and status for each visible job.")
    public List<JobStatusSummary> getStatus() {
        return jobRegistry.statusSummaries();
    }

    @PostMapping("/jobs")
    @Operation(
        summary = "Archive a video",
        description = "Starts a job for a video URL or bare video id. Unset engine options take the configured defaults."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Job created and started"),
        @ApiResponse(responseCode = "400", description = "No video id could be derived from the URL")
    })
    public ResponseEntity<JobCreatedDto> addJob(@Valid @RequestBody AddJobRequest request) throws InterruptedException {
        DownloadJob job = jobService.addJob(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new JobCreatedDto(job.getId(), job.getVideoId(), job.getStatus()));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    @Operation(summary = "Cancel a running job")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "202", description = "Cancellation requested"),
        @ApiResponse(responseCode = "404", description = "Job not found"),
        @ApiResponse(responseCode = "409", description = "Job is not running")
    })
    public ResponseEntity<Map<String, Object>> cancelJob(@PathVariable String jobId) {
        jobRegistry.cancelJob(jobId);
        return ResponseEntity.accepted().body(Map.of(
                "jobId", jobId,
                "message", "Cancellation requested",
                "timestamp", LocalDateTime.now()
        ));
    }

    @DeleteMapping("/jobs/{jobId}/tempfiles")
    @Operation(
        summary = "Delete a job's temporary files",
        description = "Removes the staging files of an ended job. Refused while a finished job may still have an incomplete mux."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Files deleted"),
        @ApiResponse(responseCode = "404", description = "Job not found"),
        @ApiResponse(responseCode = "409", description = "Temporary files cannot be deleted yet")
    })
    public Map<String, Object> deleteTempFiles(@PathVariable String jobId) {
        int deleted = jobRegistry.deleteTempFiles(jobId);
        return Map.of("jobId", jobId, "deletedFiles", deleted);
    }

    @PostMapping("/jobs/{jobId}/healthcheck")
    @Operation(summary = "Run a health check now", description = "Checks a finished archive against its upstream source.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Check completed"),
        @ApiResponse(responseCode = "404", description = "Job not found"),
        @ApiResponse(responseCode = "409", description = "Job is not finished")
    })
    public Map<String, Object> runHealthCheck(@PathVariable String jobId) throws InterruptedException {
        HealthCheckResult result = jobRegistry.runHealthCheck(jobId, healthCheckService);
        return Map.of("jobId", jobId, "result", result);
    }
}
