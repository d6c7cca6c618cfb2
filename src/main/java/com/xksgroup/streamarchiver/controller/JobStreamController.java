package com.xksgroup.streamarchiver.controller;

import com.xksgroup.streamarchiver.service.EventService;
import com.xksgroup.streamarchiver.service.JobRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(
        name = "Job Streams",
        description = "Live job updates over Server-Sent Events (SSE)."
)
@RestController
@RequestMapping("stream-archiver/api/v1/jobs")
@RequiredArgsConstructor
public class JobStreamController {

    private final EventService eventService;
    private final JobRegistry jobRegistry;

    @Operation(
            summary = "Stream updates of all jobs",
            description = """
                Emits a `job-update` event with the job's full state every time any job changes.
                A `heartbeat` event is sent while nothing changes so idle connections stay open.
                """,
            responses = @ApiResponse(
                    responseCode = "200",
                    description = "SSE stream started (Content-Type: text/event-stream)",
                    content = @Content(mediaType = "text/event-stream", schema = @Schema(implementation = String.class))
            )
    )
    @GetMapping(value = "/stream", produces = "text/event-stream")
    public SseEmitter streamAll() {
        return eventService.subscribe();
    }

    @Operation(
            summary = "Stream updates of one job",
            description = "Sends the job's current state as a `job-detail` event, then one per change."
    )
    @GetMapping(value = "/{jobId}/stream", produces = "text/event-stream")
    public SseEmitter streamJob(@PathVariable String jobId) {
        return eventService.subscribe(jobRegistry.getJob(jobId).snapshot());
    }
}
