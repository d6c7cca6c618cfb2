package com.xksgroup.streamarchiver.model.Job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time copy of a job's state. This is what gets persisted, broadcast to
 * subscribers and returned by the API; it never references the live engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobSnapshot {

    private String id;

    // Descriptive fields
    private String author;
    private String channelId;
    private String videoId;
    private Instant scheduledStartTime;
    private String thumbnailUrl;
    private String title;

    // Progress
    private String currentManifest;
    private JobStatus status;
    private Instant finishTime;

    @Builder.Default
    private List<JobLogMessage> messageLog = new ArrayList<>();

    @Builder.Default
    private Map<String, ManifestProgress> manifestProgress = new LinkedHashMap<>();

    @Builder.Default
    private HealthCheckStatus healthCheck = new HealthCheckStatus();

    @Builder.Default
    private Set<String> outputPaths = new LinkedHashSet<>();
}
