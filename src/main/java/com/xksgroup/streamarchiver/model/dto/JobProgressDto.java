package com.xksgroup.streamarchiver.model.dto;

import com.xksgroup.streamarchiver.model.Job.HealthCheckStatus;
import com.xksgroup.streamarchiver.model.Job.JobLogMessage;
import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import com.xksgroup.streamarchiver.model.Job.JobStatus;
import com.xksgroup.streamarchiver.model.Job.ManifestProgress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobProgressDto {

    private String id;
    private String videoId;
    private String title;
    private String author;
    private String channelId;
    private String thumbnailUrl;
    private JobStatus status;
    private String statusDescription;

    // Progress tracking
    private String currentManifest;
    private long videoSeq;
    private long audioSeq;
    private long maxSeq;
    private int progressPercentage;
    private String downloadedFormatted;
    private String remainingTime;

    private Instant scheduledStartTime;
    private Instant finishTime;

    private Map<String, ManifestProgress> manifests;
    private List<JobLogMessage> messages;
    private HealthCheckStatus healthCheck;
    private Set<String> outputPaths;

    public static String formatDuration(Long seconds) {
        if (seconds == null || seconds <= 0) {
            return "0s";
        }

        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }

    public static String formatFileSize(Long bytes) {
        if (bytes == null || bytes <= 0) {
            return "0 B";
        }

        String[] units = {"B", "KB", "MB", "GB", "TB"};
        int unitIndex = 0;
        double size = bytes;

        while (size >= 1024.0 && unitIndex < units.length - 1) {
            size /= 1024.0;
            unitIndex++;
        }

        return String.format("%.1f %s", size, units[unitIndex]);
    }

    public static JobProgressDto fromSnapshot(JobSnapshot job) {
        Map<String, ManifestProgress> manifests = job.getManifestProgress();
        long videoSeq = manifests.values().stream().mapToLong(ManifestProgress::getVideoSeq).sum();
        long audioSeq = manifests.values().stream().mapToLong(ManifestProgress::getAudioSeq).sum();
        long maxSeq = manifests.values().stream().mapToLong(ManifestProgress::getMaxSeq).sum();
        long downloaded = manifests.values().stream().mapToLong(ManifestProgress::getTotalDownloaded).sum();

        ManifestProgress current = job.getCurrentManifest() != null ? manifests.get(job.getCurrentManifest()) : null;
        Duration remaining = current != null ? current.getEstimatedTimeRemaining() : null;

        return JobProgressDto.builder()
                .id(job.getId())
                .videoId(job.getVideoId())
                .title(job.getTitle())
                .author(job.getAuthor())
                .channelId(job.getChannelId())
                .thumbnailUrl(job.getThumbnailUrl())
                .status(job.getStatus())
                .statusDescription(generateUserFriendlyDescription(job))

                .currentManifest(job.getCurrentManifest())
                .videoSeq(videoSeq)
                .audioSeq(audioSeq)
                .maxSeq(maxSeq)
                .progressPercentage(maxSeq > 0 ? (int) Math.min(100, Math.max(videoSeq, audioSeq) * 100 / maxSeq) : 0)
                .downloadedFormatted(formatFileSize(downloaded))
                .remainingTime(remaining != null ? formatDuration(remaining.getSeconds()) : null)

                .scheduledStartTime(job.getScheduledStartTime())
                .finishTime(job.getFinishTime())

                .manifests(manifests)
                .messages(job.getMessageLog())
                .healthCheck(job.getHealthCheck())
                .outputPaths(job.getOutputPaths())
                .build();
    }

    private static String generateUserFriendlyDescription(JobSnapshot job) {
        JobStatus status = job.getStatus() != null ? job.getStatus() : JobStatus.UNKNOWN;
        switch (status) {
            case WAITING:
                if (job.getScheduledStartTime() != null) {
                    return "Waiting for the stream to start (scheduled " + job.getScheduledStartTime() + ")";
                }
                return "Waiting for the stream to start...";

            case DOWNLOADING:
                return "Downloading stream fragments...";

            case MUXING:
                return "Combining audio and video...";

            case FINISHED:
                return "Archive completed successfully!";

            case ERROR:
                return "Archiving failed: " + job.getMessageLog().stream()
                        .map(JobLogMessage::message)
                        .filter(Objects::nonNull)
                        .filter(m -> m.startsWith("Exception: "))
                        .reduce((first, second) -> second)
                        .orElse("Unknown error");

            case CANCELLED:
                return "Archiving was cancelled";

            case UNAVAILABLE:
                return "Stream is unavailable";

            default:
                return "Preparing...";
        }
    }
}
