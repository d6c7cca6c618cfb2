package com.xksgroup.streamarchiver.model.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.xksgroup.streamarchiver.model.Job.MediaKind;

import java.time.Instant;
import java.util.List;

/**
 * Events emitted by the download engine, in the order the engine produces them.
 * <p>
 * On the wire each event is a JSON object carrying a {@code type} discriminator.
 * Types this service does not know about decode to {@link Unrecognized}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = DownloadEvent.Unrecognized.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = DownloadEvent.StreamInfo.class, name = "stream-info"),
        @JsonSubTypes.Type(value = DownloadEvent.Fragment.class, name = "fragment"),
        @JsonSubTypes.Type(value = DownloadEvent.FormatSelection.class, name = "format-selection"),
        @JsonSubTypes.Type(value = DownloadEvent.StreamMux.class, name = "stream-mux"),
        @JsonSubTypes.Type(value = DownloadEvent.StreamMuxProgress.class, name = "stream-mux-progress"),
        @JsonSubTypes.Type(value = DownloadEvent.StreamUnavailable.class, name = "stream-unavailable"),
        @JsonSubTypes.Type(value = DownloadEvent.JobFinished.class, name = "download-job-finished"),
        @JsonSubTypes.Type(value = DownloadEvent.JobFailedOutputMove.class, name = "download-job-failed-output-move"),
        @JsonSubTypes.Type(value = DownloadEvent.FreeText.class, name = "string")
})
public sealed interface DownloadEvent {

    EventKind kind();

    enum EventKind {
        STREAM_INFO,
        FRAGMENT,
        FORMAT_SELECTION,
        STREAM_MUX,
        STREAM_MUX_PROGRESS,
        STREAM_UNAVAILABLE,
        JOB_FINISHED,
        JOB_FAILED_OUTPUT_MOVE,
        FREE_TEXT,
        UNRECOGNIZED
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamInfo(String videoTitle, Instant scheduledStart) implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.STREAM_INFO;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Fragment(String manifestId, MediaKind mediaType, long currentFragment,
                    long maxFragments, long fragmentSize) implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.FRAGMENT;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FormatSelection(String manifestId, MediaKind majorType, FormatInfo format) implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.FORMAT_SELECTION;
        }
    }

    /**
     * Selected upstream format. Video formats carry a quality label, audio formats a bitrate.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record FormatInfo(String qualityLabel, Long bitrate, String codec, Integer itag,
                      Double targetDurationSec) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamMux() implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.STREAM_MUX;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamMuxProgress(String manifestId, MuxProgress progress) implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.STREAM_MUX_PROGRESS;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MuxProgress(Double outTimeSeconds, Long totalSize) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamUnavailable() implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.STREAM_UNAVAILABLE;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobFinished(List<String> outputPaths) implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.JOB_FINISHED;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobFailedOutputMove() implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.JOB_FAILED_OUTPUT_MOVE;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FreeText(String text) implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.FREE_TEXT;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Unrecognized() implements DownloadEvent {
        @Override
        public EventKind kind() {
            return EventKind.UNRECOGNIZED;
        }
    }
}
