package com.xksgroup.streamarchiver.model.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.streamarchiver.model.Job.MediaKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadEvent decoding Tests")
class DownloadEventTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private DownloadEvent decode(String json) throws Exception {
        return objectMapper.readValue(json, DownloadEvent.class);
    }

    @Test
    @DisplayName("Should decode stream info with its scheduled start")
    void testStreamInfo() throws Exception {
        DownloadEvent event = decode("{\"type\":\"stream-info\",\"videoTitle\":\"Karaoke\","
                + "\"scheduledStart\":\"2024-11-20T18:00:00Z\"}");

        assertEquals(DownloadEvent.EventKind.STREAM_INFO, event.kind());
        DownloadEvent.StreamInfo info = (DownloadEvent.StreamInfo) event;
        assertEquals("Karaoke", info.videoTitle());
        assertEquals(Instant.parse("2024-11-20T18:00:00Z"), info.scheduledStart());
    }

    @Test
    @DisplayName("Should decode fragments and media kinds case-insensitively")
    void testFragment() throws Exception {
        DownloadEvent.Fragment fragment = (DownloadEvent.Fragment) decode("{\"type\":\"fragment\","
                + "\"manifestId\":\"dQw4w9WgXcQ.1~0\",\"mediaType\":\"Audio\",\"currentFragment\":12,"
                + "\"maxFragments\":40,\"fragmentSize\":65536,\"extra\":true}");

        assertEquals("dQw4w9WgXcQ.1~0", fragment.manifestId());
        assertEquals(MediaKind.AUDIO, fragment.mediaType());
        assertEquals(12, fragment.currentFragment());
        assertEquals(40, fragment.maxFragments());
        assertEquals(65536, fragment.fragmentSize());
    }

    @Test
    @DisplayName("Should decode nested payloads")
    void testNestedPayloads() throws Exception {
        DownloadEvent.FormatSelection selection = (DownloadEvent.FormatSelection) decode(
                "{\"type\":\"format-selection\",\"manifestId\":\"vid.0\",\"majorType\":\"video\","
                        + "\"format\":{\"qualityLabel\":\"1080p\",\"codec\":\"vp9\",\"itag\":248,\"targetDurationSec\":2.0}}");
        assertEquals(MediaKind.VIDEO, selection.majorType());
        assertEquals("1080p", selection.format().qualityLabel());
        assertEquals(248, selection.format().itag());
        assertNull(selection.format().bitrate());

        DownloadEvent.StreamMuxProgress progress = (DownloadEvent.StreamMuxProgress) decode(
                "{\"type\":\"stream-mux-progress\",\"manifestId\":\"vid.0\","
                        + "\"progress\":{\"outTimeSeconds\":12.5,\"totalSize\":1024}}");
        assertEquals(12.5, progress.progress().outTimeSeconds());
        assertEquals(1024L, progress.progress().totalSize());

        DownloadEvent.JobFinished finished = (DownloadEvent.JobFinished) decode(
                "{\"type\":\"download-job-finished\",\"outputPaths\":[\"/out/a.mp4\",\"/out/a.jpg\"]}");
        assertEquals(List.of("/out/a.mp4", "/out/a.jpg"), finished.outputPaths());
    }

    @Test
    @DisplayName("Should decode payload-less events")
    void testPayloadLessEvents() throws Exception {
        assertEquals(DownloadEvent.EventKind.STREAM_MUX, decode("{\"type\":\"stream-mux\"}").kind());
        assertEquals(DownloadEvent.EventKind.STREAM_UNAVAILABLE, decode("{\"type\":\"stream-unavailable\"}").kind());
        assertEquals(DownloadEvent.EventKind.JOB_FAILED_OUTPUT_MOVE,
                decode("{\"type\":\"download-job-failed-output-move\"}").kind());
        assertEquals("hello", ((DownloadEvent.FreeText) decode("{\"type\":\"string\",\"text\":\"hello\"}")).text());
    }

    @Test
    @DisplayName("Should map unknown event types to Unrecognized")
    void testUnknownType() throws Exception {
        DownloadEvent event = decode("{\"type\":\"extractor-retry\",\"attempt\":3}");

        assertInstanceOf(DownloadEvent.Unrecognized.class, event);
        assertEquals(DownloadEvent.EventKind.UNRECOGNIZED, event.kind());
    }
}
