package com.xksgroup.streamarchiver.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strongly-typed binding for the {@code archiver.*} properties.
 *
 * <pre>
 * archiver:
 *   tasklist:
 *     hide-finished-age-days: 30
 *   healthchecks:
 *     enable-scheduled: true
 *   downloader:
 *     command: moonarchive
 *     output-directory: /opt/archiver/output
 *   channels:
 *     - id: UCxxxxxxxxxxxxxxxxxxxxxx
 *       name: Some Channel
 *       num-desc-lookbehind: 2
 *       terms:
 *         karaoke: '(?i)(\W|^)karaoke'
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "archiver")
public class ArchiverProperties {

    public static final Set<Integer> VALID_RESOLUTIONS = Set.of(144, 240, 360, 480, 720, 1080, 1440, 2160, 4320);

    @Valid
    @NestedConfigurationProperty
    private TaskListConfig tasklist = new TaskListConfig();

    @Valid
    @NestedConfigurationProperty
    private HealthcheckConfig healthchecks = new HealthcheckConfig();

    @Valid
    @NestedConfigurationProperty
    private DownloaderConfig downloader = new DownloaderConfig();

    @Valid
    @NestedConfigurationProperty
    private FeedConfig feed = new FeedConfig();

    @Valid
    @NestedConfigurationProperty
    private PlayerConfig player = new PlayerConfig();

    @Valid
    private List<NotificationConfig> notifications = new ArrayList<>();

    @Valid
    private List<ChannelMonitorConfig> channels = new ArrayList<>();

    // ------------------------------------------------------------------ //

    @Data
    public static class TaskListConfig {
        /** Finished jobs older than this are hidden from the job list; 0 keeps everything visible. */
        @Min(0)
        private int hideFinishedAgeDays = 0;

        @JsonIgnore
        public Duration getHideFinishedAge() {
            return hideFinishedAgeDays > 0 ? Duration.ofDays(hideFinishedAgeDays) : null;
        }
    }

    @Data
    public static class HealthcheckConfig {
        private boolean enableScheduled = false;
        @NotNull
        private Duration requestInterval = Duration.ofSeconds(20);
    }

    @Data
    public static class DownloaderConfig {
        @NotBlank
        private String command = "moonarchive";
        @Min(1)
        private int numParallelDownloads = 1;
        private int maxVideoResolution = 4320;
        private String ffmpegPath;
        private String outputDirectory;
        private String outputTemplate;
        private String stagingDirectory;
        private String poToken;
        private String visitorData;
        private String cookieFile;
    }

    @Data
    public static class FeedConfig {
        @NotBlank
        private String baseUrl = "https://www.youtube.com/feeds/videos.xml";
        @NotNull
        private Duration pollInterval = Duration.ofMinutes(10);
        @Min(1)
        private int maxConcurrentFetches = 3;
    }

    @Data
    public static class PlayerConfig {
        @NotBlank
        private String baseUrl = "https://www.youtube.com";
        @NotNull
        private Duration requestInterval = Duration.ofSeconds(20);
        @Min(1)
        private int maxAttempts = 10;
        @NotNull
        private Duration retryDelay = Duration.ofSeconds(10);
        @NotNull
        private Duration clientConfigMaxAge = Duration.ofHours(4);
    }

    @Data
    public static class NotificationConfig {
        @NotBlank
        private String url;
        private List<String> tags = new ArrayList<>();
    }

    @Data
    public static class ChannelMonitorConfig {
        @NotBlank
        @Pattern(regexp = "UC.*", message = "expected 'UC' prefix for channel id")
        private String id;
        private String name;
        @Min(0)
        private int numDescLookbehind = 2;
        /** Rule name mapped to the regular expression that detects it. */
        private Map<String, String> terms = new LinkedHashMap<>();
        private String outputDirectory;
        private boolean includeNonLiveContent = false;
    }
}
