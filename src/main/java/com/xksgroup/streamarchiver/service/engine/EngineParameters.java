package com.xksgroup.streamarchiver.service.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options handed to the download engine. {@code null} means "not specified by the caller";
 * the job registry fills such gaps from the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineParameters {
    private String url;

    private String ffmpegPath;
    private String poToken;
    private String visitorData;
    private String cookieFile;

    private String stagingDirectory;
    private String outputDirectory;
    private String outputTemplate;

    private Integer maxVideoResolution;
    private Integer numParallelDownloads;
    private Integer pollIntervalSeconds;

    private boolean writeDescription;
    private boolean writeThumbnail;
    private boolean preferVp9;
}
