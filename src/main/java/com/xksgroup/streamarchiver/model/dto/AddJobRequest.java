package com.xksgroup.streamarchiver.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddJobRequest {

    @NotBlank(message = "url is required")
    @Schema(description = "Video URL or bare video id", example = "https://www.youtube.com/watch?v=dQw4w9WgXcQ")
    private String url;

    @Schema(description = "Output directory; defaults to the configured one")
    private String outputDirectory;

    @Schema(description = "Maximum video height", example = "1080")
    private Integer maxVideoResolution;

    private boolean writeDescription = true;

    private boolean writeThumbnail = true;

    private boolean preferVp9 = true;
}
