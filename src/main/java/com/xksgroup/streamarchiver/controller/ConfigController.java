package com.xksgroup.streamarchiver.controller;

import com.xksgroup.streamarchiver.config.ArchiverProperties;
import com.xksgroup.streamarchiver.config.ConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("stream-archiver/api/v1/config")
@RequiredArgsConstructor
@Tag(name = "Configuration", description = "Read and replace the live archiver configuration")
public class ConfigController {

    private final ConfigService configService;

    @GetMapping
    @Operation(summary = "Current configuration")
    public ArchiverProperties getConfig() {
        return configService.getConfig();
    }

    @PutMapping
    @Operation(
        summary = "Replace the configuration",
        description = "Validates and swaps in the new configuration. The feed monitor resumes if channels were added."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Configuration replaced"),
        @ApiResponse(responseCode = "400", description = "Invalid configuration; the current one is kept")
    })
    public ArchiverProperties replaceConfig(@RequestBody ArchiverProperties replacement) {
        configService.update(replacement);
        return configService.getConfig();
    }
}
