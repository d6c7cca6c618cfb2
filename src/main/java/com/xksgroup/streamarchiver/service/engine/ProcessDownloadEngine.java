package com.xksgroup.streamarchiver.service.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.streamarchiver.exception.EngineException;
import com.xksgroup.streamarchiver.model.event.DownloadEvent;
import com.xksgroup.streamarchiver.model.event.DownloadEventHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the engine as an external process that writes one JSON event per line to stdout.
 * Events are delivered on the thread that called {@link #run()}.
 */
@Slf4j
public class ProcessDownloadEngine implements DownloadEngine {

    private final String command;
    private final EngineParameters parameters;
    private final ObjectMapper objectMapper;
    private final ExecutorService outputExecutor;

    private volatile DownloadEventHandler handler;
    private volatile Process process;
    private volatile boolean cancelled;

    public ProcessDownloadEngine(String command, EngineParameters parameters, ObjectMapper objectMapper,
                                 ExecutorService outputExecutor) {
        this.command = command;
        this.parameters = parameters;
        this.objectMapper = objectMapper;
        this.outputExecutor = outputExecutor;
    }

    @Override
    public EngineParameters getParameters() {
        return parameters;
    }

    @Override
    public void setEventHandler(DownloadEventHandler handler) {
        this.handler = handler;
    }

    @Override
    public void run() throws Exception {
        if (cancelled) {
            throw new CancellationException("Engine cancelled before start");
        }
        List<String> cmd = buildCommand();
        log.info("Starting download engine: {}", String.join(" ", cmd));

        Process started;
        try {
            started = startProcess(cmd);
        } catch (IOException e) {
            throw new EngineException("Could not start download engine '" + command + "': " + e.getMessage(), e);
        }
        this.process = started;
        if (cancelled) {
            // cancel() ran before the process was visible to it
            started.destroyForcibly();
        }

        try {
            awaitProcess(started);
        } finally {
            if (started.isAlive()) {
                log.warn("Stopping download engine for {} after an abnormal exit", parameters.getUrl());
                started.destroyForcibly();
            }
        }
    }

    Process startProcess(List<String> cmd) throws IOException {
        return new ProcessBuilder(cmd).start();
    }

    private void awaitProcess(Process started) throws InterruptedException, EngineException {
        // Drain stderr in a separate thread so the process never blocks on a full pipe
        Future<?> stderrTask = outputExecutor.submit(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(started.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.contains("Error") || line.contains("error") || line.contains("failed")) {
                        log.error("Engine stderr: {}", line);
                    } else {
                        log.debug("Engine stderr: {}", line);
                    }
                }
            } catch (IOException e) {
                if (!cancelled) {
                    log.warn("Error reading engine stderr: {}", e.getMessage());
                }
            }
        });

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                dispatch(line);
            }
        } catch (IOException e) {
            if (!cancelled) {
                throw new EngineException("Lost connection to download engine output: " + e.getMessage(), e);
            }
        }

        try {
            int exit = started.waitFor();
            try {
                stderrTask.get(10, TimeUnit.SECONDS);
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Timeout waiting for engine stderr to drain");
                stderrTask.cancel(true);
            }
            if (cancelled) {
                throw new CancellationException("Download engine was cancelled");
            }
            if (exit != 0) {
                throw new EngineException("Download engine failed, exit=" + exit);
            }
            log.info("Download engine completed for {}", parameters.getUrl());
        } catch (InterruptedException e) {
            log.warn("Download engine interrupted for {}", parameters.getUrl());
            started.destroyForcibly();
            stderrTask.cancel(true);
            throw e;
        }
    }

    @Override
    public void cancel() {
        cancelled = true;
        Process running = this.process;
        if (running != null && running.isAlive()) {
            log.info("Stopping download engine for {}", parameters.getUrl());
            running.destroyForcibly();
        }
    }

    private void dispatch(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            log.debug("Engine stdout: {}", trimmed);
            return;
        }
        DownloadEventHandler target = handler;
        if (target == null) {
            return;
        }
        try {
            target.handleEvent(objectMapper.readValue(trimmed, DownloadEvent.class));
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed engine event: {}", e.getOriginalMessage());
        }
    }

    List<String> buildCommand() {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("--json-events");
        addOption(cmd, "--ffmpeg-path", parameters.getFfmpegPath());
        addOption(cmd, "--po-token", parameters.getPoToken());
        addOption(cmd, "--visitor-data", parameters.getVisitorData());
        addOption(cmd, "--cookies", parameters.getCookieFile());
        addOption(cmd, "--staging-directory", parameters.getStagingDirectory());
        addOption(cmd, "--output-directory", parameters.getOutputDirectory());
        addOption(cmd, "--output-template", parameters.getOutputTemplate());
        addOption(cmd, "--max-video-resolution", parameters.getMaxVideoResolution());
        addOption(cmd, "--num-parallel-downloads", parameters.getNumParallelDownloads());
        addOption(cmd, "--poll-interval", parameters.getPollIntervalSeconds());
        if (parameters.isWriteDescription()) cmd.add("--write-description");
        if (parameters.isWriteThumbnail()) cmd.add("--write-thumbnail");
        if (parameters.isPreferVp9()) cmd.add("--prioritize-vp9");
        cmd.add(parameters.getUrl());
        return cmd;
    }

    private static void addOption(List<String> cmd, String flag, Object value) {
        if (value != null && !value.toString().isBlank()) {
            cmd.add(flag);
            cmd.add(value.toString());
        }
    }
}
