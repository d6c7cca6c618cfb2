package com.xksgroup.streamarchiver.service.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.streamarchiver.config.ConfigService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Component
@RequiredArgsConstructor
public class ProcessDownloadEngineFactory implements DownloadEngineFactory {

    private final ConfigService configService;
    private final ObjectMapper objectMapper;
    private final ExecutorService outputExecutor = Executors.newCachedThreadPool();

    @Override
    public DownloadEngine create(EngineParameters parameters) {
        String command = configService.getConfig().getDownloader().getCommand();
        return new ProcessDownloadEngine(command, parameters, objectMapper, outputExecutor);
    }

    @PreDestroy
    public void shutdown() {
        outputExecutor.shutdownNow();
    }
}
