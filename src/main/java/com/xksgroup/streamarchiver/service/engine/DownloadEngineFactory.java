package com.xksgroup.streamarchiver.service.engine;

@FunctionalInterface
public interface DownloadEngineFactory {

    DownloadEngine create(EngineParameters parameters);
}
