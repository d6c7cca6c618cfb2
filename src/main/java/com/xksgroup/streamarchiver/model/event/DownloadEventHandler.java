package com.xksgroup.streamarchiver.model.event;

/**
 * Anything that accepts the download engine's event stream.
 */
@FunctionalInterface
public interface DownloadEventHandler {

    void handleEvent(DownloadEvent event);
}
