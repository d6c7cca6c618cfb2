package com.xksgroup.streamarchiver.service.engine;

import com.xksgroup.streamarchiver.model.event.DownloadEventHandler;

/**
 * The external download/mux engine driving one job.
 * <p>
 * {@link #run()} blocks until the engine is done and reports progress only through the
 * attached handler. A cancelled run ends with a {@link java.util.concurrent.CancellationException}
 * or an {@link InterruptedException}.
 */
public interface DownloadEngine {

    EngineParameters getParameters();

    void setEventHandler(DownloadEventHandler handler);

    void run() throws Exception;

    void cancel();
}
