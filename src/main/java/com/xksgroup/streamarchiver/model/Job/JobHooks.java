package com.xksgroup.streamarchiver.model.Job;

/**
 * Side effects a job triggers on its surroundings. Implementations must not block.
 */
public interface JobHooks {

    /** The job's status changed; send a status notification. */
    void statusChanged(DownloadJob job);

    /** The job's state changed in any way; publish a snapshot to subscribers. */
    void updated(DownloadJob job);

    /** Write a snapshot of the job to the store. */
    void persist(DownloadJob job);

    /** The job finished downloading; start post-completion health checks. */
    void finished(DownloadJob job);
}
