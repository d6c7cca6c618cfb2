package com.xksgroup.streamarchiver.model.Job;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum JobStatus {
    UNKNOWN(3),      // Job created, no event received yet
    WAITING(1),      // Stream scheduled, waiting for it to go live
    DOWNLOADING(2),  // Fragments are being downloaded
    MUXING(0),       // Fragments are being combined into the output file
    FINISHED(0),     // Output written
    ERROR(0),        // Engine failure or failed output move
    CANCELLED(0),    // Task cancelled externally
    UNAVAILABLE(0);  // Stream went private or was removed

    private static final Set<JobStatus> TERMINAL = EnumSet.of(FINISHED, ERROR, CANCELLED, UNAVAILABLE);
    private static final Set<JobStatus> TEMP_FILE_DELETABLE = EnumSet.of(CANCELLED, FINISHED, ERROR);

    private final int sortPriority;

    JobStatus(int sortPriority) {
        this.sortPriority = sortPriority;
    }

    public int getSortPriority() {
        return sortPriority;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean allowsTempFileDeletion() {
        return TEMP_FILE_DELETABLE.contains(this);
    }

    /**
     * "Finished", "Downloading", ... as shown in notifications.
     */
    public String displayName() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    /**
     * Tag suffix used for status notifications, e.g. {@code status:finished}.
     */
    public String notificationTag() {
        return "status:" + name().toLowerCase(Locale.ROOT);
    }
}
