package com.xksgroup.streamarchiver.model.Job;

import java.time.Instant;

public record JobLogMessage(Instant eventTime, String message) {
}
