package com.xksgroup.streamarchiver.model.Job;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckStatus {
    private HealthCheckResult lastResult;
    private Instant lastChecked;

    public HealthCheckStatus copy() {
        return new HealthCheckStatus(lastResult, lastChecked);
    }
}
