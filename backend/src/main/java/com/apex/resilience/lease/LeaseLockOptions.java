package com.apex.resilience.lease;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class LeaseLockOptions {

    @Builder.Default
    long ttlMs = 3000;

    @Builder.Default
    long renewMs = 1500;

    @Builder.Default
    String env = "dev";

    @Builder.Default
    String service = "apex";

    @Builder.Default
    LeaseMetrics metrics = LeaseMetrics.NOOP;

    public static LeaseLockOptions defaults() {
        return LeaseLockOptions.builder().build();
    }
}
