package com.apex.resilience.lease;

/**
 * Leadership metrics keyed by environment, service and instance. Every method is a no-op by
 * default.
 */
public interface LeaseMetrics {

    LeaseMetrics NOOP = new LeaseMetrics() {
    };

    default void setLeaderState(String env, String service, String instance, boolean leader) {
    }

    default void incLeaderElections(String env, String service) {
    }

    default void incRenewFailures(String env, String service) {
    }
}
