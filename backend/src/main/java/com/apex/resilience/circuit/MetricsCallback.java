package com.apex.resilience.circuit;

import java.util.Map;

/**
 * Single-entry metrics sink. Emitted names:
 * <ul>
 *     <li>{@code circuit_state} with {@code value} (state code)</li>
 *     <li>{@code err_rate_window} with {@code value} (error fraction)</li>
 *     <li>{@code transitions_total} with {@code from} and {@code to} (state names)</li>
 *     <li>{@code flood_coalesced_total} with {@code add}</li>
 *     <li>{@code per_sec_event_rate} with {@code value} (events in the current second)</li>
 * </ul>
 */
@FunctionalInterface
public interface MetricsCallback {

    String CIRCUIT_STATE = "circuit_state";
    String ERR_RATE_WINDOW = "err_rate_window";
    String TRANSITIONS_TOTAL = "transitions_total";
    String FLOOD_COALESCED_TOTAL = "flood_coalesced_total";
    String PER_SEC_EVENT_RATE = "per_sec_event_rate";

    void emit(String name, Map<String, Object> fields);
}
