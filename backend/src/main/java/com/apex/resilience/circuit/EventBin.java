package com.apex.resilience.circuit;

/**
 * Outcome counts for one wall-clock second of the rolling window.
 */
final class EventBin {

    private final long epochSecond;
    private long okCount;
    private long errCount;

    EventBin(long epochSecond) {
        this.epochSecond = epochSecond;
    }

    void add(boolean isError) {
        if (isError) {
            errCount++;
        } else {
            okCount++;
        }
    }

    long epochSecond() {
        return epochSecond;
    }

    long okCount() {
        return okCount;
    }

    long errCount() {
        return errCount;
    }

    long total() {
        return okCount + errCount;
    }
}
