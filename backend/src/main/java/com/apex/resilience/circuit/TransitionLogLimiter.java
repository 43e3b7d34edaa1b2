package com.apex.resilience.circuit;

/**
 * Per-second line budget for transition logging. The budget refills whenever the observed
 * second changes, independent of how many transitions happen.
 */
final class TransitionLogLimiter {

    private final int maxLinesPerSec;
    private long currentSecond = Long.MIN_VALUE;
    private int remaining;

    TransitionLogLimiter(int maxLinesPerSec) {
        this.maxLinesPerSec = Math.max(0, maxLinesPerSec);
        this.remaining = this.maxLinesPerSec;
    }

    boolean tryAcquire(long epochSecond) {
        if (epochSecond != currentSecond) {
            currentSecond = epochSecond;
            remaining = maxLinesPerSec;
        }
        if (remaining > 0) {
            remaining--;
            return true;
        }
        return false;
    }
}
