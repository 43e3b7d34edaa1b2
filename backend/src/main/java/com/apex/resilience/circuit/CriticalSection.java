package com.apex.resilience.circuit;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Scoped acquisition around breaker state. Chosen once when the breaker is built: either a
 * single-permit, non-reentrant guard or a pass-through.
 */
interface CriticalSection {

    <T> T call(Supplier<T> body);

    static CriticalSection locking() {
        Semaphore permit = new Semaphore(1);
        return new CriticalSection() {
            @Override
            public <T> T call(Supplier<T> body) {
                permit.acquireUninterruptibly();
                try {
                    return body.get();
                } finally {
                    permit.release();
                }
            }
        };
    }

    static CriticalSection none() {
        return new CriticalSection() {
            @Override
            public <T> T call(Supplier<T> body) {
                return body.get();
            }
        };
    }
}
