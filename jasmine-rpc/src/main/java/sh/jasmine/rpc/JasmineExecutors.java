// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the SDK's background executors.
 *
 * <p>
 * All threads are daemon threads so an unclosed client never keeps the JVM
 * alive.
 */
public final class JasmineExecutors {

    private static final AtomicInteger SCHEDULER_THREAD_ID = new AtomicInteger(0);

    private JasmineExecutors() {
    }

    /**
     * Creates the single-threaded scheduler used for receipt polling.
     *
     * <p>
     * Scheduled tasks only issue asynchronous requests, so one thread serves
     * any number of pending confirmations. Threads are named
     * {@code jasmine-receipt-poller-N}.
     *
     * @return a new scheduler; the caller owns its shutdown
     */
    public static ScheduledExecutorService newReceiptPoller() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            // Mask off sign bit to keep ids non-negative after overflow
            final int id = SCHEDULER_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            final Thread t = new Thread(r, "jasmine-receipt-poller-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
