// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors owned by {@link RadiusClient} instances that were not given one.
 */
public final class RadiusExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private RadiusExecutors() {
    }

    /**
     * A cached pool of daemon threads named {@code radius-io-N}. RPC calls block
     * on the network, so the pool grows with demand and idles back down.
     */
    public static ExecutorService newIoExecutor() {
        return Executors.newCachedThreadPool(r -> {
            // mask the sign bit so ids stay non-negative after overflow
            final int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            final Thread t = new Thread(r, "radius-io-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
