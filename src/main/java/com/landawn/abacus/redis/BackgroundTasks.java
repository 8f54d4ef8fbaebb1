/*
 * Copyright (C) 2015 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.redis;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.AsyncExecutor;
import com.landawn.abacus.util.IOUtil;
import com.landawn.abacus.util.N;

/**
 * Runs best-effort store commands off the caller's thread: the write-back of {@link SemanticCache#remember(String, long, Class, java.util.concurrent.Callable)},
 * the expiry set by {@link SemanticCache#multiput(String, java.util.Map, long)}, and the readiness
 * ping issued by {@link ConnectionResolver#run()}.
 *
 * <p><b>Errors are dropped.</b> A failing task is logged at debug level and counted in
 * {@link #droppedCount()}; nothing is reported to the code that submitted it.</p>
 */
public class BackgroundTasks {

    static final Logger logger = LoggerFactory.getLogger(BackgroundTasks.class);

    static final AsyncExecutor sharedExecutor = new AsyncExecutor(//
            N.max(8, IOUtil.CPU_CORES), // coreThreadPoolSize
            N.max(32, IOUtil.CPU_CORES * 4), // maxThreadPoolSize
            180L, TimeUnit.SECONDS);

    private final AsyncExecutor asyncExecutor;

    private final AtomicInteger inFlight = new AtomicInteger();

    private final AtomicLong droppedCounter = new AtomicLong();

    private final Object idleLock = new Object();

    /**
     * Constructs an instance that runs tasks on the shared executor.
     */
    public BackgroundTasks() {
        this(sharedExecutor);
    }

    /**
     * Constructs an instance that runs tasks on the specified executor.
     *
     * @param asyncExecutor the executor
     */
    public BackgroundTasks(final AsyncExecutor asyncExecutor) {
        N.checkArgNotNull(asyncExecutor, "asyncExecutor");

        this.asyncExecutor = asyncExecutor;
    }

    /**
     * Submits a task whose outcome nobody waits for.
     *
     * @param description what the task does, used in the log line if it fails
     * @param task the task
     */
    public void fireAndForget(final String description, final Callable<?> task) {
        inFlight.incrementAndGet();

        try {
            asyncExecutor.execute(() -> {
                try {
                    task.call();
                } catch (final Exception e) {
                    drop(description, e);
                } finally {
                    release();
                }

                return null;
            });
        } catch (final RuntimeException e) {
            // rejected by the executor
            drop(description, e);
            release();
        }
    }

    /**
     * Returns the number of tasks that failed and whose failure was dropped.
     *
     * @return the dropped count
     */
    public long droppedCount() {
        return droppedCounter.get();
    }

    /**
     * Returns the number of tasks submitted but not yet finished.
     *
     * @return the in-flight count
     */
    public int inFlightCount() {
        return inFlight.get();
    }

    /**
     * Waits until every submitted task has finished.
     *
     * @param timeoutMillis the maximum time to wait
     * @return {@code true} if no task is in flight, {@code false} if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitIdle(final long timeoutMillis) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + timeoutMillis;

        synchronized (idleLock) {
            while (inFlight.get() > 0) {
                final long remaining = deadline - System.currentTimeMillis();

                if (remaining <= 0) {
                    return false;
                }

                idleLock.wait(remaining);
            }
        }

        return true;
    }

    private void drop(final String description, final Exception e) {
        droppedCounter.incrementAndGet();

        if (logger.isDebugEnabled()) {
            logger.debug("Dropped failure of background task '" + description + "': " + e);
        }
    }

    private void release() {
        if (inFlight.decrementAndGet() == 0) {
            synchronized (idleLock) {
                idleLock.notifyAll();
            }
        }
    }
}
