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

/**
 * Base class for {@link StoreConnection} implementations.
 * It keeps the server URL and the closed flag, and turns {@link #close()} into a
 * once-only call of {@link #doClose()}.
 *
 * <p><b>Thread Safety:</b> {@code serverUrl} is immutable after construction and the closed
 * flag is volatile. Subclasses must make their command methods thread-safe.</p>
 *
 * @see JedisStoreConnection
 */
public abstract class AbstractStoreConnection implements StoreConnection {

    private final String serverUrl;

    private volatile boolean isClosed = false;

    /**
     * Constructs a connection for the specified server URL.
     *
     * @param serverUrl the address, or comma separated addresses, of the store
     */
    protected AbstractStoreConnection(final String serverUrl) {
        this.serverUrl = serverUrl;
    }

    @Override
    public String serverUrl() {
        return serverUrl;
    }

    @Override
    public synchronized void close() {
        if (isClosed) {
            return;
        }

        try {
            doClose();
        } finally {
            isClosed = true;
        }
    }

    /**
     * Checks whether {@link #close()} has been called.
     *
     * @return {@code true} if closed
     */
    public boolean isClosed() {
        return isClosed;
    }

    /**
     * Releases the underlying client. Called at most once.
     */
    protected abstract void doClose();

    protected void assertNotClosed() {
        if (isClosed) {
            throw new IllegalStateException("Connection to " + serverUrl + " has been closed");
        }
    }
}
