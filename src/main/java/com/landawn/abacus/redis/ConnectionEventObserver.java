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
 * Receives connection lifecycle signals from a {@link JedisStoreConnection}.
 *
 * <p>Handlers are invoked on the thread that observed the transition, usually a thread running a
 * cache operation. They must return quickly, must not block or retry, and must not touch the cache.
 * An exception thrown by a handler is logged and otherwise ignored.</p>
 *
 * @see LoggingConnectionEventObserver
 */
public interface ConnectionEventObserver {

    /**
     * The client handle was built (or rebuilt after a failure).
     *
     * @param serverUrl the address(es) of the store
     */
    void onConnect(String serverUrl);

    /**
     * The store answered a command; the connection is usable.
     *
     * @param serverUrl the address(es) of the store
     */
    void onReady(String serverUrl);

    /**
     * The connection was lost; the client will reconnect on the next command.
     *
     * @param serverUrl the address(es) of the store
     */
    void onReconnecting(String serverUrl);

    /**
     * A connection-level failure occurred.
     *
     * @param serverUrl the address(es) of the store
     * @param error the failure
     */
    void onError(String serverUrl, Throwable error);
}
