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

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;

/**
 * The default {@link ConnectionEventObserver}: writes one log line per lifecycle signal.
 */
public class LoggingConnectionEventObserver implements ConnectionEventObserver {

    static final Logger logger = LoggerFactory.getLogger(LoggingConnectionEventObserver.class);

    @Override
    public void onConnect(final String serverUrl) {
        logger.info("Redis has connected: " + serverUrl);
    }

    @Override
    public void onReady(final String serverUrl) {
        logger.info("Redis is ready: " + serverUrl);
    }

    @Override
    public void onReconnecting(final String serverUrl) {
        logger.warn("Redis has lost connection, reconnecting on next command: " + serverUrl);
    }

    @Override
    public void onError(final String serverUrl, final Throwable error) {
        logger.error("Redis connection error (" + serverUrl + "): " + error);
    }
}
