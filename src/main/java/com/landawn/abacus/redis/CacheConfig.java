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

import lombok.Builder;
import lombok.Value;

/**
 * Connection settings for the Redis server (or cluster) behind a {@link SemanticCache}.
 *
 * <p>An instance supplied by the application may leave any field {@code null}, meaning
 * "not specified". {@link ConnectionResolver#resolve(java.util.Map, CacheConfig)} layers the
 * environment over it and fills the gaps with defaults, producing a config with every field
 * except {@code password} set.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * CacheConfig config = CacheConfig.builder()
 *         .host("redis-1,redis-2,redis-3")
 *         .port(7000)
 *         .password("secret")
 *         .build();
 * }</pre>
 *
 * @see ConnectionResolver
 */
@Value
@Builder(toBuilder = true)
public class CacheConfig {

    /**
     * Host name, or a comma separated list of {@code host[:port]} addresses for a cluster.
     */
    String host;

    /**
     * Port paired with every address that does not carry its own.
     */
    Integer port;

    /**
     * Password sent with AUTH after the connection is built, {@code null} for none.
     */
    String password;

    /**
     * Forces cluster topology even for a single seed address.
     */
    Boolean cluster;

    /**
     * Connect and socket timeout in milliseconds.
     */
    Long timeout;

    /**
     * Returns an empty config: every setting falls through to the environment or the defaults.
     *
     * @return a config with no field specified
     */
    public static CacheConfig empty() {
        return builder().build();
    }
}
