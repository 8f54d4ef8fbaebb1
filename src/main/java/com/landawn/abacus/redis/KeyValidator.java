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
 * Guards cache operations against malformed keys. A key is valid if it is present and textual.
 */
public final class KeyValidator {

    private KeyValidator() {
        // utility class.
    }

    /**
     * Checks whether the specified key may be sent to the store.
     *
     * @param key the candidate key, may be {@code null} or of any type
     * @return {@code true} if {@code key} is a non-null {@code String}
     */
    public static boolean isValid(final Object key) {
        return key instanceof String;
    }
}
