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
import com.landawn.abacus.parser.JSONParser;
import com.landawn.abacus.parser.ParserFactory;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * Converts scalar cache values to and from the JSON text stored in Redis.
 *
 * <p>Encoding always succeeds for values the JSON parser can represent. Decoding is soft:
 * a store miss ({@code null} text) and malformed text both decode to {@code null}, which the
 * cache treats as "absent".</p>
 *
 * <p>Hash field values written by {@link SemanticCache#multiput(String, java.util.Map)} do not go
 * through this codec.</p>
 */
public class ValueCodec {

    static final Logger logger = LoggerFactory.getLogger(ValueCodec.class);

    static final String NULL_TEXT = "null";

    private static final JSONParser jsonParser = ParserFactory.createJSONParser();

    /**
     * Encodes the specified value as JSON text.
     *
     * @param value the value to encode, may be {@code null}
     * @return the JSON text, {@code "null"} for a {@code null} value
     */
    public String encode(final Object value) {
        return value == null ? NULL_TEXT : jsonParser.serialize(value);
    }

    /**
     * Decodes JSON text read from the store.
     *
     * @param <T> the target type
     * @param text the stored text, {@code null} on a store miss
     * @param targetType the class to decode into
     * @return the decoded value, or {@code null} if the text is absent, JSON {@code null}, or malformed
     * @throws IllegalArgumentException if {@code targetType} is {@code null}
     */
    public <T> T decode(final String text, final Class<? extends T> targetType) throws IllegalArgumentException {
        N.checkArgNotNull(targetType, "targetType");

        if (Strings.isEmpty(text) || NULL_TEXT.equals(text)) {
            return null;
        }

        try {
            return jsonParser.deserialize(text, targetType);
        } catch (final RuntimeException e) {
            logger.debug("Failed to decode cached text as " + targetType.getName() + ": " + e.getMessage());
            return null;
        }
    }
}
