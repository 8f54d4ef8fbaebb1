/*
 * Copyright (c) 2015, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.redis;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class KeyValidatorTest {

    @Test
    public void test_is_valid() {
        assertTrue(KeyValidator.isValid("user:1"));
        assertTrue(KeyValidator.isValid(""));

        assertFalse(KeyValidator.isValid(null));
        assertFalse(KeyValidator.isValid(1));
        assertFalse(KeyValidator.isValid(new StringBuilder("user:1")));
    }
}
