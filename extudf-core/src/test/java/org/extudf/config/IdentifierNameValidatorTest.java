// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.extudf.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link IdentifierNameValidator}.
 */
@DisplayName("IdentifierNameValidator Unit Tests")
class IdentifierNameValidatorTest {

    private final IdentifierNameValidator validator = new IdentifierNameValidator(8);

    @Test
    @DisplayName("UT-NAME-001: Ordinary names up to the limit are valid")
    void testValid() {
        Assertions.assertTrue(validator.isValidName("metaphon"));
        Assertions.assertTrue(validator.isValidName("f"));
        Assertions.assertTrue(validator.isValidName("m\u00e9taph"));
    }

    @Test
    @DisplayName("UT-NAME-002: Length counts code points")
    void testLength() {
        Assertions.assertFalse(validator.isValidName("metaphone"));
        // eight supplementary characters, sixteen chars
        String smileys = new String(Character.toChars(0x1F600)).repeat(8);
        Assertions.assertEquals(16, smileys.length());
        Assertions.assertTrue(validator.isValidName(smileys));
        Assertions.assertFalse(validator.isValidName(smileys + "x"));
    }

    @Test
    @DisplayName("UT-NAME-003: Blank, control characters and broken surrogates are invalid")
    void testInvalid() {
        Assertions.assertFalse(validator.isValidName(null));
        Assertions.assertFalse(validator.isValidName(" "));
        Assertions.assertFalse(validator.isValidName("a\u0000b"));
        Assertions.assertFalse(validator.isValidName("tab\tx"));
        Assertions.assertFalse(validator.isValidName("x\uD83D"));
        Assertions.assertFalse(validator.isValidName("\uDE00x"));
    }

    @Test
    @DisplayName("UT-NAME-004: Limit must be positive")
    void testLimit() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new IdentifierNameValidator(0));
    }
}
