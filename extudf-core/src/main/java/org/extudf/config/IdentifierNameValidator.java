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

import org.extudf.spi.NameValidator;

import com.google.common.base.Preconditions;

/**
 * Function name policy: non-blank, at most {@code maxLength} characters (code
 * points), well-formed UTF-16 and free of control characters.
 */
public class IdentifierNameValidator implements NameValidator {

    private final int maxLength;

    public IdentifierNameValidator(int maxLength) {
        Preconditions.checkArgument(maxLength > 0, "maxLength must be positive: %s", maxLength);
        this.maxLength = maxLength;
    }

    @Override
    public boolean isValidName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return false;
        }
        int length = 0;
        for (int i = 0; i < name.length(); ) {
            char c = name.charAt(i);
            int codePoint;
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= name.length() || !Character.isLowSurrogate(name.charAt(i + 1))) {
                    return false;
                }
                codePoint = Character.toCodePoint(c, name.charAt(i + 1));
                i += 2;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            } else {
                codePoint = c;
                i++;
            }
            if (Character.isISOControl(codePoint)) {
                return false;
            }
            if (++length > maxLength) {
                return false;
            }
        }
        return true;
    }
}
