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

package org.extudf;

/**
 * SQL result type an extension function returns.
 *
 * <p>Codes are the persisted catalog values. Code 3 (row result) is not a
 * valid function return type and is rejected by {@link #fromCode(int)}.
 */
public enum ReturnType {
    STRING(0),
    REAL(1),
    INT(2),
    DECIMAL(4);

    private final int code;

    ReturnType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static ReturnType fromCode(int code) {
        for (ReturnType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown return type code: " + code);
    }
}
