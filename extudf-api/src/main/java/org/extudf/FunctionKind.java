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
 * Kind of an extension function, fixed when the function is created.
 *
 * <p>The code is the value stored in the function catalog.
 */
public enum FunctionKind {
    SCALAR(1),
    AGGREGATE(2);

    private final int code;

    FunctionKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Maps a persisted catalog code back to a kind.
     *
     * @param code catalog code
     * @return the matching kind
     * @throws IllegalArgumentException if the code is unknown
     */
    public static FunctionKind fromCode(int code) {
        for (FunctionKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown function kind code: " + code);
    }
}
