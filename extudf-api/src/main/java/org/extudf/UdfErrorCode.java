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
 * Error kinds reported by extension function DDL, lookup and startup loading.
 */
public enum UdfErrorCode {
    INVALID_PATH(1),
    INVALID_NAME(2),
    DUPLICATE_NAME(3),
    LIBRARY_LOAD_ERROR(4),
    MISSING_SYMBOL(5),
    SUSPICIOUS_BINDING(6),
    AGGREGATE_MISSING_AUX_SYMBOL(7),
    FUNCTION_NOT_FOUND(8),
    PERSISTENCE_ERROR(9),
    TRANSACTION_ABORTED(10);

    private final int code;

    UdfErrorCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
