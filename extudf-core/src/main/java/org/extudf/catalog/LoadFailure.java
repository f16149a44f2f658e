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

package org.extudf.catalog;

import java.util.Objects;

/**
 * Standard failure record for one catalog row skipped by the startup scan.
 */
public final class LoadFailure {

    /** The catalog itself could not be read. */
    public static final String STAGE_READ = "read";
    /** Path or name failed validation. */
    public static final String STAGE_VALIDATE = "validate";
    /** The library could not be opened; the function stays registered but unusable. */
    public static final String STAGE_OPEN = "open";
    /** Symbols could not be resolved. */
    public static final String STAGE_RESOLVE = "resolve";
    /** Another row already registered the same name. */
    public static final String STAGE_CONFLICT = "conflict";

    private final String functionName;
    private final String stage;
    private final String message;
    private final Throwable cause;

    public LoadFailure(String functionName, String stage, String message, Throwable cause) {
        this.functionName = functionName;
        this.stage = requireNonBlank(stage, "stage");
        this.message = requireNonBlank(message, "message");
        this.cause = cause;
    }

    /** Function name of the row, or null for a catalog-level failure. */
    public String getFunctionName() {
        return functionName;
    }

    public String getStage() {
        return stage;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "LoadFailure{function=" + functionName + ", stage=" + stage + ", message=" + message + '}';
    }

    private static String requireNonBlank(String value, String fieldName) {
        Objects.requireNonNull(value, fieldName);
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " is blank");
        }
        return trimmed;
    }
}
