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

import java.util.Objects;

/**
 * Function Definition - one row of the function catalog.
 *
 * <p>A definition names a native entry point and the library it lives in.
 * It is the durable part of a registered function: the runtime state (opened
 * library, resolved symbols, usage count) is rebuilt from it on every start.
 *
 * <p>Example SQL:
 * <pre>{@code
 * CREATE FUNCTION metaphon RETURNS STRING SONAME 'udf_example.so';
 * CREATE AGGREGATE FUNCTION avgcost RETURNS REAL SONAME 'udf_example.so';
 * }</pre>
 *
 * <p>Design principles:
 * <ul>
 *   <li>Name is unique among visible functions (compared case-insensitively)</li>
 *   <li>Library path is relative to the configured plugin directory</li>
 *   <li>Immutable after creation (use builder for construction)</li>
 * </ul>
 */
public final class FunctionDefinition {

    /** Declared function name, also the native symbol name */
    private final String name;

    private final FunctionKind kind;

    private final ReturnType returnType;

    /** Library path relative to the plugin directory */
    private final String libraryPath;

    private FunctionDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.returnType = Objects.requireNonNull(builder.returnType, "returnType is required");
        this.libraryPath = Objects.requireNonNull(builder.libraryPath, "libraryPath is required");
    }

    public String getName() {
        return name;
    }

    public FunctionKind getKind() {
        return kind;
    }

    public ReturnType getReturnType() {
        return returnType;
    }

    public String getLibraryPath() {
        return libraryPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionDefinition that = (FunctionDefinition) o;
        return name.equals(that.name)
                && kind == that.kind
                && returnType == that.returnType
                && libraryPath.equals(that.libraryPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, returnType, libraryPath);
    }

    @Override
    public String toString() {
        return "FunctionDefinition{"
                + "name='" + name + '\''
                + ", kind=" + kind
                + ", returnType=" + returnType
                + ", libraryPath='" + libraryPath + '\''
                + '}';
    }

    /**
     * Creates a new builder.
     *
     * @return new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with values from this definition.
     *
     * @return builder with copied values
     */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .kind(kind)
                .returnType(returnType)
                .libraryPath(libraryPath);
    }

    /**
     * Builder for {@link FunctionDefinition}.
     */
    public static final class Builder {
        private String name;
        private FunctionKind kind = FunctionKind.SCALAR;
        private ReturnType returnType;
        private String libraryPath;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(FunctionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder returnType(ReturnType returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder libraryPath(String libraryPath) {
            this.libraryPath = libraryPath;
            return this;
        }

        /**
         * Builds the FunctionDefinition.
         *
         * @return built definition
         * @throws NullPointerException if name, returnType or libraryPath is null
         */
        public FunctionDefinition build() {
            return new FunctionDefinition(this);
        }
    }
}
