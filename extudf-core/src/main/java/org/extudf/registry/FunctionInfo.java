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

package org.extudf.registry;

import org.extudf.FunctionDefinition;
import org.extudf.FunctionKind;
import org.extudf.ReturnType;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a registered function, for listings and DDL results.
 */
public final class FunctionInfo {

    private final FunctionDefinition definition;
    private final Path resolvedLibraryPath;
    private final boolean suspiciousBinding;
    private final int usageCount;
    private final Visibility visibility;

    FunctionInfo(FunctionDefinition definition, Path resolvedLibraryPath, boolean suspiciousBinding,
            int usageCount, Visibility visibility) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.resolvedLibraryPath = resolvedLibraryPath;
        this.suspiciousBinding = suspiciousBinding;
        this.usageCount = usageCount;
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return definition.getName();
    }

    public FunctionKind getKind() {
        return definition.getKind();
    }

    public ReturnType getReturnType() {
        return definition.getReturnType();
    }

    public String getLibraryPath() {
        return definition.getLibraryPath();
    }

    public FunctionDefinition getDefinition() {
        return definition;
    }

    /** Canonical path of the opened library, or empty if it failed to load. */
    public Optional<Path> getResolvedLibraryPath() {
        return Optional.ofNullable(resolvedLibraryPath);
    }

    public boolean isUsable() {
        return resolvedLibraryPath != null;
    }

    /** True if the function was bound without auxiliary symbols; see {@code allow_suspicious_udfs}. */
    public boolean isSuspiciousBinding() {
        return suspiciousBinding;
    }

    public int getUsageCount() {
        return usageCount;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    @Override
    public String toString() {
        return "FunctionInfo{"
                + "name='" + getName() + '\''
                + ", kind=" + getKind()
                + ", returnType=" + getReturnType()
                + ", libraryPath='" + getLibraryPath() + '\''
                + ", usable=" + isUsable()
                + (suspiciousBinding ? ", suspicious" : "")
                + '}';
    }
}
