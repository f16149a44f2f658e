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
import org.extudf.loader.LibraryHandle;
import org.extudf.resolver.EntryPoints;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One registered extension function: its definition, the library backing it and
 * the resolved entry points.
 *
 * <p>A descriptor without a library is registered but unusable: its library
 * failed to open during the startup scan. It can be listed and dropped, but
 * never acquired.
 *
 * <p>{@code usageCount} counts the callers holding the descriptor plus one while
 * it is visible by name. It is incremented by lookups under the registry read
 * lock and otherwise only changed under the registry write lock, which is why it
 * is atomic. Visibility and the registry key only change under the write lock.
 */
public final class FunctionDescriptor {

    static final long UNREGISTERED = -1L;

    private final FunctionDefinition definition;
    private final LibraryHandle library;
    private final EntryPoints entryPoints;
    private final AtomicInteger usageCount = new AtomicInteger(1);

    private volatile Visibility visibility = Visibility.VISIBLE;
    private volatile long key = UNREGISTERED;

    private FunctionDescriptor(FunctionDefinition definition, LibraryHandle library, EntryPoints entryPoints) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.library = library;
        this.entryPoints = entryPoints;
    }

    /**
     * Creates a usable descriptor. The caller transfers its hold on {@code library}
     * to the descriptor; the registry releases it when the descriptor is removed.
     */
    public static FunctionDescriptor loaded(FunctionDefinition definition, LibraryHandle library,
            EntryPoints entryPoints) {
        Objects.requireNonNull(library, "library");
        Objects.requireNonNull(entryPoints, "entryPoints");
        if (entryPoints.getKind() != definition.getKind()) {
            throw new IllegalArgumentException("Entry points resolved for " + entryPoints.getKind()
                    + " but function is " + definition.getKind());
        }
        return new FunctionDescriptor(definition, library, entryPoints);
    }

    /**
     * Creates a registered-but-unusable descriptor for a function whose library
     * could not be opened.
     */
    public static FunctionDescriptor unloaded(FunctionDefinition definition) {
        return new FunctionDescriptor(definition, null, null);
    }

    /** Registry key of a function name: names compare case-insensitively. */
    public static String nameKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public String getName() {
        return definition.getName();
    }

    public FunctionDefinition getDefinition() {
        return definition;
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

    public Optional<LibraryHandle> getLibrary() {
        return Optional.ofNullable(library);
    }

    public boolean isUsable() {
        return library != null;
    }

    /**
     * Returns the resolved entry points.
     *
     * @throws IllegalStateException if the descriptor is unusable
     */
    public EntryPoints getEntryPoints() {
        if (entryPoints == null) {
            throw new IllegalStateException("Function '" + getName() + "' has no loaded library");
        }
        return entryPoints;
    }

    public int getUsageCount() {
        return usageCount.get();
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public FunctionInfo toInfo() {
        return new FunctionInfo(definition,
                library != null ? library.getPath() : null,
                entryPoints != null && entryPoints.isSuspicious(),
                usageCount.get(),
                visibility);
    }

    long getKey() {
        return key;
    }

    void setKey(long key) {
        this.key = key;
    }

    void setVisibility(Visibility visibility) {
        this.visibility = visibility;
    }

    AtomicInteger usage() {
        return usageCount;
    }

    @Override
    public String toString() {
        return "FunctionDescriptor{"
                + "name='" + getName() + '\''
                + ", kind=" + getKind()
                + ", library=" + (library != null ? library.getPath() : "<not loaded>")
                + ", usageCount=" + usageCount.get()
                + ", visibility=" + visibility
                + '}';
    }
}
