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

package org.extudf.loader;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime handle for one opened native library.
 *
 * <p>A handle is shared by every function backed by the same library. Its
 * reference count and closed flag are owned by {@link LibraryHandleManager}
 * and only change under the manager's lock.
 */
public final class LibraryHandle {

    private final Path path;
    private final NativeModule module;
    private final Instant openedAt;

    // written under LibraryHandleManager#lifecycleLock, read from any thread
    private volatile int refCount;
    private volatile boolean closed;

    LibraryHandle(Path path, NativeModule module, Instant openedAt) {
        this.path = Objects.requireNonNull(path, "path");
        this.module = Objects.requireNonNull(module, "module");
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt");
    }

    /** Canonical library path; the deduplication key. */
    public Path getPath() {
        return path;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Looks up an exported symbol.
     *
     * @throws IllegalStateException if the library has already been closed
     */
    public Optional<NativeSymbol> findSymbol(String symbolName) {
        if (closed) {
            throw new IllegalStateException("Library already closed: " + path);
        }
        return module.findSymbol(symbolName);
    }

    /** Number of holders; a snapshot, for diagnostics. */
    public int getRefCount() {
        return refCount;
    }

    int retain() {
        return ++refCount;
    }

    int releaseOne() {
        return --refCount;
    }

    void markClosed() {
        closed = true;
    }

    NativeModule getModule() {
        return module;
    }

    @Override
    public String toString() {
        return "LibraryHandle{"
                + "path=" + path
                + ", refCount=" + refCount
                + ", closed=" + closed
                + '}';
    }
}
