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

import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opens and closes native extension libraries, sharing one handle per path.
 *
 * <h2>Responsibilities</h2>
 *
 * <ol>
 *   <li>Resolves a library path against the plugin directory and canonicalizes it.</li>
 *   <li>Returns the already-open handle for an equal canonical path, or opens a new one
 *       through the {@link NativeLoader}.</li>
 *   <li>Counts holders per handle and closes the platform handle exactly once, when the
 *       last holder releases it.</li>
 * </ol>
 *
 * <h2>Path Policy</h2>
 *
 * <p>This manager does not decide whether a path is allowed. Callers run the
 * path validator before {@link #acquire(String)}; the manager only resolves.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All open/close/count transitions run under one lifecycle lock, separate
 * from any registry lock. Opening happens under that lock so two functions
 * created concurrently against the same library never open it twice, and
 * closing happens under it so a concurrent acquire never receives a handle
 * that is about to be closed.
 */
public class LibraryHandleManager {
    private static final Logger LOG = LogManager.getLogger(LibraryHandleManager.class);

    private final Path pluginDir;
    private final NativeLoader loader;
    private final Map<Path, LibraryHandle> handlesByPath = new HashMap<>();
    private final Object lifecycleLock = new Object();

    public LibraryHandleManager(Path pluginDir) {
        this(pluginDir, new JnaNativeLoader());
    }

    public LibraryHandleManager(Path pluginDir, NativeLoader loader) {
        this.pluginDir = normalize(Objects.requireNonNull(pluginDir, "pluginDir"));
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public Path getPluginDir() {
        return pluginDir;
    }

    /**
     * Returns a held reference to the library at {@code libraryPath}, opening it if needed.
     *
     * @param libraryPath path relative to the plugin directory
     * @return handle with one more holder
     * @throws LibraryLoadException if the platform loader cannot open the library
     */
    public LibraryHandle acquire(String libraryPath) throws LibraryLoadException {
        Objects.requireNonNull(libraryPath, "libraryPath");
        Path canonical = canonicalize(libraryPath);
        synchronized (lifecycleLock) {
            LibraryHandle handle = handlesByPath.get(canonical);
            if (handle == null) {
                NativeModule module = loader.open(canonical);
                handle = new LibraryHandle(canonical, module, Instant.now());
                handlesByPath.put(canonical, handle);
                LOG.info("Opened extension library: path={}", canonical);
            }
            int holders = handle.retain();
            LOG.debug("Acquired extension library: path={}, refCount={}", canonical, holders);
            return handle;
        }
    }

    /**
     * Drops one holder of the handle, closing the library when none remain.
     *
     * @param handle a handle previously returned by {@link #acquire(String)}
     * @throws IllegalStateException if the handle was already closed or does not belong to
     *         this manager
     */
    public void release(LibraryHandle handle) {
        Objects.requireNonNull(handle, "handle");
        synchronized (lifecycleLock) {
            Preconditions.checkState(!handle.isClosed(), "Library released after close: %s", handle.getPath());
            Preconditions.checkState(handlesByPath.get(handle.getPath()) == handle,
                    "Library handle not managed here: %s", handle.getPath());
            int holders = handle.releaseOne();
            Preconditions.checkState(holders >= 0, "Negative library refCount: %s", handle.getPath());
            LOG.debug("Released extension library: path={}, refCount={}", handle.getPath(), holders);
            if (holders == 0) {
                handlesByPath.remove(handle.getPath());
                closeModule(handle);
            }
        }
    }

    /**
     * Returns the open handle for a library path without taking a reference.
     *
     * @param libraryPath path relative to the plugin directory
     * @return the handle, or empty if the library is not open
     */
    public Optional<LibraryHandle> get(String libraryPath) {
        Path canonical = canonicalize(libraryPath);
        synchronized (lifecycleLock) {
            return Optional.ofNullable(handlesByPath.get(canonical));
        }
    }

    public List<LibraryHandle> list() {
        List<LibraryHandle> results;
        synchronized (lifecycleLock) {
            results = new ArrayList<>(handlesByPath.values());
        }
        results.sort(Comparator.comparing(LibraryHandle::getPath));
        return results;
    }

    public int openCount() {
        synchronized (lifecycleLock) {
            return handlesByPath.size();
        }
    }

    /**
     * Closes every library that is still open, regardless of holders.
     *
     * <p>Only for process teardown, after query execution has stopped.
     */
    public void closeAll() {
        synchronized (lifecycleLock) {
            for (LibraryHandle handle : handlesByPath.values()) {
                if (handle.getRefCount() > 0) {
                    LOG.warn("Closing extension library with live references: path={}, refCount={}",
                            handle.getPath(), handle.getRefCount());
                }
                closeModule(handle);
            }
            handlesByPath.clear();
        }
    }

    /**
     * Resolves a library path against the plugin directory. Symlinks are followed
     * when the file exists so aliases of one library share a handle.
     */
    public Path canonicalize(String libraryPath) {
        Path resolved = normalize(pluginDir.resolve(libraryPath));
        if (Files.exists(resolved)) {
            try {
                return resolved.toRealPath();
            } catch (IOException e) {
                LOG.debug("Can't resolve real path of {}, using normalized path", resolved, e);
            }
        }
        return resolved;
    }

    private static void closeModule(LibraryHandle handle) {
        handle.markClosed();
        try {
            handle.getModule().close();
            LOG.info("Closed extension library: path={}", handle.getPath());
        } catch (RuntimeException e) {
            LOG.warn("Failed to close extension library: path={}", handle.getPath(), e);
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
