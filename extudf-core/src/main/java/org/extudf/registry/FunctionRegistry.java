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

import org.extudf.UdfException;
import org.extudf.loader.LibraryHandle;
import org.extudf.loader.LibraryHandleManager;

import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Concurrent registry of extension functions.
 *
 * <h2>Layout</h2>
 *
 * <p>Descriptors live in an arena keyed by a registry-assigned, never reused
 * {@code long}. A separate name index maps each visible function name to its arena
 * key. Dropping a function that is still in use removes the name index entry
 * and leaves the arena entry in place, shadowed, until the last holder releases it.
 * Shadowed entries can therefore never collide with each other or with a newly
 * created function of the same name.
 *
 * <h2>Reference Counting</h2>
 *
 * <p>A visible descriptor carries one implicit hold for the registry itself.
 * {@link #acquire(String)} adds a hold, {@link #release(FunctionDescriptor)} drops one,
 * {@link #markForRemoval(String)} drops the registry's own. When the count reaches
 * zero the descriptor is removed and its library hold is returned to the
 * {@link LibraryHandleManager}, which closes the library once no other function
 * shares it.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>One read/write lock guards both maps. Lookups take the read side and run in
 * parallel; insert, release and removal take the write side. Library release runs
 * after the write lock is dropped so a slow native finalizer never blocks lookups.
 */
public class FunctionRegistry {
    private static final Logger LOG = LogManager.getLogger(FunctionRegistry.class);

    private final LibraryHandleManager libraries;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private final Map<Long, FunctionDescriptor> arena = new HashMap<>();
    private final Map<String, Long> visibleNames = new HashMap<>();
    private long nextKey = 1L;

    public FunctionRegistry(LibraryHandleManager libraries) {
        this.libraries = Objects.requireNonNull(libraries, "libraries");
    }

    /**
     * Looks up a usable function and takes a hold on it. The caller must call
     * {@link #release(FunctionDescriptor)} exactly once when its invocation is done.
     *
     * @param name function name
     * @return the held descriptor, or empty if no such function exists or its library
     *         failed to load
     */
    public Optional<FunctionDescriptor> acquire(String name) {
        lock.readLock().lock();
        try {
            FunctionDescriptor descriptor = lookupVisible(name);
            if (descriptor == null || !descriptor.isUsable()) {
                return Optional.empty();
            }
            int holders = descriptor.usage().incrementAndGet();
            LOG.debug("Acquired function: name={}, usageCount={}", descriptor.getName(), holders);
            return Optional.of(descriptor);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Looks up a usable function without taking a hold, for existence checks such as
     * name resolution during parsing.
     *
     * @param name function name
     * @return the descriptor, or empty if no such function exists or it is unusable
     */
    public Optional<FunctionDescriptor> find(String name) {
        lock.readLock().lock();
        try {
            FunctionDescriptor descriptor = lookupVisible(name);
            return descriptor != null && descriptor.isUsable() ? Optional.of(descriptor) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Looks up a visible function whether or not its library loaded. Used by DDL.
     */
    public Optional<FunctionDescriptor> getRegistered(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lookupVisible(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Registers a new descriptor as visible, with the registry's own hold.
     *
     * @param descriptor a descriptor that was never registered
     * @throws UdfException {@code DUPLICATE_NAME} if a visible function has the same name
     */
    public void insert(FunctionDescriptor descriptor) throws UdfException {
        Objects.requireNonNull(descriptor, "descriptor");
        lock.writeLock().lock();
        try {
            Preconditions.checkState(descriptor.getKey() == FunctionDescriptor.UNREGISTERED,
                    "Function descriptor already registered: %s", descriptor.getName());
            String nameKey = FunctionDescriptor.nameKey(descriptor.getName());
            if (visibleNames.containsKey(nameKey)) {
                throw UdfException.duplicateName(descriptor.getName());
            }
            long key = nextKey++;
            descriptor.setKey(key);
            descriptor.setVisibility(Visibility.VISIBLE);
            descriptor.usage().set(1);
            arena.put(key, descriptor);
            visibleNames.put(nameKey, key);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Registered function: name={}, kind={}, library={}, usable={}",
                descriptor.getName(), descriptor.getKind(), descriptor.getLibraryPath(), descriptor.isUsable());
    }

    /**
     * Returns a hold taken by {@link #acquire(String)}.
     *
     * @param descriptor a descriptor returned by {@link #acquire(String)}
     * @throws IllegalStateException if the descriptor is not registered or holds no
     *         caller reference; releasing more often than acquiring breaks the registry
     */
    public void release(FunctionDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        FunctionDescriptor removed = null;
        lock.writeLock().lock();
        try {
            checkRegistered(descriptor);
            int floor = descriptor.getVisibility() == Visibility.VISIBLE ? 1 : 0;
            Preconditions.checkState(descriptor.getUsageCount() > floor,
                    "Function released more often than acquired: %s", descriptor.getName());
            int holders = descriptor.usage().decrementAndGet();
            LOG.debug("Released function: name={}, usageCount={}", descriptor.getName(), holders);
            if (holders == 0) {
                removeLocked(descriptor);
                removed = descriptor;
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            LOG.info("Removed shadowed function after last release: name={}", removed.getName());
            releaseLibrary(removed);
        }
    }

    /**
     * Drops the function called {@code name}. After this returns no lookup finds it.
     * If callers still hold it, it is shadowed and removed when the last one releases.
     *
     * @param name function name
     * @return true if the function was removed at once, false if it was shadowed
     * @throws UdfException {@code FUNCTION_NOT_FOUND} if no visible function has that name
     */
    public boolean markForRemoval(String name) throws UdfException {
        FunctionDescriptor descriptor;
        lock.writeLock().lock();
        try {
            descriptor = lookupVisible(name);
            if (descriptor == null) {
                throw UdfException.functionNotFound(name);
            }
            if (!unregisterLocked(descriptor)) {
                return false;
            }
        } finally {
            lock.writeLock().unlock();
        }
        releaseLibrary(descriptor);
        return true;
    }

    /**
     * Drops a specific registered descriptor, for example one staged by a DDL statement
     * that is being rolled back. Same semantics as {@link #markForRemoval(String)}.
     *
     * @return true if the descriptor was removed at once, false if it was shadowed
     * @throws IllegalStateException if the descriptor is not visible in this registry
     */
    public boolean discard(FunctionDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        lock.writeLock().lock();
        try {
            checkRegistered(descriptor);
            Preconditions.checkState(descriptor.getVisibility() == Visibility.VISIBLE,
                    "Function already dropped: %s", descriptor.getName());
            if (!unregisterLocked(descriptor)) {
                return false;
            }
        } finally {
            lock.writeLock().unlock();
        }
        releaseLibrary(descriptor);
        return true;
    }

    /**
     * Snapshots of the visible functions, sorted by name.
     */
    public List<FunctionInfo> list() {
        List<FunctionInfo> results = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Long key : visibleNames.values()) {
                results.add(arena.get(key).toInfo());
            }
        } finally {
            lock.readLock().unlock();
        }
        results.sort(Comparator.comparing(FunctionInfo::getName, String.CASE_INSENSITIVE_ORDER));
        return results;
    }

    /** Number of visible functions. */
    public int size() {
        lock.readLock().lock();
        try {
            return visibleNames.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Fast check used by the engine to skip extension function resolution entirely. */
    public boolean hasFunctions() {
        return size() > 0;
    }

    /** Number of dropped functions still kept alive by callers. */
    public int shadowedCount() {
        lock.readLock().lock();
        try {
            return arena.size() - visibleNames.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every visible function. Libraries of functions still held by callers
     * stay open until those callers release them.
     */
    public void close() {
        List<FunctionDescriptor> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (Long key : new ArrayList<>(visibleNames.values())) {
                FunctionDescriptor descriptor = arena.get(key);
                if (unregisterLocked(descriptor)) {
                    removed.add(descriptor);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        for (FunctionDescriptor descriptor : removed) {
            releaseLibrary(descriptor);
        }
        LOG.info("Function registry closed: removed={}, stillInUse={}", removed.size(), shadowedCount());
    }

    private FunctionDescriptor lookupVisible(String name) {
        if (name == null) {
            return null;
        }
        Long key = visibleNames.get(FunctionDescriptor.nameKey(name));
        return key != null ? arena.get(key) : null;
    }

    private void checkRegistered(FunctionDescriptor descriptor) {
        Preconditions.checkState(arena.get(descriptor.getKey()) == descriptor,
                "Function descriptor not registered: %s", descriptor.getName());
    }

    /**
     * Takes the descriptor out of the name index and drops the registry's hold.
     * Returns true if it was removed from the arena as well.
     */
    private boolean unregisterLocked(FunctionDescriptor descriptor) {
        visibleNames.remove(FunctionDescriptor.nameKey(descriptor.getName()));
        int holders = descriptor.usage().decrementAndGet();
        Preconditions.checkState(holders >= 0, "Negative usage count: %s", descriptor.getName());
        if (holders == 0) {
            removeLocked(descriptor);
            LOG.info("Dropped function: name={}", descriptor.getName());
            return true;
        }
        descriptor.setVisibility(Visibility.SHADOWED);
        LOG.info("Dropped function still in use, shadowed until released: name={}, holders={}",
                descriptor.getName(), holders);
        return false;
    }

    // the descriptor keeps its key, so any later release fails checkRegistered
    private void removeLocked(FunctionDescriptor descriptor) {
        arena.remove(descriptor.getKey());
    }

    private void releaseLibrary(FunctionDescriptor descriptor) {
        Optional<LibraryHandle> library = descriptor.getLibrary();
        if (library.isPresent()) {
            libraries.release(library.get());
        }
    }
}
