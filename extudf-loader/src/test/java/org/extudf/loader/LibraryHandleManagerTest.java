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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Unit tests for {@link LibraryHandleManager}.
 */
@DisplayName("LibraryHandleManager Unit Tests")
class LibraryHandleManagerTest {

    @TempDir
    Path pluginDir;

    private NativeLoader loader;
    private LibraryHandleManager manager;

    @BeforeEach
    void setUp() throws LibraryLoadException {
        loader = Mockito.mock(NativeLoader.class);
        Mockito.when(loader.open(ArgumentMatchers.any(Path.class)))
                .thenAnswer(invocation -> Mockito.mock(NativeModule.class));
        manager = new LibraryHandleManager(pluginDir, loader);
    }

    @Nested
    @DisplayName("Acquire Tests")
    class AcquireTests {

        @Test
        @DisplayName("UT-LOADER-LHM-001: First acquire opens the library")
        void testAcquireOpens() throws Exception {
            // When
            LibraryHandle handle = manager.acquire("libdemo.so");

            // Then
            Assertions.assertEquals(pluginDir.toAbsolutePath().normalize().resolve("libdemo.so"), handle.getPath());
            Assertions.assertEquals(1, handle.getRefCount());
            Assertions.assertFalse(handle.isClosed());
            Mockito.verify(loader, Mockito.times(1)).open(handle.getPath());
        }

        @Test
        @DisplayName("UT-LOADER-LHM-002: Equal paths share one handle")
        void testAcquireSharesHandle() throws Exception {
            // When
            LibraryHandle first = manager.acquire("libdemo.so");
            LibraryHandle second = manager.acquire("./sub/../libdemo.so");

            // Then
            Assertions.assertSame(first, second);
            Assertions.assertEquals(2, first.getRefCount());
            Assertions.assertEquals(1, manager.openCount());
            Mockito.verify(loader, Mockito.times(1)).open(ArgumentMatchers.any(Path.class));
        }

        @Test
        @DisplayName("UT-LOADER-LHM-003: Symlinked alias of an existing file shares the handle")
        void testSymlinkAlias() throws Exception {
            // Given
            Path real = Files.createFile(pluginDir.resolve("libreal.so"));
            Files.createSymbolicLink(pluginDir.resolve("libalias.so"), real);

            // When
            LibraryHandle first = manager.acquire("libreal.so");
            LibraryHandle second = manager.acquire("libalias.so");

            // Then
            Assertions.assertSame(first, second);
        }

        @Test
        @DisplayName("UT-LOADER-LHM-004: Loader failure propagates and leaves nothing open")
        void testAcquireFailure() throws Exception {
            // Given
            Path broken = pluginDir.toAbsolutePath().normalize().resolve("libbroken.so");
            Mockito.when(loader.open(broken))
                    .thenThrow(new LibraryLoadException(broken, "undefined symbol: foo", null));

            // When
            LibraryLoadException e = Assertions.assertThrows(LibraryLoadException.class,
                    () -> manager.acquire("libbroken.so"));

            // Then
            Assertions.assertEquals("undefined symbol: foo", e.getPlatformMessage());
            Assertions.assertEquals(0, manager.openCount());
            Assertions.assertFalse(manager.get("libbroken.so").isPresent());
        }
    }

    @Nested
    @DisplayName("Release Tests")
    class ReleaseTests {

        @Test
        @DisplayName("UT-LOADER-LHM-010: Library closes exactly once after last release")
        void testCloseAfterLastRelease() throws Exception {
            // Given
            LibraryHandle first = manager.acquire("libdemo.so");
            LibraryHandle second = manager.acquire("libdemo.so");
            NativeModule module = first.getModule();

            // When
            manager.release(first);

            // Then
            Assertions.assertFalse(first.isClosed());
            Mockito.verify(module, Mockito.never()).close();

            // When
            manager.release(second);

            // Then
            Assertions.assertTrue(second.isClosed());
            Mockito.verify(module, Mockito.times(1)).close();
            Assertions.assertEquals(0, manager.openCount());
        }

        @Test
        @DisplayName("UT-LOADER-LHM-011: Release after close is a contract violation")
        void testDoubleRelease() throws Exception {
            // Given
            LibraryHandle handle = manager.acquire("libdemo.so");
            manager.release(handle);

            // When / Then
            Assertions.assertThrows(IllegalStateException.class, () -> manager.release(handle));
            Mockito.verify(handle.getModule(), Mockito.times(1)).close();
        }

        @Test
        @DisplayName("UT-LOADER-LHM-012: Re-acquire after close opens a fresh handle")
        void testReopenAfterClose() throws Exception {
            // Given
            LibraryHandle old = manager.acquire("libdemo.so");
            manager.release(old);

            // When
            LibraryHandle fresh = manager.acquire("libdemo.so");

            // Then
            Assertions.assertNotSame(old, fresh);
            Assertions.assertFalse(fresh.isClosed());
            Assertions.assertThrows(IllegalStateException.class, () -> old.findSymbol("f"));
            Mockito.verify(loader, Mockito.times(2)).open(ArgumentMatchers.any(Path.class));
        }

        @Test
        @DisplayName("UT-LOADER-LHM-013: Close failure is logged, handle still retired")
        void testCloseFailure() throws Exception {
            // Given
            LibraryHandle handle = manager.acquire("libdemo.so");
            Mockito.doThrow(new IllegalStateException("finalizer crashed")).when(handle.getModule()).close();

            // When
            manager.release(handle);

            // Then
            Assertions.assertTrue(handle.isClosed());
            Assertions.assertEquals(0, manager.openCount());
        }

        @Test
        @DisplayName("UT-LOADER-LHM-014: closeAll closes every open library")
        void testCloseAll() throws Exception {
            // Given
            LibraryHandle a = manager.acquire("liba.so");
            LibraryHandle b = manager.acquire("libb.so");

            // When
            manager.closeAll();

            // Then
            Assertions.assertTrue(a.isClosed());
            Assertions.assertTrue(b.isClosed());
            Assertions.assertTrue(manager.list().isEmpty());
        }
    }

    @Test
    @DisplayName("UT-LOADER-LHM-020: Concurrent acquires of one path open it once")
    void testConcurrentAcquire() throws Exception {
        // Given
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LibraryHandle>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return manager.acquire("libshared.so");
                }));
            }

            // When
            start.countDown();
            List<LibraryHandle> handles = new ArrayList<>();
            for (Future<LibraryHandle> future : futures) {
                handles.add(future.get(10, TimeUnit.SECONDS));
            }

            // Then
            Mockito.verify(loader, Mockito.times(1)).open(ArgumentMatchers.any(Path.class));
            Assertions.assertEquals(threads, handles.get(0).getRefCount());
            for (LibraryHandle handle : handles) {
                Assertions.assertSame(handles.get(0), handle);
                manager.release(handle);
            }
            Assertions.assertTrue(handles.get(0).isClosed());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("UT-LOADER-LHM-021: Reference count changes are visible to readers on other threads")
    void testRefCountVisibleAcrossThreads() throws Exception {
        // Given
        LibraryHandle handle = manager.acquire("libshared.so");
        manager.acquire("libshared.so");
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> observer = executor.submit(() -> {
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
                while (handle.getRefCount() != 0) {
                    if (System.nanoTime() > deadline) {
                        return false;
                    }
                    Thread.onSpinWait();
                }
                return true;
            });

            // When
            executor.submit(() -> {
                manager.release(handle);
                manager.release(handle);
            }).get(10, TimeUnit.SECONDS);

            // Then
            Assertions.assertTrue(observer.get(15, TimeUnit.SECONDS));
            Assertions.assertTrue(handle.isClosed());
        } finally {
            executor.shutdownNow();
        }
    }
}
