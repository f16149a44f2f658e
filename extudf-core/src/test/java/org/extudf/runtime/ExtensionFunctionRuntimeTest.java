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

package org.extudf.runtime;

import org.extudf.FakeNativeLoader;
import org.extudf.FunctionDefinition;
import org.extudf.ReturnType;
import org.extudf.UdfErrorCode;
import org.extudf.UdfException;
import org.extudf.catalog.JsonFileFunctionCatalog;
import org.extudf.catalog.ScanReport;
import org.extudf.config.UdfConfig;
import org.extudf.registry.FunctionDescriptor;
import org.extudf.registry.FunctionInfo;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tests for {@link ExtensionFunctionRuntime} wired against a file catalog.
 */
@DisplayName("ExtensionFunctionRuntime Tests")
class ExtensionFunctionRuntimeTest {

    private static final String LIB = "udf_example.so";

    @TempDir
    Path tempDir;

    private FakeNativeLoader loader;
    private JsonFileFunctionCatalog catalog;
    private ExtensionFunctionRuntime runtime;

    @BeforeEach
    void setUp() {
        loader = new FakeNativeLoader()
                .library(LIB, "metaphon", "metaphon_init", "metaphon_deinit", "myfunc_int", "myfunc_int_init",
                        "myfunc");
        catalog = new JsonFileFunctionCatalog(tempDir.resolve("func.json"));
        runtime = newRuntime(false);
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    private ExtensionFunctionRuntime newRuntime(boolean allowSuspicious) {
        UdfConfig config = UdfConfig.builder()
                .pluginDir(tempDir.resolve("plugins"))
                .allowSuspiciousUdfs(allowSuspicious)
                .build();
        return new ExtensionFunctionRuntime(config, catalog, loader);
    }

    private static FunctionDefinition scalar(String name) {
        return FunctionDefinition.builder()
                .name(name)
                .returnType(ReturnType.STRING)
                .libraryPath(LIB)
                .build();
    }

    private void create(String name) throws Exception {
        runtime.createFunction(scalar(name), catalog.beginTransaction());
    }

    @Test
    @DisplayName("IT-RUNTIME-001: Create, call and drop round trip closes the library")
    void testRoundTrip() throws Exception {
        // Given
        runtime.start();
        create("metaphon");

        // When
        FunctionDescriptor held = runtime.acquire("metaphon").get();
        Object result = held.getEntryPoints().getMain().invoke(String.class, "hello");
        runtime.release(held);
        runtime.dropFunction("metaphon", catalog.beginTransaction());

        // Then
        Assertions.assertEquals("metaphon", result);
        Assertions.assertFalse(runtime.find("metaphon").isPresent());
        Assertions.assertTrue(catalog.listDefinitions().isEmpty());
        Assertions.assertFalse(loader.isOpen(LIB));
        Assertions.assertEquals(0, runtime.getLibraries().openCount());
    }

    @Test
    @DisplayName("IT-RUNTIME-002: Restart reloads exactly what was committed")
    void testRestart() throws Exception {
        // Given
        runtime.start();
        create("metaphon");
        create("myfunc_int");
        runtime.close();
        Assertions.assertFalse(loader.isOpen(LIB));

        // When
        runtime = newRuntime(false);
        ScanReport report = runtime.start();

        // Then
        Assertions.assertEquals(2, report.getLoaded().size());
        Assertions.assertTrue(report.getFailures().isEmpty());
        List<String> names = runtime.listFunctions().stream().map(FunctionInfo::getName).collect(Collectors.toList());
        Assertions.assertEquals(List.of("metaphon", "myfunc_int"), names);
        Assertions.assertTrue(loader.isOpen(LIB));
    }

    @Test
    @DisplayName("IT-RUNTIME-003: Rolled back create leaves neither catalog row nor function")
    void testRollbackOnly() throws Exception {
        runtime.start();
        JsonFileFunctionCatalog.Transaction transaction = catalog.beginTransaction();
        transaction.setRollbackOnly();

        UdfException e = Assertions.assertThrows(UdfException.class,
                () -> runtime.createFunction(scalar("metaphon"), transaction));

        Assertions.assertEquals(UdfErrorCode.TRANSACTION_ABORTED, e.getErrorCode());
        Assertions.assertTrue(catalog.listDefinitions().isEmpty());
        Assertions.assertTrue(runtime.listFunctions().isEmpty());
        Assertions.assertFalse(loader.isOpen(LIB));
        catalog.beginTransaction().rollback();
    }

    @Test
    @DisplayName("IT-RUNTIME-004: Bare symbol binds only when suspicious functions are allowed")
    void testSuspicious() throws Exception {
        runtime.start();
        UdfException e = Assertions.assertThrows(UdfException.class, () -> create("myfunc"));
        Assertions.assertEquals(UdfErrorCode.SUSPICIOUS_BINDING, e.getErrorCode());

        runtime.close();
        runtime = newRuntime(true);
        runtime.start();
        create("myfunc");

        FunctionInfo info = runtime.listFunctions().get(0);
        Assertions.assertEquals("myfunc", info.getName());
        Assertions.assertTrue(info.isSuspiciousBinding());
    }

    @Test
    @DisplayName("IT-RUNTIME-005: Close keeps held functions callable until released")
    void testCloseWhileHeld() throws Exception {
        runtime.start();
        create("metaphon");
        FunctionDescriptor held = runtime.acquire("metaphon").get();

        runtime.getRegistry().close();

        Assertions.assertFalse(runtime.find("metaphon").isPresent());
        Assertions.assertEquals("metaphon", held.getEntryPoints().getMain().invoke(String.class));
        runtime.release(held);
        Assertions.assertFalse(loader.isOpen(LIB));
    }
}
