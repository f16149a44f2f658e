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
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Optional;

/**
 * Tests for {@link JnaNativeLoader} against the real platform loader.
 */
@DisplayName("JnaNativeLoader Tests")
class JnaNativeLoaderTest {

    private static final Path[] LIBC_CANDIDATES = {
            Paths.get("/lib/x86_64-linux-gnu/libc.so.6"),
            Paths.get("/lib/aarch64-linux-gnu/libc.so.6"),
            Paths.get("/lib64/libc.so.6"),
            Paths.get("/usr/lib/libc.so.6"),
    };

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("UT-LOADER-JNA-001: Missing file fails with platform message")
    void testMissingLibrary() {
        // Given
        Path missing = tempDir.resolve("libmissing.so");
        JnaNativeLoader loader = new JnaNativeLoader();

        // When
        LibraryLoadException e = Assertions.assertThrows(LibraryLoadException.class, () -> loader.open(missing));

        // Then
        Assertions.assertEquals(missing, e.getLibraryPath());
        Assertions.assertNotNull(e.getPlatformMessage());
        Assertions.assertTrue(e.getMessage().contains("libmissing.so"));
    }

    @Test
    @DisplayName("UT-LOADER-JNA-002: Symbols of the C library resolve, unknown ones do not")
    void testLibcSymbols() throws LibraryLoadException {
        Optional<Path> libc = Arrays.stream(LIBC_CANDIDATES).filter(Files::exists).findFirst();
        Assumptions.assumeTrue(libc.isPresent(), "no libc found at a known location");

        NativeModule module = new JnaNativeLoader().open(libc.get());
        try {
            Optional<NativeSymbol> abs = module.findSymbol("abs");
            Assertions.assertTrue(abs.isPresent());
            Assertions.assertNotEquals(0L, abs.get().getAddress());
            Assertions.assertEquals(42, abs.get().invoke(Integer.class, -42));
            Assertions.assertFalse(module.findSymbol("abs_init").isPresent());
        } finally {
            module.close();
        }
    }
}
