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

import com.sun.jna.Function;
import com.sun.jna.NativeLibrary;
import com.sun.jna.Pointer;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link NativeLoader} backed by JNA's {@link NativeLibrary}.
 *
 * <p>JNA caches {@code NativeLibrary} instances by name, so a module obtained
 * here must only be closed once no other caller can reach the same path.
 * {@link LibraryHandleManager} guarantees that by closing under its own lock.
 */
public class JnaNativeLoader implements NativeLoader {

    @Override
    public NativeModule open(Path path) throws LibraryLoadException {
        Objects.requireNonNull(path, "path");
        try {
            return new JnaNativeModule(NativeLibrary.getInstance(path.toString()));
        } catch (UnsatisfiedLinkError e) {
            throw new LibraryLoadException(path, e.getMessage(), e);
        }
    }

    private static final class JnaNativeModule implements NativeModule {

        private final NativeLibrary library;

        private JnaNativeModule(NativeLibrary library) {
            this.library = library;
        }

        @Override
        public Optional<NativeSymbol> findSymbol(String symbolName) {
            try {
                return Optional.of(new JnaNativeSymbol(symbolName, library.getFunction(symbolName)));
            } catch (UnsatisfiedLinkError e) {
                return Optional.empty();
            }
        }

        @Override
        public void close() {
            library.close();
        }

        @Override
        public String toString() {
            return "JnaNativeModule{" + library.getFile() + '}';
        }
    }

    private static final class JnaNativeSymbol implements NativeSymbol {

        private final String name;
        private final Function function;

        private JnaNativeSymbol(String name, Function function) {
            this.name = name;
            this.function = function;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public long getAddress() {
            return Pointer.nativeValue(function);
        }

        @Override
        public Object invoke(Class<?> returnType, Object... args) {
            return function.invoke(returnType, args);
        }
    }
}
