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

import org.extudf.loader.LibraryLoadException;
import org.extudf.loader.NativeLoader;
import org.extudf.loader.NativeModule;
import org.extudf.loader.NativeSymbol;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link NativeLoader} for tests. Libraries are keyed by file name and
 * export a fixed set of symbols. Opens and closes are counted, and invoking a symbol
 * of a closed module throws, which is how tests detect use-after-close.
 */
public class FakeNativeLoader implements NativeLoader {

    private static final AtomicLong NEXT_ADDRESS = new AtomicLong(0x1000);

    private final Map<String, Set<String>> exports = new ConcurrentHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> opens = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> closes = new ConcurrentHashMap<>();

    /**
     * Declares a library exporting the given symbols.
     */
    public FakeNativeLoader library(String fileName, String... symbols) {
        exports.put(fileName, new HashSet<>(Arrays.asList(symbols)));
        failures.remove(fileName);
        return this;
    }

    /**
     * Makes opening the library fail with the given platform message.
     */
    public FakeNativeLoader failing(String fileName, String platformMessage) {
        failures.put(fileName, platformMessage);
        return this;
    }

    public int openCount(String fileName) {
        return counter(opens, fileName).get();
    }

    public int closeCount(String fileName) {
        return counter(closes, fileName).get();
    }

    public boolean isOpen(String fileName) {
        return openCount(fileName) > closeCount(fileName);
    }

    @Override
    public NativeModule open(Path path) throws LibraryLoadException {
        String fileName = path.getFileName().toString();
        String failure = failures.get(fileName);
        if (failure != null) {
            throw new LibraryLoadException(path, failure, null);
        }
        Set<String> symbols = exports.get(fileName);
        if (symbols == null) {
            throw new LibraryLoadException(path, fileName + ": cannot open shared object file: No such file or directory",
                    null);
        }
        counter(opens, fileName).incrementAndGet();
        return new FakeModule(fileName, symbols);
    }

    private static AtomicInteger counter(Map<String, AtomicInteger> counters, String fileName) {
        return counters.computeIfAbsent(fileName, k -> new AtomicInteger());
    }

    private final class FakeModule implements NativeModule {

        private final String fileName;
        private final Set<String> symbols;
        private volatile boolean closed;

        private FakeModule(String fileName, Set<String> symbols) {
            this.fileName = fileName;
            this.symbols = symbols;
        }

        @Override
        public Optional<NativeSymbol> findSymbol(String symbolName) {
            if (closed) {
                throw new IllegalStateException("Symbol lookup on closed library " + fileName);
            }
            return symbols.contains(symbolName)
                    ? Optional.of(new FakeSymbol(this, symbolName, NEXT_ADDRESS.getAndAdd(16)))
                    : Optional.empty();
        }

        @Override
        public void close() {
            if (closed) {
                throw new IllegalStateException("Library closed twice: " + fileName);
            }
            closed = true;
            counter(closes, fileName).incrementAndGet();
        }
    }

    private static final class FakeSymbol implements NativeSymbol {

        private final FakeModule module;
        private final String name;
        private final long address;

        private FakeSymbol(FakeModule module, String name, long address) {
            this.module = module;
            this.name = name;
            this.address = address;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public long getAddress() {
            return address;
        }

        @Override
        public Object invoke(Class<?> returnType, Object... args) {
            if (module.closed) {
                throw new IllegalStateException("Call into closed library " + module.fileName + ": " + name);
            }
            return name;
        }
    }
}
