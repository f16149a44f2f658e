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

package org.extudf.resolver;

import org.extudf.FunctionKind;
import org.extudf.UdfException;
import org.extudf.loader.LibraryHandle;
import org.extudf.loader.NativeSymbol;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the entry points of an extension function from an opened library.
 *
 * <p>Naming convention, for a function declared as {@code f}:
 * <ul>
 *   <li>{@code f} - main entry point, mandatory</li>
 *   <li>{@code f_clear}, {@code f_add} - mandatory for aggregates</li>
 *   <li>{@code f_init}, {@code f_deinit} - optional</li>
 * </ul>
 *
 * <p>A non-aggregate function with neither {@code f_init} nor {@code f_deinit} is
 * refused as a suspicious binding unless suspicious bindings are allowed: a bare
 * name such as {@code abs} found in a C runtime is far more likely an unrelated
 * symbol than an extension function.
 *
 * <p>Resolution only reads the library; it never touches the registry.
 */
public class SymbolResolver {
    private static final Logger LOG = LogManager.getLogger(SymbolResolver.class);

    private final boolean allowSuspiciousBindings;

    public SymbolResolver(boolean allowSuspiciousBindings) {
        this.allowSuspiciousBindings = allowSuspiciousBindings;
    }

    public boolean isAllowSuspiciousBindings() {
        return allowSuspiciousBindings;
    }

    /**
     * Resolves the entry points of {@code functionName}.
     *
     * @param library opened library the function lives in
     * @param functionName declared function name
     * @param kind function kind
     * @return resolved entry points
     * @throws UdfException {@code MISSING_SYMBOL} if the main symbol is absent,
     *         {@code AGGREGATE_MISSING_AUX_SYMBOL} if an aggregate lacks {@code _clear} or {@code _add},
     *         {@code SUSPICIOUS_BINDING} if no auxiliary symbol exists and that is not allowed
     */
    public EntryPoints resolve(LibraryHandle library, String functionName, FunctionKind kind)
            throws UdfException {
        Objects.requireNonNull(library, "library");
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(kind, "kind");

        List<EntryPoint> entryPoints = new ArrayList<>();
        NativeSymbol main = library.findSymbol(functionName)
                .orElseThrow(() -> UdfException.missingSymbol(functionName, functionName));
        entryPoints.add(new EntryPoint(EntryPoint.Role.EVAL, main));

        if (kind == FunctionKind.AGGREGATE) {
            entryPoints.add(requireAggregateSymbol(library, functionName, EntryPoint.Role.CLEAR));
            entryPoints.add(requireAggregateSymbol(library, functionName, EntryPoint.Role.ADD));
        }

        Optional<EntryPoint> deinit = optionalSymbol(library, functionName, EntryPoint.Role.DEINIT);
        Optional<EntryPoint> init = optionalSymbol(library, functionName, EntryPoint.Role.INIT);
        deinit.ifPresent(entryPoints::add);
        init.ifPresent(entryPoints::add);

        boolean suspicious = false;
        if (!init.isPresent() && !deinit.isPresent() && kind != FunctionKind.AGGREGATE) {
            if (!allowSuspiciousBindings) {
                throw UdfException.suspiciousBinding(functionName);
            }
            suspicious = true;
            LOG.warn("Binding function without auxiliary symbols: function={}, library={}, missing={} and {}",
                    functionName, library.getPath(), EntryPoint.Role.INIT.symbolFor(functionName),
                    EntryPoint.Role.DEINIT.symbolFor(functionName));
        }
        return new EntryPoints(kind, entryPoints, suspicious);
    }

    private static EntryPoint requireAggregateSymbol(LibraryHandle library, String functionName,
            EntryPoint.Role role) throws UdfException {
        String symbolName = role.symbolFor(functionName);
        NativeSymbol symbol = library.findSymbol(symbolName)
                .orElseThrow(() -> UdfException.aggregateMissingAuxSymbol(functionName, symbolName));
        return new EntryPoint(role, symbol);
    }

    private static Optional<EntryPoint> optionalSymbol(LibraryHandle library, String functionName,
            EntryPoint.Role role) {
        return library.findSymbol(role.symbolFor(functionName)).map(symbol -> new EntryPoint(role, symbol));
    }
}
