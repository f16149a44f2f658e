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

package org.extudf.catalog;

import org.extudf.FunctionDefinition;
import org.extudf.UdfException;
import org.extudf.loader.LibraryHandle;
import org.extudf.registry.FunctionDescriptor;
import org.extudf.registry.FunctionRegistry;
import org.extudf.spi.CatalogException;
import org.extudf.spi.FunctionCatalog;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds the in-memory registry from the function catalog at startup.
 *
 * <h2>Failure Semantics</h2>
 *
 * <p>Every row is loaded independently; a failing row is logged, recorded in the
 * {@link ScanReport} and skipped, and never stops the scan:
 * <ul>
 *   <li>{@code validate} - bad path or name; the row is ignored.</li>
 *   <li>{@code open} - the library failed to open; the function is registered
 *       but unusable so it can still be listed and dropped.</li>
 *   <li>{@code resolve} - a symbol is missing; the row is ignored and the library
 *       hold released.</li>
 *   <li>{@code conflict} - an earlier row already registered the name.</li>
 * </ul>
 *
 * <p>A catalog that cannot be read at all yields an empty registry and a single
 * {@code read} failure; the boot path continues.
 */
public class StartupLoader {
    private static final Logger LOG = LogManager.getLogger(StartupLoader.class);

    private final FunctionCatalog catalog;
    private final FunctionBinder binder;
    private final FunctionRegistry registry;

    public StartupLoader(FunctionCatalog catalog, FunctionBinder binder, FunctionRegistry registry) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.binder = Objects.requireNonNull(binder, "binder");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ScanReport loadAll() {
        List<FunctionDefinition> rows;
        try {
            rows = catalog.listDefinitions();
        } catch (CatalogException e) {
            LOG.error("Can't read the function catalog, no extension function is loaded", e);
            return new ScanReport(Collections.emptyList(), Collections.singletonList(
                    new LoadFailure(null, LoadFailure.STAGE_READ, "Can't read function catalog: " + e.getMessage(), e)),
                    0);
        }

        List<String> loaded = new ArrayList<>();
        List<LoadFailure> failures = new ArrayList<>();
        for (FunctionDefinition row : rows) {
            LoadFailure failure = loadRow(row);
            if (failure == null) {
                loaded.add(row.getName());
                continue;
            }
            LOG.warn("Skip function row due to load failure: function={}, library={}, stage={}, message={}",
                    row.getName(), row.getLibraryPath(), failure.getStage(), failure.getMessage(),
                    failure.getCause());
            failures.add(failure);
        }
        LOG.info("Loaded extension functions from catalog: rows={}, loaded={}, failed={}",
                rows.size(), loaded.size(), failures.size());
        return new ScanReport(loaded, failures, rows.size());
    }

    private LoadFailure loadRow(FunctionDefinition row) {
        try {
            binder.validate(row);
        } catch (UdfException e) {
            return new LoadFailure(row.getName(), LoadFailure.STAGE_VALIDATE, e.getMessage(), e);
        }

        LibraryHandle library;
        try {
            library = binder.openLibrary(row);
        } catch (UdfException e) {
            LoadFailure failure = register(FunctionDescriptor.unloaded(row));
            return failure != null
                    ? failure
                    : new LoadFailure(row.getName(), LoadFailure.STAGE_OPEN, e.getMessage(), e);
        }

        FunctionDescriptor descriptor;
        try {
            descriptor = binder.resolve(row, library);
        } catch (UdfException e) {
            return new LoadFailure(row.getName(), LoadFailure.STAGE_RESOLVE, e.getMessage(), e);
        }
        return register(descriptor);
    }

    private LoadFailure register(FunctionDescriptor descriptor) {
        try {
            registry.insert(descriptor);
            return null;
        } catch (UdfException e) {
            binder.unbind(descriptor);
            return new LoadFailure(descriptor.getName(), LoadFailure.STAGE_CONFLICT, e.getMessage(), e);
        }
    }
}
