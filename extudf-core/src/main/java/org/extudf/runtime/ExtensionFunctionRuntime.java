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

import org.extudf.FunctionDefinition;
import org.extudf.UdfException;
import org.extudf.catalog.FunctionBinder;
import org.extudf.catalog.FunctionDdlService;
import org.extudf.catalog.ScanReport;
import org.extudf.catalog.StartupLoader;
import org.extudf.config.IdentifierNameValidator;
import org.extudf.config.PluginDirPathValidator;
import org.extudf.config.UdfConfig;
import org.extudf.loader.JnaNativeLoader;
import org.extudf.loader.LibraryHandleManager;
import org.extudf.loader.NativeLoader;
import org.extudf.registry.FunctionDescriptor;
import org.extudf.registry.FunctionInfo;
import org.extudf.registry.FunctionRegistry;
import org.extudf.resolver.SymbolResolver;
import org.extudf.spi.FunctionCatalog;
import org.extudf.spi.TransactionContext;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Extension function runtime - entry point the query engine talks to.
 *
 * <p>Responsibilities:
 * <ol>
 *   <li>Wire library loading, symbol resolution, the registry and catalog sync from
 *       one {@link UdfConfig}</li>
 *   <li>Load the catalog at startup ({@link #start()})</li>
 *   <li>Serve lookups from query execution threads: {@link #acquire(String)},
 *       {@link #find(String)}, {@link #release(FunctionDescriptor)}</li>
 *   <li>Run CREATE / DROP FUNCTION through {@link FunctionDdlService}</li>
 * </ol>
 */
public class ExtensionFunctionRuntime implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ExtensionFunctionRuntime.class);

    private final UdfConfig config;
    private final LibraryHandleManager libraries;
    private final FunctionRegistry registry;
    private final StartupLoader startupLoader;
    private final FunctionDdlService ddlService;

    public ExtensionFunctionRuntime(UdfConfig config, FunctionCatalog catalog) {
        this(config, catalog, new JnaNativeLoader());
    }

    public ExtensionFunctionRuntime(UdfConfig config, FunctionCatalog catalog, NativeLoader loader) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(loader, "loader");

        this.libraries = new LibraryHandleManager(config.getPluginDir(), loader);
        this.registry = new FunctionRegistry(libraries);
        FunctionBinder binder = new FunctionBinder(
                libraries,
                new SymbolResolver(config.isAllowSuspiciousUdfs()),
                new PluginDirPathValidator(config.getPluginDir()),
                new IdentifierNameValidator(config.getMaxNameLength()));
        this.startupLoader = new StartupLoader(catalog, binder, registry);
        this.ddlService = new FunctionDdlService(registry, catalog, binder);
    }

    /**
     * Loads every function in the catalog. Failing rows are logged and skipped.
     */
    public ScanReport start() {
        LOG.info("Starting extension function runtime: {}", config);
        return startupLoader.loadAll();
    }

    public Optional<FunctionDescriptor> acquire(String name) {
        return registry.acquire(name);
    }

    public Optional<FunctionDescriptor> find(String name) {
        return registry.find(name);
    }

    public void release(FunctionDescriptor descriptor) {
        registry.release(descriptor);
    }

    public FunctionInfo createFunction(FunctionDefinition definition, TransactionContext transaction)
            throws UdfException {
        return ddlService.createFunction(definition, transaction);
    }

    public void dropFunction(String name, TransactionContext transaction) throws UdfException {
        ddlService.dropFunction(name, transaction);
    }

    public List<FunctionInfo> listFunctions() {
        return registry.list();
    }

    public UdfConfig getConfig() {
        return config;
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    public LibraryHandleManager getLibraries() {
        return libraries;
    }

    /**
     * Drops every function from memory and closes every library. Only call once
     * query execution has stopped.
     */
    @Override
    public void close() {
        registry.close();
        libraries.closeAll();
        LOG.info("Extension function runtime stopped");
    }
}
