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
import org.extudf.loader.LibraryHandleManager;
import org.extudf.loader.LibraryLoadException;
import org.extudf.registry.FunctionDescriptor;
import org.extudf.resolver.EntryPoints;
import org.extudf.resolver.SymbolResolver;
import org.extudf.spi.NameValidator;
import org.extudf.spi.PathValidator;

import java.util.Objects;

/**
 * Turns a function definition into a registrable descriptor: validation, library
 * open and symbol resolution. Shared by the startup scan and CREATE FUNCTION.
 *
 * <p>A failed bind never leaves a library hold behind.
 */
public class FunctionBinder {

    private final LibraryHandleManager libraries;
    private final SymbolResolver resolver;
    private final PathValidator pathValidator;
    private final NameValidator nameValidator;

    public FunctionBinder(LibraryHandleManager libraries, SymbolResolver resolver, PathValidator pathValidator,
            NameValidator nameValidator) {
        this.libraries = Objects.requireNonNull(libraries, "libraries");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.pathValidator = Objects.requireNonNull(pathValidator, "pathValidator");
        this.nameValidator = Objects.requireNonNull(nameValidator, "nameValidator");
    }

    /**
     * @throws UdfException {@code INVALID_PATH} or {@code INVALID_NAME}
     */
    public void validate(FunctionDefinition definition) throws UdfException {
        if (!pathValidator.isAllowedPath(definition.getLibraryPath())) {
            throw UdfException.invalidPath(definition.getName(), definition.getLibraryPath());
        }
        if (!nameValidator.isValidName(definition.getName())) {
            throw UdfException.invalidName(definition.getName());
        }
    }

    /**
     * Opens (or shares) the library of a validated definition.
     *
     * @return a library hold owned by the caller
     * @throws UdfException {@code LIBRARY_LOAD_ERROR}
     */
    public LibraryHandle openLibrary(FunctionDefinition definition) throws UdfException {
        try {
            return libraries.acquire(definition.getLibraryPath());
        } catch (LibraryLoadException e) {
            throw UdfException.libraryLoadError(definition.getName(), definition.getLibraryPath(),
                    e.getPlatformMessage(), e);
        }
    }

    /**
     * Resolves symbols from a library hold. On success the hold moves into the returned
     * descriptor; on failure it is released here.
     */
    public FunctionDescriptor resolve(FunctionDefinition definition, LibraryHandle library) throws UdfException {
        EntryPoints entryPoints;
        try {
            entryPoints = resolver.resolve(library, definition.getName(), definition.getKind());
        } catch (UdfException | RuntimeException e) {
            libraries.release(library);
            throw e;
        }
        return FunctionDescriptor.loaded(definition, library, entryPoints);
    }

    /**
     * Validates, opens and resolves in one step.
     */
    public FunctionDescriptor bind(FunctionDefinition definition) throws UdfException {
        validate(definition);
        return resolve(definition, openLibrary(definition));
    }

    /**
     * Returns the library hold of a descriptor that never made it into the registry.
     */
    public void unbind(FunctionDescriptor descriptor) {
        descriptor.getLibrary().ifPresent(libraries::release);
    }
}
