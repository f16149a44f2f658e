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
import org.extudf.UdfErrorCode;
import org.extudf.UdfException;
import org.extudf.registry.FunctionDescriptor;
import org.extudf.registry.FunctionInfo;
import org.extudf.registry.FunctionRegistry;
import org.extudf.spi.CatalogException;
import org.extudf.spi.FunctionCatalog;
import org.extudf.spi.TransactionContext;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CREATE / DROP FUNCTION orchestration.
 *
 * <p>Keeps the in-memory {@link FunctionRegistry} and the durable {@link FunctionCatalog}
 * in step: each statement either commits both sides or leaves both as they were.
 *
 * <p>Create:
 * <ol>
 *   <li>Validate path and name, reject a name that is already registered.</li>
 *   <li>Open the library and resolve symbols.</li>
 *   <li>Stage the descriptor in the registry.</li>
 *   <li>Write the catalog row, then commit the caller's transaction.</li>
 * </ol>
 * Any failure, checked or not, rolls back the transaction and removes the staged
 * descriptor, which returns its library hold.
 *
 * <p>Drop:
 * <ol>
 *   <li>Locate the function.</li>
 *   <li>Delete the catalog row, then commit.</li>
 *   <li>Mark the function for removal in the registry.</li>
 * </ol>
 * Any failure rolls back the transaction and leaves the registry untouched.
 *
 * <p>Statements are serialized against each other; lookups from query execution
 * are never blocked by a running statement.
 */
public class FunctionDdlService {
    private static final Logger LOG = LogManager.getLogger(FunctionDdlService.class);

    private final FunctionRegistry registry;
    private final FunctionCatalog catalog;
    private final FunctionBinder binder;
    private final ReentrantLock ddlLock = new ReentrantLock();

    public FunctionDdlService(FunctionRegistry registry, FunctionCatalog catalog, FunctionBinder binder) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.binder = Objects.requireNonNull(binder, "binder");
    }

    /**
     * Creates a function.
     *
     * @param definition the function to create
     * @param transaction the caller's transaction; committed or rolled back here
     * @return snapshot of the registered function
     * @throws UdfException describing the first failing step
     */
    public FunctionInfo createFunction(FunctionDefinition definition, TransactionContext transaction)
            throws UdfException {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(transaction, "transaction");
        String name = definition.getName();

        ddlLock.lock();
        FunctionDescriptor bound = null;
        FunctionDescriptor staged = null;
        try {
            binder.validate(definition);
            if (registry.getRegistered(name).isPresent()) {
                throw UdfException.duplicateName(name);
            }
            bound = binder.bind(definition);
            registry.insert(bound);
            staged = bound;
            logPhase("create", name, DdlPhase.STAGED);

            try {
                catalog.insertDefinition(definition);
            } catch (CatalogException e) {
                throw UdfException.persistenceError(name, e);
            }
            logPhase("create", name, DdlPhase.PERSISTED);

            commit(name, transaction);
            logPhase("create", name, DdlPhase.COMMITTED);
            LOG.info("Created function: name={}, kind={}, returnType={}, library={}",
                    name, definition.getKind(), definition.getReturnType(), definition.getLibraryPath());
            return staged.toInfo();
        } catch (UdfException | RuntimeException e) {
            if (staged != null) {
                registry.discard(staged);
            } else if (bound != null) {
                binder.unbind(bound);
            }
            abort("create", name, transaction, e);
            throw e;
        } finally {
            ddlLock.unlock();
        }
    }

    /**
     * Drops a function. Callers already executing it finish normally; its library
     * is closed after the last of them releases it.
     *
     * @param name function name
     * @param transaction the caller's transaction; committed or rolled back here
     * @throws UdfException {@code FUNCTION_NOT_FOUND}, {@code PERSISTENCE_ERROR} or
     *         {@code TRANSACTION_ABORTED}
     */
    public void dropFunction(String name, TransactionContext transaction) throws UdfException {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transaction, "transaction");

        ddlLock.lock();
        try {
            FunctionDescriptor descriptor = registry.getRegistered(name)
                    .orElseThrow(() -> UdfException.functionNotFound(name));
            logPhase("drop", name, DdlPhase.STAGED);

            try {
                catalog.deleteDefinition(descriptor.getName());
            } catch (CatalogException e) {
                throw UdfException.persistenceError(name, e);
            }
            logPhase("drop", name, DdlPhase.PERSISTED);

            commit(name, transaction);
            logPhase("drop", name, DdlPhase.COMMITTED);

            boolean closed = registry.markForRemoval(descriptor.getName());
            LOG.info("Dropped function: name={}, removedImmediately={}", name, closed);
        } catch (UdfException | RuntimeException e) {
            abort("drop", name, transaction, e);
            throw e;
        } finally {
            ddlLock.unlock();
        }
    }

    private static void commit(String name, TransactionContext transaction) throws UdfException {
        if (transaction.isRollbackRequested()) {
            throw UdfException.transactionAborted(name, null);
        }
        try {
            transaction.commit();
        } catch (CatalogException e) {
            throw UdfException.transactionAborted(name, e);
        }
    }

    private static void abort(String statement, String name, TransactionContext transaction, Exception failure) {
        try {
            transaction.rollback();
        } catch (CatalogException | RuntimeException e) {
            failure.addSuppressed(e);
            LOG.error("Failed to roll back {} function transaction: name={}", statement, name, e);
        }
        logPhase(statement, name, DdlPhase.ABORTED);
        if (!(failure instanceof UdfException)) {
            LOG.error("{} function rolled back after unexpected failure: name={}", statement, name, failure);
            return;
        }
        UdfErrorCode errorCode = ((UdfException) failure).getErrorCode();
        if (errorCode == UdfErrorCode.PERSISTENCE_ERROR || errorCode == UdfErrorCode.TRANSACTION_ABORTED) {
            LOG.warn("{} function rolled back: name={}, error={}", statement, name, failure.getMessage());
        }
    }

    private static void logPhase(String statement, String name, DdlPhase phase) {
        LOG.debug("{} function {}: name={}", statement, phase, name);
    }
}
