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

package org.extudf.spi;

import org.extudf.FunctionDefinition;

import java.util.List;

/**
 * Durable store of registered function definitions.
 *
 * <p>Mutations are issued inside a transaction owned by the caller. An
 * implementation must never commit or roll back on its own; the outcome is
 * decided through {@link TransactionContext}.
 */
public interface FunctionCatalog {

    /**
     * Returns all persisted definitions, in storage order.
     *
     * @return persisted definitions
     * @throws CatalogException if the catalog cannot be read
     */
    List<FunctionDefinition> listDefinitions() throws CatalogException;

    /**
     * Writes one definition within the active transaction.
     *
     * @param definition the definition to persist
     * @throws CatalogException if the row cannot be written
     */
    void insertDefinition(FunctionDefinition definition) throws CatalogException;

    /**
     * Deletes the definition with the given name within the active transaction.
     *
     * @param name function name
     * @throws CatalogException if the row does not exist or cannot be deleted
     */
    void deleteDefinition(String name) throws CatalogException;
}
