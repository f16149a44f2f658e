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
import org.extudf.FunctionKind;
import org.extudf.ReturnType;
import org.extudf.spi.CatalogException;
import org.extudf.spi.FunctionCatalog;
import org.extudf.spi.TransactionContext;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Function catalog persisted as a JSON array in one file.
 *
 * <p>Row layout follows the classic function table: {@code name}, {@code ret}
 * (return type code), {@code dl} (library path) and {@code type} (kind code).
 *
 * <p>Mutations are only accepted inside a transaction from {@link #beginTransaction()}.
 * They are buffered in the transaction and written on commit by replacing the file
 * atomically; rollback discards them. At most one transaction is open at a time.
 */
public class JsonFileFunctionCatalog implements FunctionCatalog {
    private static final Logger LOG = LogManager.getLogger(JsonFileFunctionCatalog.class);
    private static final TypeReference<List<CatalogRow>> ROWS_TYPE = new TypeReference<List<CatalogRow>>() {
    };

    private final Path file;
    private final ObjectMapper mapper;
    private final Object lock = new Object();

    // guarded by lock
    private Transaction active;

    public JsonFileFunctionCatalog(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Opens a transaction for one DDL statement.
     *
     * @throws CatalogException if the file cannot be read
     * @throws IllegalStateException if another transaction is still open
     */
    public Transaction beginTransaction() throws CatalogException {
        synchronized (lock) {
            Preconditions.checkState(active == null, "Function catalog transaction already open");
            active = new Transaction(readRows());
            return active;
        }
    }

    /**
     * Returns the committed rows. Rows with unknown kind or return type codes are
     * logged and left out.
     */
    @Override
    public List<FunctionDefinition> listDefinitions() throws CatalogException {
        List<CatalogRow> rows;
        synchronized (lock) {
            rows = readRows();
        }
        List<FunctionDefinition> definitions = new ArrayList<>(rows.size());
        for (CatalogRow row : rows) {
            try {
                definitions.add(row.toDefinition());
            } catch (IllegalArgumentException e) {
                LOG.warn("Invalid row in function catalog {}: {}", file, row, e);
            }
        }
        return definitions;
    }

    @Override
    public void insertDefinition(FunctionDefinition definition) throws CatalogException {
        Objects.requireNonNull(definition, "definition");
        synchronized (lock) {
            Transaction transaction = requireActive();
            if (transaction.indexOf(definition.getName()) >= 0) {
                throw new CatalogException("Duplicate entry '" + definition.getName() + "' in function catalog");
            }
            transaction.rows.add(CatalogRow.of(definition));
        }
    }

    @Override
    public void deleteDefinition(String name) throws CatalogException {
        Objects.requireNonNull(name, "name");
        synchronized (lock) {
            Transaction transaction = requireActive();
            int index = transaction.indexOf(name);
            if (index < 0) {
                throw new CatalogException("Function '" + name + "' not found in function catalog");
            }
            transaction.rows.remove(index);
        }
    }

    private Transaction requireActive() throws CatalogException {
        if (active == null) {
            throw new CatalogException("No open transaction on function catalog " + file);
        }
        return active;
    }

    private List<CatalogRow> readRows() throws CatalogException {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<CatalogRow> rows = mapper.readValue(file.toFile(), ROWS_TYPE);
            return rows != null ? new ArrayList<>(rows) : new ArrayList<>();
        } catch (IOException e) {
            throw new CatalogException("Failed to read function catalog " + file, e);
        }
    }

    private void writeRows(List<CatalogRow> rows) throws CatalogException {
        Path dir = file.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                mapper.writeValue(out, rows);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new CatalogException("Failed to write function catalog " + file, e);
        }
    }

    /**
     * One open catalog transaction.
     */
    public final class Transaction implements TransactionContext {

        private final List<CatalogRow> rows;
        private volatile boolean rollbackRequested;

        private Transaction(List<CatalogRow> rows) {
            this.rows = rows;
        }

        private int indexOf(String name) {
            for (int i = 0; i < rows.size(); i++) {
                if (name.equalsIgnoreCase(rows.get(i).name)) {
                    return i;
                }
            }
            return -1;
        }

        @Override
        public boolean isRollbackRequested() {
            return rollbackRequested;
        }

        /** Marks the transaction so the statement rolls back instead of committing. */
        public void setRollbackOnly() {
            rollbackRequested = true;
        }

        @Override
        public void commit() throws CatalogException {
            synchronized (lock) {
                checkActive();
                try {
                    writeRows(rows);
                } finally {
                    active = null;
                }
            }
        }

        @Override
        public void rollback() {
            synchronized (lock) {
                if (active == this) {
                    active = null;
                }
            }
        }

        private void checkActive() throws CatalogException {
            if (active != this) {
                throw new CatalogException("Function catalog transaction is no longer open");
            }
        }
    }

    static final class CatalogRow {

        @JsonProperty("name")
        private final String name;
        @JsonProperty("ret")
        private final int ret;
        @JsonProperty("dl")
        private final String dl;
        @JsonProperty("type")
        private final int type;

        @JsonCreator
        CatalogRow(@JsonProperty("name") String name, @JsonProperty("ret") int ret,
                @JsonProperty("dl") String dl, @JsonProperty("type") int type) {
            this.name = name;
            this.ret = ret;
            this.dl = dl;
            // rows written before aggregates existed carry no type
            this.type = type == 0 ? FunctionKind.SCALAR.getCode() : type;
        }

        static CatalogRow of(FunctionDefinition definition) {
            return new CatalogRow(definition.getName(), definition.getReturnType().getCode(),
                    definition.getLibraryPath(), definition.getKind().getCode());
        }

        FunctionDefinition toDefinition() {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Catalog row without name");
            Preconditions.checkArgument(!Strings.isNullOrEmpty(dl), "Catalog row without library path: %s", name);
            return FunctionDefinition.builder()
                    .name(name)
                    .returnType(ReturnType.fromCode(ret))
                    .libraryPath(dl)
                    .kind(FunctionKind.fromCode(type))
                    .build();
        }

        @Override
        public String toString() {
            return "{name=" + name + ", ret=" + ret + ", dl=" + dl + ", type=" + type + '}';
        }
    }
}
