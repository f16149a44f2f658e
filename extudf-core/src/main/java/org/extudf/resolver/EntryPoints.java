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

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The entry points resolved for one function.
 *
 * <p>{@code EVAL} is always present; {@code CLEAR} and {@code ADD} are present for
 * aggregates; {@code INIT} and {@code DEINIT} are optional.
 */
public final class EntryPoints {

    private final FunctionKind kind;
    private final Map<EntryPoint.Role, EntryPoint> byRole;
    private final boolean suspicious;

    EntryPoints(FunctionKind kind, List<EntryPoint> entryPoints, boolean suspicious) {
        this.kind = Objects.requireNonNull(kind, "kind");
        Map<EntryPoint.Role, EntryPoint> roles = new EnumMap<>(EntryPoint.Role.class);
        for (EntryPoint entryPoint : entryPoints) {
            Preconditions.checkArgument(roles.put(entryPoint.getRole(), entryPoint) == null,
                    "Duplicate entry point role: %s", entryPoint.getRole());
        }
        Preconditions.checkArgument(roles.containsKey(EntryPoint.Role.EVAL), "Missing main entry point");
        if (kind == FunctionKind.AGGREGATE) {
            Preconditions.checkArgument(roles.containsKey(EntryPoint.Role.CLEAR)
                    && roles.containsKey(EntryPoint.Role.ADD), "Aggregate needs clear and add entry points");
        }
        this.byRole = Collections.unmodifiableMap(roles);
        this.suspicious = suspicious;
    }

    public FunctionKind getKind() {
        return kind;
    }

    public EntryPoint getMain() {
        return byRole.get(EntryPoint.Role.EVAL);
    }

    public Optional<EntryPoint> getInit() {
        return get(EntryPoint.Role.INIT);
    }

    public Optional<EntryPoint> getDeinit() {
        return get(EntryPoint.Role.DEINIT);
    }

    public Optional<EntryPoint> getClear() {
        return get(EntryPoint.Role.CLEAR);
    }

    public Optional<EntryPoint> getAdd() {
        return get(EntryPoint.Role.ADD);
    }

    public Optional<EntryPoint> get(EntryPoint.Role role) {
        return Optional.ofNullable(byRole.get(role));
    }

    public List<EntryPoint> all() {
        return new ArrayList<>(byRole.values());
    }

    /**
     * True if the binding has no auxiliary symbol and was only accepted because
     * suspicious bindings are allowed.
     */
    public boolean isSuspicious() {
        return suspicious;
    }

    @Override
    public String toString() {
        return "EntryPoints{" + kind + ", " + byRole.values() + (suspicious ? ", suspicious" : "") + '}';
    }
}
