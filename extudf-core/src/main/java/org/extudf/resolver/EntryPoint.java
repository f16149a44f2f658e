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

import org.extudf.loader.NativeSymbol;

import java.util.Objects;

/**
 * A resolved native entry point tagged with the calling convention it is used with.
 *
 * <p>The role is fixed at resolution time by the function kind and never changes.
 */
public final class EntryPoint {

    /**
     * Calling conventions of extension function entry points. The suffix is appended
     * to the declared function name to form the exported symbol name.
     */
    public enum Role {
        EVAL(""),
        INIT("_init"),
        DEINIT("_deinit"),
        CLEAR("_clear"),
        ADD("_add");

        private final String suffix;

        Role(String suffix) {
            this.suffix = suffix;
        }

        public String getSuffix() {
            return suffix;
        }

        public String symbolFor(String functionName) {
            return functionName + suffix;
        }
    }

    private final Role role;
    private final NativeSymbol symbol;

    public EntryPoint(Role role, NativeSymbol symbol) {
        this.role = Objects.requireNonNull(role, "role");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
    }

    public Role getRole() {
        return role;
    }

    public String getSymbolName() {
        return symbol.getName();
    }

    public NativeSymbol getSymbol() {
        return symbol;
    }

    /**
     * Calls the entry point. The owning library must still be held by the caller.
     */
    public Object invoke(Class<?> returnType, Object... args) {
        return symbol.invoke(returnType, args);
    }

    @Override
    public String toString() {
        return role + ":" + symbol.getName();
    }
}
