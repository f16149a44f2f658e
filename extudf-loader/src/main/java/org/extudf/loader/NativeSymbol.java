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

package org.extudf.loader;

/**
 * Entry point exported by a {@link NativeModule}.
 *
 * <p>A symbol is only callable while the module that produced it is open.
 */
public interface NativeSymbol {

    String getName();

    /** Raw address of the entry point. */
    long getAddress();

    /**
     * Calls the entry point with the C calling convention.
     *
     * @param returnType Java type the native return value maps to
     * @param args arguments, already mapped to native-compatible types
     * @return the mapped return value
     */
    Object invoke(Class<?> returnType, Object... args);
}
