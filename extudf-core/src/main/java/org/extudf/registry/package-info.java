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

/**
 * In-memory registry of extension functions.
 *
 * <p>{@link org.extudf.registry.FunctionRegistry} is the only state shared by query
 * execution threads. Lookups run under a read lock; a function dropped while in use
 * is shadowed, so callers that already hold it finish their calls against a library
 * that stays open until the last of them releases it.
 */
package org.extudf.registry;
