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
 * Native library loading for extension functions.
 *
 * <p>This package opens dynamic libraries through a {@link org.extudf.loader.NativeLoader}
 * (JNA by default), shares one {@link org.extudf.loader.LibraryHandle} per canonical
 * path, and closes each library exactly once when its last holder releases it.
 *
 * <p>It carries no function semantics: symbol naming conventions, registration and
 * persistence live in the core module.
 */
package org.extudf.loader;
