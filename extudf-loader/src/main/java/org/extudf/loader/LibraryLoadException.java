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

import java.nio.file.Path;

/**
 * Raised when the platform loader refuses to open a library: missing file,
 * unresolved dependencies, wrong architecture and so on.
 */
public class LibraryLoadException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Path libraryPath;
    private final String platformMessage;

    public LibraryLoadException(Path libraryPath, String platformMessage, Throwable cause) {
        super("Can't open shared library '" + libraryPath + "': " + platformMessage, cause);
        this.libraryPath = libraryPath;
        this.platformMessage = platformMessage;
    }

    public Path getLibraryPath() {
        return libraryPath;
    }

    /** Message reported by the platform loader, without the path prefix. */
    public String getPlatformMessage() {
        return platformMessage;
    }
}
