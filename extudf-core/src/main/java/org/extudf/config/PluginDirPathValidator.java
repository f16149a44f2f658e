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

package org.extudf.config;

import org.extudf.spi.PathValidator;

import com.google.common.base.Strings;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Confines library paths to the plugin directory.
 *
 * <p>Rejects blank and absolute paths, any path with a {@code ..} segment, and
 * anything that does not stay below the plugin directory once normalized.
 */
public class PluginDirPathValidator implements PathValidator {

    private final Path pluginDir;

    public PluginDirPathValidator(Path pluginDir) {
        this.pluginDir = Objects.requireNonNull(pluginDir, "pluginDir").toAbsolutePath().normalize();
    }

    @Override
    public boolean isAllowedPath(String libraryPath) {
        if (Strings.isNullOrEmpty(libraryPath) || libraryPath.trim().isEmpty()) {
            return false;
        }
        // both separators count, whatever the platform
        for (String segment : libraryPath.split("[/\\\\]")) {
            if ("..".equals(segment)) {
                return false;
            }
        }
        Path relative;
        try {
            relative = Paths.get(libraryPath);
        } catch (InvalidPathException e) {
            return false;
        }
        if (relative.isAbsolute() || relative.getRoot() != null) {
            return false;
        }
        Path resolved = pluginDir.resolve(relative).normalize();
        return resolved.startsWith(pluginDir) && !resolved.equals(pluginDir);
    }
}
