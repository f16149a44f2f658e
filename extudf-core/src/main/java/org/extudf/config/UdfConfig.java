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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration of the extension function runtime.
 *
 * <p>Recognized keys, as they appear in the server configuration file:
 * <ul>
 *   <li>{@code udf_plugin_dir} - directory all library paths are resolved against
 *       and confined to (default {@code ./plugins})</li>
 *   <li>{@code allow_suspicious_udfs} - accept functions without {@code _init} or
 *       {@code _deinit} symbols, with a warning (default {@code false})</li>
 *   <li>{@code udf_max_name_length} - longest accepted function name, in characters
 *       (default {@code 64})</li>
 * </ul>
 */
public final class UdfConfig {

    public static final String PLUGIN_DIR = "udf_plugin_dir";
    public static final String ALLOW_SUSPICIOUS_UDFS = "allow_suspicious_udfs";
    public static final String MAX_NAME_LENGTH = "udf_max_name_length";

    public static final String DEFAULT_PLUGIN_DIR = "./plugins";
    public static final int DEFAULT_MAX_NAME_LENGTH = 64;

    private final Path pluginDir;
    private final boolean allowSuspiciousUdfs;
    private final int maxNameLength;

    private UdfConfig(Builder builder) {
        this.pluginDir = Objects.requireNonNull(builder.pluginDir, "pluginDir").toAbsolutePath().normalize();
        this.allowSuspiciousUdfs = builder.allowSuspiciousUdfs;
        Preconditions.checkArgument(builder.maxNameLength > 0, "%s must be positive: %s",
                MAX_NAME_LENGTH, builder.maxNameLength);
        this.maxNameLength = builder.maxNameLength;
    }

    public Path getPluginDir() {
        return pluginDir;
    }

    public boolean isAllowSuspiciousUdfs() {
        return allowSuspiciousUdfs;
    }

    public int getMaxNameLength() {
        return maxNameLength;
    }

    public static UdfConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the recognized keys from {@code properties}; unknown keys are ignored.
     *
     * @throws IllegalArgumentException if a recognized key has a malformed value
     */
    public static UdfConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String pluginDir = trimToNull(properties.getProperty(PLUGIN_DIR));
        if (pluginDir != null) {
            builder.pluginDir(Paths.get(pluginDir));
        }
        String allowSuspicious = trimToNull(properties.getProperty(ALLOW_SUSPICIOUS_UDFS));
        if (allowSuspicious != null) {
            builder.allowSuspiciousUdfs(parseBoolean(ALLOW_SUSPICIOUS_UDFS, allowSuspicious));
        }
        String maxNameLength = trimToNull(properties.getProperty(MAX_NAME_LENGTH));
        if (maxNameLength != null) {
            try {
                builder.maxNameLength(Integer.parseInt(maxNameLength));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + MAX_NAME_LENGTH + ": " + maxNameLength, e);
            }
        }
        return builder.build();
    }

    /**
     * Loads a {@code key = value} configuration file.
     *
     * @throws IOException if the file cannot be read
     */
    public static UdfConfig load(Path configFile) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(configFile)) {
            properties.load(in);
        }
        return fromProperties(properties);
    }

    private static boolean parseBoolean(String key, String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "1".equals(lower) || "on".equals(lower)) {
            return true;
        }
        if ("false".equals(lower) || "0".equals(lower) || "off".equals(lower)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }

    private static String trimToNull(String value) {
        return Strings.emptyToNull(value == null ? null : value.trim());
    }

    @Override
    public String toString() {
        return "UdfConfig{"
                + PLUGIN_DIR + "=" + pluginDir
                + ", " + ALLOW_SUSPICIOUS_UDFS + "=" + allowSuspiciousUdfs
                + ", " + MAX_NAME_LENGTH + "=" + maxNameLength
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link UdfConfig}.
     */
    public static final class Builder {
        private Path pluginDir = Paths.get(DEFAULT_PLUGIN_DIR);
        private boolean allowSuspiciousUdfs;
        private int maxNameLength = DEFAULT_MAX_NAME_LENGTH;

        private Builder() {
        }

        public Builder pluginDir(Path pluginDir) {
            this.pluginDir = pluginDir;
            return this;
        }

        public Builder allowSuspiciousUdfs(boolean allowSuspiciousUdfs) {
            this.allowSuspiciousUdfs = allowSuspiciousUdfs;
            return this;
        }

        public Builder maxNameLength(int maxNameLength) {
            this.maxNameLength = maxNameLength;
            return this;
        }

        public UdfConfig build() {
            return new UdfConfig(this);
        }
    }
}
