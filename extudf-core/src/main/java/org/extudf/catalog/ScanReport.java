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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result summary of one startup scan.
 */
public final class ScanReport {

    private final List<String> loaded;
    private final List<LoadFailure> failures;
    private final int rowsScanned;

    public ScanReport(List<String> loaded, List<LoadFailure> failures, int rowsScanned) {
        this.loaded = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(loaded, "loaded")));
        this.failures = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(failures, "failures")));
        this.rowsScanned = rowsScanned;
    }

    /** Names of the functions registered as usable. */
    public List<String> getLoaded() {
        return loaded;
    }

    public List<LoadFailure> getFailures() {
        return failures;
    }

    public int getRowsScanned() {
        return rowsScanned;
    }
}
