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

package org.extudf;

import java.util.Objects;
import java.util.Optional;

/**
 * Exception raised when creating, dropping or loading an extension function fails.
 *
 * <p>Every instance carries one {@link UdfErrorCode} plus the function name and,
 * for symbol resolution failures, the native symbol that could not be bound.
 * Use the static factories so messages stay uniform across the call sites.
 */
public class UdfException extends Exception {

    private static final long serialVersionUID = 1L;

    private final UdfErrorCode errorCode;
    private final String functionName;
    private final String symbolName;

    public UdfException(UdfErrorCode errorCode, String functionName, String message) {
        this(errorCode, functionName, null, message, null);
    }

    public UdfException(UdfErrorCode errorCode, String functionName, String symbolName, String message,
            Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.functionName = functionName;
        this.symbolName = symbolName;
    }

    public UdfErrorCode getErrorCode() {
        return errorCode;
    }

    public Optional<String> getFunctionName() {
        return Optional.ofNullable(functionName);
    }

    public Optional<String> getSymbolName() {
        return Optional.ofNullable(symbolName);
    }

    public static UdfException invalidPath(String functionName, String libraryPath) {
        return new UdfException(UdfErrorCode.INVALID_PATH, functionName,
                "No paths allowed for shared library: '" + libraryPath + "'");
    }

    public static UdfException invalidName(String functionName) {
        return new UdfException(UdfErrorCode.INVALID_NAME, functionName,
                "Invalid function name: '" + functionName + "'");
    }

    public static UdfException duplicateName(String functionName) {
        return new UdfException(UdfErrorCode.DUPLICATE_NAME, functionName,
                "Function '" + functionName + "' already exists");
    }

    public static UdfException libraryLoadError(String functionName, String libraryPath, String platformMessage,
            Throwable cause) {
        return new UdfException(UdfErrorCode.LIBRARY_LOAD_ERROR, functionName, null,
                "Can't open shared library '" + libraryPath + "' (" + platformMessage + ")", cause);
    }

    public static UdfException missingSymbol(String functionName, String symbolName) {
        return new UdfException(UdfErrorCode.MISSING_SYMBOL, functionName, symbolName,
                "Can't find symbol '" + symbolName + "' in library", null);
    }

    public static UdfException suspiciousBinding(String functionName) {
        return new UdfException(UdfErrorCode.SUSPICIOUS_BINDING, functionName, functionName,
                "Can't find symbol '" + functionName + "_init' or '" + functionName
                        + "_deinit' in library; refusing to bind a function without auxiliary symbols", null);
    }

    public static UdfException aggregateMissingAuxSymbol(String functionName, String symbolName) {
        return new UdfException(UdfErrorCode.AGGREGATE_MISSING_AUX_SYMBOL, functionName, symbolName,
                "Can't find symbol '" + symbolName + "' required by aggregate function '" + functionName + "'",
                null);
    }

    public static UdfException functionNotFound(String functionName) {
        return new UdfException(UdfErrorCode.FUNCTION_NOT_FOUND, functionName,
                "Function '" + functionName + "' does not exist");
    }

    public static UdfException persistenceError(String functionName, Throwable cause) {
        return new UdfException(UdfErrorCode.PERSISTENCE_ERROR, functionName, null,
                "Error writing function catalog for '" + functionName + "': "
                        + (cause != null ? cause.getMessage() : "unknown error"), cause);
    }

    public static UdfException transactionAborted(String functionName, Throwable cause) {
        return new UdfException(UdfErrorCode.TRANSACTION_ABORTED, functionName, null,
                "Transaction for function '" + functionName + "' was rolled back", cause);
    }
}
