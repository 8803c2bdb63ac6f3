/*
 * LoggableException.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.doclayer.util;

import io.doclayer.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception type that carries a set of keys and values describing the failure. The keys and values are kept
 * apart from the message so that they can be logged in a structured (and searchable) form.
 *
 * <p>
 * Keys keep the order in which they were added. Adding the same key twice replaces the earlier value.
 * </p>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];

    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with the given message and a flattened sequence of key/value pairs.
     *
     * @param msg error message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if <code>keyValues</code> has an odd number of elements
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nullable Throwable cause) {
        super(cause);
    }

    /**
     * Get the log information attached to this exception.
     *
     * @return an unmodifiable view of the log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Get a single value of the log information.
     *
     * @param key the key to look up
     * @return the value for the key or {@code null} if there is none
     */
    @Nullable
    public Object getLogInfoValue(@Nonnull Object key) {
        return logInfo == null ? null : logInfo.get(key.toString());
    }

    /**
     * Add a key/value pair to the log information. The key is converted with {@link Object#toString()}, so
     * enum constants of the various {@code LogMessageKeys} can be passed directly.
     *
     * @param key key of the pair
     * @param value value of the pair
     * @return this exception
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object key, @Nullable Object value) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(key.toString(), value);
        return this;
    }

    /**
     * Add a flattened list of key/value pairs to the log information. Every even element is a key and the element
     * following it is its value, so <code>["k0", "v0", "k1", "v1"]</code> adds two pairs. This is the format that
     * {@link #exportLogInfo()} produces.
     *
     * @param keyValues alternating keys and values
     * @return this exception
     * @throws IllegalArgumentException if <code>keyValues</code> has an odd number of elements
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object... keyValues) {
        if ((keyValues.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            addLogInfo(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return this;
    }

    /**
     * Export the log information as a flattened array of alternating keys and values, in insertion order.
     *
     * @return the flattened log information
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        Object[] exported = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exported[i] = entry.getKey();
            exported[i + 1] = entry.getValue();
            i += 2;
        }
        return exported;
    }
}
