/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.histogram.util;

/** A class containing utility methods. */
public final class Utils {

    /** Name of the setting capping the element count of a dense materialization. */
    public static final String BROADCAST_LIMIT = "HISTOGRAM_BROADCAST_LIMIT";

    /** The largest array Java can reliably allocate. */
    public static final long DEFAULT_BROADCAST_LIMIT = Integer.MAX_VALUE - 8;

    private Utils() {}

    /**
     * Returns the value of a setting, looked up first as a system property and then as an
     * environment variable.
     *
     * @param name the name of the setting
     * @return the value, or {@code null} if neither source defines a non-empty value
     */
    public static String getEnvOrSystemProperty(String name) {
        String value = System.getProperty(name);
        if (value == null || value.isEmpty()) {
            value = System.getenv(name);
            if (value == null || value.isEmpty()) {
                return null;
            }
        }
        return value;
    }

    /**
     * Returns the maximum number of elements a dense array may be materialized with.
     *
     * @return the broadcast element limit
     * @throws IllegalArgumentException if the configured value is not a positive integer
     */
    public static long getBroadcastLimit() {
        String limit = getEnvOrSystemProperty(BROADCAST_LIMIT);
        if (limit == null) {
            return DEFAULT_BROADCAST_LIMIT;
        }
        long value;
        try {
            value = Long.parseLong(limit.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid " + BROADCAST_LIMIT + " value: " + limit, e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(
                    "Invalid " + BROADCAST_LIMIT + " value: " + limit);
        }
        return Math.min(value, DEFAULT_BROADCAST_LIMIT);
    }

    /**
     * Checks that {@code count} arrays of {@code size} elements each may be allocated together.
     *
     * @param size the number of elements of each array
     * @param count the number of arrays
     * @return {@code size} as an {@code int}
     * @throws IllegalArgumentException if the total overflows or exceeds {@link
     *     #getBroadcastLimit()}
     */
    public static int checkAllocation(long size, long count) {
        long total;
        try {
            total = Math.multiplyExact(size, count);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Cannot materialize " + count + " arrays of " + size + " elements", e);
        }
        checkAllocation(total);
        return (int) size;
    }

    /**
     * Checks that an array of {@code size} elements may be allocated.
     *
     * @param size the number of elements to allocate
     * @return {@code size} as an {@code int}
     * @throws IllegalArgumentException if {@code size} exceeds {@link #getBroadcastLimit()}
     */
    public static int checkAllocation(long size) {
        long limit = getBroadcastLimit();
        if (size > limit) {
            throw new IllegalArgumentException(
                    "Cannot materialize "
                            + size
                            + " elements, the limit is "
                            + limit
                            + " (see "
                            + BROADCAST_LIMIT
                            + ')');
        }
        return (int) size;
    }
}
