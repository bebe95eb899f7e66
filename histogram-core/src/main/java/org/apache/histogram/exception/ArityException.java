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

package org.apache.histogram.exception;

/**
 * Thrown to indicate that the number of arguments passed to a per-axis operation does not match the
 * number of axes.
 */
public class ArityException extends BaseException {

    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    /**
     * Constructs a new exception for a call that supplied {@code actual} arguments where {@code
     * expected} were required.
     *
     * @param expected the required number of arguments
     * @param actual the number of arguments supplied
     */
    public ArityException(int expected, int actual) {
        super(
                "Must have the same number of arguments as the number of axes: expected "
                        + expected
                        + " but got "
                        + actual);
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Returns the required number of arguments.
     *
     * @return the required number of arguments
     */
    public int getExpected() {
        return expected;
    }

    /**
     * Returns the number of arguments that were supplied.
     *
     * @return the number of arguments that were supplied
     */
    public int getActual() {
        return actual;
    }
}
