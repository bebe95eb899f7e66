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

package org.apache.histogram.ndarray.types;

/**
 * The reductions that can be applied to a whole {@link org.apache.histogram.ndarray.ArrayTuple}
 * or to a single {@link org.apache.histogram.ndarray.NDArray}.
 *
 * <p>{@link #MIN} and {@link #MAX} have no identity element: reducing an empty selection with them
 * fails. Boolean reductions treat any non-zero value as {@code true}.
 */
public enum Reduction {
    SUM("sum", 0, DataType.FLOAT64) {
        @Override
        public double combine(double accumulator, double value) {
            return accumulator + value;
        }
    },
    PROD("prod", 1, DataType.FLOAT64) {
        @Override
        public double combine(double accumulator, double value) {
            return accumulator * value;
        }
    },
    MIN("min", Double.NaN, DataType.FLOAT64) {
        @Override
        public double combine(double accumulator, double value) {
            return Math.min(accumulator, value);
        }
    },
    MAX("max", Double.NaN, DataType.FLOAT64) {
        @Override
        public double combine(double accumulator, double value) {
            return Math.max(accumulator, value);
        }
    },
    ANY("any", 0, DataType.BOOLEAN) {
        @Override
        public double combine(double accumulator, double value) {
            return accumulator != 0 || value != 0 ? 1 : 0;
        }
    },
    ALL("all", 1, DataType.BOOLEAN) {
        @Override
        public double combine(double accumulator, double value) {
            return accumulator != 0 && value != 0 ? 1 : 0;
        }
    };

    private final String operatorName;
    private final double identity;
    private final DataType resultType;

    Reduction(String operatorName, double identity, DataType resultType) {
        this.operatorName = operatorName;
        this.identity = identity;
        this.resultType = resultType;
    }

    /**
     * Folds {@code value} into {@code accumulator}.
     *
     * @param accumulator the result so far
     * @param value the next element
     * @return the new result
     */
    public abstract double combine(double accumulator, double value);

    /**
     * Returns {@code true} if this reduction has an identity element and so can reduce an empty
     * selection.
     *
     * @return whether this reduction has an identity element
     */
    public boolean hasIdentity() {
        return this != MIN && this != MAX;
    }

    /**
     * Returns the result of reducing an empty selection.
     *
     * @return the identity element
     * @throws IllegalArgumentException if this reduction has no identity element
     */
    public double getIdentity() {
        if (!hasIdentity()) {
            throw new IllegalArgumentException(
                    "zero-size array to reduction operation "
                            + operatorName
                            + " which has no identity");
        }
        return identity;
    }

    /**
     * Returns the {@link DataType} of the reduced result.
     *
     * @return the {@link DataType} of the reduced result
     */
    public DataType getResultType() {
        return resultType;
    }

    /**
     * Returns the lower case operator name, such as {@code sum}.
     *
     * @return the operator name
     */
    public String getOperatorName() {
        return operatorName;
    }
}
