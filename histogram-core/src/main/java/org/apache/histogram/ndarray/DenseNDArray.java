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

package org.apache.histogram.ndarray;

import java.util.function.DoubleUnaryOperator;
import org.apache.histogram.ndarray.types.DataType;
import org.apache.histogram.ndarray.types.Shape;
import org.apache.histogram.ndarray.types.SparseFormat;

/** An {@link NDArray} storing every element in row-major order. */
public final class DenseNDArray extends BaseNDArray {

    private final double[] data;

    /**
     * Constructs a dense array over {@code data}, which is not copied.
     *
     * @param data the elements in row-major order
     * @param shape the shape of the array
     * @param dataType the data type of the array
     * @throws IllegalArgumentException if the number of elements does not match {@code shape}
     */
    DenseNDArray(double[] data, Shape shape, DataType dataType) {
        super(shape, dataType);
        if (data.length != shape.size()) {
            throw new IllegalArgumentException(
                    "Data of length " + data.length + " does not match shape " + shape);
        }
        this.data = data;
    }

    /** {@inheritDoc} */
    @Override
    public SparseFormat getSparseFormat() {
        return SparseFormat.DENSE;
    }

    /** {@inheritDoc} */
    @Override
    public double getDouble(long... indices) {
        return data[(int) flatIndex(indices)];
    }

    /** {@inheritDoc} */
    @Override
    public double[] toDoubleArray() {
        return data.clone();
    }

    /** {@inheritDoc} */
    @Override
    public NDArray toDense() {
        return this;
    }

    /** {@inheritDoc} */
    @Override
    public NDArray transpose() {
        int rank = shape.dimension();
        if (rank < 2) {
            return this;
        }
        Shape outShape = shape.reverse();
        long[] inStrides = shape.strides();
        long[] outStrides = outShape.strides();
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; ++i) {
            long remainder = i;
            long target = 0;
            for (int d = 0; d < rank; ++d) {
                long coordinate = remainder / inStrides[d];
                remainder %= inStrides[d];
                target += coordinate * outStrides[rank - 1 - d];
            }
            out[(int) target] = data[i];
        }
        return new DenseNDArray(out, outShape, dataType);
    }

    /** {@inheritDoc} */
    @Override
    public NDArray map(DoubleUnaryOperator operator) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; ++i) {
            out[i] = operator.applyAsDouble(data[i]);
        }
        return new DenseNDArray(out, shape, DataType.FLOAT64);
    }
}
