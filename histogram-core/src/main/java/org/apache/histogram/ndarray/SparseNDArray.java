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
import org.apache.histogram.util.Utils;

/**
 * An {@link NDArray} holding a single vector laid along one dimension of a higher rank array.
 *
 * <p>Every dimension other than {@link #getAxis()} has length 1, so the array costs only as much
 * memory as its vector while broadcasting against arrays that span the other dimensions. This is
 * the form the bin centers, edges and widths of a histogram take until they are explicitly
 * densified.
 */
public final class SparseNDArray extends BaseNDArray {

    private final double[] data;
    private final int axis;

    /**
     * Constructs a sparse grid array over {@code data}, which is not copied.
     *
     * @param data the elements along {@code axis}
     * @param axis the dimension holding the data
     * @param rank the number of dimensions
     * @param dataType the data type of the array
     * @throws IllegalArgumentException if {@code axis} is not a dimension of a rank {@code rank}
     *     array
     */
    SparseNDArray(double[] data, int axis, int rank, DataType dataType) {
        super(Shape.singleton(rank, axis, data.length), dataType);
        this.data = data;
        this.axis = axis;
    }

    /**
     * Returns the dimension holding the data.
     *
     * @return the dimension holding the data
     */
    public int getAxis() {
        return axis;
    }

    /** {@inheritDoc} */
    @Override
    public SparseFormat getSparseFormat() {
        return SparseFormat.SPARSE_GRID;
    }

    /** {@inheritDoc} */
    @Override
    public double getDouble(long... indices) {
        // all other dimensions have length 1, so the flat index is the index along axis
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
        Utils.checkAllocation(data.length);
        return new DenseNDArray(data.clone(), shape, dataType);
    }

    /** {@inheritDoc} */
    @Override
    public NDArray transpose() {
        return new SparseNDArray(data, shape.dimension() - 1 - axis, shape.dimension(), dataType);
    }

    /** {@inheritDoc} */
    @Override
    public NDArray map(DoubleUnaryOperator operator) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; ++i) {
            out[i] = operator.applyAsDouble(data[i]);
        }
        return new SparseNDArray(out, axis, shape.dimension(), DataType.FLOAT64);
    }
}
