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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.histogram.ndarray.types.DataType;
import org.apache.histogram.ndarray.types.Shape;
import org.apache.histogram.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** This class contains various methods for creating and combining {@link NDArray}s. */
public final class NDArrays {

    private static final Logger logger = LoggerFactory.getLogger(NDArrays.class);

    private NDArrays() {}

    ////////////////////////////////////////
    // Creation
    ////////////////////////////////////////

    /**
     * Creates a scalar {@link NDArray}.
     *
     * @param value the value of the scalar
     * @return a rank 0 {@link NDArray}
     */
    public static NDArray create(double value) {
        return new DenseNDArray(new double[] {value}, new Shape(), DataType.FLOAT64);
    }

    /**
     * Creates a one-dimensional {@link NDArray} holding a copy of {@code data}.
     *
     * @param data the elements of the array
     * @return a rank 1 {@link NDArray}
     */
    public static NDArray create(double[] data) {
        return create(data, new Shape(data.length));
    }

    /**
     * Creates a dense {@link NDArray} holding a copy of {@code data} in the given shape.
     *
     * <p>Examples
     *
     * <pre>
     * jshell&gt; NDArrays.create(new double[] {0, 1, 2, 3, 4, 5}, new Shape(2, 3));
     * ND: (2, 3) float64 default
     * [0.0, 1.0, 2.0, 3.0, 4.0, 5.0]
     * </pre>
     *
     * @param data the elements of the array in row-major order
     * @param shape the shape of the array
     * @return a dense {@link NDArray}
     * @throws IllegalArgumentException if the number of elements does not match {@code shape}
     */
    public static NDArray create(double[] data, Shape shape) {
        return new DenseNDArray(data.clone(), shape, DataType.FLOAT64);
    }

    /**
     * Creates a boolean {@link NDArray} in the given shape.
     *
     * @param data the elements of the array in row-major order
     * @param shape the shape of the array
     * @return a dense boolean {@link NDArray}
     * @throws IllegalArgumentException if the number of elements does not match {@code shape}
     */
    public static NDArray create(boolean[] data, Shape shape) {
        double[] values = new double[data.length];
        for (int i = 0; i < data.length; ++i) {
            values[i] = data[i] ? 1 : 0;
        }
        return new DenseNDArray(values, shape, DataType.BOOLEAN);
    }

    /**
     * Creates a sparse grid {@link NDArray} holding a copy of {@code data} along {@code axis} of a
     * rank {@code rank} array.
     *
     * @param data the elements along {@code axis}
     * @param axis the dimension holding the data
     * @param rank the number of dimensions
     * @return a {@link SparseNDArray}
     * @throws IllegalArgumentException if {@code axis} is not a dimension of a rank {@code rank}
     *     array
     */
    public static NDArray createSparse(double[] data, int axis, int rank) {
        return new SparseNDArray(data.clone(), axis, rank, DataType.FLOAT64);
    }

    ////////////////////////////////////////
    // Grids
    ////////////////////////////////////////

    /**
     * Returns coordinate arrays from coordinate vectors, using matrix ({@code ij}) indexing.
     *
     * <p>For {@code K} vectors of lengths {@code n0 ... n(K-1)}, array {@code i} of the result has
     * rank {@code K} and holds vector {@code i} along dimension {@code i}. With {@code sparse} set
     * every other dimension has length 1; otherwise every array is broadcast to the full shape
     * {@code (n0, ..., n(K-1))}.
     *
     * <p>Examples
     *
     * <pre>
     * jshell&gt; NDArrays.meshgrid(true, new double[] {1, 2, 3}, new double[] {4, 5});
     * [ND: (3, 1) float64 sparse_grid
     * [1.0, 2.0, 3.0], ND: (1, 2) float64 sparse_grid
     * [4.0, 5.0]]
     * </pre>
     *
     * @param sparse whether to keep the arrays as sparse grids
     * @param vectors the coordinate vectors
     * @return one array per vector, in the same order
     * @throws IllegalArgumentException if a dense grid exceeds the broadcast limit
     */
    public static List<NDArray> meshgrid(boolean sparse, double[]... vectors) {
        return meshgrid(sparse, Arrays.asList(vectors));
    }

    /**
     * Returns coordinate arrays from coordinate vectors, using matrix ({@code ij}) indexing.
     *
     * @param sparse whether to keep the arrays as sparse grids
     * @param vectors the coordinate vectors
     * @return one array per vector, in the same order
     * @throws IllegalArgumentException if a dense grid exceeds the broadcast limit
     * @see #meshgrid(boolean, double[]...)
     */
    public static List<NDArray> meshgrid(boolean sparse, List<double[]> vectors) {
        int rank = vectors.size();
        List<NDArray> grid = new ArrayList<>(rank);
        for (int i = 0; i < rank; ++i) {
            grid.add(createSparse(vectors.get(i), i, rank));
        }
        if (sparse) {
            return Collections.unmodifiableList(grid);
        }
        return broadcastArrays(grid);
    }

    ////////////////////////////////////////
    // Broadcasting
    ////////////////////////////////////////

    /**
     * Returns the shape that all of {@code arrays} broadcast to.
     *
     * @param arrays the arrays to broadcast together
     * @return the common {@link Shape}
     * @throws IllegalArgumentException if the arrays cannot be broadcast together
     * @see Shape#broadcast(Shape...)
     */
    public static Shape broadcastShape(List<? extends NDArray> arrays) {
        return Shape.broadcast(arrays.stream().map(NDArray::getShape).toArray(Shape[]::new));
    }

    /**
     * Broadcasts every array against every other one.
     *
     * <p>The result holds the same logical values as {@code arrays}, all densely stored in their
     * common shape.
     *
     * @param arrays the arrays to broadcast
     * @return the dense arrays, in the same order
     * @throws IllegalArgumentException if the arrays cannot be broadcast together, or the result
     *     exceeds the broadcast limit
     */
    public static List<NDArray> broadcastArrays(List<? extends NDArray> arrays) {
        Shape shape = broadcastShape(arrays);
        Utils.checkAllocation(shape.size(), Math.max(arrays.size(), 1));
        logger.debug("Broadcasting {} arrays to shape {}", arrays.size(), shape);
        List<NDArray> out = new ArrayList<>(arrays.size());
        for (NDArray array : arrays) {
            out.add(array.broadcast(shape));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Joins arrays of the same shape along a new leading dimension.
     *
     * <p>An empty list stacks to the empty vector of shape {@code (0)}.
     *
     * @param arrays the arrays to stack
     * @return an {@link NDArray} of shape {@code (arrays.size(), ...)}
     * @throws IllegalArgumentException if the arrays do not all have the same shape, or the result
     *     exceeds the broadcast limit
     */
    public static NDArray stack(List<? extends NDArray> arrays) {
        if (arrays.isEmpty()) {
            return new DenseNDArray(new double[0], new Shape(0), DataType.FLOAT64);
        }
        Shape shape = arrays.get(0).getShape();
        DataType dataType = arrays.get(0).getDataType();
        for (NDArray array : arrays) {
            if (!shape.equals(array.getShape())) {
                throw new IllegalArgumentException(
                        "All arrays must have the same shape to be stacked, got "
                                + shape
                                + " and "
                                + array.getShape());
            }
            if (array.getDataType() != dataType) {
                dataType = DataType.FLOAT64;
            }
        }
        int length = Utils.checkAllocation(shape.size(), arrays.size());
        double[] out = new double[length * arrays.size()];
        for (int i = 0; i < arrays.size(); ++i) {
            System.arraycopy(arrays.get(i).toDoubleArray(), 0, out, i * length, length);
        }
        return new DenseNDArray(out, new Shape(arrays.size()).addAll(shape), dataType);
    }
}
