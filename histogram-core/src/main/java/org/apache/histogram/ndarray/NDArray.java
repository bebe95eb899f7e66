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
import org.apache.histogram.ndarray.types.Reduction;
import org.apache.histogram.ndarray.types.Shape;
import org.apache.histogram.ndarray.types.SparseFormat;

/**
 * An interface representing an n-dimensional array.
 *
 * <p>NDArray is the core data structure for the grids derived from histogram axes. An array is
 * either stored densely, or as a sparse grid vector which only holds the elements along one
 * dimension and relies on broadcasting to stand in for its full shape. Both storage formats expose
 * the same logical values: two arrays are equal when their shapes, data types and elements are
 * equal, whatever their {@link SparseFormat}.
 *
 * <p>Arrays are immutable. Every operation returns a new array, or this array when the result
 * would be identical.
 *
 * @see NDArrays
 */
public interface NDArray {

    /**
     * Returns the {@link Shape} of this {@code NDArray}.
     *
     * @return the {@link Shape} of this {@code NDArray}
     */
    Shape getShape();

    /**
     * Returns the {@link DataType} of this {@code NDArray}.
     *
     * @return the {@link DataType} of this {@code NDArray}
     */
    DataType getDataType();

    /**
     * Returns the {@link SparseFormat} of this {@code NDArray}.
     *
     * @return the {@link SparseFormat} of this {@code NDArray}
     */
    SparseFormat getSparseFormat();

    /**
     * Returns {@code true} if this {@code NDArray} is not stored densely.
     *
     * @return {@code true} if this {@code NDArray} is not stored densely
     */
    default boolean isSparse() {
        return getSparseFormat() != SparseFormat.DENSE;
    }

    /**
     * Returns the total number of elements in this {@code NDArray}.
     *
     * @return the number of elements in this {@code NDArray}
     */
    default long size() {
        return getShape().size();
    }

    /**
     * Returns {@code true} if this {@code NDArray} has no elements.
     *
     * @return {@code true} if this {@code NDArray} has no elements
     */
    default boolean isEmpty() {
        return getShape().size() == 0;
    }

    /**
     * Returns the element at the given position.
     *
     * @param indices one index per dimension, none for a scalar
     * @return the element at the given position
     * @throws IndexOutOfBoundsException if the number of indices does not match the rank or an
     *     index is out of range
     */
    double getDouble(long... indices);

    /**
     * Returns the element at the given position as a boolean, any non-zero value being {@code
     * true}.
     *
     * @param indices one index per dimension, none for a scalar
     * @return the element at the given position as a boolean
     * @throws IndexOutOfBoundsException if the number of indices does not match the rank or an
     *     index is out of range
     */
    default boolean getBoolean(long... indices) {
        return getDouble(indices) != 0;
    }

    /**
     * Returns every element of this {@code NDArray} in row-major order.
     *
     * <p>A sparse grid array returns only its stored elements, which is the same sequence as its
     * row-major order since all other dimensions have length 1.
     *
     * @return a new array holding the elements of this {@code NDArray}
     */
    double[] toDoubleArray();

    /**
     * Returns a densely stored {@code NDArray} holding the same values.
     *
     * @return this array if it is already dense, otherwise a dense copy
     * @throws IllegalArgumentException if the dense copy exceeds the broadcast limit
     */
    NDArray toDense();

    /**
     * Broadcasts this {@code NDArray} to be the given shape.
     *
     * <p>Dimensions of length 1 are repeated to the length of the target. The result is always
     * dense.
     *
     * @param shape the new {@link Shape} of this {@code NDArray}
     * @return the broadcasted {@code NDArray}
     * @throws IllegalArgumentException if this array cannot be broadcast to {@code shape}, or the
     *     result exceeds the broadcast limit
     */
    NDArray broadcast(Shape shape);

    /**
     * Returns this {@code NDArray} with its dimensions reversed.
     *
     * @return the transposed {@code NDArray}
     */
    NDArray transpose();

    /**
     * Applies {@code operator} to every element.
     *
     * @param operator the function to apply
     * @return a new {@code NDArray} of the same shape and storage format
     */
    NDArray map(DoubleUnaryOperator operator);

    /**
     * Adds a number to this {@code NDArray} element-wise.
     *
     * @param n the number to add
     * @return the result {@code NDArray}
     */
    default NDArray add(double n) {
        return map(x -> x + n);
    }

    /**
     * Subtracts a number from this {@code NDArray} element-wise.
     *
     * @param n the number to subtract
     * @return the result {@code NDArray}
     */
    default NDArray sub(double n) {
        return map(x -> x - n);
    }

    /**
     * Multiplies this {@code NDArray} by a number element-wise.
     *
     * @param n the number to multiply by
     * @return the result {@code NDArray}
     */
    default NDArray mul(double n) {
        return map(x -> x * n);
    }

    /**
     * Divides this {@code NDArray} by a number element-wise.
     *
     * @param n the number to divide by
     * @return the result {@code NDArray}
     */
    default NDArray div(double n) {
        return map(x -> x / n);
    }

    /**
     * Returns the numerical negative {@code NDArray} element-wise.
     *
     * @return the result {@code NDArray}
     */
    default NDArray neg() {
        return map(x -> -x);
    }

    /**
     * Reduces this {@code NDArray} along the given axes.
     *
     * @param reduction the reduction to apply
     * @param axes the dimensions to reduce, negative values counting from the last dimension; all
     *     dimensions if none are given
     * @return an {@code NDArray} without the reduced dimensions
     * @throws IllegalArgumentException if an axis is out of range or repeated, or if an empty
     *     selection is reduced with a reduction which has no identity
     */
    NDArray reduce(Reduction reduction, int... axes);

    /**
     * Returns the sum of this {@code NDArray}.
     *
     * @return the sum of this {@code NDArray}
     */
    default NDArray sum() {
        return reduce(Reduction.SUM);
    }

    /**
     * Returns the product of this {@code NDArray}.
     *
     * @return the product of this {@code NDArray}
     */
    default NDArray prod() {
        return reduce(Reduction.PROD);
    }

    /**
     * Returns the minimum of this {@code NDArray}.
     *
     * @return the minimum of this {@code NDArray}
     * @throws IllegalArgumentException if this {@code NDArray} is empty
     */
    default NDArray min() {
        return reduce(Reduction.MIN);
    }

    /**
     * Returns the maximum of this {@code NDArray}.
     *
     * @return the maximum of this {@code NDArray}
     * @throws IllegalArgumentException if this {@code NDArray} is empty
     */
    default NDArray max() {
        return reduce(Reduction.MAX);
    }

    /**
     * Returns {@code true} if any element within this {@code NDArray} is non-zero.
     *
     * @return a boolean scalar {@code NDArray}
     */
    default NDArray any() {
        return reduce(Reduction.ANY);
    }

    /**
     * Returns {@code true} if all elements within this {@code NDArray} are non-zero.
     *
     * @return a boolean scalar {@code NDArray}
     */
    default NDArray all() {
        return reduce(Reduction.ALL);
    }

    /**
     * Returns {@code true} if this {@code NDArray} has the same shape and elements as {@code
     * other}.
     *
     * @param other the {@code NDArray} to compare
     * @return the boolean result
     */
    boolean contentEquals(NDArray other);

    /**
     * Returns {@code true} if two {@code NDArray}s have the same shape and are element-wise equal
     * within a tolerance.
     *
     * @param other the {@code NDArray} to compare
     * @param rtol the relative tolerance
     * @param atol the absolute tolerance
     * @return the boolean result
     */
    boolean allClose(NDArray other, double rtol, double atol);
}
