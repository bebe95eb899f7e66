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

import java.util.Arrays;
import java.util.stream.LongStream;
import org.apache.histogram.ndarray.NDArray;

/** A class that presents the {@link NDArray}'s shape information. */
public class Shape {

    private final long[] shape;

    /**
     * Constructs and initializes a {@code Shape} with specified dimension as {@code (long...
     * shape)}.
     *
     * @param shape the dimensions of the shape
     * @throws IllegalArgumentException Thrown if any element in Shape is negative
     */
    public Shape(long... shape) {
        if (Arrays.stream(shape).anyMatch(s -> s < 0)) {
            throw new IllegalArgumentException("The shape must be >= 0: " + Arrays.toString(shape));
        }
        this.shape = shape.clone();
    }

    /**
     * Returns the shape of a rank {@code rank} array which has {@code length} elements along
     * {@code axis} and a single element along every other dimension.
     *
     * @param rank the number of dimensions
     * @param axis the dimension holding the data
     * @param length the number of elements along {@code axis}
     * @return the singleton-padded shape
     * @throws IllegalArgumentException if {@code axis} is not a dimension of a rank {@code rank}
     *     shape
     */
    public static Shape singleton(int rank, int axis, long length) {
        if (axis < 0 || axis >= rank) {
            throw new IllegalArgumentException(
                    "Invalid axis " + axis + " for a shape of rank " + rank);
        }
        long[] out = new long[rank];
        Arrays.fill(out, 1);
        out[axis] = length;
        return new Shape(out);
    }

    /**
     * Returns a new shape altering the given dimension.
     *
     * @param shape the shape to update
     * @param dimension the dimension to get the shape in
     * @param value the value to set the dimension to
     * @return a new shape with the update applied
     */
    public static Shape update(Shape shape, int dimension, long value) {
        long[] newShape = shape.shape.clone();
        newShape[dimension] = value;
        return new Shape(newShape);
    }

    /**
     * Returns the shape every one of {@code shapes} broadcasts to.
     *
     * <p>Shapes are aligned on their last dimension and shorter shapes are padded with leading
     * ones. Along every dimension the lengths must either be equal or be 1, and the result takes
     * the length that is not 1. For example {@code (3, 1)} and {@code (1, 2)} broadcast to {@code
     * (3, 2)}, while {@code (3)} and {@code (2)} are incompatible.
     *
     * @param shapes the shapes to broadcast together
     * @return the common shape, or the scalar shape {@code ()} if no shape is given
     * @throws IllegalArgumentException if the shapes cannot be broadcast together
     */
    public static Shape broadcast(Shape... shapes) {
        int rank = Arrays.stream(shapes).mapToInt(Shape::dimension).max().orElse(0);
        long[] out = new long[rank];
        Arrays.fill(out, 1);
        for (Shape s : shapes) {
            int offset = rank - s.dimension();
            for (int i = 0; i < s.dimension(); ++i) {
                long current = out[offset + i];
                long length = s.shape[i];
                if (length == current || length == 1) {
                    continue;
                }
                if (current != 1) {
                    throw new IllegalArgumentException(
                            "Shapes cannot be broadcast together: "
                                    + Arrays.toString(shapes));
                }
                out[offset + i] = length;
            }
        }
        return new Shape(out);
    }

    /**
     * Returns {@code true} if an array of this shape can be broadcast to {@code target} without
     * changing {@code target}.
     *
     * @param target the shape to broadcast to
     * @return whether this shape broadcasts to {@code target}
     */
    public boolean isBroadcastableTo(Shape target) {
        if (dimension() > target.dimension()) {
            return false;
        }
        int offset = target.dimension() - dimension();
        for (int i = 0; i < shape.length; ++i) {
            if (shape[i] != 1 && shape[i] != target.shape[offset + i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the dimensions of the {@code Shape}.
     *
     * @return the dimensions of the {@code Shape}
     */
    public long[] getShape() {
        return shape.clone();
    }

    /**
     * Returns the shape in the given dimension.
     *
     * @param dimension the dimension to get the shape in
     * @return the shape in the given dimension
     */
    public long get(int dimension) {
        return shape[dimension];
    }

    /**
     * Returns the size of a specific dimension or several specific dimensions.
     *
     * @param dimensions the dimension or dimensions to find the size of
     * @return the size of specific dimension(s)
     * @throws IllegalArgumentException thrown if passed an invalid dimension, or if the size
     *     overflows a {@code long}
     */
    public long size(int... dimensions) {
        long total = 1;
        for (int d : dimensions) {
            if (d < 0 || d >= shape.length) {
                throw new IllegalArgumentException("Invalid dimension " + d);
            }
            total = multiply(total, shape[d]);
        }
        return total;
    }

    /**
     * Returns the total size.
     *
     * @return the total number of elements
     * @throws IllegalArgumentException if the size overflows a {@code long}
     */
    public long size() {
        long total = 1;
        for (long v : shape) {
            total = multiply(total, v);
        }
        return total;
    }

    private long multiply(long total, long length) {
        try {
            return Math.multiplyExact(total, length);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("The size of shape " + this + " overflows", e);
        }
    }

    /**
     * Returns the number of dimensions of this {@code Shape}.
     *
     * @return the number of dimensions of this {@code Shape}
     */
    public int dimension() {
        return shape.length;
    }

    /**
     * Returns the row-major strides of this {@code Shape}, counted in elements.
     *
     * @return the number of elements to skip to advance one step along each dimension
     */
    public long[] strides() {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; --i) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    /**
     * Creates a new {@code Shape} whose content is a slice of this shape.
     *
     * @param beginIndex the beginning index, inclusive
     * @return a new {@code Shape} whose content is a slice of this shape
     */
    public Shape slice(int beginIndex) {
        return slice(beginIndex, shape.length);
    }

    /**
     * Creates a new {@code Shape} whose content is a slice of this shape.
     *
     * <p>The sub shape begins at the specified {@code beginIndex} and extends to {@code endIndex -
     * 1}.
     *
     * @param beginIndex the beginning index, inclusive
     * @param endIndex the ending index, exclusive
     * @return a new {@code Shape} whose content is a slice of this shape
     */
    public Shape slice(int beginIndex, int endIndex) {
        return new Shape(Arrays.copyOfRange(shape, beginIndex, endIndex));
    }

    /**
     * Returns a new {@code Shape} with the dimensions in reverse order.
     *
     * @return the reversed {@code Shape}
     */
    public Shape reverse() {
        long[] out = new long[shape.length];
        for (int i = 0; i < shape.length; ++i) {
            out[i] = shape[shape.length - 1 - i];
        }
        return new Shape(out);
    }

    /**
     * Joins this shape with axes.
     *
     * @param axes the axes to join
     * @return the joined {@code Shape}
     */
    public Shape add(long... axes) {
        return this.addAll(new Shape(axes));
    }

    /**
     * Joins this shape with specified {@code other} shape.
     *
     * @param other the shape to join
     * @return the joined {@code Shape}
     */
    public Shape addAll(Shape other) {
        return new Shape(
                LongStream.concat(Arrays.stream(shape), Arrays.stream(other.shape)).toArray());
    }

    /**
     * Returns the head index of the shape.
     *
     * @return the head index of the shape
     * @throws IndexOutOfBoundsException Thrown if the shape is empty
     */
    public long head() {
        // scalar case
        if (shape.length == 0) {
            throw new IndexOutOfBoundsException("can't get value from scalar shape.");
        }
        return shape[0];
    }

    /**
     * Returns {@code true} if the NDArray is a scalar.
     *
     * @return whether the NDArray is a scalar
     */
    public boolean isScalar() {
        return dimension() == 0;
    }

    /**
     * Returns {@code true} if the NDArray contains zero dimensions.
     *
     * @return whether the NDArray contain zero dimensions
     */
    public boolean hasZeroDimension() {
        for (int i = 0; i < dimension(); i++) {
            if (shape[i] == 0) {
                return true;
            }
        }
        return false;
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Shape shape1 = (Shape) o;
        return Arrays.equals(shape, shape1.shape);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return Arrays.hashCode(shape);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(');
        for (int i = 0; i < shape.length; ++i) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(shape[i]);
        }
        sb.append(')');
        return sb.toString();
    }
}
