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

import java.util.Arrays;
import java.util.Objects;
import org.apache.histogram.ndarray.types.DataType;
import org.apache.histogram.ndarray.types.Reduction;
import org.apache.histogram.ndarray.types.Shape;
import org.apache.histogram.util.Utils;

/** Holds the shape and data type of an {@link NDArray} and implements format-free operations. */
abstract class BaseNDArray implements NDArray {

    protected final Shape shape;
    protected final DataType dataType;

    BaseNDArray(Shape shape, DataType dataType) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
    }

    /** {@inheritDoc} */
    @Override
    public Shape getShape() {
        return shape;
    }

    /** {@inheritDoc} */
    @Override
    public DataType getDataType() {
        return dataType;
    }

    /**
     * Returns the row-major position of the element at {@code indices}.
     *
     * @param indices one index per dimension
     * @return the row-major position
     * @throws IndexOutOfBoundsException if the indices do not address an element
     */
    protected long flatIndex(long... indices) {
        if (indices.length != shape.dimension()) {
            throw new IndexOutOfBoundsException(
                    "Expected "
                            + shape.dimension()
                            + " indices for shape "
                            + shape
                            + " but got "
                            + indices.length);
        }
        long[] strides = shape.strides();
        long flat = 0;
        for (int i = 0; i < indices.length; ++i) {
            if (indices[i] < 0 || indices[i] >= shape.get(i)) {
                throw new IndexOutOfBoundsException(
                        "Index "
                                + indices[i]
                                + " is out of bounds for dimension "
                                + i
                                + " with size "
                                + shape.get(i));
            }
            flat += indices[i] * strides[i];
        }
        return flat;
    }

    /** {@inheritDoc} */
    @Override
    public NDArray broadcast(Shape target) {
        if (!isSparse() && shape.equals(target)) {
            return this;
        }
        if (!shape.isBroadcastableTo(target)) {
            throw new IllegalArgumentException(
                    "Cannot broadcast an array of shape " + shape + " to " + target);
        }
        int size = Utils.checkAllocation(target.size());
        double[] source = toDoubleArray();

        // strides of the source aligned to the target, 0 along repeated dimensions
        int rank = target.dimension();
        int offset = rank - shape.dimension();
        long[] sourceStrides = new long[rank];
        long[] strides = shape.strides();
        for (int i = 0; i < shape.dimension(); ++i) {
            sourceStrides[offset + i] = shape.get(i) == 1 ? 0 : strides[i];
        }

        double[] out = new double[size];
        long[] counter = new long[rank];
        long position = 0;
        for (int i = 0; i < size; ++i) {
            out[i] = source[(int) position];
            for (int d = rank - 1; d >= 0; --d) {
                if (++counter[d] < target.get(d)) {
                    position += sourceStrides[d];
                    break;
                }
                position -= sourceStrides[d] * (counter[d] - 1);
                counter[d] = 0;
            }
        }
        return new DenseNDArray(out, target, dataType);
    }

    /** {@inheritDoc} */
    @Override
    public NDArray reduce(Reduction reduction, int... axes) {
        int rank = shape.dimension();
        boolean[] reduced = new boolean[rank];
        if (axes.length == 0) {
            Arrays.fill(reduced, true);
        }
        for (int axis : axes) {
            int dim = axis < 0 ? axis + rank : axis;
            if (dim < 0 || dim >= rank) {
                throw new IllegalArgumentException(
                        "Axis " + axis + " is out of bounds for an array of rank " + rank);
            }
            if (reduced[dim]) {
                throw new IllegalArgumentException("Duplicate axis " + axis);
            }
            reduced[dim] = true;
        }

        long[] kept = new long[rank];
        int keptRank = 0;
        for (int d = 0; d < rank; ++d) {
            if (!reduced[d]) {
                kept[keptRank++] = shape.get(d);
            }
        }
        Shape outShape = new Shape(Arrays.copyOf(kept, keptRank));

        // stride of each input dimension within the output, 0 along reduced dimensions
        long[] outStrides = new long[rank];
        long[] strides = outShape.strides();
        for (int d = 0, k = 0; d < rank; ++d) {
            if (!reduced[d]) {
                outStrides[d] = strides[k++];
            }
        }

        double[] source = toDoubleArray();
        double[] out = new double[Math.toIntExact(outShape.size())];
        boolean[] seen = new boolean[out.length];
        long[] inStrides = shape.strides();
        for (int i = 0; i < source.length; ++i) {
            long remainder = i;
            int target = 0;
            for (int d = 0; d < rank; ++d) {
                long coordinate = remainder / inStrides[d];
                remainder %= inStrides[d];
                target += (int) (coordinate * outStrides[d]);
            }
            if (seen[target]) {
                out[target] = reduction.combine(out[target], source[i]);
            } else {
                out[target] =
                        reduction.hasIdentity()
                                ? reduction.combine(reduction.getIdentity(), source[i])
                                : source[i];
                seen[target] = true;
            }
        }
        for (int i = 0; i < out.length; ++i) {
            if (!seen[i]) {
                out[i] = reduction.getIdentity();
            }
        }
        return new DenseNDArray(out, outShape, reduction.getResultType());
    }

    /** {@inheritDoc} */
    @Override
    public boolean contentEquals(NDArray other) {
        return other != null
                && shape.equals(other.getShape())
                && Arrays.equals(toDoubleArray(), other.toDoubleArray());
    }

    /** {@inheritDoc} */
    @Override
    public boolean allClose(NDArray other, double rtol, double atol) {
        if (other == null || !shape.equals(other.getShape())) {
            return false;
        }
        double[] actual = toDoubleArray();
        double[] expected = other.toDoubleArray();
        for (int i = 0; i < actual.length; ++i) {
            if (Double.compare(actual[i], expected[i]) == 0) {
                continue;
            }
            if (!(Math.abs(actual[i] - expected[i]) <= atol + rtol * Math.abs(expected[i]))) {
                return false;
            }
        }
        return true;
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NDArray)) {
            return false;
        }
        NDArray other = (NDArray) o;
        return dataType == other.getDataType() && contentEquals(other);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return 31 * shape.hashCode() + Arrays.hashCode(toDoubleArray());
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64);
        sb.append("ND: ")
                .append(shape)
                .append(' ')
                .append(dataType)
                .append(' ')
                .append(getSparseFormat().getType())
                .append('\n')
                .append(Arrays.toString(toDoubleArray()));
        return sb.toString();
    }
}
