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

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.histogram.ndarray.types.Reduction;
import org.apache.histogram.ndarray.types.Shape;

/**
 * An {@code ArrayTuple} is an immutable, ordered sequence of {@link NDArray}s that is handled as a
 * single value.
 *
 * <p>The bin centers, edges and widths of a histogram are returned as an {@code ArrayTuple} holding
 * one array per axis. The arrays broadcast against each other, and are usually stored as sparse
 * grids; {@link #broadcast()} expands them to their full dense shape.
 *
 * <p>Two families of operations are available:
 *
 * <ul>
 *   <li>member-wise forwarding, {@link #map(Function)} and {@link #collect(Function)}, which apply
 *       a function to every member separately;
 *   <li>ensemble reductions, {@link #reduce(Reduction)} and its shortcuts {@link #sum()}, {@link
 *       #prod()}, {@link #min()}, {@link #max()}, {@link #any()} and {@link #all()}, which
 *       broadcast all members to a common shape, stack them and reduce the stack as a whole.
 * </ul>
 *
 * <p>The reduction shortcuts share their names with the per-array reductions of {@link NDArray}
 * and take precedence over them: {@code tuple.sum()} is the sum over the whole ensemble, not a
 * tuple of per-member sums. Use {@code tuple.map(NDArray::sum)} for the latter.
 */
public final class ArrayTuple implements Iterable<NDArray> {

    private final List<NDArray> arrays;

    /**
     * Constructs an {@code ArrayTuple} holding the given arrays in iteration order.
     *
     * @param arrays the member arrays
     * @throws NullPointerException if {@code arrays} or any of its members is {@code null}
     */
    public ArrayTuple(Collection<? extends NDArray> arrays) {
        this.arrays = List.copyOf(arrays);
    }

    /**
     * Constructs an {@code ArrayTuple} holding the given arrays.
     *
     * @param arrays the member arrays
     * @return a new {@code ArrayTuple}
     */
    public static ArrayTuple of(NDArray... arrays) {
        return new ArrayTuple(Arrays.asList(arrays));
    }

    /**
     * Returns the number of member arrays.
     *
     * @return the number of member arrays
     */
    public int size() {
        return arrays.size();
    }

    /**
     * Returns {@code true} if this tuple has no members.
     *
     * @return {@code true} if this tuple has no members
     */
    public boolean isEmpty() {
        return arrays.isEmpty();
    }

    /**
     * Returns the member at {@code index}, negative values counting from the end.
     *
     * @param index the position of the member
     * @return the member array
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public NDArray get(int index) {
        return arrays.get(index < 0 ? index + arrays.size() : index);
    }

    /**
     * Returns the members as an unmodifiable list.
     *
     * @return the members
     */
    public List<NDArray> asList() {
        return arrays;
    }

    /**
     * Returns a sequential stream over the members.
     *
     * @return a stream over the members
     */
    public Stream<NDArray> stream() {
        return arrays.stream();
    }

    /** {@inheritDoc} */
    @Override
    public Iterator<NDArray> iterator() {
        return arrays.iterator();
    }

    /**
     * Gets the shapes of all members.
     *
     * @return shapes of the members, in order
     */
    public Shape[] getShapes() {
        return stream().map(NDArray::getShape).toArray(Shape[]::new);
    }

    /**
     * Applies {@code function} to every member and returns the results as a new tuple.
     *
     * @param function the function to apply to each member
     * @return a new {@code ArrayTuple} of the results, in order
     */
    public ArrayTuple map(Function<? super NDArray, ? extends NDArray> function) {
        List<NDArray> out = new ArrayList<>(arrays.size());
        for (NDArray array : arrays) {
            out.add(function.apply(array));
        }
        return new ArrayTuple(out);
    }

    /**
     * Applies {@code function} to every member and returns the results as a list, for member
     * properties that are not arrays themselves.
     *
     * @param function the function to apply to each member
     * @param <T> the result type
     * @return an unmodifiable list of the results, in order
     */
    public <T> List<T> collect(Function<? super NDArray, ? extends T> function) {
        List<T> out = new ArrayList<>(arrays.size());
        for (NDArray array : arrays) {
            out.add(function.apply(array));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns the members fully broadcast against each other.
     *
     * <p>The values are unchanged; sparse grid members are expanded to the dense common shape.
     *
     * @return a new {@code ArrayTuple} of dense arrays
     * @throws IllegalArgumentException if the members cannot be broadcast together, or the result
     *     exceeds the broadcast limit
     */
    public ArrayTuple broadcast() {
        return new ArrayTuple(NDArrays.broadcastArrays(arrays));
    }

    /**
     * Reduces the whole ensemble of members to a single value.
     *
     * @param reduction the reduction to apply
     * @return a scalar {@link NDArray}
     * @throws IllegalArgumentException if the members cannot be broadcast together, or the tuple
     *     is empty and the reduction has no identity
     * @see #reduce(Reduction, int...)
     */
    public NDArray reduce(Reduction reduction) {
        return reduce(reduction, new int[0]);
    }

    /**
     * Reduces the ensemble of members along the given axes.
     *
     * <p>The members are broadcast to their common shape and stacked along a new leading dimension,
     * which is then reduced. Axis 0 of the stack is the member axis, so {@code reduce(SUM, 0)} adds
     * the members element-wise.
     *
     * @param reduction the reduction to apply
     * @param axes the dimensions of the stack to reduce, all of them if none are given
     * @return the reduced {@link NDArray}
     * @throws IllegalArgumentException if the members cannot be broadcast together, an axis is
     *     invalid, or an empty selection is reduced with a reduction which has no identity
     */
    public NDArray reduce(Reduction reduction, int... axes) {
        return NDArrays.stack(NDArrays.broadcastArrays(arrays)).reduce(reduction, axes);
    }

    /**
     * Returns the sum over every element of every member.
     *
     * @return a scalar {@link NDArray}
     */
    public NDArray sum() {
        return reduce(Reduction.SUM);
    }

    /**
     * Returns the product over every element of every member.
     *
     * @return a scalar {@link NDArray}
     */
    public NDArray prod() {
        return reduce(Reduction.PROD);
    }

    /**
     * Returns the minimum over every element of every member.
     *
     * @return a scalar {@link NDArray}
     * @throws IllegalArgumentException if there are no elements
     */
    public NDArray min() {
        return reduce(Reduction.MIN);
    }

    /**
     * Returns the maximum over every element of every member.
     *
     * @return a scalar {@link NDArray}
     * @throws IllegalArgumentException if there are no elements
     */
    public NDArray max() {
        return reduce(Reduction.MAX);
    }

    /**
     * Tests whether any element of any member is non-zero.
     *
     * @return a boolean scalar {@link NDArray}
     */
    public NDArray any() {
        return reduce(Reduction.ANY);
    }

    /**
     * Tests whether every element of every member is non-zero.
     *
     * @return a boolean scalar {@link NDArray}
     */
    public NDArray all() {
        return reduce(Reduction.ALL);
    }

    /**
     * Returns the public operations available on a tuple and on its members, for completion in
     * interactive tools.
     *
     * @return the sorted, distinct method names
     */
    public static List<String> memberNames() {
        return Stream.of(NDArray.class.getMethods(), ArrayTuple.class.getMethods())
                .flatMap(Arrays::stream)
                .filter(m -> m.getDeclaringClass() != Object.class)
                .map(Method::getName)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
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
        return arrays.equals(((ArrayTuple) o).arrays);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return Objects.hash(arrays);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(200);
        builder.append("ArrayTuple size: ").append(size()).append('\n');
        int index = 0;
        for (NDArray array : arrays) {
            builder.append(index++)
                    .append(": ")
                    .append(array.getShape())
                    .append(' ')
                    .append(array.getDataType())
                    .append(' ')
                    .append(array.getSparseFormat().getType())
                    .append('\n');
        }
        return builder.toString();
    }
}
