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

package org.apache.histogram.axis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;
import org.apache.histogram.exception.ArityException;
import org.apache.histogram.exception.AttributeNotFoundException;
import org.apache.histogram.exception.AxisTypeException;
import org.apache.histogram.ndarray.ArrayTuple;
import org.apache.histogram.ndarray.NDArrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@code AxesTuple} is the ordered, fixed-length sequence of {@link Axis} objects describing
 * the dimensions of a histogram.
 *
 * <p>The tuple offers three kinds of access to its axes:
 *
 * <ul>
 *   <li>per-axis properties, such as {@link #getSize()}, returned as one value per axis;
 *   <li>grid properties, {@link #getCenters()}, {@link #getEdges()} and {@link #getWidths()},
 *       returned as an {@link ArrayTuple} of sparse grid arrays which broadcast against each other
 *       and against the histogram's bin contents;
 *   <li>per-axis queries, {@link #value(double...)}, {@link #bin(int...)} and {@link
 *       #index(Object...)}, which take exactly one argument per axis.
 * </ul>
 *
 * <p>Arbitrary axis attributes are read and written for all axes at once with {@link
 * #getMember(String)} and {@link #setMember(String, List)}.
 *
 * <p>The constructor wraps the list it is given without copying it. It never changes the list,
 * but {@link #setMember(String, List)} changes the axes themselves and must not run concurrently
 * with any other access to them.
 */
public final class AxesTuple implements Iterable<Axis> {

    private static final Logger logger = LoggerFactory.getLogger(AxesTuple.class);

    private final List<Axis> axes;

    /**
     * Constructs an {@code AxesTuple} over {@code axes}, which is wrapped without copying.
     *
     * @param axes the axes, in dimension order
     * @throws AxisTypeException if an element of {@code axes} is not an {@link Axis}
     */
    public AxesTuple(List<? extends Axis> axes) {
        checkAxes(axes);
        this.axes = Collections.unmodifiableList(axes);
    }

    /**
     * Constructs an {@code AxesTuple} holding a copy of {@code candidates}, after checking that
     * every one of them is an {@link Axis}.
     *
     * @param candidates the axes, in dimension order
     * @return a new {@code AxesTuple}
     * @throws AxisTypeException if an element of {@code candidates} is not an {@link Axis}
     */
    public static AxesTuple copyOf(Collection<?> candidates) {
        checkAxes(candidates);
        List<Axis> axes = new ArrayList<>(candidates.size());
        for (Object item : candidates) {
            axes.add((Axis) item);
        }
        return new AxesTuple(axes);
    }

    /**
     * Constructs an {@code AxesTuple} over the given axes.
     *
     * @param axes the axes, in dimension order
     * @return a new {@code AxesTuple}
     * @throws AxisTypeException if an element of {@code axes} is not an {@link Axis}
     */
    public static AxesTuple of(Object... axes) {
        return copyOf(Arrays.asList(axes));
    }

    private static void checkAxes(Collection<?> candidates) {
        for (Object item : candidates) {
            if (!(item instanceof Axis)) {
                throw new AxisTypeException(
                        "Only a list of Axis supported in AxesTuple, got " + item);
            }
        }
    }

    /**
     * Returns the number of axes.
     *
     * @return the number of axes
     */
    public int dimension() {
        return axes.size();
    }

    /**
     * Returns {@code true} if there are no axes.
     *
     * @return {@code true} if there are no axes
     */
    public boolean isEmpty() {
        return axes.isEmpty();
    }

    /**
     * Returns the axis at {@code index}, negative values counting from the end.
     *
     * @param index the position of the axis
     * @return the axis
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public Axis get(int index) {
        int position = index < 0 ? index + axes.size() : index;
        if (position < 0 || position >= axes.size()) {
            throw new IndexOutOfBoundsException(
                    "Index " + index + " out of range for " + axes.size() + " axes");
        }
        return axes.get(position);
    }

    /**
     * Returns the axes from {@code beginIndex} to the end.
     *
     * @param beginIndex the first axis, inclusive
     * @return a new {@code AxesTuple}
     * @see #slice(int, int)
     */
    public AxesTuple slice(int beginIndex) {
        return slice(beginIndex, axes.size());
    }

    /**
     * Returns the axes from {@code beginIndex} to {@code endIndex - 1}.
     *
     * <p>Negative bounds count from the end, and out of range bounds are clipped, so a slice is
     * never out of range; it may be empty.
     *
     * @param beginIndex the first axis, inclusive
     * @param endIndex the last axis, exclusive
     * @return a new {@code AxesTuple}
     */
    public AxesTuple slice(int beginIndex, int endIndex) {
        int begin = clip(beginIndex);
        int end = Math.max(begin, clip(endIndex));
        return new AxesTuple(new ArrayList<>(axes.subList(begin, end)));
    }

    private int clip(int index) {
        int position = index < 0 ? index + axes.size() : index;
        return Math.max(0, Math.min(position, axes.size()));
    }

    /**
     * Returns the axes as an unmodifiable list.
     *
     * @return the axes
     */
    public List<Axis> asList() {
        return axes;
    }

    /**
     * Returns a sequential stream over the axes.
     *
     * @return a stream over the axes
     */
    public Stream<Axis> stream() {
        return axes.stream();
    }

    /** {@inheritDoc} */
    @Override
    public Iterator<Axis> iterator() {
        return axes.iterator();
    }

    /**
     * Returns the number of bins of each axis.
     *
     * @return one size per axis
     */
    public List<Integer> getSize() {
        return collect(Axis::getSize);
    }

    /**
     * Returns the number of bins of each axis, flow bins included.
     *
     * @return one extent per axis
     */
    public List<Integer> getExtent() {
        return collect(Axis::getExtent);
    }

    /**
     * Returns the bin centers as a sparse grid.
     *
     * <p>Array {@code i} has one dimension per axis, holding the centers of axis {@code i} along
     * dimension {@code i} and length 1 along every other one. Use {@link ArrayTuple#broadcast()}
     * for the dense grid.
     *
     * @return one array per axis
     */
    public ArrayTuple getCenters() {
        return grid("centers", Axis::getCenters);
    }

    /**
     * Returns the bin edges as a sparse grid.
     *
     * @return one array per axis
     * @see #getCenters()
     */
    public ArrayTuple getEdges() {
        return grid("edges", Axis::getEdges);
    }

    /**
     * Returns the bin widths as a sparse grid.
     *
     * @return one array per axis
     * @see #getCenters()
     */
    public ArrayTuple getWidths() {
        return grid("widths", Axis::getWidths);
    }

    private ArrayTuple grid(String property, Function<Axis, double[]> vector) {
        logger.debug("Building sparse {} grid over {} axes", property, axes.size());
        List<double[]> vectors = collect(vector);
        return new ArrayTuple(NDArrays.meshgrid(true, vectors));
    }

    /**
     * Returns the coordinate at one bin index per axis.
     *
     * @param indexes the bin index for each axis
     * @return the coordinate along each axis
     * @throws ArityException if the number of indexes differs from the number of axes
     * @see Axis#value(double)
     */
    public List<Double> value(double... indexes) {
        checkArity(indexes.length);
        List<Double> out = new ArrayList<>(indexes.length);
        for (int i = 0; i < indexes.length; ++i) {
            out.add(axes.get(i).value(indexes[i]));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns the bin at one bin index per axis.
     *
     * @param indexes the bin index for each axis
     * @return the bin of each axis
     * @throws ArityException if the number of indexes differs from the number of axes
     * @see Axis#bin(int)
     */
    public List<Object> bin(int... indexes) {
        checkArity(indexes.length);
        List<Object> out = new ArrayList<>(indexes.length);
        for (int i = 0; i < indexes.length; ++i) {
            out.add(axes.get(i).bin(indexes[i]));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns the bin index of one value per axis.
     *
     * @param values the coordinate or category for each axis
     * @return the bin index along each axis
     * @throws ArityException if the number of values differs from the number of axes
     * @see Axis#index(Object)
     */
    public List<Integer> index(Object... values) {
        checkArity(values.length);
        List<Integer> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; ++i) {
            out.add(axes.get(i).index(values[i]));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Reads a named attribute from every axis.
     *
     * @param name the attribute name
     * @return the attribute value of each axis
     * @throws AttributeNotFoundException if an axis has no attribute called {@code name}
     */
    public List<Object> getMember(String name) {
        return collect(axis -> axis.getAttribute(name));
    }

    /**
     * Writes a named attribute on every axis, {@code values.get(i)} going to axis {@code i}.
     *
     * <p>Axes are written in order. If writing to one of them fails, the axes before it keep their
     * new values.
     *
     * @param name the attribute name
     * @param values one value per axis
     * @throws ArityException if the number of values differs from the number of axes
     * @throws AttributeNotFoundException if an axis cannot hold an attribute called {@code name}
     */
    public void setMember(String name, List<?> values) {
        checkArity(values.size());
        logger.debug("Setting attribute {} on {} axes", name, axes.size());
        for (int i = 0; i < values.size(); ++i) {
            logger.trace("Setting attribute {} on axis {}", name, i);
            axes.get(i).setAttribute(name, values.get(i));
        }
    }

    private void checkArity(int count) {
        if (count != axes.size()) {
            throw new ArityException(axes.size(), count);
        }
    }

    private <T> List<T> collect(Function<Axis, ? extends T> function) {
        List<T> out = new ArrayList<>(axes.size());
        for (Axis axis : axes) {
            out.add(function.apply(axis));
        }
        return Collections.unmodifiableList(out);
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
        return axes.equals(((AxesTuple) o).axes);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return axes.hashCode();
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("AxesTuple(");
        for (int i = 0; i < axes.size(); ++i) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(axes.get(i));
        }
        sb.append(')');
        return sb.toString();
    }
}
