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

import org.apache.histogram.exception.AttributeNotFoundException;

/**
 * The binning scheme of one dimension of a histogram.
 *
 * <p>Bins are numbered from 0 to {@code getSize() - 1}. Axes may add flow bins which collect
 * values falling outside the regular bins; {@link #getExtent()} counts them too.
 *
 * <p>Besides its fixed properties, an axis carries named attributes, such as a label, which can be
 * read and written through {@link #getAttribute(String)} and {@link #setAttribute(String,
 * Object)}. {@link AxesTuple} forwards these calls to all axes of a histogram at once.
 */
public interface Axis {

    /**
     * Returns the number of bins, without flow bins.
     *
     * @return the number of bins
     */
    int getSize();

    /**
     * Returns the number of bins including the underflow and overflow bins.
     *
     * @return the number of bins including flow bins
     */
    int getExtent();

    /**
     * Returns the center of each bin.
     *
     * @return a new array of {@link #getSize()} centers
     */
    double[] getCenters();

    /**
     * Returns the edges of the bins.
     *
     * @return a new array of {@link #getSize()} + 1 edges
     */
    double[] getEdges();

    /**
     * Returns the width of each bin.
     *
     * @return a new array of {@link #getSize()} widths
     */
    double[] getWidths();

    /**
     * Returns the coordinate at a fractional bin index; {@code value(i)} is the lower edge of bin
     * {@code i}.
     *
     * @param index the bin index
     * @return the coordinate
     */
    double value(double index);

    /**
     * Returns the bin at {@code index}: its {@code [lower, upper]} edges for a continuous axis, its
     * label for a category axis.
     *
     * @param index the bin index
     * @return the description of the bin
     */
    Object bin(int index);

    /**
     * Returns the index of the bin holding {@code value}.
     *
     * @param value the coordinate or category to look up
     * @return the bin index, -1 for the underflow bin and {@link #getSize()} for the overflow bin
     */
    int index(Object value);

    /**
     * Returns the value of a named attribute.
     *
     * @param name the attribute name
     * @return the attribute value, possibly {@code null}
     * @throws AttributeNotFoundException if the axis has no attribute called {@code name}
     */
    Object getAttribute(String name);

    /**
     * Sets the value of a named attribute.
     *
     * @param name the attribute name
     * @param value the new value
     * @throws AttributeNotFoundException if the axis cannot hold an attribute called {@code name}
     */
    void setAttribute(String name, Object value);
}
