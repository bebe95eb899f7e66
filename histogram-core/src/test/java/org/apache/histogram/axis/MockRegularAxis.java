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

import java.util.Arrays;
import java.util.List;

/** Evenly spaced bins over {@code [start, stop)}. */
class MockRegularAxis extends MockAxis {

    private final int bins;
    private final double start;
    private final double stop;
    private final boolean underflow;
    private final boolean overflow;

    MockRegularAxis(int bins, double start, double stop) {
        this(bins, start, stop, true, true);
    }

    MockRegularAxis(int bins, double start, double stop, boolean underflow, boolean overflow) {
        super("");
        this.bins = bins;
        this.start = start;
        this.stop = stop;
        this.underflow = underflow;
        this.overflow = overflow;
    }

    @Override
    public int getSize() {
        return bins;
    }

    @Override
    public int getExtent() {
        return bins + (underflow ? 1 : 0) + (overflow ? 1 : 0);
    }

    @Override
    public double[] getCenters() {
        double[] centers = new double[bins];
        for (int i = 0; i < bins; ++i) {
            centers[i] = value(i + 0.5);
        }
        return centers;
    }

    @Override
    public double[] getEdges() {
        double[] edges = new double[bins + 1];
        for (int i = 0; i <= bins; ++i) {
            edges[i] = value(i);
        }
        return edges;
    }

    @Override
    public double[] getWidths() {
        double[] widths = new double[bins];
        Arrays.fill(widths, (stop - start) / bins);
        return widths;
    }

    @Override
    public double value(double index) {
        return start + index * (stop - start) / bins;
    }

    @Override
    public Object bin(int index) {
        List<Double> bin = Arrays.asList(value(index), value(index + 1));
        return bin;
    }

    @Override
    public int index(Object value) {
        double x = ((Number) value).doubleValue();
        if (Double.isNaN(x)) {
            return bins;
        }
        double position = Math.floor((x - start) * bins / (stop - start));
        if (position < 0) {
            return -1;
        }
        return position >= bins ? bins : (int) position;
    }

    @Override
    public String toString() {
        return "Regular(" + bins + ", " + start + ", " + stop + ')';
    }
}
