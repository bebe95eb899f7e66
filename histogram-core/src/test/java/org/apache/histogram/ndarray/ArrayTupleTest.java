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
import java.util.List;
import org.apache.histogram.ndarray.types.DataType;
import org.apache.histogram.ndarray.types.Reduction;
import org.apache.histogram.ndarray.types.Shape;
import org.apache.histogram.util.Assertions;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ArrayTupleTest {

    private static ArrayTuple grid() {
        return new ArrayTuple(
                NDArrays.meshgrid(true, new double[] {1, 2, 3}, new double[] {10, 20}));
    }

    @Test
    public void testSequence() {
        ArrayTuple tuple = grid();
        Assert.assertEquals(tuple.size(), 2);
        Assert.assertFalse(tuple.isEmpty());
        Assert.assertSame(tuple.get(-1), tuple.get(1));
        Assert.assertEquals(tuple.stream().count(), 2);
        Assert.expectThrows(IndexOutOfBoundsException.class, () -> tuple.get(2));
        Assert.expectThrows(
                UnsupportedOperationException.class, () -> tuple.asList().remove(0));
        Assert.expectThrows(NullPointerException.class, () -> ArrayTuple.of((NDArray) null));
    }

    @Test
    public void testMap() {
        ArrayTuple doubled = grid().map(a -> a.mul(2));
        Assert.assertEquals(doubled.size(), 2);
        Assert.assertTrue(doubled.get(0).isSparse());
        Assertions.assertArrayEquals(doubled.get(0).toDoubleArray(), new double[] {2, 4, 6});
        Assertions.assertArrayEquals(doubled.get(1).toDoubleArray(), new double[] {20, 40});

        ArrayTuple transposed = grid().map(NDArray::transpose);
        Assert.assertEquals(
                transposed.getShapes(), new Shape[] {new Shape(1, 3), new Shape(2, 1)});
    }

    @Test
    public void testCollect() {
        List<Shape> shapes = grid().collect(NDArray::getShape);
        Assert.assertEquals(shapes, Arrays.asList(new Shape(3, 1), new Shape(1, 2)));
        Assert.assertEquals(grid().collect(NDArray::size), Arrays.asList(3L, 2L));
    }

    @Test
    public void testEnsembleReductions() {
        ArrayTuple tuple = grid();
        // dense members: 2 * (1 + 2 + 3) and 3 * (10 + 20)
        Assert.assertEquals(tuple.sum().getDouble(), 102.0);
        Assert.assertEquals(tuple.sum().getShape(), new Shape());
        Assert.assertEquals(tuple.max().getDouble(), 20.0);
        Assert.assertEquals(tuple.min().getDouble(), 1.0);
        Assertions.assertAlmostEquals(tuple.prod().getDouble(), 36.0 * 8e6);
        Assert.assertTrue(tuple.any().getBoolean());
        Assert.assertTrue(tuple.all().getBoolean());
        Assert.assertEquals(tuple.all().getDataType(), DataType.BOOLEAN);
        Assert.assertFalse(tuple.map(a -> a.sub(1)).all().getBoolean());
    }

    @Test
    public void testEnsembleDiffersFromPerMember() {
        ArrayTuple tuple = grid();
        ArrayTuple perMember = tuple.map(NDArray::sum);
        Assert.assertEquals(perMember.get(0).getDouble(), 6.0);
        Assert.assertEquals(perMember.get(1).getDouble(), 30.0);
        Assert.assertNotEquals(tuple.sum().getDouble(), perMember.sum().getDouble());
    }

    @Test
    public void testReduceAlongAxes() {
        ArrayTuple tuple = grid();
        NDArray elementwise = tuple.reduce(Reduction.SUM, 0);
        Assert.assertEquals(elementwise.getShape(), new Shape(3, 2));
        Assertions.assertArrayEquals(
                elementwise.toDoubleArray(), new double[] {11, 21, 12, 22, 13, 23});

        NDArray rows = tuple.reduce(Reduction.SUM, 1);
        Assert.assertEquals(rows.getShape(), new Shape(2, 2));
        Assertions.assertArrayEquals(rows.toDoubleArray(), new double[] {6, 6, 30, 60});
    }

    @Test
    public void testEmptyEnsemble() {
        ArrayTuple empty = ArrayTuple.of();
        Assert.assertTrue(empty.broadcast().isEmpty());
        Assert.assertEquals(empty.sum().getDouble(), 0.0);
        Assert.assertEquals(empty.prod().getDouble(), 1.0);
        Assert.assertFalse(empty.any().getBoolean());
        Assert.assertTrue(empty.all().getBoolean());
        Assert.expectThrows(IllegalArgumentException.class, empty::min);
        Assert.expectThrows(IllegalArgumentException.class, empty::max);
    }

    @Test
    public void testBroadcast() {
        ArrayTuple tuple = grid();
        ArrayTuple dense = tuple.broadcast();
        Assert.assertEquals(dense.getShapes(), new Shape[] {new Shape(3, 2), new Shape(3, 2)});
        Assert.assertFalse(dense.get(0).isSparse());
        Assertions.assertArrayEquals(
                dense.get(0).toDoubleArray(), new double[] {1, 1, 2, 2, 3, 3});
        Assertions.assertAlmostEquals(
                dense.get(1),
                NDArrays.create(new double[] {10, 20, 10, 20, 10, 20}, new Shape(3, 2)));

        ArrayTuple again = dense.broadcast();
        Assert.assertEquals(again, dense);
        Assert.assertSame(again.get(0), dense.get(0));
        Assert.assertEquals(dense.sum().getDouble(), tuple.sum().getDouble());
    }

    @Test
    public void testIncompatibleMembers() {
        ArrayTuple tuple =
                ArrayTuple.of(
                        NDArrays.create(new double[] {1, 2, 3}),
                        NDArrays.create(new double[] {1, 2}));
        Assert.expectThrows(IllegalArgumentException.class, tuple::sum);
        Assert.expectThrows(IllegalArgumentException.class, tuple::broadcast);
    }

    @Test
    public void testMemberNames() {
        List<String> names = ArrayTuple.memberNames();
        Assert.assertTrue(names.contains("broadcast"));
        Assert.assertTrue(names.contains("sum"));
        Assert.assertTrue(names.contains("getShape"));
        Assert.assertTrue(names.contains("transpose"));
        Assert.assertFalse(names.contains("wait"));
        Assert.assertFalse(names.contains("getClass"));
        Assert.assertEquals(names.stream().distinct().count(), names.size());
    }

    @Test
    public void testEqualsAndToString() {
        Assert.assertEquals(grid(), grid());
        Assert.assertEquals(grid().hashCode(), grid().hashCode());
        Assert.assertNotEquals(grid(), grid().broadcast());
        Assert.assertTrue(grid().toString().contains("(3, 1) float64 sparse_grid"));
    }
}
