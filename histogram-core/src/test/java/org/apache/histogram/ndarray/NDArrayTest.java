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

import org.apache.histogram.ndarray.types.DataType;
import org.apache.histogram.ndarray.types.Reduction;
import org.apache.histogram.ndarray.types.Shape;
import org.apache.histogram.ndarray.types.SparseFormat;
import org.apache.histogram.util.Assertions;
import org.testng.Assert;
import org.testng.annotations.Test;

public class NDArrayTest {

    @Test
    public void testSparseAccess() {
        NDArray array = NDArrays.createSparse(new double[] {1, 2, 3}, 1, 3);
        Assert.assertEquals(array.getShape(), new Shape(1, 3, 1));
        Assert.assertEquals(array.getSparseFormat(), SparseFormat.SPARSE_GRID);
        Assert.assertEquals(((SparseNDArray) array).getAxis(), 1);
        Assert.assertEquals(array.size(), 3);
        Assert.assertEquals(array.getDouble(0, 2, 0), 3.0);
        Assert.expectThrows(IndexOutOfBoundsException.class, () -> array.getDouble(1, 0, 0));
        Assert.expectThrows(IndexOutOfBoundsException.class, () -> array.getDouble(0, 1));
    }

    @Test
    public void testSparseToDense() {
        NDArray sparse = NDArrays.createSparse(new double[] {1, 2, 3}, 0, 2);
        NDArray dense = sparse.toDense();
        Assert.assertFalse(dense.isSparse());
        Assert.assertEquals(dense.getShape(), new Shape(3, 1));
        Assert.assertEquals(dense, sparse);
        Assert.assertEquals(dense.hashCode(), sparse.hashCode());
        Assert.assertSame(dense.toDense(), dense);
    }

    @Test
    public void testTranspose() {
        NDArray sparse = NDArrays.createSparse(new double[] {1, 2, 3}, 0, 2).transpose();
        Assert.assertTrue(sparse.isSparse());
        Assert.assertEquals(sparse.getShape(), new Shape(1, 3));

        NDArray dense = NDArrays.create(new double[] {0, 1, 2, 3, 4, 5}, new Shape(2, 3));
        NDArray transposed = dense.transpose();
        Assert.assertEquals(transposed.getShape(), new Shape(3, 2));
        Assertions.assertArrayEquals(
                transposed.toDoubleArray(), new double[] {0, 3, 1, 4, 2, 5});
    }

    @Test
    public void testMapKeepsFormat() {
        NDArray sparse = NDArrays.createSparse(new double[] {1, 2}, 1, 2);
        NDArray doubled = sparse.mul(2).add(1);
        Assert.assertTrue(doubled.isSparse());
        Assertions.assertArrayEquals(doubled.toDoubleArray(), new double[] {3, 5});
        Assertions.assertArrayEquals(sparse.neg().toDoubleArray(), new double[] {-1, -2});
        Assertions.assertArrayEquals(
                NDArrays.create(new double[] {4, 8}).div(4).sub(1).toDoubleArray(),
                new double[] {0, 1});
    }

    @Test
    public void testBroadcast() {
        NDArray row = NDArrays.create(new double[] {1, 2, 3});
        NDArray broadcast = row.broadcast(new Shape(2, 3));
        Assertions.assertArrayEquals(broadcast.toDoubleArray(), new double[] {1, 2, 3, 1, 2, 3});

        NDArray column = NDArrays.createSparse(new double[] {1, 2}, 0, 2);
        Assertions.assertArrayEquals(
                column.broadcast(new Shape(2, 3)).toDoubleArray(),
                new double[] {1, 1, 1, 2, 2, 2});

        NDArray scalar = NDArrays.create(7);
        Assertions.assertArrayEquals(
                scalar.broadcast(new Shape(2, 2)).toDoubleArray(), new double[] {7, 7, 7, 7});

        Assert.assertSame(row.broadcast(new Shape(3)), row);
        Assert.expectThrows(IllegalArgumentException.class, () -> row.broadcast(new Shape(2, 2)));
    }

    @Test
    public void testReduce() {
        NDArray array = NDArrays.create(new double[] {0, 1, 2, 3, 4, 5}, new Shape(2, 3));
        Assert.assertEquals(array.sum().getDouble(), 15.0);
        Assert.assertEquals(array.sum().getShape(), new Shape());
        Assert.assertEquals(array.max().getDouble(), 5.0);
        Assert.assertEquals(array.min().getDouble(), 0.0);
        Assert.assertEquals(array.prod().getDouble(), 0.0);

        NDArray columns = array.reduce(Reduction.SUM, 0);
        Assert.assertEquals(columns.getShape(), new Shape(3));
        Assertions.assertArrayEquals(columns.toDoubleArray(), new double[] {3, 5, 7});
        Assertions.assertArrayEquals(
                array.reduce(Reduction.MAX, -1).toDoubleArray(), new double[] {2, 5});
        Assertions.assertArrayEquals(
                array.reduce(Reduction.SUM, 0, 1).toDoubleArray(), new double[] {15});

        Assert.expectThrows(IllegalArgumentException.class, () -> array.reduce(Reduction.SUM, 2));
        Assert.expectThrows(
                IllegalArgumentException.class, () -> array.reduce(Reduction.SUM, 0, -2));
    }

    @Test
    public void testBooleanReductions() {
        NDArray array = NDArrays.create(new double[] {0, 1, 2});
        NDArray any = array.any();
        Assert.assertEquals(any.getDataType(), DataType.BOOLEAN);
        Assert.assertTrue(any.getDataType().isBoolean());
        Assert.assertTrue(array.getDataType().isFloating());
        Assert.assertEquals(any.getDataType().getFormat(), DataType.Format.BOOLEAN);
        Assert.assertTrue(any.getBoolean());
        Assert.assertFalse(array.all().getBoolean());

        NDArray flags = NDArrays.create(new boolean[] {true, true}, new Shape(2));
        Assert.assertTrue(flags.all().getBoolean());
        Assert.assertEquals(flags.sum().getDouble(), 2.0);
    }

    @Test
    public void testEmptyReductions() {
        NDArray empty = NDArrays.create(new double[0]);
        Assert.assertEquals(empty.sum().getDouble(), 0.0);
        Assert.assertEquals(empty.prod().getDouble(), 1.0);
        Assert.assertFalse(empty.any().getBoolean());
        Assert.assertTrue(empty.all().getBoolean());
        IllegalArgumentException e =
                Assert.expectThrows(IllegalArgumentException.class, empty::min);
        Assert.assertTrue(e.getMessage().contains("no identity"));
        Assert.expectThrows(IllegalArgumentException.class, empty::max);
    }

    @Test
    public void testNanPropagates() {
        NDArray array = NDArrays.create(new double[] {1, Double.NaN, 3});
        Assert.assertTrue(Double.isNaN(array.max().getDouble()));
        Assert.assertTrue(Double.isNaN(array.min().getDouble()));
    }

    @Test
    public void testAllClose() {
        NDArray a = NDArrays.create(new double[] {1e10, 1e-7});
        NDArray b = NDArrays.create(new double[] {1.00001e10, 1e-8});
        Assert.assertFalse(a.allClose(b, 1e-5, 1e-8));
        Assert.assertTrue(a.allClose(a.add(1e-9), 1e-5, 1e-8));
        Assert.assertFalse(a.allClose(NDArrays.create(new double[] {1}), 1e-5, 1e-8));
        Assert.assertTrue(a.contentEquals(NDArrays.create(new double[] {1e10, 1e-7})));
    }
}
