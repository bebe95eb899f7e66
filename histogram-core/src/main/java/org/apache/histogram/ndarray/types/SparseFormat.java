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

/**
 * An enum representing the storage formats of an {@link org.apache.histogram.ndarray.NDArray}.
 *
 * <ul>
 *   <li>DENSE: every element stored in row-major order
 *   <li>SPARSE_GRID: a single vector laid along one dimension, every other dimension of length 1
 * </ul>
 */
public enum SparseFormat {
    DENSE("default"),
    SPARSE_GRID("sparse_grid");

    private String type;

    SparseFormat(String type) {
        this.type = type;
    }

    /**
     * Returns the {@code SparseFormat} name.
     *
     * @return the {@code SparseFormat} name
     */
    public String getType() {
        return type;
    }
}
