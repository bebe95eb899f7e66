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

import java.util.HashMap;
import java.util.Map;
import org.apache.histogram.exception.AttributeNotFoundException;

/** Base of the axes used in tests, holding the named attributes. */
abstract class MockAxis implements Axis {

    private final Map<String, Object> attributes = new HashMap<>();

    MockAxis(String label) {
        attributes.put("label", label);
    }

    /** {@inheritDoc} */
    @Override
    public Object getAttribute(String name) {
        switch (name) {
            case "size":
                return getSize();
            case "extent":
                return getExtent();
            default:
                if (!attributes.containsKey(name)) {
                    throw new AttributeNotFoundException(
                            getClass().getSimpleName() + " has no attribute '" + name + '\'');
                }
                return attributes.get(name);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void setAttribute(String name, Object value) {
        if ("size".equals(name) || "extent".equals(name)) {
            throw new AttributeNotFoundException("can't set attribute '" + name + '\'');
        }
        attributes.put(name, value);
    }
}
