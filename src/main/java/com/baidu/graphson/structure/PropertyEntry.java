/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with this
 * work for additional information regarding copyright ownership. The ASF
 * licenses this file to You under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.baidu.graphson.structure;

import java.util.List;
import java.util.Objects;

import com.baidu.graphson.util.E;
import com.google.common.collect.ImmutableList;

/**
 * All values of one property key on a vertex. A key may carry several
 * vertex properties (list or set cardinality), so values is a list even
 * when it holds a single element.
 */
public final class PropertyEntry {

    private final String key;
    private final ImmutableList<VertexPropertyRef> values;

    public PropertyEntry(String key, List<VertexPropertyRef> values) {
        E.checkNotNull(key, "key");
        E.checkNotNull(values, "values", key);
        this.key = key;
        this.values = ImmutableList.copyOf(values);
    }

    public String key() {
        return this.key;
    }

    public List<VertexPropertyRef> values() {
        return this.values;
    }

    public PropertyEntry withValues(List<VertexPropertyRef> values) {
        return new PropertyEntry(this.key, values);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof PropertyEntry)) {
            return false;
        }
        PropertyEntry other = (PropertyEntry) obj;
        return this.key.equals(other.key) && this.values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.key, this.values);
    }

    @Override
    public String toString() {
        return String.format("%s=%s", this.key, this.values);
    }
}
