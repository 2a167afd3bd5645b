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

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

public final class VertexRef extends GraphElement {

    private final ImmutableList<PropertyEntry> properties;

    public VertexRef(Scalar id, @Nullable String label,
                     List<PropertyEntry> properties) {
        this(id, label, properties, ImmutableList.of());
    }

    public VertexRef(Scalar id, @Nullable String label,
                     List<PropertyEntry> properties,
                     List<KeyValue> extensions) {
        super(id, label, extensions);
        this.properties = ImmutableList.copyOf(properties);
    }

    @Override
    public ValueType type() {
        return ValueType.VERTEX;
    }

    /**
     * The property entries in the order the source document listed them.
     */
    public List<PropertyEntry> properties() {
        return this.properties;
    }

    @Override
    public VertexRef withLabel(String label) {
        return new VertexRef(this.id(), label, this.properties,
                             this.extensions());
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof VertexRef)) {
            return false;
        }
        VertexRef other = (VertexRef) obj;
        return this.elementEquals(other) &&
               this.properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.elementHash(), this.properties);
    }

    @Override
    public String toString() {
        return String.format("v[%s:%s]%s", this.id(), this.label(),
                             this.properties);
    }
}
