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

import com.baidu.graphson.util.E;
import com.google.common.collect.ImmutableList;

public final class VertexPropertyRef extends GraphElement {

    private final TypedValue value;
    private final ImmutableList<KeyValue> metaProperties;

    public VertexPropertyRef(Scalar id, @Nullable String label,
                             TypedValue value) {
        this(id, label, value, ImmutableList.of(), ImmutableList.of());
    }

    public VertexPropertyRef(Scalar id, @Nullable String label,
                             TypedValue value, List<KeyValue> metaProperties,
                             List<KeyValue> extensions) {
        super(id, label, extensions);
        E.checkNotNull(value, "value", "vertex property");
        this.value = value;
        this.metaProperties = ImmutableList.copyOf(metaProperties);
    }

    @Override
    public ValueType type() {
        return ValueType.VERTEX_PROPERTY;
    }

    public TypedValue value() {
        return this.value;
    }

    public List<KeyValue> metaProperties() {
        return this.metaProperties;
    }

    @Override
    public VertexPropertyRef withLabel(String label) {
        return new VertexPropertyRef(this.id(), label, this.value,
                                     this.metaProperties, this.extensions());
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof VertexPropertyRef)) {
            return false;
        }
        VertexPropertyRef other = (VertexPropertyRef) obj;
        return this.elementEquals(other) &&
               this.value.equals(other.value) &&
               this.metaProperties.equals(other.metaProperties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.elementHash(), this.value,
                            this.metaProperties);
    }

    @Override
    public String toString() {
        return String.format("vp[%s:%s->%s]", this.id(), this.label(),
                             this.value);
    }
}
