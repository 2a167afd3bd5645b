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

public final class EdgeRef extends GraphElement {

    private final Scalar inVertexId;
    private final Scalar outVertexId;
    private final String inVertexLabel;
    private final String outVertexLabel;
    private final ImmutableList<KeyValue> properties;

    public EdgeRef(Scalar id, @Nullable String label,
                   Scalar inVertexId, Scalar outVertexId,
                   List<KeyValue> properties) {
        this(id, label, inVertexId, outVertexId, null, null,
             properties, ImmutableList.of());
    }

    public EdgeRef(Scalar id, @Nullable String label,
                   Scalar inVertexId, Scalar outVertexId,
                   @Nullable String inVertexLabel,
                   @Nullable String outVertexLabel,
                   List<KeyValue> properties, List<KeyValue> extensions) {
        super(id, label, extensions);
        E.checkNotNull(inVertexId, "inVertexId", "edge");
        E.checkNotNull(outVertexId, "outVertexId", "edge");
        this.inVertexId = inVertexId;
        this.outVertexId = outVertexId;
        this.inVertexLabel = inVertexLabel;
        this.outVertexLabel = outVertexLabel;
        this.properties = ImmutableList.copyOf(properties);
    }

    @Override
    public ValueType type() {
        return ValueType.EDGE;
    }

    public Scalar inVertexId() {
        return this.inVertexId;
    }

    public Scalar outVertexId() {
        return this.outVertexId;
    }

    @Nullable
    public String inVertexLabel() {
        return this.inVertexLabel;
    }

    @Nullable
    public String outVertexLabel() {
        return this.outVertexLabel;
    }

    public List<KeyValue> properties() {
        return this.properties;
    }

    @Override
    public EdgeRef withLabel(String label) {
        return new EdgeRef(this.id(), label, this.inVertexId,
                           this.outVertexId, this.inVertexLabel,
                           this.outVertexLabel, this.properties,
                           this.extensions());
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof EdgeRef)) {
            return false;
        }
        EdgeRef other = (EdgeRef) obj;
        return this.elementEquals(other) &&
               this.inVertexId.equals(other.inVertexId) &&
               this.outVertexId.equals(other.outVertexId) &&
               Objects.equals(this.inVertexLabel, other.inVertexLabel) &&
               Objects.equals(this.outVertexLabel, other.outVertexLabel) &&
               this.properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.elementHash(), this.inVertexId,
                            this.outVertexId, this.inVertexLabel,
                            this.outVertexLabel, this.properties);
    }

    @Override
    public String toString() {
        return String.format("e[%s][%s-%s->%s]", this.id(), this.outVertexId,
                             this.label(), this.inVertexId);
    }
}
