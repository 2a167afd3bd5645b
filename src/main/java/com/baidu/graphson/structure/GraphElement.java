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

/**
 * Common state of vertices, edges and vertex properties.
 *
 * The label may be null only for elements produced by a lenient decode,
 * such a tree has to pass a label fixup before it can be encoded.
 */
public abstract class GraphElement extends TypedValue {

    private final Scalar id;
    private final String label;
    private final ImmutableList<KeyValue> extensions;

    GraphElement(Scalar id, @Nullable String label,
                 List<KeyValue> extensions) {
        E.checkNotNull(id, "id", this.getClass().getSimpleName());
        E.checkArgument(!id.isNull(), "The id of %s can't be null scalar",
                        this.getClass().getSimpleName());
        E.checkNotNull(extensions, "extensions");
        this.id = id;
        this.label = label;
        this.extensions = ImmutableList.copyOf(extensions);
    }

    public Scalar id() {
        return this.id;
    }

    @Nullable
    public String label() {
        return this.label;
    }

    public boolean hasLabel() {
        return this.label != null && !this.label.isEmpty();
    }

    /**
     * Provider specific fields which are outside the element's standard
     * field set, in source order.
     */
    public List<KeyValue> extensions() {
        return this.extensions;
    }

    public abstract GraphElement withLabel(String label);

    protected boolean elementEquals(GraphElement other) {
        return this.id.equals(other.id) &&
               Objects.equals(this.label, other.label) &&
               this.extensions.equals(other.extensions);
    }

    protected int elementHash() {
        return Objects.hash(this.id, this.label, this.extensions);
    }
}
