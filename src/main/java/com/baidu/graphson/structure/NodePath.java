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
 * The position of a node inside a document, as the sequence of object keys
 * and array indexes walked from the root. A path links to its parent, so
 * {@link #child} is constant time and never changes the receiver.
 */
public final class NodePath {

    public static final NodePath ROOT = new NodePath(null, null);

    /**
     * The deepest path decoders and encoders accept by default, counted in
     * segments from the document root.
     */
    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final String ROOT_SYMBOL = "$";

    private final NodePath parent;
    private final Object segment;
    private final int depth;
    private final int hash;

    private NodePath(NodePath parent, Object segment) {
        this.parent = parent;
        this.segment = segment;
        if (parent == null) {
            this.depth = 0;
            this.hash = 1;
        } else {
            this.depth = parent.depth + 1;
            this.hash = 31 * parent.hash + segment.hashCode();
        }
    }

    public NodePath child(String key) {
        E.checkNotNull(key, "key");
        return new NodePath(this, key);
    }

    public NodePath child(int index) {
        E.checkArgument(index >= 0, "Invalid index %s", index);
        return new NodePath(this, index);
    }

    public List<Object> segments() {
        Object[] segments = new Object[this.depth];
        NodePath path = this;
        for (int i = this.depth - 1; i >= 0; i--) {
            segments[i] = path.segment;
            path = path.parent;
        }
        return ImmutableList.copyOf(segments);
    }

    public int depth() {
        return this.depth;
    }

    public boolean isRoot() {
        return this.depth == 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof NodePath)) {
            return false;
        }
        NodePath other = (NodePath) obj;
        if (this.depth != other.depth || this.hash != other.hash) {
            return false;
        }
        NodePath path = this;
        while (path.depth > 0) {
            if (!Objects.equals(path.segment, other.segment)) {
                return false;
            }
            path = path.parent;
            other = other.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return this.hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(ROOT_SYMBOL);
        for (Object segment : this.segments()) {
            if (segment instanceof Integer) {
                sb.append('[').append(segment).append(']');
            } else {
                sb.append('.').append(segment);
            }
        }
        return sb.toString();
    }
}
