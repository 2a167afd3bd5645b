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

package com.baidu.graphson.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.baidu.graphson.structure.EdgeRef;
import com.baidu.graphson.structure.KeyValue;
import com.baidu.graphson.structure.ListValue;
import com.baidu.graphson.structure.MapValue;
import com.baidu.graphson.structure.PropertyEntry;
import com.baidu.graphson.structure.Scalar;
import com.baidu.graphson.structure.TypedValue;
import com.baidu.graphson.structure.VertexPropertyRef;
import com.baidu.graphson.structure.VertexRef;
import com.baidu.graphson.util.E;

/**
 * A bottom-up tree rewrite: the children of a node are rebuilt first, then
 * the hook of the node's own type is called with the rebuilt node. Every
 * hook returns its argument by default, subclasses override the ones they
 * need.
 */
public abstract class TreeRewriter implements Fixup {

    @Override
    public TypedValue apply(TypedValue value) {
        E.checkNotNull(value, "value");
        return this.rewrite(value);
    }

    protected TypedValue rewrite(TypedValue value) {
        switch (value.type()) {
            case SCALAR:
                return this.rewriteScalar((Scalar) value);
            case VERTEX:
                return this.rewriteVertex(this.rebuild((VertexRef) value));
            case EDGE:
                return this.rewriteEdge(this.rebuild((EdgeRef) value));
            case VERTEX_PROPERTY:
                return this.rebuild((VertexPropertyRef) value);
            case PROPERTY:
                KeyValue kv = (KeyValue) value;
                return kv.withValue(this.rewrite(kv.value()));
            case LIST:
                return this.rewriteList(this.rebuild((ListValue) value));
            case MAP:
                return this.rewriteMap(this.rebuild((MapValue) value));
            default:
                throw new AssertionError(String.format(
                          "Unknown value type '%s'", value.type()));
        }
    }

    protected TypedValue rewriteScalar(Scalar scalar) {
        return scalar;
    }

    protected TypedValue rewriteVertex(VertexRef vertex) {
        return vertex;
    }

    protected TypedValue rewriteEdge(EdgeRef edge) {
        return edge;
    }

    /**
     * Vertex properties stay vertex properties, a vertex can't hold
     * anything else in its property lists.
     */
    protected VertexPropertyRef rewriteVertexProperty(VertexPropertyRef prop) {
        return prop;
    }

    protected TypedValue rewriteList(ListValue list) {
        return list;
    }

    protected TypedValue rewriteMap(MapValue map) {
        return map;
    }

    private VertexRef rebuild(VertexRef vertex) {
        List<PropertyEntry> entries = new ArrayList<>();
        for (PropertyEntry entry : vertex.properties()) {
            List<VertexPropertyRef> values = new ArrayList<>();
            for (VertexPropertyRef prop : entry.values()) {
                values.add(this.rebuild(prop));
            }
            entries.add(entry.withValues(values));
        }
        return new VertexRef(vertex.id(), vertex.label(), entries,
                             this.rewriteAll(vertex.extensions()));
    }

    private VertexPropertyRef rebuild(VertexPropertyRef prop) {
        VertexPropertyRef rebuilt = new VertexPropertyRef(
                                    prop.id(), prop.label(),
                                    this.rewrite(prop.value()),
                                    this.rewriteAll(prop.metaProperties()),
                                    this.rewriteAll(prop.extensions()));
        return this.rewriteVertexProperty(rebuilt);
    }

    private EdgeRef rebuild(EdgeRef edge) {
        return new EdgeRef(edge.id(), edge.label(),
                           edge.inVertexId(), edge.outVertexId(),
                           edge.inVertexLabel(), edge.outVertexLabel(),
                           this.rewriteAll(edge.properties()),
                           this.rewriteAll(edge.extensions()));
    }

    private ListValue rebuild(ListValue list) {
        List<TypedValue> values = new ArrayList<>(list.size());
        for (TypedValue value : list.values()) {
            values.add(this.rewrite(value));
        }
        return new ListValue(values);
    }

    private MapValue rebuild(MapValue map) {
        MapValue.Builder builder = MapValue.builder();
        for (Map.Entry<TypedValue, TypedValue> e : map.entries().entrySet()) {
            builder.put(this.rewrite(e.getKey()), this.rewrite(e.getValue()));
        }
        return builder.build();
    }

    private List<KeyValue> rewriteAll(List<KeyValue> kvs) {
        List<KeyValue> result = new ArrayList<>(kvs.size());
        for (KeyValue kv : kvs) {
            result.add(kv.withValue(this.rewrite(kv.value())));
        }
        return result;
    }
}
