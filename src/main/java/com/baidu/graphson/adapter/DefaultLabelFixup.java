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

import com.baidu.graphson.structure.EdgeRef;
import com.baidu.graphson.structure.GraphElement;
import com.baidu.graphson.structure.TypedValue;
import com.baidu.graphson.structure.VertexPropertyRef;
import com.baidu.graphson.structure.VertexRef;
import com.baidu.graphson.util.E;

/**
 * Gives every vertex, edge and vertex property that has no label the
 * configured one. Elements that have a label keep it.
 */
public class DefaultLabelFixup extends TreeRewriter {

    private final String label;

    public DefaultLabelFixup(String label) {
        E.checkNotBlank(label, "default label");
        this.label = label;
    }

    public String label() {
        return this.label;
    }

    @Override
    protected TypedValue rewriteVertex(VertexRef vertex) {
        return this.fill(vertex);
    }

    @Override
    protected TypedValue rewriteEdge(EdgeRef edge) {
        return this.fill(edge);
    }

    @Override
    protected VertexPropertyRef rewriteVertexProperty(VertexPropertyRef prop) {
        return prop.hasLabel() ? prop : prop.withLabel(this.label);
    }

    private GraphElement fill(GraphElement element) {
        return element.hasLabel() ? element : element.withLabel(this.label);
    }
}
