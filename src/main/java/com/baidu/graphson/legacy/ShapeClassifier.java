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

package com.baidu.graphson.legacy;

import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

import com.baidu.graphson.io.GraphSONTag;
import com.baidu.graphson.io.GraphSONTokens;
import com.baidu.graphson.util.E;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

/**
 * Infers the shape of an untagged json object from the fields it has.
 *
 * The legacy encoding carries no discriminator for elements, so an object
 * may match several shapes (a plain map can happen to hold "inV" and
 * "outV"). Rules are therefore evaluated in a fixed precedence and the
 * first match wins; {@link Shape#MAP} is the fallback when none matches.
 */
public final class ShapeClassifier {

    public static final ShapeClassifier DEFAULT = new ShapeClassifier(
           ImmutableList.of(
               new ShapeRule(Shape.TYPED_SCALAR,
                             ShapeClassifier::hasTypeTag),
               new ShapeRule(Shape.EDGE, ShapeClassifier::isEdge),
               new ShapeRule(Shape.VERTEX, ShapeClassifier::isVertex),
               new ShapeRule(Shape.VERTEX_PROPERTY,
                             ShapeClassifier::isVertexProperty)
           ));

    private final List<ShapeRule> rules;

    public ShapeClassifier(List<ShapeRule> rules) {
        E.checkNotNull(rules, "rules");
        this.rules = ImmutableList.copyOf(rules);
    }

    public List<ShapeRule> rules() {
        return this.rules;
    }

    public Shape classify(JsonNode object) {
        E.checkArgument(object.isObject(),
                        "Can only classify object nodes, but got %s",
                        object.getNodeType());
        for (ShapeRule rule : this.rules) {
            if (rule.matches(object)) {
                return rule.shape();
            }
        }
        return Shape.MAP;
    }

    private static boolean hasTypeTag(JsonNode node) {
        return node.has(GraphSONTag.TYPE_KEY);
    }

    private static boolean isEdge(JsonNode node) {
        if (declaresType(node, GraphSONTokens.EDGE)) {
            return true;
        }
        return node.has(GraphSONTokens.IN) && node.has(GraphSONTokens.OUT);
    }

    private static boolean isVertex(JsonNode node) {
        if (declaresType(node, GraphSONTokens.VERTEX)) {
            return true;
        }
        if (node.has(GraphSONTokens.VALUE)) {
            return false;
        }
        boolean identified = node.has(GraphSONTokens.ID) ||
                             node.has(GraphSONTokens.LABEL);
        return identified &&
               isPropertyLists(node.get(GraphSONTokens.PROPERTIES));
    }

    private static boolean isVertexProperty(JsonNode node) {
        return node.has(GraphSONTokens.ID) &&
               node.has(GraphSONTokens.LABEL) &&
               node.has(GraphSONTokens.VALUE) &&
               !node.has(GraphSONTokens.IN) &&
               !node.has(GraphSONTokens.OUT);
    }

    private static boolean declaresType(JsonNode node, String type) {
        JsonNode declared = node.get(GraphSONTokens.TYPE);
        return declared != null && declared.isTextual() &&
               type.equals(declared.textValue());
    }

    /**
     * Vertex properties map each key to a list of property objects.
     */
    private static boolean isPropertyLists(JsonNode properties) {
        if (properties == null || !properties.isObject()) {
            return false;
        }
        Iterator<JsonNode> values = properties.elements();
        while (values.hasNext()) {
            if (!values.next().isArray()) {
                return false;
            }
        }
        return true;
    }

    public static final class ShapeRule {

        private final Shape shape;
        private final Predicate<JsonNode> predicate;

        public ShapeRule(Shape shape, Predicate<JsonNode> predicate) {
            E.checkNotNull(shape, "shape");
            E.checkNotNull(predicate, "predicate");
            this.shape = shape;
            this.predicate = predicate;
        }

        public Shape shape() {
            return this.shape;
        }

        public boolean matches(JsonNode node) {
            return this.predicate.test(node);
        }

        @Override
        public String toString() {
            return String.format("ShapeRule{%s}", this.shape);
        }
    }
}
