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

package com.baidu.graphson.io;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;

import com.baidu.graphson.exception.EncodeError;
import com.baidu.graphson.exception.EncodeException;
import com.baidu.graphson.structure.EdgeRef;
import com.baidu.graphson.structure.GraphElement;
import com.baidu.graphson.structure.KeyValue;
import com.baidu.graphson.structure.ListValue;
import com.baidu.graphson.structure.MapValue;
import com.baidu.graphson.structure.NodePath;
import com.baidu.graphson.structure.NumericWidth;
import com.baidu.graphson.structure.PropertyEntry;
import com.baidu.graphson.structure.Scalar;
import com.baidu.graphson.structure.ScalarKind;
import com.baidu.graphson.structure.TypedValue;
import com.baidu.graphson.structure.VertexPropertyRef;
import com.baidu.graphson.structure.VertexRef;
import com.baidu.graphson.util.E;
import com.baidu.graphson.util.JsonUtil;
import com.baidu.graphson.util.Log;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes a {@link TypedValue} tree as a tagged GraphSON document tree.
 *
 * Composite values are wrapped as {"@type": tag, "@value": payload}.
 * Strings, booleans and null stay bare, numbers always carry a numeric
 * tag: the explicit width of the scalar if it has one, otherwise the tag
 * chosen by the {@link NumericWidthPolicy}.
 *
 * An encoder holds only immutable settings, one instance may serve any
 * number of threads.
 */
public class CurrentEncoder {

    private static final Logger LOG = Log.logger(CurrentEncoder.class);

    private static final String PROPERTIES = GraphSONTokens.PROPERTIES;

    public static final String DEFAULT_EXTENSION_KEY = "@extensions";

    private final GraphSONVersion version;
    private final NumericWidthPolicy policy;
    private final boolean allowExtendedTypes;
    private final String extensionKey;
    private final int maxDepth;
    private final JsonNodeFactory factory;

    public CurrentEncoder(GraphSONVersion version, NumericWidthPolicy policy) {
        this(version, policy, false, DEFAULT_EXTENSION_KEY);
    }

    public CurrentEncoder(GraphSONVersion version, NumericWidthPolicy policy,
                          boolean allowExtendedTypes, String extensionKey) {
        this(version, policy, allowExtendedTypes, extensionKey,
             NodePath.DEFAULT_MAX_DEPTH);
    }

    public CurrentEncoder(GraphSONVersion version, NumericWidthPolicy policy,
                          boolean allowExtendedTypes, String extensionKey,
                          int maxDepth) {
        E.checkNotNull(version, "version");
        E.checkNotBlank(extensionKey, "extension key");
        E.checkArgument(maxDepth > 0,
                        "The max depth must be > 0, but got %s", maxDepth);
        this.version = version;
        this.policy = policy;
        this.allowExtendedTypes = allowExtendedTypes;
        this.extensionKey = extensionKey;
        this.maxDepth = maxDepth;
        this.factory = JsonUtil.nodeFactory();
    }

    public GraphSONVersion version() {
        return this.version;
    }

    public NumericWidthPolicy policy() {
        return this.policy;
    }

    public JsonNode encode(TypedValue value) {
        return this.encode(value, NodePath.ROOT);
    }

    /**
     * Encode a value that is embedded in a larger document, error paths
     * start at the given base.
     */
    public JsonNode encode(TypedValue value, NodePath base) {
        E.checkNotNull(value, "value");
        E.checkNotNull(base, "base path");
        if (this.policy == null || !this.policy.complete()) {
            throw new EncodeException(EncodeError.UNSUPPORTED_WIDTH_POLICY,
                                      base,
                                      "incomplete numeric width policy %s",
                                      this.policy);
        }
        return this.write(value, base);
    }

    private JsonNode write(TypedValue value, NodePath path) {
        if (path.depth() > this.maxDepth) {
            throw new EncodeException(
                      EncodeError.INTERNAL_INVARIANT_VIOLATION, path,
                      "nesting exceeds the max depth %s", this.maxDepth);
        }
        switch (value.type()) {
            case SCALAR:
                return this.writeScalar((Scalar) value, path);
            case VERTEX:
                return this.wrap(GraphSONTag.VERTEX,
                                 this.writeVertex((VertexRef) value, path));
            case EDGE:
                return this.wrap(GraphSONTag.EDGE,
                                 this.writeEdge((EdgeRef) value, path));
            case VERTEX_PROPERTY:
                return this.wrap(GraphSONTag.VERTEX_PROPERTY,
                                 this.writeVertexProperty(
                                      (VertexPropertyRef) value, path));
            case PROPERTY:
                return this.wrap(GraphSONTag.PROPERTY,
                                 this.writeProperty((KeyValue) value, path));
            case LIST:
                return this.writeList((ListValue) value, path);
            case MAP:
                return this.writeMap((MapValue) value, path);
            default:
                throw new AssertionError(String.format(
                          "Unknown value type '%s'", value.type()));
        }
    }

    private ObjectNode wrap(GraphSONTag tag, JsonNode payload) {
        ObjectNode node = this.factory.objectNode();
        node.put(GraphSONTag.TYPE_KEY, tag.tag());
        node.set(GraphSONTag.VALUE_KEY, payload);
        return node;
    }

    private ObjectNode writeVertex(VertexRef vertex, NodePath path) {
        ObjectNode payload = this.writeElementHead(vertex, path);

        List<PropertyEntry> entries = vertex.properties();
        if (!entries.isEmpty()) {
            NodePath propsPath = path.child(PROPERTIES);
            ObjectNode properties = payload.putObject(PROPERTIES);
            for (PropertyEntry entry : entries) {
                NodePath entryPath = propsPath.child(entry.key());
                this.checkUnique(properties, entry.key(), entryPath);
                ArrayNode values = properties.putArray(entry.key());
                int i = 0;
                for (VertexPropertyRef property : entry.values()) {
                    values.add(this.write(property, entryPath.child(i++)));
                }
            }
        }
        this.writeExtensions(vertex, payload, path);
        return payload;
    }

    private ObjectNode writeEdge(EdgeRef edge, NodePath path) {
        ObjectNode payload = this.writeElementHead(edge, path);

        if (edge.inVertexLabel() != null) {
            payload.put(GraphSONTokens.IN_LABEL, edge.inVertexLabel());
        }
        if (edge.outVertexLabel() != null) {
            payload.put(GraphSONTokens.OUT_LABEL, edge.outVertexLabel());
        }
        this.putValue(payload, GraphSONTokens.IN, edge.inVertexId(), path);
        this.putValue(payload, GraphSONTokens.OUT, edge.outVertexId(), path);

        if (!edge.properties().isEmpty()) {
            NodePath propsPath = path.child(PROPERTIES);
            ObjectNode properties = payload.putObject(PROPERTIES);
            for (KeyValue property : edge.properties()) {
                NodePath propPath = propsPath.child(property.key());
                this.checkUnique(properties, property.key(), propPath);
                properties.set(property.key(), this.write(property, propPath));
            }
        }
        this.writeExtensions(edge, payload, path);
        return payload;
    }

    private ObjectNode writeVertexProperty(VertexPropertyRef property,
                                           NodePath path) {
        this.checkElement(property, path);
        ObjectNode payload = this.factory.objectNode();
        this.putValue(payload, GraphSONTokens.ID, property.id(), path);
        this.putValue(payload, GraphSONTokens.VALUE, property.value(), path);
        payload.put(GraphSONTokens.LABEL, property.label());

        if (!property.metaProperties().isEmpty()) {
            NodePath propsPath = path.child(PROPERTIES);
            ObjectNode properties = payload.putObject(PROPERTIES);
            for (KeyValue meta : property.metaProperties()) {
                NodePath metaPath = propsPath.child(meta.key());
                this.checkUnique(properties, meta.key(), metaPath);
                properties.set(meta.key(), this.write(meta.value(), metaPath));
            }
        }
        this.writeExtensions(property, payload, path);
        return payload;
    }

    private ObjectNode writeProperty(KeyValue property, NodePath path) {
        ObjectNode payload = this.factory.objectNode();
        payload.put(GraphSONTokens.KEY, property.key());
        this.putValue(payload, GraphSONTokens.VALUE, property.value(), path);
        return payload;
    }

    private ObjectNode writeElementHead(GraphElement element, NodePath path) {
        this.checkElement(element, path);
        ObjectNode payload = this.factory.objectNode();
        this.putValue(payload, GraphSONTokens.ID, element.id(), path);
        payload.put(GraphSONTokens.LABEL, element.label());
        return payload;
    }

    private void putValue(ObjectNode payload, String field, TypedValue value,
                          NodePath path) {
        payload.set(field, this.write(value, path.child(field)));
    }

    private void writeExtensions(GraphElement element, ObjectNode payload,
                                 NodePath path) {
        if (element.extensions().isEmpty()) {
            return;
        }
        NodePath extPath = path.child(this.extensionKey);
        if (GraphSONTokens.ELEMENT_FIELDS.contains(this.extensionKey)) {
            throw new EncodeException(
                      EncodeError.INTERNAL_INVARIANT_VIOLATION, extPath,
                      "extension key '%s' is an element field",
                      this.extensionKey);
        }
        ObjectNode extensions = payload.putObject(this.extensionKey);
        for (KeyValue field : element.extensions()) {
            NodePath fieldPath = extPath.child(field.key());
            this.checkUnique(extensions, field.key(), fieldPath);
            extensions.set(field.key(), this.write(field.value(), fieldPath));
        }
    }

    private void checkElement(GraphElement element, NodePath path) {
        if (!element.hasLabel()) {
            throw new EncodeException(
                      EncodeError.INTERNAL_INVARIANT_VIOLATION, path,
                      "%s with id %s has no label",
                      element.type().string(), element.id());
        }
    }

    private void checkUnique(ObjectNode node, String key, NodePath path) {
        if (node.has(key)) {
            throw new EncodeException(
                      EncodeError.INTERNAL_INVARIANT_VIOLATION, path,
                      "duplicate key '%s'", key);
        }
    }

    private JsonNode writeList(ListValue list, NodePath path) {
        ArrayNode array = this.factory.arrayNode();
        int i = 0;
        for (TypedValue value : list.values()) {
            array.add(this.write(value, path.child(i++)));
        }
        if (this.version.tagsCollections()) {
            return this.wrap(GraphSONTag.LIST, array);
        }
        return array;
    }

    private JsonNode writeMap(MapValue map, NodePath path) {
        if (this.version.tagsCollections()) {
            // Keys and values alternate in one flat array
            ArrayNode array = this.factory.arrayNode();
            int i = 0;
            for (Map.Entry<TypedValue, TypedValue> e : map.entries()
                                                          .entrySet()) {
                array.add(this.write(e.getKey(), path.child(i++)));
                array.add(this.write(e.getValue(), path.child(i++)));
            }
            return this.wrap(GraphSONTag.MAP, array);
        }

        ObjectNode object = this.factory.objectNode();
        for (Map.Entry<TypedValue, TypedValue> e : map.entries().entrySet()) {
            TypedValue key = e.getKey();
            if (!(key instanceof Scalar) ||
                ((Scalar) key).kind() != ScalarKind.STRING) {
                throw new EncodeException(EncodeError.UNSUPPORTED_KEY, path,
                                          "%s can't write non-string map " +
                                          "key %s", this.version.string(),
                                          key);
            }
            String name = ((Scalar) key).asString();
            object.set(name, this.write(e.getValue(), path.child(name)));
        }
        return object;
    }

    private JsonNode writeScalar(Scalar scalar, NodePath path) {
        switch (scalar.kind()) {
            case STRING:
                return this.factory.textNode(scalar.asString());
            case BOOLEAN:
                return this.factory.booleanNode(scalar.asBoolean());
            case NULL:
                return this.factory.nullNode();
            case INTEGER:
            case FLOAT:
                NumericWidth width = this.chooseWidth(scalar, path);
                return this.wrap(GraphSONTag.of(width),
                                 this.writeNumber(scalar, width));
            default:
                throw new AssertionError(String.format(
                          "Unknown scalar kind '%s'", scalar.kind()));
        }
    }

    private NumericWidth chooseWidth(Scalar scalar, NodePath path) {
        if (scalar.width().specified()) {
            return scalar.width();
        }

        if (scalar.kind() == ScalarKind.FLOAT) {
            if (this.policy.floats() ==
                NumericWidthPolicy.FloatPreference.PREFER_FLOAT) {
                if (scalar.fitsFloat32()) {
                    return NumericWidth.FLOAT32;
                }
                LOG.debug("Widen {} at '{}' to double, it has no exact " +
                          "float representation", scalar, path);
            }
            return NumericWidth.FLOAT64;
        }

        if (scalar.isBigInteger()) {
            if (!this.allowExtendedTypes) {
                throw new EncodeException(
                          EncodeError.UNSUPPORTED_WIDTH_POLICY, path,
                          "integer %s exceeds 64 bits and extended types " +
                          "are not allowed", scalar);
            }
            return NumericWidth.BIG_INTEGER;
        }
        if (this.policy.integers() ==
            NumericWidthPolicy.IntegerPreference.PREFER_INT32) {
            if (scalar.fitsInt32()) {
                return NumericWidth.INT32;
            }
            LOG.debug("Widen {} at '{}' to int64, it exceeds 32 bits",
                      scalar, path);
        }
        return NumericWidth.INT64;
    }

    private JsonNode writeNumber(Scalar scalar, NumericWidth width) {
        Number number = scalar.asNumber();
        switch (width) {
            case INT32:
                return this.factory.numberNode(number.intValue());
            case INT64:
                return this.factory.numberNode(number.longValue());
            case BIG_INTEGER:
                BigInteger big = number instanceof BigInteger ?
                                 (BigInteger) number :
                                 BigInteger.valueOf(number.longValue());
                return this.factory.numberNode(big);
            case FLOAT32:
                return this.factory.numberNode(number.floatValue());
            case FLOAT64:
                return this.factory.numberNode(number.doubleValue());
            default:
                throw new AssertionError(String.format(
                          "Unknown numeric width '%s'", width));
        }
    }
}
