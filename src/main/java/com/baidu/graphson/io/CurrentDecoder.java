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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.baidu.graphson.exception.DecodeError;
import com.baidu.graphson.exception.DecodeException;
import com.baidu.graphson.structure.EdgeRef;
import com.baidu.graphson.structure.KeyValue;
import com.baidu.graphson.structure.ListValue;
import com.baidu.graphson.structure.MapValue;
import com.baidu.graphson.structure.NodePath;
import com.baidu.graphson.structure.PropertyEntry;
import com.baidu.graphson.structure.Scalar;
import com.baidu.graphson.structure.TypedValue;
import com.baidu.graphson.structure.VertexPropertyRef;
import com.baidu.graphson.structure.VertexRef;
import com.baidu.graphson.util.E;
import com.baidu.graphson.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Reads a tagged GraphSON 2.0/3.0 document tree back into a
 * {@link TypedValue}, the inverse of {@link CurrentEncoder}.
 *
 * Tagged nodes are dispatched through a table from tag to reader, so
 * supporting a new tag means adding one entry rather than a subclass.
 */
public class CurrentDecoder {

    @FunctionalInterface
    private interface TagReader {
        TypedValue read(CurrentDecoder decoder, JsonNode payload,
                        NodePath path);
    }

    private static final Map<GraphSONTag, TagReader> READERS;

    static {
        ImmutableMap.Builder<GraphSONTag, TagReader> readers =
                                                     ImmutableMap.builder();
        readers.put(GraphSONTag.VERTEX, CurrentDecoder::readVertex);
        readers.put(GraphSONTag.EDGE, CurrentDecoder::readEdge);
        readers.put(GraphSONTag.VERTEX_PROPERTY,
                    CurrentDecoder::readVertexProperty);
        readers.put(GraphSONTag.PROPERTY, CurrentDecoder::readProperty);
        readers.put(GraphSONTag.LIST, CurrentDecoder::readList);
        readers.put(GraphSONTag.MAP, CurrentDecoder::readMap);
        for (GraphSONTag tag : GraphSONTag.values()) {
            if (tag.numeric()) {
                readers.put(tag, (decoder, payload, path) -> {
                    return NumericTags.read(tag, payload, path);
                });
            }
        }
        READERS = readers.build();
    }

    private final String extensionKey;
    private final int maxDepth;

    public CurrentDecoder() {
        this(CurrentEncoder.DEFAULT_EXTENSION_KEY);
    }

    public CurrentDecoder(String extensionKey) {
        this(extensionKey, NodePath.DEFAULT_MAX_DEPTH);
    }

    public CurrentDecoder(String extensionKey, int maxDepth) {
        E.checkNotBlank(extensionKey, "extension key");
        E.checkArgument(maxDepth > 0,
                        "The max depth must be > 0, but got %s", maxDepth);
        this.extensionKey = extensionKey;
        this.maxDepth = maxDepth;
    }

    public TypedValue decode(String json) {
        return this.decode(JsonUtil.fromJson(json));
    }

    public TypedValue decode(JsonNode node) {
        E.checkNotNull(node, "node");
        return this.read(node, NodePath.ROOT);
    }

    private TypedValue read(JsonNode node, NodePath path) {
        if (path.depth() > this.maxDepth) {
            throw new DecodeException(DecodeError.UNRECOGNIZED_SHAPE, path,
                                      "nesting exceeds the max depth %s",
                                      this.maxDepth);
        }
        if (node.isTextual()) {
            return Scalar.of(node.textValue());
        } else if (node.isBoolean()) {
            return Scalar.of(node.booleanValue());
        } else if (node.isNull()) {
            return Scalar.NULL;
        } else if (node.isIntegralNumber()) {
            // Untagged numbers are tolerated as width-less scalars
            return Scalar.ofInteger(node.bigIntegerValue());
        } else if (node.isNumber()) {
            return Scalar.ofFloat(node.doubleValue());
        } else if (node.isArray()) {
            return this.readArray(node, path);
        } else if (node.isObject()) {
            if (node.has(GraphSONTag.TYPE_KEY)) {
                return this.readTagged(node, path);
            }
            return this.readObjectMap(node, path);
        }
        throw new DecodeException(DecodeError.UNRECOGNIZED_SHAPE, path,
                                  "unexpected %s node", node.getNodeType());
    }

    private TypedValue readTagged(JsonNode node, NodePath path) {
        JsonNode type = node.get(GraphSONTag.TYPE_KEY);
        if (!type.isTextual()) {
            throw new DecodeException(DecodeError.TYPE_MISMATCH,
                                      path.child(GraphSONTag.TYPE_KEY),
                                      "tag must be a string, but got %s",
                                      type.getNodeType());
        }
        GraphSONTag tag = GraphSONTag.fromTag(type.textValue());
        TagReader reader = tag == null ? null : READERS.get(tag);
        if (reader == null) {
            throw new DecodeException(DecodeError.UNRECOGNIZED_SHAPE, path,
                                      "unknown tag '%s'", type.textValue());
        }
        JsonNode payload = node.get(GraphSONTag.VALUE_KEY);
        if (payload == null) {
            throw new DecodeException(DecodeError.MISSING_FIELD, path,
                                      "tag '%s' without '%s'",
                                      tag, GraphSONTag.VALUE_KEY);
        }
        return reader.read(this, payload, path);
    }

    private TypedValue readVertex(JsonNode payload, NodePath path) {
        NodePath valuePath = path.child(GraphSONTag.VALUE_KEY);
        checkObject(payload, valuePath);
        Scalar id = this.readId(payload, GraphSONTokens.ID, valuePath);
        String label = readLabel(payload, valuePath);

        List<PropertyEntry> entries = new ArrayList<>();
        JsonNode properties = payload.get(GraphSONTokens.PROPERTIES);
        if (properties != null) {
            NodePath propsPath = valuePath.child(GraphSONTokens.PROPERTIES);
            checkObject(properties, propsPath);
            Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                NodePath entryPath = propsPath.child(field.getKey());
                JsonNode array = field.getValue();
                if (!array.isArray()) {
                    throw typeMismatch(entryPath, "array", array);
                }
                List<VertexPropertyRef> values = new ArrayList<>();
                for (int i = 0; i < array.size(); i++) {
                    TypedValue value = this.read(array.get(i),
                                                 entryPath.child(i));
                    if (!(value instanceof VertexPropertyRef)) {
                        throw new DecodeException(
                                  DecodeError.TYPE_MISMATCH,
                                  entryPath.child(i),
                                  "expect %s but got %s",
                                  GraphSONTag.VERTEX_PROPERTY,
                                  value.type().string());
                    }
                    values.add((VertexPropertyRef) value);
                }
                entries.add(new PropertyEntry(field.getKey(), values));
            }
        }
        return new VertexRef(id, label, entries,
                             this.readExtensions(payload, valuePath));
    }

    private TypedValue readEdge(JsonNode payload, NodePath path) {
        NodePath valuePath = path.child(GraphSONTag.VALUE_KEY);
        checkObject(payload, valuePath);
        Scalar id = this.readId(payload, GraphSONTokens.ID, valuePath);
        String label = readLabel(payload, valuePath);
        Scalar inV = this.readId(payload, GraphSONTokens.IN, valuePath);
        Scalar outV = this.readId(payload, GraphSONTokens.OUT, valuePath);
        String inLabel = readOptionalText(payload, GraphSONTokens.IN_LABEL,
                                          valuePath);
        String outLabel = readOptionalText(payload, GraphSONTokens.OUT_LABEL,
                                           valuePath);

        List<KeyValue> properties = new ArrayList<>();
        JsonNode props = payload.get(GraphSONTokens.PROPERTIES);
        if (props != null) {
            NodePath propsPath = valuePath.child(GraphSONTokens.PROPERTIES);
            checkObject(props, propsPath);
            Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                NodePath propPath = propsPath.child(field.getKey());
                TypedValue value = this.read(field.getValue(), propPath);
                if (value instanceof KeyValue) {
                    properties.add((KeyValue) value);
                } else {
                    properties.add(new KeyValue(field.getKey(), value));
                }
            }
        }
        return new EdgeRef(id, label, inV, outV, inLabel, outLabel,
                           properties,
                           this.readExtensions(payload, valuePath));
    }

    private TypedValue readVertexProperty(JsonNode payload, NodePath path) {
        NodePath valuePath = path.child(GraphSONTag.VALUE_KEY);
        checkObject(payload, valuePath);
        Scalar id = this.readId(payload, GraphSONTokens.ID, valuePath);
        String label = readLabel(payload, valuePath);
        JsonNode value = payload.get(GraphSONTokens.VALUE);
        if (value == null) {
            throw missing(valuePath, GraphSONTokens.VALUE);
        }
        TypedValue propValue = this.read(value,
                                         valuePath.child(GraphSONTokens.VALUE));
        List<KeyValue> metas = this.readKeyValues(payload,
                                                  GraphSONTokens.PROPERTIES,
                                                  valuePath);
        return new VertexPropertyRef(id, label, propValue, metas,
                                     this.readExtensions(payload, valuePath));
    }

    private TypedValue readProperty(JsonNode payload, NodePath path) {
        NodePath valuePath = path.child(GraphSONTag.VALUE_KEY);
        checkObject(payload, valuePath);
        JsonNode key = payload.get(GraphSONTokens.KEY);
        if (key == null || key.isNull()) {
            throw missing(valuePath, GraphSONTokens.KEY);
        }
        if (!key.isTextual()) {
            throw typeMismatch(valuePath.child(GraphSONTokens.KEY),
                               "string", key);
        }
        JsonNode value = payload.get(GraphSONTokens.VALUE);
        if (value == null) {
            throw missing(valuePath, GraphSONTokens.VALUE);
        }
        return new KeyValue(key.textValue(),
                            this.read(value,
                                      valuePath.child(GraphSONTokens.VALUE)));
    }

    private TypedValue readList(JsonNode payload, NodePath path) {
        return this.readArray(payload, path.child(GraphSONTag.VALUE_KEY));
    }

    private ListValue readArray(JsonNode array, NodePath path) {
        if (!array.isArray()) {
            throw typeMismatch(path, "array", array);
        }
        List<TypedValue> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(this.read(array.get(i), path.child(i)));
        }
        return new ListValue(values);
    }

    private TypedValue readMap(JsonNode payload, NodePath path) {
        NodePath valuePath = path.child(GraphSONTag.VALUE_KEY);
        if (!payload.isArray()) {
            throw typeMismatch(valuePath, "array", payload);
        }
        if (payload.size() % 2 != 0) {
            throw new DecodeException(DecodeError.TYPE_MISMATCH, valuePath,
                                      "map payload must hold key/value " +
                                      "pairs, but got %s items",
                                      payload.size());
        }
        MapValue.Builder builder = MapValue.builder();
        for (int i = 0; i < payload.size(); i += 2) {
            TypedValue key = this.read(payload.get(i), valuePath.child(i));
            TypedValue value = this.read(payload.get(i + 1),
                                         valuePath.child(i + 1));
            builder.put(key, value);
        }
        return builder.build();
    }

    private MapValue readObjectMap(JsonNode node, NodePath path) {
        MapValue.Builder builder = MapValue.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.put(field.getKey(),
                        this.read(field.getValue(),
                                  path.child(field.getKey())));
        }
        return builder.build();
    }

    private List<KeyValue> readKeyValues(JsonNode payload, String field,
                                         NodePath path) {
        JsonNode node = payload.get(field);
        if (node == null) {
            return ImmutableList.of();
        }
        NodePath nodePath = path.child(field);
        checkObject(node, nodePath);
        List<KeyValue> result = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            result.add(new KeyValue(entry.getKey(),
                                    this.read(entry.getValue(),
                                              nodePath.child(entry.getKey()))));
        }
        return result;
    }

    private List<KeyValue> readExtensions(JsonNode payload, NodePath path) {
        return this.readKeyValues(payload, this.extensionKey, path);
    }

    private Scalar readId(JsonNode payload, String field, NodePath path) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            throw missing(path, field);
        }
        TypedValue id = this.read(node, path.child(field));
        if (!(id instanceof Scalar)) {
            throw new DecodeException(DecodeError.TYPE_MISMATCH,
                                      path.child(field),
                                      "id must be a scalar, but got %s",
                                      id.type().string());
        }
        return (Scalar) id;
    }

    private static String readLabel(JsonNode payload, NodePath path) {
        String label = readOptionalText(payload, GraphSONTokens.LABEL, path);
        if (label == null || label.isEmpty()) {
            throw missing(path, GraphSONTokens.LABEL);
        }
        return label;
    }

    private static String readOptionalText(JsonNode payload, String field,
                                           NodePath path) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw typeMismatch(path.child(field), "string", node);
        }
        return node.textValue();
    }

    private static void checkObject(JsonNode node, NodePath path) {
        if (!node.isObject()) {
            throw typeMismatch(path, "object", node);
        }
    }

    private static DecodeException missing(NodePath path, String field) {
        return new DecodeException(DecodeError.MISSING_FIELD, path,
                                   "required field '%s' is absent", field);
    }

    private static DecodeException typeMismatch(NodePath path, String expect,
                                                JsonNode actual) {
        return new DecodeException(DecodeError.TYPE_MISMATCH, path,
                                   "expect %s but got %s",
                                   expect, actual.getNodeType());
    }
}
