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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.slf4j.Logger;

import com.baidu.graphson.exception.DecodeError;
import com.baidu.graphson.exception.DecodeException;
import com.baidu.graphson.io.GraphSONTag;
import com.baidu.graphson.io.GraphSONTokens;
import com.baidu.graphson.io.NumericTags;
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
import com.baidu.graphson.util.Log;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;

/**
 * Decodes a legacy (untagged, GraphSON 1.0 style) document into a
 * {@link TypedValue} tree.
 *
 * Elements are recognized by shape through a {@link ShapeClassifier}.
 * Any node that can't be decoded aborts the whole decode with a
 * {@link DecodeException} naming the path of the node, no partial tree is
 * ever returned.
 */
public class LegacyDecoder {

    private static final Logger LOG = Log.logger(LegacyDecoder.class);

    private static final Set<String> VERTEX_FIELDS = ImmutableSet.of(
            GraphSONTokens.ID, GraphSONTokens.LABEL, GraphSONTokens.TYPE,
            GraphSONTokens.PROPERTIES
    );
    private static final Set<String> EDGE_FIELDS = ImmutableSet.of(
            GraphSONTokens.ID, GraphSONTokens.LABEL, GraphSONTokens.TYPE,
            GraphSONTokens.IN, GraphSONTokens.OUT,
            GraphSONTokens.IN_LABEL, GraphSONTokens.OUT_LABEL,
            GraphSONTokens.PROPERTIES
    );
    private static final Set<String> VERTEX_PROPERTY_FIELDS = ImmutableSet.of(
            GraphSONTokens.ID, GraphSONTokens.LABEL, GraphSONTokens.VALUE,
            GraphSONTokens.PROPERTIES
    );

    private final ShapeClassifier classifier;
    private final ExtensionPolicy extensionPolicy;
    private final boolean labelRequired;
    private final int maxDepth;

    public LegacyDecoder() {
        this(ExtensionPolicy.PRESERVE, true);
    }

    /**
     * @param labelRequired false to leave a missing element label null
     *                      instead of failing, for callers that fill
     *                      labels with a fixup before encoding
     */
    public LegacyDecoder(ExtensionPolicy extensionPolicy,
                         boolean labelRequired) {
        this(extensionPolicy, labelRequired, NodePath.DEFAULT_MAX_DEPTH);
    }

    public LegacyDecoder(ExtensionPolicy extensionPolicy,
                         boolean labelRequired, int maxDepth) {
        this(ShapeClassifier.DEFAULT, extensionPolicy, labelRequired,
             maxDepth);
    }

    /**
     * @param maxDepth the deepest path, in segments from the document
     *                 root, a node may sit at
     */
    public LegacyDecoder(ShapeClassifier classifier,
                         ExtensionPolicy extensionPolicy,
                         boolean labelRequired, int maxDepth) {
        E.checkNotNull(classifier, "classifier");
        E.checkNotNull(extensionPolicy, "extension policy");
        E.checkArgument(maxDepth > 0,
                        "The max depth must be > 0, but got %s", maxDepth);
        this.classifier = classifier;
        this.extensionPolicy = extensionPolicy;
        this.labelRequired = labelRequired;
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return this.maxDepth;
    }

    public TypedValue decode(String json) {
        return this.decode(JsonUtil.fromJson(json));
    }

    public TypedValue decode(JsonNode document) {
        return this.decode(document, NodePath.ROOT);
    }

    /**
     * Decode a document embedded in a larger one, error paths start at
     * the given base.
     */
    public TypedValue decode(JsonNode document, NodePath base) {
        E.checkNotNull(document, "document");
        E.checkNotNull(base, "base path");
        return this.read(document, base);
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
            return Scalar.ofInteger(node.bigIntegerValue());
        } else if (node.isNumber()) {
            return Scalar.ofFloat(node.doubleValue());
        } else if (node.isArray()) {
            List<TypedValue> values = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                values.add(this.read(node.get(i), path.child(i)));
            }
            return new ListValue(values);
        } else if (node.isObject()) {
            return this.readObject(node, path);
        }
        throw new DecodeException(DecodeError.UNRECOGNIZED_SHAPE, path,
                                  "unexpected %s node", node.getNodeType());
    }

    private TypedValue readObject(JsonNode node, NodePath path) {
        Shape shape = this.classifier.classify(node);
        switch (shape) {
            case TYPED_SCALAR:
                return readTypedScalar(node, path);
            case EDGE:
                return this.readEdge(node, path);
            case VERTEX:
                return this.readVertex(node, path);
            case VERTEX_PROPERTY:
                return this.readVertexProperty(node, path, null);
            case MAP:
                return this.readMap(node, path);
            default:
                throw new AssertionError(String.format(
                          "Unknown shape '%s'", shape));
        }
    }

    private static Scalar readTypedScalar(JsonNode node, NodePath path) {
        if (node.size() != 2 || !node.has(GraphSONTag.VALUE_KEY)) {
            throw new DecodeException(DecodeError.UNRECOGNIZED_SHAPE, path,
                                      "a typed value must hold exactly " +
                                      "'%s' and '%s'", GraphSONTag.TYPE_KEY,
                                      GraphSONTag.VALUE_KEY);
        }
        JsonNode type = node.get(GraphSONTag.TYPE_KEY);
        if (!type.isTextual()) {
            throw typeMismatch(path.child(GraphSONTag.TYPE_KEY),
                               "string", type);
        }
        GraphSONTag tag = GraphSONTag.fromTag(type.textValue());
        if (tag == null || !tag.numeric()) {
            throw new DecodeException(DecodeError.UNRECOGNIZED_SHAPE, path,
                                      "unsupported scalar tag '%s'",
                                      type.textValue());
        }
        return NumericTags.read(tag, node.get(GraphSONTag.VALUE_KEY), path);
    }

    private VertexRef readVertex(JsonNode node, NodePath path) {
        Scalar id = this.readId(node, GraphSONTokens.ID, path);
        String label = this.readLabel(node, path, null);

        List<PropertyEntry> entries = new ArrayList<>();
        JsonNode properties = node.get(GraphSONTokens.PROPERTIES);
        if (properties != null && !properties.isNull()) {
            NodePath propsPath = path.child(GraphSONTokens.PROPERTIES);
            checkObject(properties, propsPath);
            Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.add(this.readPropertyEntry(field.getKey(),
                                                   field.getValue(),
                                                   propsPath.child(
                                                   field.getKey())));
            }
        }
        return new VertexRef(id, label, entries,
                             this.readExtensions(node, VERTEX_FIELDS, path));
    }

    private PropertyEntry readPropertyEntry(String key, JsonNode items,
                                            NodePath path) {
        if (!items.isArray()) {
            throw typeMismatch(path, "array", items);
        }
        List<VertexPropertyRef> values = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = items.get(i);
            NodePath itemPath = path.child(i);
            checkObject(item, itemPath);
            values.add(this.readVertexProperty(item, itemPath, key));
        }
        return new PropertyEntry(key, values);
    }

    private VertexPropertyRef readVertexProperty(JsonNode node, NodePath path,
                                                 @Nullable String key) {
        Scalar id = this.readId(node, GraphSONTokens.ID, path);
        // The key of the enclosing property map names the property
        String label = this.readLabel(node, path, key);
        JsonNode value = node.get(GraphSONTokens.VALUE);
        if (value == null) {
            throw missing(path, GraphSONTokens.VALUE);
        }
        TypedValue propValue = this.read(value,
                                         path.child(GraphSONTokens.VALUE));
        List<KeyValue> metas = this.readKeyValues(node,
                                                  GraphSONTokens.PROPERTIES,
                                                  path);
        return new VertexPropertyRef(id, label, propValue, metas,
                                     this.readExtensions(
                                          node, VERTEX_PROPERTY_FIELDS, path));
    }

    private EdgeRef readEdge(JsonNode node, NodePath path) {
        Scalar id = this.readId(node, GraphSONTokens.ID, path);
        String label = this.readLabel(node, path, null);
        Scalar inV = this.readId(node, GraphSONTokens.IN, path);
        Scalar outV = this.readId(node, GraphSONTokens.OUT, path);
        String inLabel = readText(node, GraphSONTokens.IN_LABEL, path);
        String outLabel = readText(node, GraphSONTokens.OUT_LABEL, path);
        List<KeyValue> properties = this.readKeyValues(
                                         node, GraphSONTokens.PROPERTIES,
                                         path);
        return new EdgeRef(id, label, inV, outV, inLabel, outLabel,
                           properties,
                           this.readExtensions(node, EDGE_FIELDS, path));
    }

    private MapValue readMap(JsonNode node, NodePath path) {
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

    private List<KeyValue> readKeyValues(JsonNode node, String field,
                                         NodePath path) {
        List<KeyValue> result = new ArrayList<>();
        JsonNode object = node.get(field);
        if (object == null || object.isNull()) {
            return result;
        }
        NodePath objectPath = path.child(field);
        checkObject(object, objectPath);
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            result.add(new KeyValue(key, this.read(entry.getValue(),
                                                   objectPath.child(key))));
        }
        return result;
    }

    private List<KeyValue> readExtensions(JsonNode node, Set<String> known,
                                          NodePath path) {
        List<KeyValue> extensions = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (known.contains(key)) {
                continue;
            }
            if (this.extensionPolicy == ExtensionPolicy.DROP) {
                LOG.debug("Drop extension field '{}' at '{}'", key, path);
                continue;
            }
            extensions.add(new KeyValue(key, this.read(field.getValue(),
                                                       path.child(key))));
        }
        return extensions;
    }

    private Scalar readId(JsonNode node, String field, NodePath path) {
        JsonNode id = node.get(field);
        if (id == null || id.isNull()) {
            throw missing(path, field);
        }
        NodePath idPath = path.child(field);
        if (id.isValueNode()) {
            return (Scalar) this.read(id, idPath);
        }
        if (id.isObject() &&
            this.classifier.classify(id) == Shape.TYPED_SCALAR) {
            return readTypedScalar(id, idPath);
        }
        throw typeMismatch(idPath, "scalar", id);
    }

    private String readLabel(JsonNode node, NodePath path,
                             @Nullable String fallback) {
        String label = readText(node, GraphSONTokens.LABEL, path);
        if (label != null && !label.isEmpty()) {
            return label;
        }
        if (fallback != null) {
            return fallback;
        }
        if (this.labelRequired) {
            throw missing(path, GraphSONTokens.LABEL);
        }
        return null;
    }

    private static String readText(JsonNode node, String field,
                                   NodePath path) {
        JsonNode text = node.get(field);
        if (text == null || text.isNull()) {
            return null;
        }
        if (!text.isTextual()) {
            throw typeMismatch(path.child(field), "string", text);
        }
        return text.textValue();
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
