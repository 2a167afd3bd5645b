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

import java.util.Iterator;
import java.util.Map;

import com.baidu.graphson.exception.DecodeError;
import com.baidu.graphson.exception.DecodeException;
import com.baidu.graphson.exception.EncodeException;
import com.baidu.graphson.exception.TranslationException;
import com.baidu.graphson.structure.MapValue;
import com.baidu.graphson.structure.NodePath;
import com.baidu.graphson.util.E;
import com.baidu.graphson.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Translates a whole Gremlin server response:
 * <pre>
 * {"requestId": ..., "status": {"code", "message", "attributes"},
 *  "result": {"data", "meta"}}
 * </pre>
 * The result data goes through the adapter, the status attributes and the
 * result meta are written as maps, and every other field is copied as is.
 */
public class ResponseTranslator {

    public static final String STATUS = "status";
    public static final String ATTRIBUTES = "attributes";
    public static final String RESULT = "result";
    public static final String DATA = "data";
    public static final String META = "meta";

    private final TranslationAdapter adapter;

    public ResponseTranslator() {
        this(new TranslationAdapter());
    }

    public ResponseTranslator(TranslationAdapter adapter) {
        E.checkNotNull(adapter, "adapter");
        this.adapter = adapter;
    }

    public JsonNode translate(JsonNode response, TranslateOptions options) {
        E.checkNotNull(response, "response");
        E.checkNotNull(options, "options");
        try {
            return this.rewrite(response, options);
        } catch (DecodeException e) {
            throw new TranslationException(e,
                                           TranslationAdapter.digest(response),
                                           options.toString());
        } catch (EncodeException e) {
            throw new TranslationException(e,
                                           TranslationAdapter.digest(response),
                                           options.toString());
        }
    }

    public String translate(String response, TranslateOptions options) {
        JsonNode node = TranslationAdapter.parse(response, options);
        return JsonUtil.toJson(this.translate(node, options));
    }

    private JsonNode rewrite(JsonNode response, TranslateOptions options) {
        NodePath root = NodePath.ROOT;
        checkObject(response, root);
        JsonNode result = response.get(RESULT);
        if (result == null || result.isNull()) {
            throw new DecodeException(DecodeError.MISSING_FIELD, root,
                                      "required field '%s' is absent",
                                      RESULT);
        }
        NodePath resultPath = root.child(RESULT);
        checkObject(result, resultPath);

        ObjectNode translated = JsonUtil.nodeFactory().objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = response.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (STATUS.equals(key) && value.isObject()) {
                value = this.rewriteMapField(value, ATTRIBUTES,
                                             root.child(STATUS), options);
            } else if (RESULT.equals(key)) {
                value = this.rewriteResult(value, resultPath, options);
            }
            translated.set(key, value);
        }
        return translated;
    }

    private JsonNode rewriteResult(JsonNode result, NodePath path,
                                   TranslateOptions options) {
        ObjectNode translated = (ObjectNode) this.rewriteMapField(
                                result, META, path, options);
        JsonNode data = result.get(DATA);
        if (data != null && !data.isNull()) {
            translated.set(DATA, this.adapter.convert(data, path.child(DATA),
                                                      options));
        }
        return translated;
    }

    /**
     * Copy the object with the named field, when present, written as a map
     * whatever its shape.
     */
    private JsonNode rewriteMapField(JsonNode object, String field,
                                     NodePath path, TranslateOptions options) {
        ObjectNode copy = ((ObjectNode) object).deepCopy();
        JsonNode value = object.get(field);
        if (value == null || value.isNull()) {
            return copy;
        }
        NodePath fieldPath = path.child(field);
        checkObject(value, fieldPath);

        MapValue.Builder builder = MapValue.builder();
        Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            builder.put(entry.getKey(),
                        options.decoder().decode(entry.getValue(),
                                                 fieldPath.child(
                                                 entry.getKey())));
        }
        copy.set(field, options.encoder().encode(builder.build(), fieldPath));
        return copy;
    }

    private static void checkObject(JsonNode node, NodePath path) {
        if (!node.isObject()) {
            throw new DecodeException(DecodeError.TYPE_MISMATCH, path,
                                      "expect object but got %s",
                                      node.getNodeType());
        }
    }
}
