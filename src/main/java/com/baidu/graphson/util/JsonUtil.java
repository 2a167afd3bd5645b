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

package com.baidu.graphson.util;

import java.io.IOException;
import java.io.StringWriter;

import org.apache.commons.lang3.StringUtils;

import com.baidu.graphson.exception.SerializeException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        MAPPER.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        MAPPER.disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public static JsonNodeFactory nodeFactory() {
        return MAPPER.getNodeFactory();
    }

    public static String toJson(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SerializeException("Failed to serialize json node '%s'",
                                         e, node);
        }
    }

    /**
     * Write the leading part of a tree as text, at most maxLength chars.
     * The tree is walked token by token, so its depth doesn't matter.
     */
    public static String abbreviate(JsonNode node, int maxLength) {
        E.checkNotNull(node, "node");
        StringWriter writer = new StringWriter();
        try (JsonParser parser = node.traverse();
             JsonGenerator generator = MAPPER.getFactory()
                                             .createGenerator(writer)) {
            while (writer.getBuffer().length() <= maxLength &&
                   parser.nextToken() != null) {
                generator.copyCurrentEvent(parser);
                generator.flush();
            }
        } catch (IOException e) {
            throw new SerializeException("Failed to serialize json node",
                                         e);
        }
        return StringUtils.abbreviate(writer.toString(), maxLength);
    }

    public static JsonNode fromJson(String json) {
        E.checkNotNull(json, "json");
        try {
            return MAPPER.readTree(json);
        } catch (IOException e) {
            throw new SerializeException("Failed to deserialize json '%s'",
                                         e, json);
        }
    }
}
