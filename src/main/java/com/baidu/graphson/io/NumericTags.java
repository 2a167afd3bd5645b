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

import com.baidu.graphson.exception.DecodeError;
import com.baidu.graphson.exception.DecodeException;
import com.baidu.graphson.structure.NodePath;
import com.baidu.graphson.structure.Scalar;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads the payload of a numeric tag into a scalar that keeps the tag's
 * width. Shared by both decoders, since legacy producers may wrap single
 * numbers with the same tags while leaving elements untagged.
 */
public final class NumericTags {

    private static final String NAN = "NaN";
    private static final String POSITIVE_INFINITY = "Infinity";
    private static final String NEGATIVE_INFINITY = "-Infinity";

    private NumericTags() {
    }

    public static Scalar read(GraphSONTag tag, JsonNode payload,
                              NodePath path) {
        assert tag.numeric() : tag;
        NodePath valuePath = path.child(GraphSONTag.VALUE_KEY);
        switch (tag) {
            case INT32:
                if (payload.isIntegralNumber() && payload.canConvertToInt()) {
                    return Scalar.int32(payload.intValue());
                }
                throw mismatch(tag, payload, valuePath);
            case INT64:
                if (payload.isIntegralNumber() && payload.canConvertToLong()) {
                    return Scalar.int64(payload.longValue());
                }
                throw mismatch(tag, payload, valuePath);
            case BIG_INTEGER:
                return Scalar.bigInteger(readBigInteger(tag, payload,
                                                        valuePath));
            case FLOAT:
                return Scalar.float32((float) readDouble(tag, payload,
                                                         valuePath));
            case DOUBLE:
                return Scalar.float64(readDouble(tag, payload, valuePath));
            default:
                throw new AssertionError(String.format(
                          "Tag '%s' is not numeric", tag));
        }
    }

    private static BigInteger readBigInteger(GraphSONTag tag, JsonNode payload,
                                             NodePath path) {
        if (payload.isIntegralNumber()) {
            return payload.bigIntegerValue();
        }
        if (payload.isTextual()) {
            try {
                return new BigInteger(payload.textValue());
            } catch (NumberFormatException e) {
                throw new DecodeException(DecodeError.TYPE_MISMATCH, path, e,
                                          "invalid %s payload '%s'",
                                          tag, payload.textValue());
            }
        }
        throw mismatch(tag, payload, path);
    }

    private static double readDouble(GraphSONTag tag, JsonNode payload,
                                     NodePath path) {
        if (payload.isNumber()) {
            return payload.doubleValue();
        }
        if (payload.isTextual()) {
            switch (payload.textValue()) {
                case NAN:
                    return Double.NaN;
                case POSITIVE_INFINITY:
                    return Double.POSITIVE_INFINITY;
                case NEGATIVE_INFINITY:
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw mismatch(tag, payload, path);
    }

    private static DecodeException mismatch(GraphSONTag tag, JsonNode payload,
                                            NodePath path) {
        return new DecodeException(DecodeError.TYPE_MISMATCH, path,
                                   "expect %s payload but got %s '%s'",
                                   tag, payload.getNodeType(), payload);
    }
}
