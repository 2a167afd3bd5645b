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

package com.baidu.graphson.config;

import static com.baidu.graphson.config.OptionChecker.allowValues;
import static com.baidu.graphson.config.OptionChecker.disallowEmpty;
import static com.baidu.graphson.config.OptionChecker.disallowValues;
import static com.baidu.graphson.config.OptionChecker.rangeInt;

import com.baidu.graphson.io.CurrentEncoder;
import com.baidu.graphson.io.GraphSONTokens;
import com.baidu.graphson.io.GraphSONVersion;
import com.baidu.graphson.io.NumericWidthPolicy.FloatPreference;
import com.baidu.graphson.io.NumericWidthPolicy.IntegerPreference;
import com.baidu.graphson.legacy.ExtensionPolicy;
import com.baidu.graphson.structure.NodePath;
import com.google.common.base.Predicates;

public class GraphSONOptions extends OptionHolder {

    private GraphSONOptions() {
        super();
    }

    private static volatile GraphSONOptions instance;

    public static synchronized GraphSONOptions instance() {
        if (instance == null) {
            instance = new GraphSONOptions();
            instance.registerOptions();
        }
        return instance;
    }

    public static final ConfigConvOption<String, GraphSONVersion>
            TARGET_VERSION =
            new ConfigConvOption<>(
                    "graphson.target_version",
                    "The GraphSON version of translated documents, " +
                    "allowed values are [v2.0, v3.0].",
                    allowValues("v2.0", "v3.0"),
                    GraphSONVersion::fromString,
                    "v3.0"
            );

    public static final ConfigConvOption<String, IntegerPreference>
            INTEGER_WIDTH =
            new ConfigConvOption<>(
                    "graphson.integer_width",
                    "The tag of integers whose width is unknown, " +
                    "allowed values are [int64, int32]. Values beyond " +
                    "32 bits are always written as int64.",
                    allowValues("int64", "int32"),
                    IntegerPreference::fromString,
                    "int64"
            );

    public static final ConfigConvOption<String, FloatPreference>
            FLOAT_WIDTH =
            new ConfigConvOption<>(
                    "graphson.float_width",
                    "The tag of floating numbers whose width is unknown, " +
                    "allowed values are [double, float].",
                    allowValues("double", "float"),
                    FloatPreference::fromString,
                    "double"
            );

    public static final ConfigOption<Boolean> ALLOW_EXTENDED_TYPES =
            new ConfigOption<>(
                    "graphson.allow_extended_types",
                    "Whether to write integers beyond 64 bits as " +
                    "gx:BigInteger instead of failing.",
                    disallowEmpty(),
                    false
            );

    public static final ConfigConvOption<String, ExtensionPolicy>
            EXTENSION_FIELDS =
            new ConfigConvOption<>(
                    "graphson.extension_fields",
                    "How to treat element fields outside the standard " +
                    "field set, allowed values are [preserve, drop].",
                    allowValues("preserve", "drop"),
                    ExtensionPolicy::fromString,
                    "preserve"
            );

    public static final ConfigOption<String> EXTENSION_KEY =
            new ConfigOption<>(
                    "graphson.extension_key",
                    "The reserved key that preserved extension fields " +
                    "are written under, it can't be an element field " +
                    "such as id or label.",
                    Predicates.and(disallowEmpty(),
                                   disallowValues(GraphSONTokens
                                                  .ELEMENT_FIELDS
                                                  .toArray(new String[0]))),
                    CurrentEncoder.DEFAULT_EXTENSION_KEY
            );

    public static final ConfigOption<String> DEFAULT_LABEL =
            new ConfigOption<>(
                    "graphson.default_label",
                    "The label given to elements that come without one, " +
                    "empty value means a missing label is an error.",
                    ""
            );

    public static final ConfigOption<Boolean> COLLAPSE_SINGLETONS =
            new ConfigOption<>(
                    "graphson.collapse_singletons",
                    "Whether to replace a single-element list held as a " +
                    "map value with its element.",
                    disallowEmpty(),
                    false
            );

    public static final ConfigOption<Integer> MAX_DEPTH =
            new ConfigOption<>(
                    "graphson.max_depth",
                    "The deepest nesting, counted in path segments from " +
                    "the document root, that a translated node may have.",
                    rangeInt(1, 65536),
                    NodePath.DEFAULT_MAX_DEPTH
            );
}
