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

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Field names shared by the legacy and the tagged encodings. They are part
 * of the wire contract and must be kept verbatim.
 */
public final class GraphSONTokens {

    public static final String ID = "id";
    public static final String LABEL = "label";
    public static final String TYPE = "type";
    public static final String PROPERTIES = "properties";
    public static final String VALUE = "value";
    public static final String KEY = "key";
    public static final String IN = "inV";
    public static final String OUT = "outV";
    public static final String IN_LABEL = "inVLabel";
    public static final String OUT_LABEL = "outVLabel";

    public static final String VERTEX = "vertex";
    public static final String EDGE = "edge";

    /**
     * Every field an element payload of the tagged encoding may carry.
     */
    public static final Set<String> ELEMENT_FIELDS = ImmutableSet.of(
            ID, LABEL, PROPERTIES, VALUE, IN, OUT, IN_LABEL, OUT_LABEL
    );

    private GraphSONTokens() {
    }
}
