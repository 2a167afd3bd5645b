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

import java.util.Map;

import com.baidu.graphson.structure.NumericWidth;
import com.google.common.collect.ImmutableMap;

/**
 * The "@type" tags of the tagged encoding. Both supported versions share
 * the tag names, they only differ in which values get wrapped.
 */
public enum GraphSONTag {

    VERTEX("g:Vertex"),

    EDGE("g:Edge"),

    VERTEX_PROPERTY("g:VertexProperty"),

    PROPERTY("g:Property"),

    LIST("g:List"),

    MAP("g:Map"),

    INT32("g:Int32"),

    INT64("g:Int64"),

    FLOAT("g:Float"),

    DOUBLE("g:Double"),

    BIG_INTEGER("gx:BigInteger");

    public static final String TYPE_KEY = "@type";
    public static final String VALUE_KEY = "@value";

    private static final Map<String, GraphSONTag> TAGS;

    static {
        ImmutableMap.Builder<String, GraphSONTag> builder =
                                                  ImmutableMap.builder();
        for (GraphSONTag tag : values()) {
            builder.put(tag.tag, tag);
        }
        TAGS = builder.build();
    }

    private final String tag;

    GraphSONTag(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return this.tag;
    }

    public boolean numeric() {
        return this == INT32 || this == INT64 || this == FLOAT ||
               this == DOUBLE || this == BIG_INTEGER;
    }

    /**
     * @return the tag for the given name, or null if the name is unknown
     */
    public static GraphSONTag fromTag(String tag) {
        return TAGS.get(tag);
    }

    public static GraphSONTag of(NumericWidth width) {
        switch (width) {
            case INT32:
                return INT32;
            case INT64:
                return INT64;
            case BIG_INTEGER:
                return BIG_INTEGER;
            case FLOAT32:
                return FLOAT;
            case FLOAT64:
                return DOUBLE;
            default:
                throw new AssertionError(String.format(
                          "No tag for numeric width '%s'", width));
        }
    }

    @Override
    public String toString() {
        return this.tag;
    }
}
