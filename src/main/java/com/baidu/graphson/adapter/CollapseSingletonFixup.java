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

import java.util.Map;

import com.baidu.graphson.structure.ListValue;
import com.baidu.graphson.structure.MapValue;
import com.baidu.graphson.structure.TypedValue;
import com.baidu.graphson.structure.ValueType;

/**
 * Replaces every map value that is a list of exactly one element with that
 * element, which flattens rows such as {"name": ["marko"]}.
 *
 * Only map values are collapsed. Vertex property lists have their own type
 * and are left alone, as is a list that is a map key.
 */
public class CollapseSingletonFixup extends TreeRewriter {

    @Override
    protected TypedValue rewriteMap(MapValue map) {
        MapValue.Builder builder = MapValue.builder();
        for (Map.Entry<TypedValue, TypedValue> e : map.entries().entrySet()) {
            builder.put(e.getKey(), collapse(e.getValue()));
        }
        return builder.build();
    }

    private static TypedValue collapse(TypedValue value) {
        if (value.type() != ValueType.LIST) {
            return value;
        }
        ListValue list = (ListValue) value;
        return list.size() == 1 ? list.values().get(0) : list;
    }
}
