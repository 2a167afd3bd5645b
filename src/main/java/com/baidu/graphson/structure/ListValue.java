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

package com.baidu.graphson.structure;

import java.util.List;

import com.baidu.graphson.util.E;
import com.google.common.collect.ImmutableList;

public final class ListValue extends TypedValue {

    public static final ListValue EMPTY = new ListValue(ImmutableList.of());

    private final ImmutableList<TypedValue> values;

    public ListValue(List<? extends TypedValue> values) {
        E.checkNotNull(values, "values");
        this.values = ImmutableList.copyOf(values);
    }

    public static ListValue of(TypedValue... values) {
        return new ListValue(ImmutableList.copyOf(values));
    }

    @Override
    public ValueType type() {
        return ValueType.LIST;
    }

    public List<TypedValue> values() {
        return this.values;
    }

    public int size() {
        return this.values.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ListValue)) {
            return false;
        }
        return this.values.equals(((ListValue) obj).values);
    }

    @Override
    public int hashCode() {
        return this.values.hashCode();
    }

    @Override
    public String toString() {
        return this.values.toString();
    }
}
