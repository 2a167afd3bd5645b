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

import java.util.LinkedHashMap;
import java.util.Map;

import com.baidu.graphson.util.E;
import com.google.common.collect.ImmutableMap;

/**
 * A map whose keys may be any value. Entry order follows the source
 * document so that a translated document lists keys as the producer did.
 */
public final class MapValue extends TypedValue {

    public static final MapValue EMPTY = new MapValue(ImmutableMap.of());

    private final ImmutableMap<TypedValue, TypedValue> entries;

    public MapValue(Map<? extends TypedValue, ? extends TypedValue> entries) {
        E.checkNotNull(entries, "entries");
        this.entries = ImmutableMap.copyOf(entries);
    }

    @Override
    public ValueType type() {
        return ValueType.MAP;
    }

    public Map<TypedValue, TypedValue> entries() {
        return this.entries;
    }

    public int size() {
        return this.entries.size();
    }

    public boolean hasOnlyStringKeys() {
        for (TypedValue key : this.entries.keySet()) {
            if (!(key instanceof Scalar) ||
                ((Scalar) key).kind() != ScalarKind.STRING) {
                return false;
            }
        }
        return true;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof MapValue)) {
            return false;
        }
        // Entry order is part of the value
        return this.entries.entrySet().asList().equals(
               ((MapValue) obj).entries.entrySet().asList());
    }

    @Override
    public int hashCode() {
        return this.entries.hashCode();
    }

    @Override
    public String toString() {
        return this.entries.toString();
    }

    /**
     * Collects entries keeping the first position of a key and the last
     * value written for it.
     */
    public static final class Builder {

        private final Map<TypedValue, TypedValue> entries;

        private Builder() {
            this.entries = new LinkedHashMap<>();
        }

        public Builder put(TypedValue key, TypedValue value) {
            E.checkNotNull(key, "key");
            E.checkNotNull(value, "value");
            this.entries.put(key, value);
            return this;
        }

        public Builder put(String key, TypedValue value) {
            return this.put(Scalar.of(key), value);
        }

        public MapValue build() {
            return new MapValue(this.entries);
        }
    }
}
