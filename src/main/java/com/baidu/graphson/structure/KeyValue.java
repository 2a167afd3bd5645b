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

import java.util.Objects;

import com.baidu.graphson.util.E;

/**
 * A plain property: a key bound to a value, used for edge properties,
 * vertex meta-properties and preserved extension fields.
 */
public final class KeyValue extends TypedValue {

    private final String key;
    private final TypedValue value;

    public KeyValue(String key, TypedValue value) {
        E.checkNotNull(key, "key");
        E.checkNotNull(value, "value", key);
        this.key = key;
        this.value = value;
    }

    @Override
    public ValueType type() {
        return ValueType.PROPERTY;
    }

    public String key() {
        return this.key;
    }

    public TypedValue value() {
        return this.value;
    }

    public KeyValue withValue(TypedValue value) {
        if (value == this.value) {
            return this;
        }
        return new KeyValue(this.key, value);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof KeyValue)) {
            return false;
        }
        KeyValue other = (KeyValue) obj;
        return this.key.equals(other.key) && this.value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.key, this.value);
    }

    @Override
    public String toString() {
        return String.format("%s=%s", this.key, this.value);
    }
}
