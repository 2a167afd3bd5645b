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

import java.util.Objects;

import com.baidu.graphson.util.E;

/**
 * Decides the numeric tag of scalars whose source carried no width. A
 * preference for the narrow type is only honored when the value fits,
 * otherwise the wider tag is used so no value is ever truncated.
 */
public final class NumericWidthPolicy {

    public static final NumericWidthPolicy DEFAULT =
           new NumericWidthPolicy(IntegerPreference.PREFER_INT64,
                                  FloatPreference.PREFER_DOUBLE);

    public enum IntegerPreference {

        PREFER_INT64("int64"),

        PREFER_INT32("int32");

        private final String name;

        IntegerPreference(String name) {
            this.name = name;
        }

        public String string() {
            return this.name;
        }

        public static IntegerPreference fromString(String name) {
            for (IntegerPreference pref : values()) {
                if (pref.name.equalsIgnoreCase(name)) {
                    return pref;
                }
            }
            E.checkArgument(false, "Unsupported integer width '%s'", name);
            return null;
        }
    }

    public enum FloatPreference {

        PREFER_DOUBLE("double"),

        PREFER_FLOAT("float");

        private final String name;

        FloatPreference(String name) {
            this.name = name;
        }

        public String string() {
            return this.name;
        }

        public static FloatPreference fromString(String name) {
            for (FloatPreference pref : values()) {
                if (pref.name.equalsIgnoreCase(name)) {
                    return pref;
                }
            }
            E.checkArgument(false, "Unsupported float width '%s'", name);
            return null;
        }
    }

    private final IntegerPreference integers;
    private final FloatPreference floats;

    public NumericWidthPolicy(IntegerPreference integers,
                              FloatPreference floats) {
        this.integers = integers;
        this.floats = floats;
    }

    public static NumericWidthPolicy of(IntegerPreference integers,
                                        FloatPreference floats) {
        return new NumericWidthPolicy(integers, floats);
    }

    public IntegerPreference integers() {
        return this.integers;
    }

    public FloatPreference floats() {
        return this.floats;
    }

    public boolean complete() {
        return this.integers != null && this.floats != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof NumericWidthPolicy)) {
            return false;
        }
        NumericWidthPolicy other = (NumericWidthPolicy) obj;
        return this.integers == other.integers && this.floats == other.floats;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.integers, this.floats);
    }

    @Override
    public String toString() {
        return String.format("%s/%s", this.integers, this.floats);
    }
}
