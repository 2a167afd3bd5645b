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

import java.math.BigInteger;
import java.util.Objects;

import com.baidu.graphson.util.E;

public final class Scalar extends TypedValue {

    public static final Scalar NULL = new Scalar(ScalarKind.NULL, null,
                                                 NumericWidth.UNSPECIFIED);
    public static final Scalar TRUE = new Scalar(ScalarKind.BOOLEAN, true,
                                                 NumericWidth.UNSPECIFIED);
    public static final Scalar FALSE = new Scalar(ScalarKind.BOOLEAN, false,
                                                  NumericWidth.UNSPECIFIED);

    private static final BigInteger LONG_MIN =
                                    BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX =
                                    BigInteger.valueOf(Long.MAX_VALUE);

    private final ScalarKind kind;
    // String, Boolean, Long, BigInteger, Double or null
    private final Object value;
    private final NumericWidth width;

    private Scalar(ScalarKind kind, Object value, NumericWidth width) {
        this.kind = kind;
        this.value = value;
        this.width = width;
    }

    public static Scalar of(String value) {
        E.checkNotNull(value, "value");
        return new Scalar(ScalarKind.STRING, value, NumericWidth.UNSPECIFIED);
    }

    public static Scalar of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Scalar ofInteger(long value) {
        return new Scalar(ScalarKind.INTEGER, value, NumericWidth.UNSPECIFIED);
    }

    public static Scalar ofInteger(BigInteger value) {
        E.checkNotNull(value, "value");
        if (fitsLong(value)) {
            return ofInteger(value.longValue());
        }
        return new Scalar(ScalarKind.INTEGER, value, NumericWidth.UNSPECIFIED);
    }

    public static Scalar ofFloat(double value) {
        return new Scalar(ScalarKind.FLOAT, value, NumericWidth.UNSPECIFIED);
    }

    public static Scalar int32(int value) {
        return new Scalar(ScalarKind.INTEGER, (long) value, NumericWidth.INT32);
    }

    public static Scalar int64(long value) {
        return new Scalar(ScalarKind.INTEGER, value, NumericWidth.INT64);
    }

    public static Scalar bigInteger(BigInteger value) {
        E.checkNotNull(value, "value");
        Object number = fitsLong(value) ? (Object) value.longValue() : value;
        return new Scalar(ScalarKind.INTEGER, number,
                          NumericWidth.BIG_INTEGER);
    }

    public static Scalar float32(float value) {
        return new Scalar(ScalarKind.FLOAT, (double) value,
                          NumericWidth.FLOAT32);
    }

    public static Scalar float64(double value) {
        return new Scalar(ScalarKind.FLOAT, value, NumericWidth.FLOAT64);
    }

    private static boolean fitsLong(BigInteger value) {
        return value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0;
    }

    @Override
    public ValueType type() {
        return ValueType.SCALAR;
    }

    public ScalarKind kind() {
        return this.kind;
    }

    public NumericWidth width() {
        return this.width;
    }

    public Object value() {
        return this.value;
    }

    public boolean isNull() {
        return this.kind == ScalarKind.NULL;
    }

    public String asString() {
        E.checkState(this.kind == ScalarKind.STRING,
                     "Can't read %s scalar as string", this.kind);
        return (String) this.value;
    }

    public boolean asBoolean() {
        E.checkState(this.kind == ScalarKind.BOOLEAN,
                     "Can't read %s scalar as boolean", this.kind);
        return (Boolean) this.value;
    }

    public Number asNumber() {
        E.checkState(this.kind.isNumber(),
                     "Can't read %s scalar as number", this.kind);
        return (Number) this.value;
    }

    /**
     * Whether an integer scalar holds a value outside the 64 bits range.
     */
    public boolean isBigInteger() {
        return this.value instanceof BigInteger;
    }

    public boolean fitsInt32() {
        if (this.kind != ScalarKind.INTEGER || this.isBigInteger()) {
            return false;
        }
        long number = (Long) this.value;
        return number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE;
    }

    public boolean fitsFloat32() {
        if (this.kind != ScalarKind.FLOAT) {
            return false;
        }
        double number = (Double) this.value;
        return Double.isNaN(number) || (double) (float) number == number;
    }

    private BigInteger bigValue() {
        if (this.value instanceof BigInteger) {
            return (BigInteger) this.value;
        }
        return BigInteger.valueOf((Long) this.value);
    }

    /**
     * Scalars are equal when kind and value are equal, the width only
     * records how the value was tagged and takes no part in equality.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Scalar)) {
            return false;
        }
        Scalar other = (Scalar) obj;
        if (this.kind != other.kind) {
            return false;
        }
        switch (this.kind) {
            case INTEGER:
                return this.bigValue().equals(other.bigValue());
            case FLOAT:
                return Double.compare((Double) this.value,
                                      (Double) other.value) == 0;
            default:
                return Objects.equals(this.value, other.value);
        }
    }

    @Override
    public int hashCode() {
        if (this.kind == ScalarKind.INTEGER) {
            return Objects.hash(this.kind, this.bigValue());
        }
        return Objects.hash(this.kind, this.value);
    }

    @Override
    public String toString() {
        if (this.kind == ScalarKind.STRING) {
            return String.format("\"%s\"", this.value);
        }
        if (this.width.specified()) {
            return String.format("%s(%s)", this.value, this.width);
        }
        return String.valueOf(this.value);
    }
}
