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

package com.baidu.graphson.exception;

public enum EncodeError {

    /**
     * The numeric width policy can't represent a scalar, or is absent.
     */
    UNSUPPORTED_WIDTH_POLICY("unsupported width policy"),

    /**
     * A value violating the model invariants reached the encoder, which
     * means an earlier stage produced a broken tree.
     */
    INTERNAL_INVARIANT_VIOLATION("internal invariant violation"),

    /**
     * A map key that the target version can't write as an object key.
     */
    UNSUPPORTED_KEY("unsupported key");

    private final String name;

    EncodeError(String name) {
        this.name = name;
    }

    public String string() {
        return this.name;
    }
}
