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

public enum DecodeError {

    /**
     * The node matches none of the known scalar, element or map shapes.
     */
    UNRECOGNIZED_SHAPE("unrecognized shape"),

    /**
     * A field required by the matched shape is absent or null.
     */
    MISSING_FIELD("missing field"),

    /**
     * A field is present but holds the wrong kind of json value.
     */
    TYPE_MISMATCH("type mismatch");

    private final String name;

    DecodeError(String name) {
        this.name = name;
    }

    public String string() {
        return this.name;
    }
}
