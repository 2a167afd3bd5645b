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

package com.baidu.graphson.legacy;

import com.baidu.graphson.util.E;

/**
 * What to do with element fields outside the standard field set, such as
 * provider specific bookkeeping attached to vertices.
 */
public enum ExtensionPolicy {

    /**
     * Keep the fields on the element, the encoder writes them under a
     * reserved key of the element payload.
     */
    PRESERVE("preserve"),

    /**
     * Discard the fields.
     */
    DROP("drop");

    private final String name;

    ExtensionPolicy(String name) {
        this.name = name;
    }

    public String string() {
        return this.name;
    }

    public static ExtensionPolicy fromString(String name) {
        for (ExtensionPolicy policy : values()) {
            if (policy.name.equalsIgnoreCase(name)) {
                return policy;
            }
        }
        E.checkArgument(false, "Unsupported extension policy '%s'", name);
        return null;
    }
}
