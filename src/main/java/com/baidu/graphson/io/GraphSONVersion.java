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

import com.baidu.graphson.util.E;

public enum GraphSONVersion {

    /**
     * Lists are bare json arrays and maps are json objects keyed by string.
     */
    V2_0("v2.0"),

    /**
     * Lists and maps are wrapped as g:List and g:Map.
     */
    V3_0("v3.0");

    private final String name;

    GraphSONVersion(String name) {
        this.name = name;
    }

    public String string() {
        return this.name;
    }

    public boolean tagsCollections() {
        return this == V3_0;
    }

    public static GraphSONVersion fromString(String name) {
        for (GraphSONVersion version : values()) {
            if (version.name.equalsIgnoreCase(name)) {
                return version;
            }
        }
        E.checkArgument(false, "Unsupported GraphSON version '%s'", name);
        return null;
    }
}
