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

/**
 * Any value that can appear in a graph-exchange document. The set of
 * subclasses is closed, {@link #type()} tells which one an instance is.
 * Instances are immutable, transformations build new trees.
 */
public abstract class TypedValue {

    TypedValue() {
        // Only subclasses in this package
    }

    public abstract ValueType type();

    public boolean isScalar() {
        return this.type() == ValueType.SCALAR;
    }

    public boolean isElement() {
        return this.type().isElement();
    }
}
