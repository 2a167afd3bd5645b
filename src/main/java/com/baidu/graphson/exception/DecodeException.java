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

import com.baidu.graphson.structure.NodePath;

public class DecodeException extends GraphSONException {

    private static final long serialVersionUID = -2416309186127432781L;

    private final DecodeError reason;
    private final NodePath path;

    public DecodeException(DecodeError reason, NodePath path,
                           String message, Object... args) {
        super(format(reason, path, message, args));
        this.reason = reason;
        this.path = path;
    }

    public DecodeException(DecodeError reason, NodePath path, Throwable cause,
                           String message, Object... args) {
        super(format(reason, path, message, args), cause);
        this.reason = reason;
        this.path = path;
    }

    public DecodeError reason() {
        return this.reason;
    }

    public NodePath path() {
        return this.path;
    }

    private static String format(DecodeError reason, NodePath path,
                                 String message, Object... args) {
        return String.format("Failed to decode node at '%s' (%s): %s",
                             path, reason.string(),
                             String.format(message, args));
    }
}
