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

import javax.annotation.Nullable;

/**
 * The public failure of one translate call. The cause is always either a
 * {@link DecodeException} or an {@link EncodeException}; the message adds
 * a digest of the input document and the options the call was made with.
 */
public class TranslationException extends GraphSONException {

    private static final long serialVersionUID = 5209113842236590177L;

    private final String document;
    private final String options;

    public TranslationException(DecodeException cause,
                                String document, String options) {
        this((GraphSONException) cause, document, options);
    }

    public TranslationException(EncodeException cause,
                                String document, String options) {
        this((GraphSONException) cause, document, options);
    }

    private TranslationException(GraphSONException cause,
                                 String document, String options) {
        super("Failed to translate document %s with options %s: %s",
              cause, document, options, cause.getMessage());
        this.document = document;
        this.options = options;
    }

    public String document() {
        return this.document;
    }

    public String options() {
        return this.options;
    }

    public boolean isDecodeFailure() {
        return this.getCause() instanceof DecodeException;
    }

    public boolean isEncodeFailure() {
        return this.getCause() instanceof EncodeException;
    }

    @Nullable
    public DecodeException decodeFailure() {
        return this.isDecodeFailure() ? (DecodeException) this.getCause() :
                                        null;
    }

    @Nullable
    public EncodeException encodeFailure() {
        return this.isEncodeFailure() ? (EncodeException) this.getCause() :
                                        null;
    }
}
