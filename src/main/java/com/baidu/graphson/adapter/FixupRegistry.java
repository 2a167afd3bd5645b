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

package com.baidu.graphson.adapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.baidu.graphson.util.E;
import com.google.common.collect.ImmutableMap;

/**
 * A lookup table from fixup name to the factory that builds the fixup for
 * a set of options. Fixups run in registration order, which is fixed when
 * the registry is built.
 */
public final class FixupRegistry {

    public static final String DEFAULT_LABEL = "default_label";
    public static final String COLLAPSE_SINGLETONS = "collapse_singletons";

    public static final FixupRegistry DEFAULT = builder().build();

    private final ImmutableMap<String, Function<TranslateOptions, Fixup>>
            factories;

    private FixupRegistry(Map<String, Function<TranslateOptions, Fixup>>
                          factories) {
        this.factories = ImmutableMap.copyOf(factories);
    }

    /**
     * A builder preloaded with the standard fixups, labels are filled
     * before singletons are collapsed.
     */
    public static Builder builder() {
        return emptyBuilder()
               .register(DEFAULT_LABEL,
                         options -> new DefaultLabelFixup(
                                    options.defaultLabel()))
               .register(COLLAPSE_SINGLETONS,
                         options -> new CollapseSingletonFixup());
    }

    public static Builder emptyBuilder() {
        return new Builder();
    }

    public Set<String> names() {
        return this.factories.keySet();
    }

    public Fixup create(String name, TranslateOptions options) {
        Function<TranslateOptions, Fixup> factory = this.factories.get(name);
        E.checkArgument(factory != null, "Undefined fixup '%s'", name);
        Fixup fixup = factory.apply(options);
        E.checkState(fixup != null, "The factory of fixup '%s' returned null",
                     name);
        return fixup;
    }

    /**
     * Build the fixups the options enable, in registration order.
     */
    public List<Fixup> fixups(TranslateOptions options) {
        List<Fixup> fixups = new ArrayList<>();
        for (String name : this.factories.keySet()) {
            if (options.fixupEnabled(name)) {
                fixups.add(this.create(name, options));
            }
        }
        return fixups;
    }

    public static class Builder {

        private final Map<String, Function<TranslateOptions, Fixup>>
                factories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name,
                                Function<TranslateOptions, Fixup> factory) {
            E.checkNotBlank(name, "fixup name");
            E.checkNotNull(factory, "fixup factory");
            E.checkArgument(!this.factories.containsKey(name),
                            "The fixup '%s' has been registered", name);
            this.factories.put(name, factory);
            return this;
        }

        public FixupRegistry build() {
            return new FixupRegistry(this.factories);
        }
    }
}
