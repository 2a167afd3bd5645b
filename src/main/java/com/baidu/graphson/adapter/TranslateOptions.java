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

import java.util.Objects;
import java.util.Set;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;

import com.baidu.graphson.config.GraphSONConfig;
import com.baidu.graphson.config.GraphSONOptions;
import com.baidu.graphson.io.CurrentEncoder;
import com.baidu.graphson.io.GraphSONTokens;
import com.baidu.graphson.io.GraphSONVersion;
import com.baidu.graphson.io.NumericWidthPolicy;
import com.baidu.graphson.legacy.ExtensionPolicy;
import com.baidu.graphson.legacy.LegacyDecoder;
import com.baidu.graphson.structure.NodePath;
import com.baidu.graphson.util.E;
import com.google.common.collect.ImmutableSet;

/**
 * Settings of one translate call. Instances are immutable and hold the
 * decoder and encoder they configure, so one options object can be shared
 * by any number of concurrent calls.
 */
public final class TranslateOptions {

    public static final TranslateOptions DEFAULT = builder().build();

    private final GraphSONVersion version;
    private final NumericWidthPolicy policy;
    private final boolean allowExtendedTypes;
    private final ExtensionPolicy extensionPolicy;
    private final String extensionKey;
    private final String defaultLabel;
    private final boolean collapseSingletons;
    private final int maxDepth;
    private final Set<String> extraFixups;

    private final LegacyDecoder decoder;
    private final CurrentEncoder encoder;

    private TranslateOptions(Builder builder) {
        this.version = builder.version;
        this.policy = builder.policy;
        this.allowExtendedTypes = builder.allowExtendedTypes;
        this.extensionPolicy = builder.extensionPolicy;
        this.extensionKey = builder.extensionKey;
        this.defaultLabel = builder.defaultLabel;
        this.collapseSingletons = builder.collapseSingletons;
        this.maxDepth = builder.maxDepth;
        this.extraFixups = builder.extraFixups.build();

        // Leave missing labels to the default label fixup
        this.decoder = new LegacyDecoder(this.extensionPolicy,
                                         !this.hasDefaultLabel(),
                                         this.maxDepth);
        this.encoder = new CurrentEncoder(this.version, this.policy,
                                          this.allowExtendedTypes,
                                          this.extensionKey, this.maxDepth);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TranslateOptions fromConfig(GraphSONConfig config) {
        E.checkNotNull(config, "config");
        NumericWidthPolicy policy = NumericWidthPolicy.of(
                config.get(GraphSONOptions.INTEGER_WIDTH),
                config.get(GraphSONOptions.FLOAT_WIDTH));
        return builder()
               .version(config.get(GraphSONOptions.TARGET_VERSION))
               .policy(policy)
               .allowExtendedTypes(
                config.get(GraphSONOptions.ALLOW_EXTENDED_TYPES))
               .extensionPolicy(config.get(GraphSONOptions.EXTENSION_FIELDS))
               .extensionKey(config.get(GraphSONOptions.EXTENSION_KEY))
               .defaultLabel(config.get(GraphSONOptions.DEFAULT_LABEL))
               .collapseSingletons(
                config.get(GraphSONOptions.COLLAPSE_SINGLETONS))
               .maxDepth(config.get(GraphSONOptions.MAX_DEPTH))
               .build();
    }

    public GraphSONVersion version() {
        return this.version;
    }

    public NumericWidthPolicy policy() {
        return this.policy;
    }

    public boolean allowExtendedTypes() {
        return this.allowExtendedTypes;
    }

    public ExtensionPolicy extensionPolicy() {
        return this.extensionPolicy;
    }

    public String extensionKey() {
        return this.extensionKey;
    }

    @Nullable
    public String defaultLabel() {
        return this.defaultLabel;
    }

    public boolean hasDefaultLabel() {
        return this.defaultLabel != null;
    }

    public boolean collapseSingletons() {
        return this.collapseSingletons;
    }

    public int maxDepth() {
        return this.maxDepth;
    }

    /**
     * Whether the fixup registered under the name runs with these options.
     */
    public boolean fixupEnabled(String name) {
        switch (name) {
            case FixupRegistry.DEFAULT_LABEL:
                return this.hasDefaultLabel();
            case FixupRegistry.COLLAPSE_SINGLETONS:
                return this.collapseSingletons;
            default:
                return this.extraFixups.contains(name);
        }
    }

    public LegacyDecoder decoder() {
        return this.decoder;
    }

    public CurrentEncoder encoder() {
        return this.encoder;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof TranslateOptions)) {
            return false;
        }
        TranslateOptions other = (TranslateOptions) obj;
        return this.version == other.version &&
               Objects.equals(this.policy, other.policy) &&
               this.allowExtendedTypes == other.allowExtendedTypes &&
               this.extensionPolicy == other.extensionPolicy &&
               this.extensionKey.equals(other.extensionKey) &&
               Objects.equals(this.defaultLabel, other.defaultLabel) &&
               this.collapseSingletons == other.collapseSingletons &&
               this.maxDepth == other.maxDepth &&
               this.extraFixups.equals(other.extraFixups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.version, this.policy, this.allowExtendedTypes,
                            this.extensionPolicy, this.extensionKey,
                            this.defaultLabel, this.collapseSingletons,
                            this.maxDepth, this.extraFixups);
    }

    @Override
    public String toString() {
        return String.format("{version=%s, widths=%s, extended=%s, " +
                             "extensions=%s(%s), defaultLabel=%s, " +
                             "collapse=%s, maxDepth=%s, fixups=%s}",
                             this.version.string(), this.policy,
                             this.allowExtendedTypes,
                             this.extensionPolicy.string(),
                             this.extensionKey, this.defaultLabel,
                             this.collapseSingletons, this.maxDepth,
                             this.extraFixups);
    }

    public static class Builder {

        private GraphSONVersion version = GraphSONVersion.V3_0;
        private NumericWidthPolicy policy = NumericWidthPolicy.DEFAULT;
        private boolean allowExtendedTypes = false;
        private ExtensionPolicy extensionPolicy = ExtensionPolicy.PRESERVE;
        private String extensionKey = CurrentEncoder.DEFAULT_EXTENSION_KEY;
        private String defaultLabel = null;
        private boolean collapseSingletons = false;
        private int maxDepth = NodePath.DEFAULT_MAX_DEPTH;
        private final ImmutableSet.Builder<String> extraFixups =
                      ImmutableSet.builder();

        private Builder() {
        }

        public Builder version(GraphSONVersion version) {
            E.checkNotNull(version, "version");
            this.version = version;
            return this;
        }

        /**
         * A null or incomplete policy is accepted here and rejected by the
         * encoder of each call that uses it.
         */
        public Builder policy(NumericWidthPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder allowExtendedTypes(boolean allowExtendedTypes) {
            this.allowExtendedTypes = allowExtendedTypes;
            return this;
        }

        public Builder extensionPolicy(ExtensionPolicy extensionPolicy) {
            E.checkNotNull(extensionPolicy, "extension policy");
            this.extensionPolicy = extensionPolicy;
            return this;
        }

        public Builder extensionKey(String extensionKey) {
            E.checkNotBlank(extensionKey, "extension key");
            E.checkArgument(!GraphSONTokens.ELEMENT_FIELDS.contains(
                            extensionKey),
                            "The extension key can't be the element " +
                            "field '%s'", extensionKey);
            this.extensionKey = extensionKey;
            return this;
        }

        /**
         * Set the deepest path, in segments from the document root, that
         * a translated node may sit at.
         */
        public Builder maxDepth(int maxDepth) {
            E.checkArgument(maxDepth > 0,
                            "The max depth must be > 0, but got %s",
                            maxDepth);
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * Set the label given to elements without one, an empty or null
         * label turns the fixup off.
         */
        public Builder defaultLabel(String defaultLabel) {
            this.defaultLabel = StringUtils.isEmpty(defaultLabel) ?
                                null : defaultLabel;
            return this;
        }

        public Builder collapseSingletons(boolean collapseSingletons) {
            this.collapseSingletons = collapseSingletons;
            return this;
        }

        /**
         * Enable a fixup registered in the adapter's registry by name.
         */
        public Builder enableFixup(String name) {
            E.checkNotBlank(name, "fixup name");
            this.extraFixups.add(name);
            return this;
        }

        public TranslateOptions build() {
            return new TranslateOptions(this);
        }
    }
}
