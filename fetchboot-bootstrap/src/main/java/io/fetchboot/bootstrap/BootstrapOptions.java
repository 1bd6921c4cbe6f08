package io.fetchboot.bootstrap;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.fetchboot.api.dataset.CacheMode;

import java.util.HashMap;
import java.util.Map;

/// The optional settings of a bootstrap, with the defaults of a plain evaluation run.
public final class BootstrapOptions {
    private final Map<String, Double> hyperparameters;
    private final boolean augment;
    private final CacheMode cache;
    private final double pad;
    private final boolean rect;
    private final boolean imageWeights;
    private final boolean quad;
    private final boolean shuffle;
    private final boolean singleClass;
    private final boolean ignoreCache;
    private final String prefix;
    private final long seed;

    private BootstrapOptions(Builder builder) {
        this.hyperparameters = Map.copyOf(builder.hyperparameters);
        this.augment = builder.augment;
        this.cache = builder.cache;
        this.pad = builder.pad;
        this.rect = builder.rect;
        this.imageWeights = builder.imageWeights;
        this.quad = builder.quad;
        this.shuffle = builder.shuffle;
        this.singleClass = builder.singleClass;
        this.ignoreCache = builder.ignoreCache;
        this.prefix = builder.prefix;
        this.seed = builder.seed;
    }

    /// @return options with every default
    public static BootstrapOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Double> hyperparameters() {
        return hyperparameters;
    }

    public boolean augment() {
        return augment;
    }

    public CacheMode cache() {
        return cache;
    }

    public double pad() {
        return pad;
    }

    public boolean rect() {
        return rect;
    }

    public boolean imageWeights() {
        return imageWeights;
    }

    public boolean quad() {
        return quad;
    }

    public boolean shuffle() {
        return shuffle;
    }

    public boolean singleClass() {
        return singleClass;
    }

    public boolean ignoreCache() {
        return ignoreCache;
    }

    public String prefix() {
        return prefix;
    }

    public long seed() {
        return seed;
    }

    @Override
    public String toString() {
        return "BootstrapOptions{rect=" + rect + ", shuffle=" + shuffle + ", quad=" + quad
                + ", imageWeights=" + imageWeights + ", cache=" + cache + ", augment=" + augment + "}";
    }

    public static final class Builder {
        private final Map<String, Double> hyperparameters = new HashMap<>();
        private boolean augment;
        private CacheMode cache = CacheMode.NONE;
        private double pad;
        private boolean rect;
        private boolean imageWeights;
        private boolean quad;
        private boolean shuffle;
        private boolean singleClass;
        private boolean ignoreCache;
        private String prefix = "";
        private long seed;

        private Builder() {
        }

        public Builder hyperparameters(Map<String, Double> hyperparameters) {
            this.hyperparameters.clear();
            this.hyperparameters.putAll(hyperparameters);
            return this;
        }

        public Builder augment(boolean augment) {
            this.augment = augment;
            return this;
        }

        public Builder cache(CacheMode cache) {
            if (cache == null) {
                throw new IllegalArgumentException("cache mode must not be null");
            }
            this.cache = cache;
            return this;
        }

        public Builder pad(double pad) {
            this.pad = pad;
            return this;
        }

        /// Rectangular batches: samples of similar aspect ratio batched together, in a fixed order.
        public Builder rect(boolean rect) {
            this.rect = rect;
            return this;
        }

        public Builder imageWeights(boolean imageWeights) {
            this.imageWeights = imageWeights;
            return this;
        }

        public Builder quad(boolean quad) {
            this.quad = quad;
            return this;
        }

        public Builder shuffle(boolean shuffle) {
            this.shuffle = shuffle;
            return this;
        }

        public Builder singleClass(boolean singleClass) {
            this.singleClass = singleClass;
            return this;
        }

        public Builder ignoreCache(boolean ignoreCache) {
            this.ignoreCache = ignoreCache;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix == null ? "" : prefix;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public BootstrapOptions build() {
            return new BootstrapOptions(this);
        }
    }
}
