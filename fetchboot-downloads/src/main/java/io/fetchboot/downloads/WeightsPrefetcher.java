package io.fetchboot.downloads;

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

import io.fetchboot.api.config.FetchbootSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Resolves the default model set ahead of time, so later runs find every model locally.
///
/// The set is one `prefix + size + extension` asset per configured size. The `6` variants
/// trained at a larger image size are added when `FETCHBOOT_DOWNLOAD_LARGE_MODELS` is set
/// to a non-empty value.
public class WeightsPrefetcher {
    private static final Logger logger = LogManager.getLogger(WeightsPrefetcher.class);

    /// Environment variable that adds the large image size variants
    public static final String LARGE_MODELS_ENV = "FETCHBOOT_DOWNLOAD_LARGE_MODELS";

    private static final String LARGE_VARIANT = "6";

    private final ArtifactResolver resolver;
    private final FetchbootSettings settings;
    private final boolean includeLarge;

    /// @param resolver the resolver every asset goes through
    /// @param settings asset prefix, sizes and extension
    /// @param includeLarge also fetch the large image size variants
    public WeightsPrefetcher(ArtifactResolver resolver, FetchbootSettings settings, boolean includeLarge) {
        this.resolver = resolver;
        this.settings = settings;
        this.includeLarge = includeLarge;
    }

    /// @param resolver the resolver every asset goes through
    /// @param settings asset prefix, sizes and extension
    /// @return a prefetcher that includes the large variants if the environment asks for them
    public static WeightsPrefetcher fromEnvironment(ArtifactResolver resolver, FetchbootSettings settings) {
        String large = System.getenv(LARGE_MODELS_ENV);
        return new WeightsPrefetcher(resolver, settings, large != null && !large.isEmpty());
    }

    /// @return the asset names this prefetcher resolves, in order
    public List<String> assetNames() {
        List<String> names = new ArrayList<>();
        for (String size : settings.assetSizes()) {
            names.add(settings.assetPrefix() + size + settings.assetExtension());
        }
        // large variants follow every base size
        if (includeLarge) {
            for (String size : settings.assetSizes()) {
                names.add(settings.assetPrefix() + size + LARGE_VARIANT + settings.assetExtension());
            }
        }
        return names;
    }

    /// Resolves every asset of the set, continuing past failures.
    /// @return one result per asset, in order
    public List<ResolutionResult> prefetch() {
        List<ResolutionResult> results = new ArrayList<>();
        for (String name : assetNames()) {
            ResolutionResult result = resolver.resolve(name);
            if (!result.isAvailable()) {
                logger.warn("Unable to prefetch {}: {}", name, result.status());
            }
            results.add(result);
        }
        long available = results.stream().filter(ResolutionResult::isAvailable).count();
        logger.info("Prefetched {}/{} model files", available, results.size());
        return results;
    }
}
