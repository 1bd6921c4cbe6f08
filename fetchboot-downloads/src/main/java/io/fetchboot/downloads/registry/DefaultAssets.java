package io.fetchboot.downloads.registry;

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

import java.util.ArrayList;
import java.util.List;

/// The asset names assumed for a release when no registry can be reached.
public final class DefaultAssets {

    private DefaultAssets() {
    }

    /// Builds `prefix + size + variant + extension` for every size and variant, sizes outermost.
    /// With default settings this is `yolov5n.pt, yolov5n6.pt, yolov5n-cls.pt, yolov5n-seg.pt,
    /// yolov5s.pt, ...`.
    ///
    /// @param settings the asset prefix, sizes, variants and extension
    /// @return the asset names
    public static List<String> names(FetchbootSettings settings) {
        List<String> names = new ArrayList<>();
        for (String size : settings.assetSizes()) {
            for (String variant : settings.assetVariants()) {
                names.add(settings.assetPrefix() + size + variant + settings.assetExtension());
            }
        }
        return List.copyOf(names);
    }
}
