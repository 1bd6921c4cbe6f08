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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class DefaultAssetsTest {

    @Test
    public void testDefaultCrossProduct() {
        List<String> names = DefaultAssets.names(FetchbootSettings.defaults());
        assertThat(names).hasSize(20);
        assertThat(names.subList(0, 4)).containsExactly("yolov5n.pt", "yolov5n6.pt", "yolov5n-cls.pt", "yolov5n-seg.pt");
        assertThat(names).contains("yolov5s.pt", "yolov5x6.pt", "yolov5l-seg.pt");
    }

    @Test
    public void testFollowsConfiguredNaming() {
        FetchbootSettings settings = FetchbootSettings.builder()
            .assetPrefix("det-")
            .assetSizes(List.of("a", "b"))
            .assetVariants(List.of(""))
            .assetExtension(".onnx")
            .build();
        assertThat(DefaultAssets.names(settings)).containsExactly("det-a.onnx", "det-b.onnx");
    }
}
