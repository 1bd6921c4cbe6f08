/// Artifact retrieval: the download engine with its fallback transport, and the resolver
/// that turns local paths, URLs and release asset names into local files.
///
/// ```java
/// FetchbootSettings settings = FetchbootSettings.load();
/// try (DownloadEngine engine = new DownloadEngine(settings);
///      ArtifactResolver resolver = new ArtifactResolver(settings, engine)) {
///     String weights = resolver.resolvePath("yolov5s.pt", settings.repository(), settings.release());
/// }
/// ```
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
