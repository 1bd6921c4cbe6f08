package io.fetchboot.api.config;

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

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Settings shared by the transports, the download engine, the artifact resolver and the
/// dataset bootstrap.
///
/// Settings are read from `~/.config/fetchboot/settings.yaml` when present, otherwise the
/// built-in defaults apply. The file holds nested maps:
///
/// ```yaml
/// registry:
///   api-base: https://api.github.com
///   download-base: https://github.com
///   repository: ultralytics/yolov5
///   release: v7.0
/// assets:
///   prefix: yolov5
///   sizes: [n, s, m, l, x]
///   variants: ["", "6", "-cls", "-seg"]
///   extension: .pt
/// download:
///   min-bytes: 100000
/// transport:
///   primary: native
///   fallback: resumable
///   retries: 9
///   retry-backoff-millis: 1000
///   connect-timeout-seconds: 10
///   read-timeout-seconds: 30
/// bootstrap:
///   worker-ceiling: 8
///   barrier-timeout-seconds: 0
/// ```
///
/// Any key may be omitted. A barrier timeout of zero means followers wait indefinitely.
public final class FetchbootSettings {

    /// Location of the settings file below the home directory
    public static final String DEFAULT_CONFIG_DIR = "~/.config/fetchboot";
    /// Settings file name inside the configuration directory
    public static final String SETTINGS_FILE = "settings.yaml";

    private final String apiBase;
    private final String downloadBase;
    private final String repository;
    private final String release;
    private final String assetPrefix;
    private final List<String> assetSizes;
    private final List<String> assetVariants;
    private final String assetExtension;
    private final long minBytes;
    private final String primaryTransport;
    private final String fallbackTransport;
    private final int retries;
    private final Duration retryBackoff;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final int workerCeiling;
    private final Duration barrierTimeout;

    private FetchbootSettings(Builder b) {
        this.apiBase = stripTrailingSlash(b.apiBase);
        this.downloadBase = stripTrailingSlash(b.downloadBase);
        this.repository = b.repository;
        this.release = b.release;
        this.assetPrefix = b.assetPrefix;
        this.assetSizes = List.copyOf(b.assetSizes);
        this.assetVariants = List.copyOf(b.assetVariants);
        this.assetExtension = b.assetExtension;
        this.minBytes = b.minBytes;
        this.primaryTransport = b.primaryTransport;
        this.fallbackTransport = b.fallbackTransport;
        this.retries = b.retries;
        this.retryBackoff = b.retryBackoff;
        this.connectTimeout = b.connectTimeout;
        this.readTimeout = b.readTimeout;
        this.workerCeiling = b.workerCeiling;
        this.barrierTimeout = b.barrierTimeout;
    }

    /// @return the built-in defaults
    public static FetchbootSettings defaults() {
        return builder().build();
    }

    /// @return a builder initialized with the defaults
    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder initialized with the values of this instance
    public Builder toBuilder() {
        Builder b = new Builder();
        b.apiBase = apiBase;
        b.downloadBase = downloadBase;
        b.repository = repository;
        b.release = release;
        b.assetPrefix = assetPrefix;
        b.assetSizes = new ArrayList<>(assetSizes);
        b.assetVariants = new ArrayList<>(assetVariants);
        b.assetExtension = assetExtension;
        b.minBytes = minBytes;
        b.primaryTransport = primaryTransport;
        b.fallbackTransport = fallbackTransport;
        b.retries = retries;
        b.retryBackoff = retryBackoff;
        b.connectTimeout = connectTimeout;
        b.readTimeout = readTimeout;
        b.workerCeiling = workerCeiling;
        b.barrierTimeout = barrierTimeout;
        return b;
    }

    /// Loads settings from the default configuration directory, falling back to the defaults
    /// when no settings file exists there.
    /// @return the effective settings
    public static FetchbootSettings load() {
        return load(expandTilde(DEFAULT_CONFIG_DIR).resolve(SETTINGS_FILE));
    }

    /// Loads settings from a YAML file, falling back to the defaults when it does not exist.
    ///
    /// @param settingsFile the YAML file to read
    /// @return the effective settings
    /// @throws UncheckedIOException if the file exists but cannot be read
    /// @throws IllegalArgumentException if the file does not contain a map at the top level
    public static FetchbootSettings load(Path settingsFile) {
        if (!Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            return parse(Files.readString(settingsFile));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings from " + settingsFile, e);
        }
    }

    /// Parses settings from YAML text, filling missing keys with the defaults.
    ///
    /// @param yamlText the YAML document
    /// @return the effective settings
    public static FetchbootSettings parse(String yamlText) {
        Load yaml = new Load(LoadSettings.builder().build());
        Object loaded = yaml.loadFromString(yamlText);
        Builder b = builder();
        if (loaded == null) {
            return b.build();
        }
        if (!(loaded instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException("settings must be a map, got " + loaded.getClass().getSimpleName());
        }

        Map<?, ?> registry = section(root, "registry");
        b.apiBase = string(registry, "api-base", b.apiBase);
        b.downloadBase = string(registry, "download-base", b.downloadBase);
        b.repository = string(registry, "repository", b.repository);
        b.release = string(registry, "release", b.release);

        Map<?, ?> assets = section(root, "assets");
        b.assetPrefix = string(assets, "prefix", b.assetPrefix);
        b.assetSizes = strings(assets, "sizes", b.assetSizes);
        b.assetVariants = strings(assets, "variants", b.assetVariants);
        b.assetExtension = string(assets, "extension", b.assetExtension);

        Map<?, ?> download = section(root, "download");
        b.minBytes = number(download, "min-bytes", b.minBytes);

        Map<?, ?> transport = section(root, "transport");
        b.primaryTransport = string(transport, "primary", b.primaryTransport);
        b.fallbackTransport = string(transport, "fallback", b.fallbackTransport);
        b.retries = (int) number(transport, "retries", b.retries);
        b.retryBackoff = Duration.ofMillis(number(transport, "retry-backoff-millis", b.retryBackoff.toMillis()));
        b.connectTimeout = Duration.ofSeconds(number(transport, "connect-timeout-seconds", b.connectTimeout.toSeconds()));
        b.readTimeout = Duration.ofSeconds(number(transport, "read-timeout-seconds", b.readTimeout.toSeconds()));

        Map<?, ?> bootstrap = section(root, "bootstrap");
        b.workerCeiling = (int) number(bootstrap, "worker-ceiling", b.workerCeiling);
        b.barrierTimeout = Duration.ofSeconds(number(bootstrap, "barrier-timeout-seconds", b.barrierTimeout.toSeconds()));
        return b.build();
    }

    private static Map<?, ?> section(Map<?, ?> root, String name) {
        Object value = root.get(name);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("settings section '" + name + "' must be a map");
    }

    private static String string(Map<?, ?> section, String key, String fallback) {
        Object value = section.get(key);
        return value == null ? fallback : value.toString();
    }

    private static long number(Map<?, ?> section, String key, long fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("settings key '" + key + "' must be a number, got '" + value + "'", e);
        }
    }

    private static List<String> strings(Map<?, ?> section, String key, List<String> fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            list.forEach(v -> result.add(v == null ? "" : v.toString()));
            return result;
        }
        if (value instanceof String s) {
            // "nsmlx" is accepted as shorthand for one size per character
            List<String> result = new ArrayList<>();
            s.chars().forEach(c -> result.add(String.valueOf((char) c)));
            return result;
        }
        throw new IllegalArgumentException("settings key '" + key + "' must be a list");
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /// Expands a leading tilde to the home directory. The `test.home.override` system
    /// property takes precedence over `user.home`.
    /// @param path the path that may start with a tilde
    /// @return the expanded path
    public static Path expandTilde(String path) {
        if (path.startsWith("~")) {
            String home = System.getProperty("test.home.override", System.getProperty("user.home"));
            return Path.of(home + path.substring(1));
        }
        return Path.of(path);
    }

    /// @return base URL of the release registry API, without trailing slash
    public String apiBase() {
        return apiBase;
    }

    /// @return base URL release assets are downloaded from, without trailing slash
    public String downloadBase() {
        return downloadBase;
    }

    /// @return the default repository identifier, as `owner/name`
    public String repository() {
        return repository;
    }

    /// @return the default release tag
    public String release() {
        return release;
    }

    /// @return prefix of the default asset names
    public String assetPrefix() {
        return assetPrefix;
    }

    /// @return the size suffix family of the default asset names
    public List<String> assetSizes() {
        return assetSizes;
    }

    /// @return the variant suffix family of the default asset names
    public List<String> assetVariants() {
        return assetVariants;
    }

    /// @return file extension of the default asset names
    public String assetExtension() {
        return assetExtension;
    }

    /// @return minimum size a downloaded artifact must exceed to be kept
    public long minBytes() {
        return minBytes;
    }

    /// @return kind name of the primary transport
    public String primaryTransport() {
        return primaryTransport;
    }

    /// @return kind name of the fallback transport
    public String fallbackTransport() {
        return fallbackTransport;
    }

    /// @return attempt budget of retrying transports
    public int retries() {
        return retries;
    }

    /// @return pause between attempts of retrying transports
    public Duration retryBackoff() {
        return retryBackoff;
    }

    /// @return connect timeout of HTTP clients
    public Duration connectTimeout() {
        return connectTimeout;
    }

    /// @return read timeout of HTTP clients
    public Duration readTimeout() {
        return readTimeout;
    }

    /// @return default upper bound of loader worker threads
    public int workerCeiling() {
        return workerCeiling;
    }

    /// @return how long barrier followers wait for the leader, zero for no limit
    public Duration barrierTimeout() {
        return barrierTimeout;
    }

    @Override
    public String toString() {
        return "FetchbootSettings{" + "apiBase='" + apiBase + '\'' + ", downloadBase='" + downloadBase + '\''
                + ", repository='" + repository + '\'' + ", release='" + release + '\'' + ", minBytes=" + minBytes
                + ", primaryTransport='" + primaryTransport + '\'' + ", fallbackTransport='" + fallbackTransport
                + '\'' + ", retries=" + retries + ", workerCeiling=" + workerCeiling + ", barrierTimeout="
                + barrierTimeout + '}';
    }

    /// Builder for {@link FetchbootSettings}, initialized with the defaults.
    public static final class Builder {
        private String apiBase = "https://api.github.com";
        private String downloadBase = "https://github.com";
        private String repository = "ultralytics/yolov5";
        private String release = "v7.0";
        private String assetPrefix = "yolov5";
        private List<String> assetSizes = new ArrayList<>(List.of("n", "s", "m", "l", "x"));
        private List<String> assetVariants = new ArrayList<>(List.of("", "6", "-cls", "-seg"));
        private String assetExtension = ".pt";
        private long minBytes = 100_000L;
        private String primaryTransport = "native";
        private String fallbackTransport = "resumable";
        private int retries = 9;
        private Duration retryBackoff = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int workerCeiling = 8;
        private Duration barrierTimeout = Duration.ZERO;

        private Builder() {
        }

        public Builder apiBase(String apiBase) {
            this.apiBase = Objects.requireNonNull(apiBase, "apiBase");
            return this;
        }

        public Builder downloadBase(String downloadBase) {
            this.downloadBase = Objects.requireNonNull(downloadBase, "downloadBase");
            return this;
        }

        public Builder repository(String repository) {
            this.repository = Objects.requireNonNull(repository, "repository");
            return this;
        }

        public Builder release(String release) {
            this.release = Objects.requireNonNull(release, "release");
            return this;
        }

        public Builder assetPrefix(String assetPrefix) {
            this.assetPrefix = Objects.requireNonNull(assetPrefix, "assetPrefix");
            return this;
        }

        public Builder assetSizes(List<String> assetSizes) {
            this.assetSizes = new ArrayList<>(assetSizes);
            return this;
        }

        public Builder assetVariants(List<String> assetVariants) {
            this.assetVariants = new ArrayList<>(assetVariants);
            return this;
        }

        public Builder assetExtension(String assetExtension) {
            this.assetExtension = Objects.requireNonNull(assetExtension, "assetExtension");
            return this;
        }

        public Builder minBytes(long minBytes) {
            this.minBytes = minBytes;
            return this;
        }

        public Builder primaryTransport(String primaryTransport) {
            this.primaryTransport = Objects.requireNonNull(primaryTransport, "primaryTransport");
            return this;
        }

        public Builder fallbackTransport(String fallbackTransport) {
            this.fallbackTransport = Objects.requireNonNull(fallbackTransport, "fallbackTransport");
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
            return this;
        }

        public Builder workerCeiling(int workerCeiling) {
            this.workerCeiling = workerCeiling;
            return this;
        }

        public Builder barrierTimeout(Duration barrierTimeout) {
            this.barrierTimeout = Objects.requireNonNull(barrierTimeout, "barrierTimeout");
            return this;
        }

        /// @return the settings
        /// @throws IllegalArgumentException if a numeric setting is out of range
        public FetchbootSettings build() {
            if (minBytes < 0) {
                throw new IllegalArgumentException("min-bytes cannot be negative: " + minBytes);
            }
            if (retries < 1) {
                throw new IllegalArgumentException("retries must be at least 1: " + retries);
            }
            if (workerCeiling < 0) {
                throw new IllegalArgumentException("worker-ceiling cannot be negative: " + workerCeiling);
            }
            if (retryBackoff.isNegative() || barrierTimeout.isNegative()) {
                throw new IllegalArgumentException("durations cannot be negative");
            }
            return new FetchbootSettings(this);
        }
    }
}
