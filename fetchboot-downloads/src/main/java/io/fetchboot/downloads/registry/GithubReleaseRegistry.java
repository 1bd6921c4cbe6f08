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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fetchboot.api.config.FetchbootSettings;
import io.fetchboot.transport.HttpClients;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Reads release descriptions from a GitHub style REST API.
///
/// Requests `<apiBase>/repos/<repository>/releases/tags/<tag>`, or
/// `<apiBase>/repos/<repository>/releases/latest`, and reads `tag_name` and
/// `assets[].name` from the JSON answer.
public class GithubReleaseRegistry implements ReleaseRegistry, Closeable {
    private static final Logger logger = LogManager.getLogger(GithubReleaseRegistry.class);

    private final String apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    /// @param settings the API base URL and HTTP timeouts
    public GithubReleaseRegistry(FetchbootSettings settings) {
        this(settings.apiBase(), HttpClients.create(settings));
    }

    /// @param apiBase the API base URL, without a trailing slash
    /// @param client the HTTP client to use
    public GithubReleaseRegistry(String apiBase, OkHttpClient client) {
        this.apiBase = apiBase;
        this.client = client;
    }

    @Override
    public ReleaseInfo lookup(String repository, String tag) throws IOException {
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("repository must not be blank");
        }
        String url = releaseUrl(repository, tag);
        logger.debug("Fetching release metadata from {}", url);

        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json")
                .get()
                .build();
        try (Response response = client.newCall(request).execute()) {
            if (response.code() != 200) {
                throw new IOException("HTTP " + response.code() + " error fetching release metadata from " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty release metadata from " + url);
            }
            return parse(body.string(), url);
        }
    }

    String releaseUrl(String repository, String tag) {
        String version = tag == null || tag.isBlank() || LATEST.equals(tag) ? LATEST : "tags/" + tag;
        return apiBase + "/repos/" + repository + "/releases/" + version;
    }

    ReleaseInfo parse(String json, String url) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed release metadata from " + url + ": " + e.getOriginalMessage(), e);
        }
        JsonNode tagNode = root == null ? null : root.get("tag_name");
        if (tagNode == null || !tagNode.isTextual() || tagNode.asText().isBlank()) {
            throw new IOException("Release metadata from " + url + " has no tag_name");
        }
        JsonNode assetsNode = root.path("assets");
        if (!assetsNode.isArray()) {
            throw new IOException("Release metadata from " + url + " has no assets list");
        }
        List<String> names = new ArrayList<>();
        for (JsonNode asset : assetsNode) {
            String name = asset.path("name").asText("");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return new ReleaseInfo(tagNode.asText(), names);
    }

    @Override
    public void close() {
        HttpClients.shutdown(client);
    }
}
