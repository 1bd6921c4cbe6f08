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
import io.fetchboot.transport.HttpClients;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/// URL helpers used while resolving artifacts.
public final class Urls {
    private static final Logger logger = LogManager.getLogger(Urls.class);

    private static final OkHttpClient SHARED_CLIENT = HttpClients.create(FetchbootSettings.defaults());

    private Urls() {
    }

    /// @param spec the text to check
    /// @return true if the text parses as a URI with both a scheme and a host
    public static boolean isUrl(String spec) {
        return isUrl(spec, false);
    }

    /// Checks whether the text is a URL, and optionally whether it answers online.
    ///
    /// @param spec the text to check
    /// @param check also require that a HEAD request to the URL answers 200
    /// @return true if the text is a URL and, when checked, exists online
    public static boolean isUrl(String spec, boolean check) {
        return isUrl(spec, check, SHARED_CLIENT);
    }

    /// @see #isUrl(String, boolean)
    public static boolean isUrl(String spec, boolean check, OkHttpClient client) {
        if (spec == null || spec.isBlank()) {
            return false;
        }
        URI uri;
        try {
            uri = new URI(spec.trim());
        } catch (URISyntaxException e) {
            return false;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return false;
        }
        if (!check) {
            return true;
        }
        Request request = new Request.Builder().url(uri.toString()).head().build();
        try (Response response = client.newCall(request).execute()) {
            return response.code() == 200;
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("Online check of {} failed: {}", spec, e.getMessage());
            return false;
        }
    }

    /// @param url the URL to ask
    /// @return the `Content-Length` the URL reports for a HEAD request, or -1 if unknown
    public static long contentLength(String url) {
        return contentLength(url, SHARED_CLIENT);
    }

    /// @see #contentLength(String)
    public static long contentLength(String url, OkHttpClient client) {
        Request request;
        try {
            request = new Request.Builder().url(url).head().build();
        } catch (IllegalArgumentException e) {
            logger.debug("Not a URL: {}", url);
            return -1;
        }
        try (Response response = client.newCall(request).execute()) {
            String length = response.header("Content-Length");
            return length == null ? -1 : Long.parseLong(length.trim());
        } catch (IOException | NumberFormatException e) {
            logger.debug("Unable to read Content-Length of {}: {}", url, e.getMessage());
            return -1;
        }
    }

    /// Derives a local file name from a URL: percent-decoded, last path segment, query removed.
    /// `https://host/a/b/my%20model.pt?auth=1` becomes `my model.pt`.
    ///
    /// @param url the URL
    /// @return the file name
    public static String localName(String url) {
        String name;
        try {
            name = URLDecoder.decode(url.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            logger.debug("Leaving malformed escapes of {} undecoded", url);
            name = url;
        }
        int query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }
        while (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
        }
        int slash = name.lastIndexOf('/');
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    /// Repairs `http:/host` into `http://host`, the form a URL takes after passing through a
    /// path normalizer.
    ///
    /// @param spec an http or https URL, possibly with a collapsed double slash
    /// @return the URL with `://` after the scheme
    public static String repairScheme(String spec) {
        for (String scheme : new String[]{"http:", "https:"}) {
            if (spec.startsWith(scheme + "/") && !spec.startsWith(scheme + "//")) {
                return scheme + "//" + spec.substring(scheme.length() + 1);
            }
        }
        return spec;
    }

    /// @param spec the text to check
    /// @return true if the text starts like an http or https URL, including the collapsed form
    public static boolean hasHttpScheme(String spec) {
        return spec.startsWith("http:/") || spec.startsWith("https:/");
    }
}
