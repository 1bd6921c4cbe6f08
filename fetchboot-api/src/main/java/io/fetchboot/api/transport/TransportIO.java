package io.fetchboot.api.transport;

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
import java.util.ServiceLoader;

/// Factory for {@link Transport} instances selected by kind name.
///
/// This factory uses ServiceLoader to discover the available transport providers and
/// selects the implementation whose {@link TransportKind} annotation names the requested
/// kind. Providers are not asked to create anything until a matching kind is found.
///
/// ```java
/// Transport primary = TransportIO.create("native", settings);
/// Transport fallback = TransportIO.create(settings.fallbackTransport(), settings);
/// ```
public class TransportIO {

    private TransportIO() {
    }

    /// Creates the transport registered under the given kind.
    ///
    /// @param kind the kind name, matched case-insensitively
    /// @param settings settings passed to the provider
    /// @return a new transport
    /// @throws IllegalArgumentException if the kind is blank or no provider handles it
    public static Transport create(String kind, FetchbootSettings settings) {
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("transport kind cannot be null or empty");
        }
        ServiceLoader<TransportProvider> loader = ServiceLoader.load(TransportProvider.class);
        for (TransportProvider provider : loader) {
            TransportKind annotation = provider.getClass().getAnnotation(TransportKind.class);
            if (annotation == null) {
                continue;
            }
            for (String supported : annotation.value()) {
                if (supported.equalsIgnoreCase(kind.trim())) {
                    return provider.create(settings);
                }
            }
        }
        throw new IllegalArgumentException(
                "No transport provider found for kind '" + kind + "', known kinds: " + knownKinds());
    }

    /// @return every kind name announced by the providers on the class path
    public static List<String> knownKinds() {
        List<String> kinds = new ArrayList<>();
        for (TransportProvider provider : ServiceLoader.load(TransportProvider.class)) {
            TransportKind annotation = provider.getClass().getAnnotation(TransportKind.class);
            if (annotation != null) {
                kinds.addAll(List.of(annotation.value()));
            }
        }
        return kinds;
    }
}
