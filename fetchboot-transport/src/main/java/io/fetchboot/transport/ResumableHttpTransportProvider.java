package io.fetchboot.transport;

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
import io.fetchboot.api.transport.Transport;
import io.fetchboot.api.transport.TransportKind;
import io.fetchboot.api.transport.TransportProvider;

/// Provider for {@link ResumableHttpTransport} instances.
@TransportKind({ResumableHttpTransport.KIND, "retrying"})
public class ResumableHttpTransportProvider implements TransportProvider {

    /// No-args constructor required for ServiceLoader
    public ResumableHttpTransportProvider() {
    }

    @Override
    public Transport create(FetchbootSettings settings) {
        return new ResumableHttpTransport(settings);
    }
}
