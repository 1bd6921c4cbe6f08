/// OkHttp based transports.
///
/// ## Key Components
///
/// - {@link io.fetchboot.transport.NativeHttpTransport}: single GET, the primary transport
/// - {@link io.fetchboot.transport.ResumableHttpTransport}: ranged resume with a retry budget,
///   the fallback transport
/// - {@link io.fetchboot.transport.HttpClients}: shared client construction
///
/// ## Service Provider
///
/// Both transports are registered as {@link io.fetchboot.api.transport.TransportProvider}
/// services and are created by kind name through
/// {@link io.fetchboot.api.transport.TransportIO}.
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
