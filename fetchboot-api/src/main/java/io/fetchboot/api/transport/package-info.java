/// Transport SPI for single-file transfers.
///
/// A {@link io.fetchboot.api.transport.Transport} copies one remote file into a local
/// path. Implementations are registered as
/// {@link io.fetchboot.api.transport.TransportProvider} services, annotated with
/// {@link io.fetchboot.api.transport.TransportKind}, and created by kind name through
/// {@link io.fetchboot.api.transport.TransportIO}.
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
