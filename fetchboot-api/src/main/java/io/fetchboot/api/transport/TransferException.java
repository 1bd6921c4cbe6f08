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

import java.io.IOException;

/// Signals that a transport gave up on a transfer, possibly after several attempts.
public class TransferException extends IOException {

    private final int attempts;

    /// @param message description of the failure
    /// @param attempts how many attempts were made before giving up
    /// @param cause the failure of the last attempt, may be null
    public TransferException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /// @return how many attempts were made before giving up
    public int getAttempts() {
        return attempts;
    }
}
