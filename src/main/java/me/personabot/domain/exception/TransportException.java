package me.personabot.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * A reply could not be delivered to the chat platform.
 */
public class TransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean retryable;
    private final int status;

    public TransportException(String message, int status, boolean retryable) {
        super(message);
        this.status = status;
        this.retryable = retryable;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.retryable = true;
    }

    /**
     * Whether a second attempt may succeed (network error, 429 or 5xx).
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * HTTP status of the failed call, {@code -1} for network errors.
     */
    public int getStatus() {
        return status;
    }
}
