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
 * Classified failure of the language model backend.
 */
public class UpstreamException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * What the upstream signalled. Only {@link #UNAVAILABLE} and
     * {@link #TIMEOUT} are transient.
     */
    public enum Failure {
        AUTH,
        QUOTA,
        INVALID_INPUT,
        UNAVAILABLE,
        TIMEOUT
    }

    private final Failure failure;
    private final String code;

    public UpstreamException(Failure failure, String code, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.code = code;
    }

    public Failure getFailure() {
        return failure;
    }

    public String getCode() {
        return code;
    }
}
