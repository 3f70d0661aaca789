package me.personabot.domain.service;

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

import me.personabot.domain.exception.UpstreamException;
import me.personabot.domain.exception.UpstreamException.Failure;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Maps language model failures to the user-facing {@link Failure} taxonomy.
 *
 * <p>
 * Classification walks the cause chain and trusts, in order: an already
 * classified {@link UpstreamException}, known langchain4j exception types
 * (matched by class name so the domain does not depend on the client library),
 * the HTTP status carried by the exception, and finally a few well-known
 * provider message fragments.
 */
public final class UpstreamErrorClassifier {

    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String QUOTA_EXCEEDED = "llm.quota_exceeded";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String CONTENT_FILTERED = "llm.content_filtered";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String MODEL_NOT_FOUND = "llm.model_not_found";
    public static final String INTERNAL_SERVER = "llm.internal_server";
    public static final String NETWORK = "llm.network";
    public static final String EMPTY_RESPONSE = "llm.empty_response";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private UpstreamErrorClassifier() {
    }

    /**
     * Classify a failure into an {@link UpstreamException}. An
     * {@code UpstreamException} found in the cause chain is returned as is.
     */
    public static UpstreamException classify(Throwable throwable) {
        if (throwable == null) {
            return new UpstreamException(Failure.UNAVAILABLE, UNKNOWN, "Unknown upstream failure", null);
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof UpstreamException upstream) {
                return upstream;
            }

            String code = classifyKnownThrowable(current);
            if (UNKNOWN.equals(code)) {
                code = classifyFromMessage(current.getMessage());
            }
            if (!UNKNOWN.equals(code)) {
                return new UpstreamException(failureOf(code), code, describe(current), throwable);
            }
            current = current.getCause();
        }
        return new UpstreamException(Failure.UNAVAILABLE, UNKNOWN, describe(throwable), throwable);
    }

    /**
     * User-facing category of a classification code.
     */
    public static Failure failureOf(String code) {
        if (code == null) {
            return Failure.UNAVAILABLE;
        }
        return switch (code) {
        case REQUEST_TIMEOUT -> Failure.TIMEOUT;
        case AUTHENTICATION -> Failure.AUTH;
        case RATE_LIMIT, QUOTA_EXCEEDED -> Failure.QUOTA;
        case INVALID_REQUEST, CONTENT_FILTERED, CONTEXT_LENGTH_EXCEEDED -> Failure.INVALID_INPUT;
        default -> Failure.UNAVAILABLE;
        };
    }

    public static boolean isTransient(Failure failure) {
        return failure == Failure.UNAVAILABLE || failure == Failure.TIMEOUT;
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return throwable instanceof IOException ? NETWORK : UNKNOWN;
        }

        return switch (className) {
        case CLASS_RATE_LIMIT_EXCEPTION -> RATE_LIMIT;
        case CLASS_TIMEOUT_EXCEPTION -> REQUEST_TIMEOUT;
        case CLASS_AUTHENTICATION_EXCEPTION -> AUTHENTICATION;
        case CLASS_INVALID_REQUEST_EXCEPTION -> INVALID_REQUEST;
        case CLASS_MODEL_NOT_FOUND_EXCEPTION -> MODEL_NOT_FOUND;
        case CLASS_CONTENT_FILTERED_EXCEPTION -> CONTENT_FILTERED;
        case CLASS_INTERNAL_SERVER_EXCEPTION -> INTERNAL_SERVER;
        case CLASS_HTTP_EXCEPTION -> classifyByStatus(readHttpStatusCode(throwable));
        default -> UNKNOWN;
        };
    }

    static String classifyByStatus(Integer statusCode) {
        if (statusCode == null) {
            return UNKNOWN;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return REQUEST_TIMEOUT;
        }
        if (statusCode >= 500) {
            return INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return UNKNOWN;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("insufficient_quota") || normalized.contains("exceeded your current quota")) {
            return QUOTA_EXCEEDED;
        }
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (normalized.contains("timed out") || normalized.contains("timeout")) {
            return REQUEST_TIMEOUT;
        }
        return UNKNOWN;
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null && !message.isBlank() ? message : throwable.getClass().getSimpleName();
    }
}
