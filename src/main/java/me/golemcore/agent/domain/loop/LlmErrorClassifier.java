package me.golemcore.agent.domain.loop;

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

import reactor.core.Exceptions;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps model-call failures to the short message shown to the user in place of
 * a reply.
 *
 * <p>
 * Classification walks the cause chain and matches structured signals only:
 * exception class names of common provider SDKs, an HTTP status exposed through
 * a {@code statusCode()} accessor, and JDK network exceptions. Free-form error
 * text is not parsed.
 */
public final class LlmErrorClassifier {

    public static final String AUTHENTICATION_MESSAGE = "Error: invalid API key. Check the model provider credentials.";
    public static final String RATE_LIMIT_MESSAGE = "Error: rate limit reached. Try again in a moment.";
    public static final String CONNECTIVITY_MESSAGE = "Error: could not reach the model API. "
            + "Check your network connection and endpoint settings.";

    public enum Category {
        AUTHENTICATION, RATE_LIMIT, CONNECTIVITY, GENERIC
    }

    private static final Set<String> AUTHENTICATION_CLASSES = Set.of(
            "AuthenticationException", "AuthenticationError", "PermissionDeniedError");
    private static final Set<String> RATE_LIMIT_CLASSES = Set.of(
            "RateLimitException", "RateLimitError");
    private static final Set<String> CONNECTIVITY_CLASSES = Set.of(
            "TimeoutException", "APIConnectionError", "APITimeoutError", "UnresolvedModelServerException");

    private LlmErrorClassifier() {
    }

    public static Category classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            Category category = classifyOne(current);
            if (category != Category.GENERIC) {
                return category;
            }
            current = current.getCause();
        }
        return Category.GENERIC;
    }

    /**
     * Returns the user-facing message for a failed model call.
     */
    public static String toUserMessage(Throwable throwable) {
        return switch (classify(throwable)) {
        case AUTHENTICATION -> AUTHENTICATION_MESSAGE;
        case RATE_LIMIT -> RATE_LIMIT_MESSAGE;
        case CONNECTIVITY -> CONNECTIVITY_MESSAGE;
        case GENERIC -> genericMessage(unwrap(throwable));
        };
    }

    private static Category classifyOne(Throwable throwable) {
        if (throwable instanceof ConnectException
                || throwable instanceof UnknownHostException
                || throwable instanceof SocketTimeoutException
                || throwable instanceof HttpConnectTimeoutException
                || throwable instanceof HttpTimeoutException) {
            return Category.CONNECTIVITY;
        }

        String simpleName = throwable.getClass().getSimpleName();
        if (AUTHENTICATION_CLASSES.contains(simpleName)) {
            return Category.AUTHENTICATION;
        }
        if (RATE_LIMIT_CLASSES.contains(simpleName)) {
            return Category.RATE_LIMIT;
        }
        if (CONNECTIVITY_CLASSES.contains(simpleName)) {
            return Category.CONNECTIVITY;
        }

        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode != null) {
            if (statusCode == 401 || statusCode == 403) {
                return Category.AUTHENTICATION;
            }
            if (statusCode == 429) {
                return Category.RATE_LIMIT;
            }
        }
        return Category.GENERIC;
    }

    private static String genericMessage(Throwable throwable) {
        String message = throwable.getMessage();
        String firstLine = message == null || message.isBlank()
                ? "no details"
                : message.strip().lines().findFirst().orElse("").strip();
        return "Error (" + throwable.getClass().getSimpleName() + "): " + firstLine;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (true) {
            // strips Reactor's wrapper around checked errors rethrown by blocking calls
            Throwable next = Exceptions.unwrap(current);
            if (next == current
                    && (current instanceof CompletionException || current instanceof ExecutionException)) {
                next = current.getCause();
            }
            if (next == null || next == current) {
                return current;
            }
            current = next;
        }
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }
}
