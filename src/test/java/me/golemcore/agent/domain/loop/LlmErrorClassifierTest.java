package me.golemcore.agent.domain.loop;

import org.junit.jupiter.api.Test;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LlmErrorClassifierTest {

    public static class AuthenticationException extends RuntimeException {
        public AuthenticationException(String message) {
            super(message);
        }
    }

    public static class RateLimitError extends RuntimeException {
        public RateLimitError(String message) {
            super(message);
        }
    }

    public static class HttpStatusException extends RuntimeException {
        private final int status;

        public HttpStatusException(int status) {
            super("HTTP " + status);
            this.status = status;
        }

        public int statusCode() {
            return status;
        }
    }

    @Test
    void shouldClassifyAuthenticationByExceptionName() {
        Throwable error = new AuthenticationException("Incorrect API key provided: sk-...");

        assertEquals(LlmErrorClassifier.Category.AUTHENTICATION, LlmErrorClassifier.classify(error));
        assertEquals(LlmErrorClassifier.AUTHENTICATION_MESSAGE, LlmErrorClassifier.toUserMessage(error));
    }

    @Test
    void shouldClassifyRateLimitByExceptionName() {
        assertEquals(LlmErrorClassifier.RATE_LIMIT_MESSAGE,
                LlmErrorClassifier.toUserMessage(new RateLimitError("slow down")));
    }

    @Test
    void shouldClassifyByHttpStatusCode() {
        assertEquals(LlmErrorClassifier.Category.AUTHENTICATION,
                LlmErrorClassifier.classify(new HttpStatusException(401)));
        assertEquals(LlmErrorClassifier.Category.AUTHENTICATION,
                LlmErrorClassifier.classify(new HttpStatusException(403)));
        assertEquals(LlmErrorClassifier.Category.RATE_LIMIT,
                LlmErrorClassifier.classify(new HttpStatusException(429)));
        assertEquals(LlmErrorClassifier.Category.GENERIC,
                LlmErrorClassifier.classify(new HttpStatusException(500)));
    }

    @Test
    void shouldClassifyNetworkFailureInCauseChain() {
        Throwable error = new IllegalStateException("request failed",
                new IOException("io", new ConnectException("Connection refused")));

        assertEquals(LlmErrorClassifier.Category.CONNECTIVITY, LlmErrorClassifier.classify(error));
        assertEquals(LlmErrorClassifier.CONNECTIVITY_MESSAGE, LlmErrorClassifier.toUserMessage(error));
    }

    @Test
    void shouldNotClassifyByMessageText() {
        Throwable error = new IllegalStateException("invalid api key and rate limit");

        assertEquals(LlmErrorClassifier.Category.GENERIC, LlmErrorClassifier.classify(error));
    }

    @Test
    void shouldFormatGenericErrorWithFirstLineOnly() {
        Throwable error = new IllegalArgumentException("bad request\n  at some.Frame");

        assertEquals("Error (IllegalArgumentException): bad request", LlmErrorClassifier.toUserMessage(error));
    }

    @Test
    void shouldUnwrapCompletionException() {
        Throwable error = new CompletionException(new UnsupportedOperationException("no tools"));

        assertEquals("Error (UnsupportedOperationException): no tools", LlmErrorClassifier.toUserMessage(error));
    }

    @Test
    void shouldUnwrapReactorWrapperAroundCheckedError() {
        RuntimeException error = assertThrows(RuntimeException.class,
                () -> Flux.<String>error(new IOException("disk said no")).blockLast());

        assertEquals("Error (IOException): disk said no", LlmErrorClassifier.toUserMessage(error));
    }

    @Test
    void shouldUnwrapReactorWrapperInsideCompletionException() {
        Throwable error = new CompletionException(Exceptions.propagate(new IOException("disk said no")));

        assertEquals("Error (IOException): disk said no", LlmErrorClassifier.toUserMessage(error));
    }

    @Test
    void shouldHandleMissingMessage() {
        assertEquals("Error (NullPointerException): no details",
                LlmErrorClassifier.toUserMessage(new NullPointerException()));
    }
}
