package com.civica.provider;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Why a dispatch produced no backend result.
 */
public enum FailureKind {
    TIMEOUT,
    HTTP_4XX,
    HTTP_5XX,
    TRANSPORT,
    MALFORMED_RESPONSE,
    CIRCUIT_OPEN,
    NO_CREDENTIAL,
    INTERRUPTED,
    UNKNOWN;

    /**
     * Map an exception raised by a backend call to a failure kind.
     */
    public static FailureKind classify(Throwable error) {
        Throwable t = Exceptions.unwrap(error);
        if (t instanceof MalformedResponseException) {
            return MALFORMED_RESPONSE;
        }
        if (t instanceof WebClientResponseException responseError) {
            return responseError.getStatusCode().is5xxServerError() ? HTTP_5XX : HTTP_4XX;
        }
        if (t instanceof InterruptedException) {
            return INTERRUPTED;
        }
        if (isTimeout(t)) {
            return TIMEOUT;
        }
        if (t instanceof WebClientRequestException || t instanceof IOException) {
            return TRANSPORT;
        }
        return UNKNOWN;
    }

    private static boolean isTimeout(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            // Netty's ReadTimeoutException arrives wrapped in a WebClientRequestException
            if (cur instanceof TimeoutException || cur.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
        }
        return false;
    }
}
