package com.civica.provider;

import com.civica.model.AnalysisResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Typed result of one dispatch attempt. Failures travel as values so the
 * batching logic never unwinds through exceptions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BackendOutcome {

    public enum Status {
        /**
         * Backend answered with a usable result.
         */
        SUCCESS,
        /**
         * The backend was called and failed; counts against the circuit breaker.
         */
        FAILURE,
        /**
         * The circuit breaker refused the call.
         */
        REJECTED,
        /**
         * The call was never attempted (no credential, interrupted before admission).
         */
        UNAVAILABLE
    }

    Status status;
    AnalysisResult result;
    FailureKind failureKind;
    String message;

    public static BackendOutcome success(AnalysisResult result) {
        return new BackendOutcome(Status.SUCCESS, result, null, null);
    }

    public static BackendOutcome failure(FailureKind kind, String message) {
        return new BackendOutcome(Status.FAILURE, null, kind, message);
    }

    public static BackendOutcome rejected() {
        return new BackendOutcome(Status.REJECTED, null, FailureKind.CIRCUIT_OPEN, "Circuit breaker is open");
    }

    public static BackendOutcome unavailable(FailureKind kind, String message) {
        return new BackendOutcome(Status.UNAVAILABLE, null, kind, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
