package com.xammer.posture.service;

import com.xammer.posture.domain.FailureCategory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps an operational error raised while scanning onto a {@link FailureCategory}
 * and a printable detail string.
 */
public class ScanFailureClassifier {

    private static final Set<String> ACCESS_DENIED_CODES = Set.of(
            "AccessDenied", "AccessDeniedException", "UnauthorizedOperation", "AuthFailure",
            "UnrecognizedClientException", "InvalidClientTokenId", "ExpiredToken", "ExpiredTokenException");

    public FailureCategory classify(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
            if (t instanceof AwsServiceException) {
                return classifyServiceError((AwsServiceException) t);
            }
            if (t instanceof TimeoutException || t instanceof CancellationException) {
                return FailureCategory.TIMEOUT;
            }
            if (t instanceof SdkClientException || t instanceof UncheckedIOException || t instanceof IOException) {
                return FailureCategory.TRANSPORT;
            }
        }
        return FailureCategory.UNKNOWN;
    }

    public String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private static FailureCategory classifyServiceError(AwsServiceException e) {
        if (e.isThrottlingException()) {
            return FailureCategory.THROTTLING;
        }
        String code = e.awsErrorDetails() == null ? null : e.awsErrorDetails().errorCode();
        if (e.statusCode() == 401 || e.statusCode() == 403 || (code != null && ACCESS_DENIED_CODES.contains(code))) {
            return FailureCategory.ACCESS_DENIED;
        }
        if (e.statusCode() >= 500) {
            return FailureCategory.TRANSPORT;
        }
        return FailureCategory.UNKNOWN;
    }
}
