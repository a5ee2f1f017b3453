package com.example.docstandards.common.util;

import com.example.docstandards.exception.TransientStorageException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.lang.NonNull;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Utility methods for retry logic around storage and evaluation calls.
 * Centralizes the retryable/terminal classification for the validation workers
 * and the audit ledger.
 */
public final class RetryUtils {

    private RetryUtils() {}

    /**
     * Determines if an exception is retryable.
     * Retryable conditions:
     * - TransientStorageException
     * - TimeoutException (blob fetch / evaluation deadlines)
     * - SdkClientException (network-level S3 failures)
     * - SdkServiceException with 5xx status or throttling
     * - TransientDataAccessException from the Mongo driver
     * - IOException
     *
     * <p>Wrapped causes are inspected, since futures from the async SDK arrive wrapped
     * in CompletionException.
     *
     * @param throwable the exception to check
     * @return true if the exception is retryable
     */
    public static boolean isRetryable(@NonNull Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth < 5) {
            if (isRetryableType(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private static boolean isRetryableType(Throwable throwable) {
        if (throwable instanceof SdkServiceException ex) {
            return ex.statusCode() >= 500 || ex.isThrottlingException();
        }
        return throwable instanceof TransientStorageException
                || throwable instanceof TimeoutException
                || throwable instanceof SdkClientException
                || throwable instanceof TransientDataAccessException
                || throwable instanceof IOException;
    }

    /**
     * Returns a predicate for use with Retry.filter().
     *
     * @return a predicate that returns true for retryable exceptions
     */
    @NonNull
    public static Predicate<Throwable> retryablePredicate() {
        return RetryUtils::isRetryable;
    }
}
