package com.batchanalytics.domain.exception;

/**
 * The rule store could not be read. Aborts the current tick only.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
