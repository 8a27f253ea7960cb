package com.logistics.churn.repository;

/**
 * The alert or benchmark store could not complete an operation. Distinguishes a failed
 * computation from a pass that found no alerts.
 */
public class AlertStoreException extends RuntimeException {

    public AlertStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
