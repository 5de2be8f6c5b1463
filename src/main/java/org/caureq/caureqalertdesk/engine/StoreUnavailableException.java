package org.caureq.caureqalertdesk.engine;

/** Transient failure of the alert or rule store (connection loss, timeout, lock conflict). */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
