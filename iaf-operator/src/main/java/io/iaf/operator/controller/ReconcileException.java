package io.iaf.operator.controller;

/**
 * A reconcile pass that cannot complete for a reason other than a failed store call. The pass
 * is retried with backoff.
 */
public class ReconcileException extends Exception {

    public ReconcileException(String message) {
        super(message);
    }
}
