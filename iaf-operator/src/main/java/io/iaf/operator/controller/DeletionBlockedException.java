package io.iaf.operator.controller;

import java.util.List;

/**
 * Raised while a ManagedService marked for deletion still has bound applications.
 */
public class DeletionBlockedException extends ReconcileException {
    private final List<String> boundApps;

    public DeletionBlockedException(String serviceName, List<String> boundApps) {
        super(String.format("ManagedService %s is still bound to applications %s", serviceName, boundApps));
        this.boundApps = List.copyOf(boundApps);
    }

    public List<String> getBoundApps() {
        return boundApps;
    }
}
