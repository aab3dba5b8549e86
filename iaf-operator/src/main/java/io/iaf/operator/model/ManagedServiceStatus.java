package io.iaf.operator.model;

import io.kubernetes.client.openapi.models.V1Condition;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Status for a ManagedService custom resource. {@code boundApps} is maintained by the binding
 * tools, never by the reconciler, and blocks deletion while non-empty.
 */
@Data
public class ManagedServiceStatus {
    private ManagedServicePhase phase;
    private String message;
    private String connectionSecretRef;
    private List<String> boundApps = new ArrayList<>();
    private List<V1Condition> conditions = new ArrayList<>();
}
