package io.iaf.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Represents a ManagedService custom resource: a platform-provisioned database that
 * applications bind to.
 */
@Data
public class ManagedService implements KubernetesObject {
    public static final String PLURAL = "managedservices";
    public static final String KIND = "ManagedService";
    public static final String FINALIZER = "iaf.io/managed-service-protection";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private ManagedServiceSpec spec;
    private ManagedServiceStatus status;
}
