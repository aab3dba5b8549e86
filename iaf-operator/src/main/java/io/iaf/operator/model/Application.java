package io.iaf.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Represents an Application custom resource.
 */
@Data
public class Application implements KubernetesObject {
    public static final String PLURAL = "applications";
    public static final String KIND = "Application";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private ApplicationSpec spec;
    private ApplicationStatus status;
}
