package io.iaf.operator.model.traefik;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Traefik {@code IngressRoute}.
 */
@Data
public class IngressRoute implements KubernetesObject {
    public static final String GROUP = "traefik.io";
    public static final String VERSION = "v1alpha1";
    public static final String PLURAL = "ingressroutes";
    public static final String KIND = "IngressRoute";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private IngressRouteSpec spec;
}
