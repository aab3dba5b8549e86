package io.iaf.operator.model.cnpg;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * CloudNativePG {@code Cluster}: the PostgreSQL cluster backing a postgres ManagedService.
 */
@Data
public class CnpgCluster implements KubernetesObject {
    public static final String GROUP = "postgresql.cnpg.io";
    public static final String VERSION = "v1";
    public static final String PLURAL = "clusters";
    public static final String KIND = "Cluster";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private CnpgClusterSpec spec;
    private CnpgClusterStatus status;
}
