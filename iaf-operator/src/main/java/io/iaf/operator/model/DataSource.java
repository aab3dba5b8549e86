package io.iaf.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Cluster-scoped DataSource registered by platform operators. Read, never written, by the
 * Application reconciler.
 */
@Data
public class DataSource implements KubernetesObject {
    public static final String PLURAL = "datasources";
    public static final String KIND = "DataSource";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private DataSourceSpec spec;
}
