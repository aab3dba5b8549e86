package io.iaf.operator.model.certmanager;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * cert-manager {@code Certificate} request. Only the spec is written; issuance is cert-manager's.
 */
@Data
public class Certificate implements KubernetesObject {
    public static final String GROUP = "cert-manager.io";
    public static final String VERSION = "v1";
    public static final String PLURAL = "certificates";
    public static final String KIND = "Certificate";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private CertificateSpec spec;
}
