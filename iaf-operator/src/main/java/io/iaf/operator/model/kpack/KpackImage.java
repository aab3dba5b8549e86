package io.iaf.operator.model.kpack;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * kpack {@code Image}: a continuously rebuilt container image from git or blob source.
 */
@Data
public class KpackImage implements KubernetesObject {
    public static final String GROUP = "kpack.io";
    public static final String VERSION = "v1alpha2";
    public static final String PLURAL = "images";
    public static final String KIND = "Image";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private KpackImageSpec spec;
    private KpackImageStatus status;
}
