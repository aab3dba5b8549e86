package io.iaf.operator.resources;

import io.iaf.operator.model.ApiGroup;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Labels, owner references and metadata shared by every child resource the operator manages.
 */
public final class ManagedResources {
    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "iaf";
    public static final String APPLICATION_LABEL = "iaf.io/application";
    public static final String MANAGED_SERVICE_LABEL = "iaf.io/managed-service";

    private ManagedResources() {
    }

    public static Map<String, String> applicationLabels(String appName) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(MANAGED_BY_LABEL, MANAGED_BY_VALUE);
        labels.put(APPLICATION_LABEL, appName);
        return labels;
    }

    public static Map<String, String> managedServiceLabels(String serviceName) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(MANAGED_BY_LABEL, MANAGED_BY_VALUE);
        labels.put(MANAGED_SERVICE_LABEL, serviceName);
        return labels;
    }

    /**
     * Metadata for a child named {@code name} in the owner's namespace, controlled by the owner
     * so that deleting the owner cascades to the child.
     */
    public static V1ObjectMeta childMetadata(KubernetesObject owner, String ownerKind, String name,
                                             Map<String, String> labels) {
        V1ObjectMeta ownerMeta = owner.getMetadata();
        return new V1ObjectMeta()
                .name(name)
                .namespace(ownerMeta.getNamespace())
                .labels(labels)
                .addOwnerReferencesItem(new V1OwnerReference()
                        .apiVersion(ApiGroup.API_VERSION)
                        .kind(ownerKind)
                        .name(ownerMeta.getName())
                        .uid(ownerMeta.getUid())
                        .controller(true)
                        .blockOwnerDeletion(true));
    }

    public static boolean isOwnedBy(KubernetesObject object, String ownerKind) {
        return controllingOwner(object, ownerKind).isPresent();
    }

    /**
     * Maps a child to the work queue key of the IAF resource that controls it.
     */
    public static Optional<Request> ownerRequest(KubernetesObject object, String ownerKind) {
        return controllingOwner(object, ownerKind)
                .map(owner -> new Request(object.getMetadata().getNamespace(), owner.getName()));
    }

    private static Optional<V1OwnerReference> controllingOwner(KubernetesObject object, String ownerKind) {
        if (object == null || object.getMetadata() == null) {
            return Optional.empty();
        }
        List<V1OwnerReference> owners = object.getMetadata().getOwnerReferences();
        if (owners == null) {
            return Optional.empty();
        }
        return owners.stream()
                .filter(ref -> Boolean.TRUE.equals(ref.getController()))
                .filter(ref -> ApiGroup.API_VERSION.equals(ref.getApiVersion()))
                .filter(ref -> ownerKind.equals(ref.getKind()))
                .findFirst();
    }
}
