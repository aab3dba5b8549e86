package io.iaf.operator.client;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Store operations shared by the reconcilers. Failed calls surface as {@link ApiException}
 * carrying the HTTP status code, except where a status code is part of the contract: not found
 * on reads, already exists on creates.
 */
@Slf4j
public final class KubernetesResources {
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;

    private KubernetesResources() {
    }

    public static <T extends KubernetesObject> Optional<T> find(
            GenericKubernetesApi<T, ?> api, String namespace, String name) throws ApiException {
        return found(api.get(namespace, name), "get", name);
    }

    public static <T extends KubernetesObject> Optional<T> findClusterScoped(
            GenericKubernetesApi<T, ?> api, String name) throws ApiException {
        return found(api.get(name), "get", name);
    }

    /**
     * Creates {@code desired}. A concurrent creation of the same object counts as success.
     */
    public static <T extends KubernetesObject> T create(GenericKubernetesApi<T, ?> api, T desired)
            throws ApiException {
        KubernetesApiResponse<T> response = api.create(desired);
        if (response.getHttpStatusCode() == CONFLICT) {
            log.debug("{} {}/{} already exists", desired.getKind(),
                    desired.getMetadata().getNamespace(), desired.getMetadata().getName());
            return desired;
        }
        return required(response, "create", desired);
    }

    public static <T extends KubernetesObject> T update(GenericKubernetesApi<T, ?> api, T object)
            throws ApiException {
        return required(api.update(object), "update", object);
    }

    public static <T extends KubernetesObject> T updateStatus(
            GenericKubernetesApi<T, ?> api, T object, Function<T, Object> status) throws ApiException {
        return required(api.updateStatus(object, status), "update status of", object);
    }

    /**
     * Creates the desired object when absent; otherwise copies its mutable fields onto the stored
     * object and updates it. Labels and owner references are only written on creation.
     *
     * @return the stored object after the write
     */
    public static <T extends KubernetesObject> T createOrUpdate(
            GenericKubernetesApi<T, ?> api, T desired, BiConsumer<T, T> copyMutableFields)
            throws ApiException {
        String namespace = desired.getMetadata().getNamespace();
        String name = desired.getMetadata().getName();

        Optional<T> existing = find(api, namespace, name);
        if (existing.isEmpty()) {
            log.info("Creating {} {}/{}", desired.getKind(), namespace, name);
            return create(api, desired);
        }
        T current = existing.get();
        copyMutableFields.accept(current, desired);
        return update(api, current);
    }

    private static <T extends KubernetesObject> Optional<T> found(
            KubernetesApiResponse<T> response, String operation, String name) throws ApiException {
        if (response.getHttpStatusCode() == NOT_FOUND) {
            return Optional.empty();
        }
        if (!response.isSuccess()) {
            throw failure(response, operation, name);
        }
        return Optional.ofNullable(response.getObject());
    }

    private static <T extends KubernetesObject> T required(
            KubernetesApiResponse<T> response, String operation, T object) throws ApiException {
        if (!response.isSuccess()) {
            throw failure(response, operation, object.getMetadata().getName());
        }
        return response.getObject() != null ? response.getObject() : object;
    }

    private static ApiException failure(KubernetesApiResponse<?> response, String operation, String name) {
        String reason = response.getStatus() != null ? response.getStatus().getMessage() : null;
        return new ApiException(response.getHttpStatusCode(),
                String.format("Failed to %s %s: %s", operation, name, reason));
    }
}
