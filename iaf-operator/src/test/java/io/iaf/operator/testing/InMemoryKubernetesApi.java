package io.iaf.operator.testing;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * API store for a single kind, held in memory. Every call hands out and keeps its own copy of an
 * object, so edits only reach the store through a write. {@code update} ignores the status and
 * {@code updateStatus} ignores everything else, and a write carrying an outdated resourceVersion
 * is rejected with 409. Deletion honours finalizers: an object with finalizers only gets a
 * deletion timestamp and disappears once an update clears them.
 */
public class InMemoryKubernetesApi<T extends KubernetesObject, L extends KubernetesListObject>
        extends GenericKubernetesApi<T, L> {

    public enum Operation {
        GET, CREATE, UPDATE, UPDATE_STATUS, DELETE
    }

    private static final String STATUS = "status";

    private final Class<T> apiType;
    private final Gson gson;
    private final Map<String, T> objects = new LinkedHashMap<>();
    private final Map<Operation, Integer> calls = new EnumMap<>(Operation.class);
    private final Map<Operation, Map<Integer, Integer>> failures = new EnumMap<>(Operation.class);
    private final List<Consumer<T>> statusListeners = new ArrayList<>();
    private long resourceVersion;

    public InMemoryKubernetesApi(Class<T> apiType, Class<L> listType, String group, String version,
                                 String plural, ApiClient apiClient) {
        super(apiType, listType, group, version, plural, apiClient);
        this.apiType = apiType;
        this.gson = apiClient.getJSON().getGson();
    }

    /**
     * Seeds the store with {@code object} itself, bypassing call counting and failure injection.
     */
    public T put(T object) {
        V1ObjectMeta metadata = object.getMetadata();
        bumpResourceVersion(metadata);
        objects.put(key(metadata.getNamespace(), metadata.getName()), object);
        return object;
    }

    /**
     * The live stored instance. Edits made to it act like changes made by another client.
     */
    public T stored(String namespace, String name) {
        return objects.get(key(namespace, name));
    }

    public boolean contains(String namespace, String name) {
        return objects.containsKey(key(namespace, name));
    }

    public int size() {
        return objects.size();
    }

    public int calls(Operation operation) {
        return calls.getOrDefault(operation, 0);
    }

    public void failNext(Operation operation, int httpStatusCode) {
        failCall(operation, 1, httpStatusCode);
    }

    /**
     * Makes the {@code n}-th upcoming call of {@code operation} fail with the given status code.
     */
    public void failCall(Operation operation, int n, int httpStatusCode) {
        failures.computeIfAbsent(operation, op -> new HashMap<>()).put(calls(operation) + n, httpStatusCode);
    }

    public void onStatusUpdate(Consumer<T> listener) {
        statusListeners.add(listener);
    }

    @Override
    public KubernetesApiResponse<T> get(String name) {
        return get(null, name);
    }

    @Override
    public KubernetesApiResponse<T> get(String namespace, String name) {
        Integer failure = record(Operation.GET);
        if (failure != null) {
            return error(failure, "injected get failure");
        }
        T object = objects.get(key(namespace, name));
        if (object == null) {
            return error(404, name + " not found");
        }
        return new KubernetesApiResponse<>(copy(object));
    }

    @Override
    public KubernetesApiResponse<T> create(T object) {
        Integer failure = record(Operation.CREATE);
        if (failure != null) {
            return error(failure, "injected create failure");
        }
        String key = key(object.getMetadata().getNamespace(), object.getMetadata().getName());
        if (objects.containsKey(key)) {
            return error(409, object.getMetadata().getName() + " already exists");
        }
        T created = copy(object);
        V1ObjectMeta metadata = created.getMetadata();
        if (metadata.getUid() == null) {
            metadata.setUid(UUID.randomUUID().toString());
        }
        metadata.setCreationTimestamp(OffsetDateTime.now(ZoneOffset.UTC));
        bumpResourceVersion(metadata);
        objects.put(key, created);
        return new KubernetesApiResponse<>(copy(created));
    }

    @Override
    public KubernetesApiResponse<T> update(T object) {
        Integer failure = record(Operation.UPDATE);
        if (failure != null) {
            return error(failure, "injected update failure");
        }
        String key = key(object.getMetadata().getNamespace(), object.getMetadata().getName());
        T current = objects.get(key);
        if (current == null) {
            return error(404, object.getMetadata().getName() + " not found");
        }
        if (isStale(object, current)) {
            return conflict(object);
        }
        T updated = merge(object, current, current);
        V1ObjectMeta metadata = updated.getMetadata();
        if (metadata.getDeletionTimestamp() != null
                && (metadata.getFinalizers() == null || metadata.getFinalizers().isEmpty())) {
            objects.remove(key);
        } else {
            objects.put(key, updated);
        }
        return new KubernetesApiResponse<>(copy(updated));
    }

    @Override
    public KubernetesApiResponse<T> updateStatus(T object, Function<T, Object> status) {
        Integer failure = record(Operation.UPDATE_STATUS);
        if (failure != null) {
            return error(failure, "injected status update failure");
        }
        String key = key(object.getMetadata().getNamespace(), object.getMetadata().getName());
        T current = objects.get(key);
        if (current == null) {
            return error(404, object.getMetadata().getName() + " not found");
        }
        if (isStale(object, current)) {
            return conflict(object);
        }
        T updated = merge(current, object, current);
        objects.put(key, updated);
        statusListeners.forEach(listener -> listener.accept(copy(updated)));
        return new KubernetesApiResponse<>(copy(updated));
    }

    @Override
    public KubernetesApiResponse<T> delete(String namespace, String name) {
        Integer failure = record(Operation.DELETE);
        if (failure != null) {
            return error(failure, "injected delete failure");
        }
        T object = objects.get(key(namespace, name));
        if (object == null) {
            return error(404, name + " not found");
        }
        V1ObjectMeta metadata = object.getMetadata();
        if (metadata.getFinalizers() != null && !metadata.getFinalizers().isEmpty()) {
            if (metadata.getDeletionTimestamp() == null) {
                metadata.setDeletionTimestamp(OffsetDateTime.now(ZoneOffset.UTC));
                bumpResourceVersion(metadata);
            }
        } else {
            objects.remove(key(namespace, name));
        }
        return new KubernetesApiResponse<>(copy(object));
    }

    /**
     * Builds the next stored version: everything but the status from {@code body}, the status from
     * {@code statusSource}, and the server-owned metadata from {@code current}.
     */
    private T merge(T body, T statusSource, T current) {
        JsonObject tree = gson.toJsonTree(body).getAsJsonObject();
        tree.remove(STATUS);
        JsonElement status = gson.toJsonTree(statusSource).getAsJsonObject().get(STATUS);
        if (status != null) {
            tree.add(STATUS, status);
        }
        T merged = gson.fromJson(tree, apiType);

        V1ObjectMeta metadata = merged.getMetadata();
        V1ObjectMeta stored = current.getMetadata();
        metadata.setUid(stored.getUid());
        metadata.setCreationTimestamp(stored.getCreationTimestamp());
        metadata.setDeletionTimestamp(stored.getDeletionTimestamp());
        bumpResourceVersion(metadata);
        return merged;
    }

    private T copy(T object) {
        return gson.fromJson(gson.toJsonTree(object), apiType);
    }

    private static <T extends KubernetesObject> boolean isStale(T incoming, T current) {
        return !Objects.equals(incoming.getMetadata().getResourceVersion(),
                current.getMetadata().getResourceVersion());
    }

    private KubernetesApiResponse<T> conflict(T object) {
        return error(409, String.format("Operation cannot be fulfilled on %s: the object has been modified",
                object.getMetadata().getName()));
    }

    private Integer record(Operation operation) {
        int call = calls.merge(operation, 1, Integer::sum);
        Map<Integer, Integer> pending = failures.get(operation);
        return pending == null ? null : pending.remove(call);
    }

    private void bumpResourceVersion(V1ObjectMeta metadata) {
        metadata.setResourceVersion(String.valueOf(++resourceVersion));
    }

    private KubernetesApiResponse<T> error(int code, String message) {
        return new KubernetesApiResponse<>(new V1Status().code(code).message(message), code);
    }

    private static String key(String namespace, String name) {
        return namespace == null ? name : namespace + "/" + name;
    }
}
