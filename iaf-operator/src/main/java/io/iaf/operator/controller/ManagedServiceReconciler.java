package io.iaf.operator.controller;

import io.iaf.operator.client.KubernetesResources;
import io.iaf.operator.client.ResourceApis;
import io.iaf.operator.model.ManagedService;
import io.iaf.operator.model.ManagedServicePhase;
import io.iaf.operator.model.ManagedServiceStatus;
import io.iaf.operator.model.cnpg.CnpgCluster;
import io.iaf.operator.resources.DatabaseResources;
import io.iaf.operator.status.ClusterReadiness;
import io.iaf.operator.status.ClusterStatusExtractor;
import io.kubernetes.client.extended.controller.reconciler.Reconciler;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.controller.reconciler.Result;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconciler for ManagedService resources. Provisions a CloudNativePG cluster per service and
 * holds a finalizer that keeps the service alive while applications are still bound to it.
 */
@Component
@Slf4j
public class ManagedServiceReconciler implements Reconciler {
    static final Duration PROVISIONING_REQUEUE = Duration.ofSeconds(10);

    private final ResourceApis apis;

    @Autowired
    public ManagedServiceReconciler(ResourceApis apis) {
        this.apis = apis;
    }

    @Override
    public Result reconcile(Request request) {
        log.info("Reconciling ManagedService {}/{}", request.getNamespace(), request.getName());

        try {
            return reconcileManagedService(request);
        } catch (DeletionBlockedException e) {
            log.warn("Deletion of ManagedService {}/{} blocked, bound applications: {}",
                    request.getNamespace(), request.getName(), e.getBoundApps());
            return new Result(true);
        } catch (ApiException e) {
            log.error("API error reconciling ManagedService {}/{} (HTTP {}): {}",
                    request.getNamespace(), request.getName(), e.getCode(), e.getMessage());
            return new Result(true);
        } catch (ReconcileException e) {
            log.error("Error reconciling ManagedService {}/{}: {}",
                    request.getNamespace(), request.getName(), e.getMessage());
            return new Result(true);
        }
    }

    private Result reconcileManagedService(Request request) throws ApiException, ReconcileException {
        Optional<ManagedService> found = KubernetesResources.find(
                apis.getManagedServices(), request.getNamespace(), request.getName());
        if (found.isEmpty()) {
            log.info("ManagedService {}/{} not found, nothing to do", request.getNamespace(), request.getName());
            return new Result(false);
        }
        ManagedService service = found.get();
        ensureStatusInitialized(service);

        if (service.getMetadata().getDeletionTimestamp() != null) {
            return handleDeletion(service);
        }

        if (!hasFinalizer(service)) {
            addFinalizer(service);
            KubernetesResources.update(apis.getManagedServices(), service);
            log.info("Added finalizer to ManagedService {}/{}",
                    service.getMetadata().getNamespace(), service.getMetadata().getName());
            return new Result(true, Duration.ZERO);
        }

        KubernetesResources.createOrUpdate(apis.getClusters(), DatabaseResources.cluster(service),
                (existing, desired) -> existing.setSpec(desired.getSpec()));
        KubernetesResources.createOrUpdate(apis.getNetworkPolicies(), DatabaseResources.networkPolicy(service),
                (existing, desired) -> existing.setSpec(desired.getSpec()));

        ClusterReadiness readiness = readClusterReadiness(service);
        return updateProvisioningStatus(service, readiness);
    }

    private Result handleDeletion(ManagedService service) throws ApiException, DeletionBlockedException {
        String name = service.getMetadata().getName();
        List<String> boundApps = service.getStatus().getBoundApps();

        if (boundApps != null && !boundApps.isEmpty()) {
            ManagedServiceStatus status = service.getStatus();
            status.setPhase(ManagedServicePhase.FAILED);
            status.setMessage(String.format(
                    "Cannot delete: service is bound to applications %s. Unbind them before deleting.",
                    boundApps));
            Conditions.upsert(status.getConditions(), Conditions.READY, false, "DeletionBlocked",
                    status.getMessage());
            updateStatus(service);
            throw new DeletionBlockedException(name, boundApps);
        }

        if (hasFinalizer(service)) {
            service.getMetadata().getFinalizers().remove(ManagedService.FINALIZER);
            KubernetesResources.update(apis.getManagedServices(), service);
            log.info("Removed finalizer from ManagedService {}/{}", service.getMetadata().getNamespace(), name);
        }
        return new Result(false);
    }

    /**
     * A cluster that cannot be read yet counts as still provisioning.
     */
    private ClusterReadiness readClusterReadiness(ManagedService service) {
        String namespace = service.getMetadata().getNamespace();
        String name = service.getMetadata().getName();
        try {
            Optional<CnpgCluster> cluster = KubernetesResources.find(apis.getClusters(), namespace, name);
            if (cluster.isPresent()) {
                return ClusterStatusExtractor.extract(cluster.get());
            }
            log.debug("Database cluster {}/{} not visible yet", namespace, name);
        } catch (ApiException e) {
            log.debug("Could not read database cluster {}/{}: {}", namespace, name, e.getMessage());
        }
        return ClusterStatusExtractor.provisioning(DatabaseResources.connectionSecretName(name));
    }

    private Result updateProvisioningStatus(ManagedService service, ClusterReadiness readiness)
            throws ApiException {
        ManagedServiceStatus status = service.getStatus();
        if (status.getPhase() != readiness.getPhase()) {
            log.info("ManagedService {}/{} phase {} -> {}", service.getMetadata().getNamespace(),
                    service.getMetadata().getName(), status.getPhase(), readiness.getPhase());
        }
        status.setPhase(readiness.getPhase());

        if (readiness.isReady()) {
            status.setConnectionSecretRef(readiness.getConnectionSecretName());
            status.setMessage(String.format("Service is ready. Connection details are in secret %s.",
                    readiness.getConnectionSecretName()));
            Conditions.upsert(status.getConditions(), Conditions.READY, true, "ClusterReady",
                    status.getMessage());
            updateStatus(service);
            return new Result(false);
        }

        status.setMessage("Provisioning in progress, waiting for the database cluster to become ready.");
        Conditions.upsert(status.getConditions(), Conditions.READY, false, "Provisioning", status.getMessage());
        updateStatus(service);
        return new Result(true, PROVISIONING_REQUEUE);
    }

    private void ensureStatusInitialized(ManagedService service) {
        if (service.getStatus() == null) {
            service.setStatus(new ManagedServiceStatus());
        }
        if (service.getStatus().getConditions() == null) {
            service.getStatus().setConditions(new ArrayList<>());
        }
    }

    private boolean hasFinalizer(ManagedService service) {
        List<String> finalizers = service.getMetadata().getFinalizers();
        return finalizers != null && finalizers.contains(ManagedService.FINALIZER);
    }

    private void addFinalizer(ManagedService service) {
        V1ObjectMeta metadata = service.getMetadata();
        if (metadata.getFinalizers() == null) {
            metadata.setFinalizers(new ArrayList<>());
        }
        metadata.getFinalizers().add(ManagedService.FINALIZER);
    }

    private void updateStatus(ManagedService service) throws ApiException {
        KubernetesResources.updateStatus(apis.getManagedServices(), service, ManagedService::getStatus);
    }
}
