package io.iaf.operator.controller;

import io.iaf.operator.client.KubernetesResources;
import io.iaf.operator.client.ResourceApis;
import io.iaf.operator.config.OperatorProperties;
import io.iaf.operator.model.Application;
import io.iaf.operator.model.ApplicationPhase;
import io.iaf.operator.model.ApplicationSpec;
import io.iaf.operator.model.ApplicationStatus;
import io.iaf.operator.model.AttachedDataSource;
import io.iaf.operator.model.BoundManagedService;
import io.iaf.operator.model.BuildStatus;
import io.iaf.operator.model.DataSource;
import io.iaf.operator.model.kpack.KpackImage;
import io.iaf.operator.model.kpack.KpackImageSpec;
import io.iaf.operator.resources.Certificates;
import io.iaf.operator.resources.EnvironmentVariables;
import io.iaf.operator.resources.IngressRoutes;
import io.iaf.operator.resources.KpackImages;
import io.iaf.operator.resources.WorkloadResources;
import io.iaf.operator.status.BuildResult;
import io.iaf.operator.status.BuildStatusExtractor;
import io.kubernetes.client.extended.controller.reconciler.Reconciler;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.controller.reconciler.Result;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServiceSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciler for Application resources: builds the image when the application is deployed from
 * source, then converges its Deployment, Service, Certificate and IngressRoute and mirrors their
 * state into the Application status.
 */
@Component
@Slf4j
public class ApplicationReconciler implements Reconciler {
    static final Duration BUILD_REQUEUE = Duration.ofSeconds(5);
    static final Duration DEPLOY_REQUEUE = Duration.ofSeconds(10);

    // phases from which the first status write of a deploy pass is Deploying
    private static final Set<ApplicationPhase> PRE_DEPLOY_PHASES =
            EnumSet.of(ApplicationPhase.PENDING, ApplicationPhase.BUILDING);

    private final ResourceApis apis;
    private final OperatorProperties properties;

    @Autowired
    public ApplicationReconciler(ResourceApis apis, OperatorProperties properties) {
        this.apis = apis;
        this.properties = properties;
    }

    @Override
    public Result reconcile(Request request) {
        log.info("Reconciling Application {}/{}", request.getNamespace(), request.getName());

        try {
            return reconcileApplication(request);
        } catch (ApiException e) {
            log.error("API error reconciling Application {}/{} (HTTP {}): {}",
                    request.getNamespace(), request.getName(), e.getCode(), e.getMessage());
            return new Result(true);
        } catch (ReconcileException e) {
            log.error("Error reconciling Application {}/{}: {}",
                    request.getNamespace(), request.getName(), e.getMessage());
            return new Result(true);
        }
    }

    private Result reconcileApplication(Request request) throws ApiException, ReconcileException {
        Optional<Application> found = KubernetesResources.find(
                apis.getApplications(), request.getNamespace(), request.getName());
        if (found.isEmpty()) {
            log.info("Application {}/{} not found, nothing to do", request.getNamespace(), request.getName());
            return new Result(false);
        }
        Application app = found.get();
        ensureStatusInitialized(app);

        ImageResolution resolution = resolveImage(app);

        if (!resolution.isResolved()) {
            setBuildingStatus(app, resolution.getBuildStatus());
            return new Result(true, BUILD_REQUEUE);
        }

        ApplicationPhase phase = app.getStatus().getPhase();
        if (phase == null || PRE_DEPLOY_PHASES.contains(phase)) {
            app = setDeployingPhaseOnly(app);
        }

        String host = resolveHost(app);
        boolean tlsEnabled = app.getSpec().tlsRequested() && properties.isTlsIssuerConfigured();

        V1Deployment deployment = reconcileDeployment(app, resolution.getImage());
        reconcileService(app);
        if (tlsEnabled) {
            reconcileCertificate(app, host);
        }
        reconcileIngressRoute(app, host, tlsEnabled);

        return reconcileStatus(app, resolution, deployment, host, tlsEnabled);
    }

    private void ensureStatusInitialized(Application app) {
        if (app.getStatus() == null) {
            app.setStatus(new ApplicationStatus());
        }
        if (app.getStatus().getConditions() == null) {
            app.getStatus().setConditions(new ArrayList<>());
        }
    }

    /**
     * Returns the image to deploy. A literal image is used as is; otherwise the kpack Image for
     * the application is created or brought up to date and its latest build is used.
     */
    private ImageResolution resolveImage(Application app) throws ApiException, InvalidImageSourceException {
        ApplicationSpec spec = app.getSpec();
        if (spec == null) {
            throw new InvalidImageSourceException(String.format(
                    "Application %s has no spec, so no image, git, or blob source", app.getMetadata().getName()));
        }
        if (spec.hasImage()) {
            return ImageResolution.resolved(spec.getImage(), BuildStatus.NOT_REQUIRED);
        }
        if (!spec.hasGitSource() && !spec.hasBlobSource()) {
            throw new InvalidImageSourceException(String.format(
                    "Application %s has no image, git, or blob source", app.getMetadata().getName()));
        }

        KpackImage desired = KpackImages.image(app, properties.getClusterBuilder(),
                properties.getRegistryPrefix(), properties.getBuildServiceAccount());
        String namespace = app.getMetadata().getNamespace();
        String name = app.getMetadata().getName();

        Optional<KpackImage> existing = KubernetesResources.find(apis.getImages(), namespace, name);
        if (existing.isEmpty()) {
            log.info("Creating image build {}/{}", namespace, name);
            KubernetesResources.create(apis.getImages(), desired);
            return ImageResolution.pending(BuildStatus.BUILDING);
        }

        KpackImage image = existing.get();
        KpackImageSpec.Source currentSource = image.getSpec() == null ? null : image.getSpec().getSource();
        if (!Objects.equals(currentSource, desired.getSpec().getSource())) {
            log.info("Source of Application {}/{} changed, updating image build", namespace, name);
            image.setSpec(desired.getSpec());
            image = KubernetesResources.update(apis.getImages(), image);
        }

        BuildResult build = BuildStatusExtractor.extract(image);
        if (!build.hasImage()) {
            return ImageResolution.pending(build.getStatus());
        }
        return ImageResolution.resolved(build.getLatestImage(), build.getStatus());
    }

    private void setBuildingStatus(Application app, BuildStatus buildStatus) throws ApiException {
        ApplicationStatus status = app.getStatus();
        logTransition(app, ApplicationPhase.BUILDING);
        status.setPhase(ApplicationPhase.BUILDING);
        status.setBuildStatus(buildStatus);
        Conditions.upsert(status.getConditions(), Conditions.READY, false, "Building",
                "Waiting for container image build to complete");
        updateStatus(app);
    }

    /**
     * Persists Deploying before any replica-derived field is touched, so observers never see a
     * stale Running phase next to a fresh replica count.
     */
    private Application setDeployingPhaseOnly(Application app) throws ApiException {
        logTransition(app, ApplicationPhase.DEPLOYING);
        app.getStatus().setPhase(ApplicationPhase.DEPLOYING);
        Conditions.upsert(app.getStatus().getConditions(), Conditions.READY, false, "Deploying",
                "Waiting for pod replicas to become available");
        return updateStatus(app);
    }

    private V1Deployment reconcileDeployment(Application app, String image) throws ApiException {
        V1Deployment desired = WorkloadResources.deployment(app, image, collectEnvironment(app));
        return KubernetesResources.createOrUpdate(apis.getDeployments(), desired,
                (existing, wanted) -> existing.setSpec(wanted.getSpec()));
    }

    /**
     * Inline variables, then attached DataSource credentials, then bound ManagedService
     * connection settings.
     */
    private List<V1EnvVar> collectEnvironment(Application app) throws ApiException {
        ApplicationSpec spec = app.getSpec();
        List<V1EnvVar> env = new ArrayList<>(EnvironmentVariables.inline(spec.getEnv()));

        if (spec.getAttachedDataSources() != null) {
            for (AttachedDataSource attached : spec.getAttachedDataSources()) {
                Optional<DataSource> dataSource = KubernetesResources.findClusterScoped(
                        apis.getDataSources(), attached.getDataSourceName());
                if (dataSource.isEmpty()) {
                    log.warn("DataSource {} attached to Application {}/{} no longer exists, skipping",
                            attached.getDataSourceName(), app.getMetadata().getNamespace(),
                            app.getMetadata().getName());
                    continue;
                }
                env.addAll(EnvironmentVariables.fromDataSource(attached, dataSource.get()));
            }
        }

        if (spec.getBoundManagedServices() != null) {
            for (BoundManagedService bound : spec.getBoundManagedServices()) {
                env.addAll(EnvironmentVariables.fromManagedService(bound));
            }
        }
        return env;
    }

    private void reconcileService(Application app) throws ApiException {
        KubernetesResources.createOrUpdate(apis.getServices(), WorkloadResources.service(app),
                ApplicationReconciler::copyServicePorts);
    }

    // cluster IPs are allocated by the API server, only ports and selector are ours
    private static void copyServicePorts(V1Service existing, V1Service desired) {
        if (existing.getSpec() == null) {
            existing.setSpec(new V1ServiceSpec());
        }
        existing.getSpec().setPorts(desired.getSpec().getPorts());
        existing.getSpec().setSelector(desired.getSpec().getSelector());
    }

    private void reconcileCertificate(Application app, String host) throws ApiException {
        KubernetesResources.createOrUpdate(apis.getCertificates(),
                Certificates.certificate(app, host, properties.getTlsIssuer()),
                (existing, wanted) -> existing.setSpec(wanted.getSpec()));
    }

    private void reconcileIngressRoute(Application app, String host, boolean tlsEnabled) throws ApiException {
        KubernetesResources.createOrUpdate(apis.getIngressRoutes(),
                IngressRoutes.ingressRoute(app, host, tlsEnabled),
                (existing, wanted) -> existing.setSpec(wanted.getSpec()));
    }

    private Result reconcileStatus(Application app, ImageResolution resolution, V1Deployment deployment,
                                   String host, boolean tlsEnabled) throws ApiException {
        int available = availableReplicas(deployment);
        ApplicationStatus status = app.getStatus();
        status.setAvailableReplicas(available);
        status.setLatestImage(resolution.getImage());
        status.setBuildStatus(resolution.getBuildStatus());
        status.setUrl((tlsEnabled ? "https" : "http") + "://" + host);

        // a rebuild in progress still serves the previous image but is not Running yet
        boolean rebuilding = resolution.getBuildStatus() == BuildStatus.BUILDING;
        if (available >= 1 && !rebuilding) {
            logTransition(app, ApplicationPhase.RUNNING);
            status.setPhase(ApplicationPhase.RUNNING);
            Conditions.upsert(status.getConditions(), Conditions.READY, true, "Available",
                    String.format("%d replica(s) available", available));
            updateStatus(app);
            return new Result(false);
        }

        logTransition(app, ApplicationPhase.DEPLOYING);
        status.setPhase(ApplicationPhase.DEPLOYING);
        if (rebuilding) {
            Conditions.upsert(status.getConditions(), Conditions.READY, false, "Building",
                    "Waiting for container image build to complete");
            updateStatus(app);
            return new Result(true, BUILD_REQUEUE);
        }
        Conditions.upsert(status.getConditions(), Conditions.READY, false, "Deploying",
                "Waiting for pod replicas to become available");
        updateStatus(app);
        return new Result(true, DEPLOY_REQUEUE);
    }

    private String resolveHost(Application app) {
        String host = app.getSpec().getHost();
        if (StringUtils.hasText(host)) {
            return host;
        }
        return app.getMetadata().getName() + "." + properties.getBaseDomain();
    }

    private static int availableReplicas(V1Deployment deployment) {
        if (deployment.getStatus() == null || deployment.getStatus().getAvailableReplicas() == null) {
            return 0;
        }
        return deployment.getStatus().getAvailableReplicas();
    }

    private Application updateStatus(Application app) throws ApiException {
        return KubernetesResources.updateStatus(apis.getApplications(), app, Application::getStatus);
    }

    private void logTransition(Application app, ApplicationPhase next) {
        ApplicationPhase current = app.getStatus().getPhase();
        if (current != next) {
            log.info("Application {}/{} phase {} -> {}", app.getMetadata().getNamespace(),
                    app.getMetadata().getName(), current, next);
        }
    }
}
