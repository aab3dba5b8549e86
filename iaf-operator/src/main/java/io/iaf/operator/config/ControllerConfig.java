package io.iaf.operator.config;

import io.iaf.operator.client.ResourceApis;
import io.iaf.operator.controller.ApplicationReconciler;
import io.iaf.operator.controller.ManagedServiceReconciler;
import io.iaf.operator.model.Application;
import io.iaf.operator.model.ManagedService;
import io.iaf.operator.model.certmanager.Certificate;
import io.iaf.operator.model.cnpg.CnpgCluster;
import io.iaf.operator.model.kpack.KpackImage;
import io.iaf.operator.model.traefik.IngressRoute;
import io.iaf.operator.resources.ManagedResources;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.extended.controller.Controller;
import io.kubernetes.client.extended.controller.ControllerManager;
import io.kubernetes.client.extended.controller.ControllerWatch;
import io.kubernetes.client.extended.controller.builder.ControllerBuilder;
import io.kubernetes.client.extended.controller.builder.DefaultControllerBuilder;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.workqueue.WorkQueue;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1NetworkPolicy;
import io.kubernetes.client.openapi.models.V1Service;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for the Application and ManagedService controllers.
 */
@Configuration
public class ControllerConfig {
    private static final List<Class<? extends KubernetesObject>> APPLICATION_CHILDREN =
            List.of(V1Deployment.class, V1Service.class, KpackImage.class, Certificate.class, IngressRoute.class);
    private static final List<Class<? extends KubernetesObject>> MANAGED_SERVICE_CHILDREN =
            List.of(CnpgCluster.class, V1NetworkPolicy.class);

    @Bean
    public ResourceApis resourceApis(ApiClient apiClient) {
        return ResourceApis.create(apiClient);
    }

    /**
     * Informer factory with one informer registered per watched kind. Controllers look their
     * informers up from it by type.
     */
    @Bean
    public SharedInformerFactory sharedInformerFactory(ApiClient apiClient, ResourceApis apis,
                                                       OperatorProperties properties) {
        SharedInformerFactory factory = new SharedInformerFactory(apiClient);
        long resyncMillis = properties.getResyncPeriod().toMillis();

        factory.sharedIndexInformerFor(apis.getApplications(), Application.class, resyncMillis);
        factory.sharedIndexInformerFor(apis.getDeployments(), V1Deployment.class, resyncMillis);
        factory.sharedIndexInformerFor(apis.getServices(), V1Service.class, resyncMillis);
        factory.sharedIndexInformerFor(apis.getImages(), KpackImage.class, resyncMillis);
        factory.sharedIndexInformerFor(apis.getCertificates(), Certificate.class, resyncMillis);
        factory.sharedIndexInformerFor(apis.getIngressRoutes(), IngressRoute.class, resyncMillis);

        factory.sharedIndexInformerFor(apis.getManagedServices(), ManagedService.class, resyncMillis);
        factory.sharedIndexInformerFor(apis.getClusters(), CnpgCluster.class, resyncMillis);
        factory.sharedIndexInformerFor(apis.getNetworkPolicies(), V1NetworkPolicy.class, resyncMillis);
        return factory;
    }

    @Bean
    public Controller applicationController(
            SharedInformerFactory informerFactory,
            ApplicationReconciler reconciler,
            OperatorProperties properties) {

        DefaultControllerBuilder builder = ControllerBuilder.defaultBuilder(informerFactory)
                .watch(workQueue -> ControllerBuilder.controllerWatchBuilder(Application.class, workQueue)
                        .withResyncPeriod(properties.getResyncPeriod())
                        .build());
        for (Class<? extends KubernetesObject> child : APPLICATION_CHILDREN) {
            builder = builder.watch(workQueue -> ownedWatch(child, Application.KIND, workQueue));
        }
        return builder
                .withWorkerCount(properties.getWorkerCount())
                .withReadyFunc(() -> allSynced(informerFactory, Application.class, APPLICATION_CHILDREN))
                .withReconciler(reconciler)
                .withName("ApplicationController")
                .build();
    }

    @Bean
    public Controller managedServiceController(
            SharedInformerFactory informerFactory,
            ManagedServiceReconciler reconciler,
            OperatorProperties properties) {

        DefaultControllerBuilder builder = ControllerBuilder.defaultBuilder(informerFactory)
                .watch(workQueue -> ControllerBuilder.controllerWatchBuilder(ManagedService.class, workQueue)
                        .withResyncPeriod(properties.getResyncPeriod())
                        .build());
        for (Class<? extends KubernetesObject> child : MANAGED_SERVICE_CHILDREN) {
            builder = builder.watch(workQueue -> ownedWatch(child, ManagedService.KIND, workQueue));
        }
        return builder
                .withWorkerCount(properties.getWorkerCount())
                .withReadyFunc(() -> allSynced(informerFactory, ManagedService.class, MANAGED_SERVICE_CHILDREN))
                .withReconciler(reconciler)
                .withName("ManagedServiceController")
                .build();
    }

    @Bean
    public ControllerManager controllerManager(
            SharedInformerFactory informerFactory,
            Controller applicationController,
            Controller managedServiceController) {
        return new ControllerManager(informerFactory, applicationController, managedServiceController);
    }

    /**
     * Enqueues the owner's key for children controlled by an IAF resource of {@code ownerKind}.
     */
    private static <T extends KubernetesObject> ControllerWatch<T> ownedWatch(
            Class<T> childClass, String ownerKind, WorkQueue<Request> workQueue) {
        return ControllerBuilder.controllerWatchBuilder(childClass, workQueue)
                .withWorkQueueKeyFunc(child -> ManagedResources.ownerRequest(child, ownerKind).orElseThrow())
                .withOnAddFilter(child -> ManagedResources.isOwnedBy(child, ownerKind))
                .withOnUpdateFilter((oldChild, newChild) -> ManagedResources.isOwnedBy(newChild, ownerKind))
                .withOnDeleteFilter((child, finalStateUnknown) -> ManagedResources.isOwnedBy(child, ownerKind))
                .build();
    }

    private static boolean allSynced(SharedInformerFactory informerFactory,
                                     Class<? extends KubernetesObject> primary,
                                     List<Class<? extends KubernetesObject>> children) {
        return informerFactory.getExistingSharedIndexInformer(primary).hasSynced()
                && children.stream().allMatch(child ->
                        informerFactory.getExistingSharedIndexInformer(child).hasSynced());
    }
}
