package io.iaf.operator.client;

import io.iaf.operator.model.ApiGroup;
import io.iaf.operator.model.Application;
import io.iaf.operator.model.ApplicationList;
import io.iaf.operator.model.DataSource;
import io.iaf.operator.model.DataSourceList;
import io.iaf.operator.model.ManagedService;
import io.iaf.operator.model.ManagedServiceList;
import io.iaf.operator.model.certmanager.Certificate;
import io.iaf.operator.model.certmanager.CertificateList;
import io.iaf.operator.model.cnpg.CnpgCluster;
import io.iaf.operator.model.cnpg.CnpgClusterList;
import io.iaf.operator.model.kpack.KpackImage;
import io.iaf.operator.model.kpack.KpackImageList;
import io.iaf.operator.model.traefik.IngressRoute;
import io.iaf.operator.model.traefik.IngressRouteList;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentList;
import io.kubernetes.client.openapi.models.V1NetworkPolicy;
import io.kubernetes.client.openapi.models.V1NetworkPolicyList;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServiceList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Typed API store access for every kind the operator reads or writes.
 */
@Getter
@RequiredArgsConstructor
public class ResourceApis {
    private final GenericKubernetesApi<Application, ApplicationList> applications;
    private final GenericKubernetesApi<ManagedService, ManagedServiceList> managedServices;
    private final GenericKubernetesApi<DataSource, DataSourceList> dataSources;
    private final GenericKubernetesApi<V1Deployment, V1DeploymentList> deployments;
    private final GenericKubernetesApi<V1Service, V1ServiceList> services;
    private final GenericKubernetesApi<KpackImage, KpackImageList> images;
    private final GenericKubernetesApi<Certificate, CertificateList> certificates;
    private final GenericKubernetesApi<IngressRoute, IngressRouteList> ingressRoutes;
    private final GenericKubernetesApi<CnpgCluster, CnpgClusterList> clusters;
    private final GenericKubernetesApi<V1NetworkPolicy, V1NetworkPolicyList> networkPolicies;

    public static ResourceApis create(ApiClient apiClient) {
        return new ResourceApis(
                new GenericKubernetesApi<>(Application.class, ApplicationList.class,
                        ApiGroup.GROUP, ApiGroup.VERSION, Application.PLURAL, apiClient),
                new GenericKubernetesApi<>(ManagedService.class, ManagedServiceList.class,
                        ApiGroup.GROUP, ApiGroup.VERSION, ManagedService.PLURAL, apiClient),
                new GenericKubernetesApi<>(DataSource.class, DataSourceList.class,
                        ApiGroup.GROUP, ApiGroup.VERSION, DataSource.PLURAL, apiClient),
                new GenericKubernetesApi<>(V1Deployment.class, V1DeploymentList.class,
                        "apps", "v1", "deployments", apiClient),
                new GenericKubernetesApi<>(V1Service.class, V1ServiceList.class,
                        "", "v1", "services", apiClient),
                new GenericKubernetesApi<>(KpackImage.class, KpackImageList.class,
                        KpackImage.GROUP, KpackImage.VERSION, KpackImage.PLURAL, apiClient),
                new GenericKubernetesApi<>(Certificate.class, CertificateList.class,
                        Certificate.GROUP, Certificate.VERSION, Certificate.PLURAL, apiClient),
                new GenericKubernetesApi<>(IngressRoute.class, IngressRouteList.class,
                        IngressRoute.GROUP, IngressRoute.VERSION, IngressRoute.PLURAL, apiClient),
                new GenericKubernetesApi<>(CnpgCluster.class, CnpgClusterList.class,
                        CnpgCluster.GROUP, CnpgCluster.VERSION, CnpgCluster.PLURAL, apiClient),
                new GenericKubernetesApi<>(V1NetworkPolicy.class, V1NetworkPolicyList.class,
                        "networking.k8s.io", "v1", "networkpolicies", apiClient));
    }
}
