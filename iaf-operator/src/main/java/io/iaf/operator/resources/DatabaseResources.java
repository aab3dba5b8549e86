package io.iaf.operator.resources;

import io.iaf.operator.model.ManagedService;
import io.iaf.operator.model.ServicePlan;
import io.iaf.operator.model.cnpg.CnpgCluster;
import io.iaf.operator.model.cnpg.CnpgClusterSpec;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1NetworkPolicy;
import io.kubernetes.client.openapi.models.V1NetworkPolicyIngressRule;
import io.kubernetes.client.openapi.models.V1NetworkPolicyPeer;
import io.kubernetes.client.openapi.models.V1NetworkPolicyPort;
import io.kubernetes.client.openapi.models.V1NetworkPolicySpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;

import java.util.List;
import java.util.Map;

/**
 * Desired CloudNativePG Cluster and NetworkPolicy for a ManagedService.
 */
public final class DatabaseResources {
    public static final String CNPG_CLUSTER_LABEL = "cnpg.io/cluster";
    public static final String CNPG_OPERATOR_NAMESPACE = "cnpg-system";
    private static final String NAMESPACE_NAME_LABEL = "kubernetes.io/metadata.name";

    private DatabaseResources() {
    }

    public static String networkPolicyName(String serviceName) {
        return serviceName + "-netpol";
    }

    /**
     * CNPG names the application credentials Secret after the cluster.
     */
    public static String connectionSecretName(String serviceName) {
        return serviceName + "-app";
    }

    public static ServicePlan planOf(ManagedService service) {
        ServicePlan plan = service.getSpec() == null ? null : service.getSpec().getPlan();
        return plan == null ? ServicePlan.MICRO : plan;
    }

    public static CnpgCluster cluster(ManagedService service) {
        String name = service.getMetadata().getName();
        ServicePlan plan = planOf(service);

        CnpgCluster cluster = new CnpgCluster();
        cluster.setApiVersion(CnpgCluster.GROUP + "/" + CnpgCluster.VERSION);
        cluster.setKind(CnpgCluster.KIND);
        cluster.setMetadata(ManagedResources.childMetadata(service, ManagedService.KIND, name,
                ManagedResources.managedServiceLabels(name)));
        cluster.setSpec(CnpgClusterSpec.builder()
                .instances(plan.getInstances())
                .storage(new CnpgClusterSpec.Storage(plan.getStorageSize()))
                .resources(new V1ResourceRequirements()
                        .putRequestsItem("cpu", new Quantity(plan.getCpu()))
                        .putRequestsItem("memory", new Quantity(plan.getMemory())))
                .build());
        return cluster;
    }

    /**
     * Admits traffic to the cluster's pods from the service's own namespace and from the CNPG
     * operator, which must reach the instance status port for the cluster to become ready.
     */
    public static V1NetworkPolicy networkPolicy(ManagedService service) {
        String name = service.getMetadata().getName();
        return new V1NetworkPolicy()
                .apiVersion("networking.k8s.io/v1")
                .kind("NetworkPolicy")
                .metadata(ManagedResources.childMetadata(service, ManagedService.KIND,
                        networkPolicyName(name), ManagedResources.managedServiceLabels(name)))
                .spec(new V1NetworkPolicySpec()
                        .podSelector(new V1LabelSelector().matchLabels(Map.of(CNPG_CLUSTER_LABEL, name)))
                        .policyTypes(List.of("Ingress"))
                        .addIngressItem(new V1NetworkPolicyIngressRule()
                                .addFromItem(new V1NetworkPolicyPeer().podSelector(new V1LabelSelector()))
                                .addFromItem(new V1NetworkPolicyPeer().namespaceSelector(new V1LabelSelector()
                                        .matchLabels(Map.of(NAMESPACE_NAME_LABEL, CNPG_OPERATOR_NAMESPACE))))
                                .addPortsItem(new V1NetworkPolicyPort().protocol("TCP"))));
    }
}
