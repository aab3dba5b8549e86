package io.iaf.operator.status;

import io.iaf.operator.model.ManagedServicePhase;
import io.iaf.operator.model.ResourceCondition;
import io.iaf.operator.model.cnpg.CnpgCluster;
import io.iaf.operator.resources.DatabaseResources;

/**
 * Reduces a CloudNativePG Cluster's status to a ManagedService phase. Anything short of a
 * {@code Ready=True} condition is still provisioning.
 */
public final class ClusterStatusExtractor {

    private ClusterStatusExtractor() {
    }

    public static ClusterReadiness extract(CnpgCluster cluster) {
        String secretName = DatabaseResources.connectionSecretName(cluster.getMetadata().getName());
        if (cluster.getStatus() == null || cluster.getStatus().getConditions() == null) {
            return provisioning(secretName);
        }
        for (ResourceCondition condition : cluster.getStatus().getConditions()) {
            if (ResourceCondition.READY.equals(condition.getType())) {
                if (ResourceCondition.TRUE.equals(condition.getStatus())) {
                    return new ClusterReadiness(ManagedServicePhase.READY, secretName);
                }
                return provisioning(secretName);
            }
        }
        return provisioning(secretName);
    }

    public static ClusterReadiness provisioning(String secretName) {
        return new ClusterReadiness(ManagedServicePhase.PROVISIONING, secretName);
    }
}
