package io.iaf.operator.resources;

import io.iaf.operator.model.Application;
import io.iaf.operator.model.ApplicationSpec;
import io.iaf.operator.testing.TestResources;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import io.kubernetes.client.openapi.models.V1Service;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkloadResourcesTest {

    @Test
    void deploymentRunsImageWithDefaults() {
        Application app = TestResources.application("shop", ApplicationSpec.builder().image("nginx:latest").build());

        V1Deployment deployment = WorkloadResources.deployment(app, "nginx:latest",
                List.of(new V1EnvVar().name("MODE").value("prod")));

        assertThat(deployment.getMetadata().getName()).isEqualTo("shop");
        assertThat(deployment.getMetadata().getNamespace()).isEqualTo(TestResources.NAMESPACE);
        assertThat(deployment.getMetadata().getLabels())
                .containsEntry(ManagedResources.MANAGED_BY_LABEL, "iaf")
                .containsEntry(ManagedResources.APPLICATION_LABEL, "shop");
        assertThat(deployment.getSpec().getReplicas()).isEqualTo(1);
        assertThat(deployment.getSpec().getSelector().getMatchLabels())
                .containsExactlyEntriesOf(deployment.getSpec().getTemplate().getMetadata().getLabels());
        assertThat(deployment.getSpec().getTemplate().getSpec().getSecurityContext().getRunAsNonRoot()).isTrue();

        V1Container container = deployment.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(container.getName()).isEqualTo(WorkloadResources.CONTAINER_NAME);
        assertThat(container.getPorts().get(0).getContainerPort()).isEqualTo(8080);
        assertThat(container.getPorts().get(0).getProtocol()).isEqualTo("TCP");
        assertThat(container.getSecurityContext().getAllowPrivilegeEscalation()).isFalse();
        assertThat(container.getEnv()).extracting(V1EnvVar::getName).containsExactly("MODE");
    }

    @Test
    void deploymentIsControlledByApplication() {
        Application app = TestResources.application("shop", ApplicationSpec.builder().image("nginx").build());

        V1OwnerReference owner = WorkloadResources.deployment(app, "nginx", List.of())
                .getMetadata().getOwnerReferences().get(0);

        assertThat(owner.getApiVersion()).isEqualTo("iaf.io/v1alpha1");
        assertThat(owner.getKind()).isEqualTo("Application");
        assertThat(owner.getUid()).isEqualTo(app.getMetadata().getUid());
        assertThat(owner.getController()).isTrue();
        assertThat(owner.getBlockOwnerDeletion()).isTrue();
    }

    @Test
    void deploymentHonoursPortAndReplicas() {
        Application app = TestResources.application("shop",
                ApplicationSpec.builder().image("nginx").port(3000).replicas(3).build());

        V1Deployment deployment = WorkloadResources.deployment(app, "nginx", List.of());

        assertThat(deployment.getSpec().getReplicas()).isEqualTo(3);
        assertThat(deployment.getSpec().getTemplate().getSpec().getContainers().get(0).getPorts().get(0)
                .getContainerPort()).isEqualTo(3000);
    }

    @Test
    void serviceSelectsApplicationPods() {
        Application app = TestResources.application("shop",
                ApplicationSpec.builder().image("nginx").port(3000).build());

        V1Service service = WorkloadResources.service(app);

        assertThat(service.getSpec().getSelector()).containsExactlyEntriesOf(
                Map.of(ManagedResources.APPLICATION_LABEL, "shop"));
        assertThat(service.getSpec().getPorts()).singleElement().satisfies(port -> {
            assertThat(port.getPort()).isEqualTo(3000);
            assertThat(port.getProtocol()).isEqualTo("TCP");
        });
    }
}
