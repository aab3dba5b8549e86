package io.iaf.operator.resources;

import io.iaf.operator.model.Application;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentSpec;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PodSecurityContext;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1SecurityContext;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;

import java.util.List;
import java.util.Map;

/**
 * Desired Deployment and Service for an Application. Both share the Application's name.
 */
public final class WorkloadResources {
    public static final String CONTAINER_NAME = "app";

    private WorkloadResources() {
    }

    public static V1Deployment deployment(Application app, String image, List<V1EnvVar> env) {
        String name = app.getMetadata().getName();
        Map<String, String> selector = Map.of(ManagedResources.APPLICATION_LABEL, name);

        V1Container container = new V1Container()
                .name(CONTAINER_NAME)
                .image(image)
                .addPortsItem(new V1ContainerPort()
                        .containerPort(app.getSpec().resolvedPort())
                        .protocol("TCP"))
                .env(env)
                .securityContext(new V1SecurityContext().allowPrivilegeEscalation(false));

        return new V1Deployment()
                .apiVersion("apps/v1")
                .kind("Deployment")
                .metadata(ManagedResources.childMetadata(app, Application.KIND, name,
                        ManagedResources.applicationLabels(name)))
                .spec(new V1DeploymentSpec()
                        .replicas(app.getSpec().resolvedReplicas())
                        .selector(new V1LabelSelector().matchLabels(selector))
                        .template(new V1PodTemplateSpec()
                                .metadata(new V1ObjectMeta().labels(selector))
                                .spec(new V1PodSpec()
                                        .securityContext(new V1PodSecurityContext().runAsNonRoot(true))
                                        .addContainersItem(container))));
    }

    public static V1Service service(Application app) {
        String name = app.getMetadata().getName();
        return new V1Service()
                .apiVersion("v1")
                .kind("Service")
                .metadata(ManagedResources.childMetadata(app, Application.KIND, name,
                        ManagedResources.applicationLabels(name)))
                .spec(new V1ServiceSpec()
                        .selector(Map.of(ManagedResources.APPLICATION_LABEL, name))
                        .addPortsItem(new V1ServicePort()
                                .port(app.getSpec().resolvedPort())
                                .protocol("TCP")));
    }
}
