package io.iaf.operator.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.KubeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Configuration for the Kubernetes client.
 */
@Configuration
@Slf4j
public class KubernetesClientConfig {
    private static final int READ_TIMEOUT_MILLIS = 60000;

    @Bean
    public ApiClient kubernetesApiClient(OperatorProperties properties) throws IOException {
        if (StringUtils.hasText(properties.getKubeconfig())) {
            return fromKubeconfig(properties.getKubeconfig());
        }
        // Service account token first (when running in cluster)
        try {
            ApiClient client = ClientBuilder.cluster().build();
            client.setReadTimeout(READ_TIMEOUT_MILLIS);
            log.info("Using in-cluster Kubernetes configuration");
            return client;
        } catch (IOException | IllegalStateException e) {
            // Fallback to kubeconfig file for local development
            return fromKubeconfig(System.getProperty("user.home") + "/.kube/config");
        }
    }

    private ApiClient fromKubeconfig(String path) throws IOException {
        log.info("Using kubeconfig {}", path);
        try (Reader reader = new FileReader(path)) {
            KubeConfig kubeConfig = KubeConfig.loadKubeConfig(reader);
            ApiClient client = ClientBuilder.kubeconfig(kubeConfig).build();
            client.setReadTimeout(READ_TIMEOUT_MILLIS);
            return client;
        }
    }
}
