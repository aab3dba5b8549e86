package io.iaf.operator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Operator settings, bound from {@code iaf.*} properties or {@code IAF_*} environment variables.
 */
@Data
@ConfigurationProperties(prefix = "iaf")
public class OperatorProperties {

    /**
     * kpack ClusterBuilder used for source builds.
     */
    private String clusterBuilder = "iaf-cluster-builder";

    /**
     * Registry repository prefix; built images are tagged {@code <prefix>/<app name>}.
     */
    private String registryPrefix = "registry.localhost:5000/iaf";

    /**
     * Service account kpack builds run as.
     */
    private String buildServiceAccount = "iaf-kpack-sa";

    /**
     * Default hostnames are {@code <app name>.<base domain>}.
     */
    private String baseDomain = "localhost";

    /**
     * cert-manager ClusterIssuer. Empty disables TLS for every application.
     */
    private String tlsIssuer = "";

    /**
     * Explicit kubeconfig path; in-cluster configuration is tried first when unset.
     */
    private String kubeconfig;

    private int workerCount = 2;

    private Duration resyncPeriod = Duration.ofMinutes(1);

    public boolean isTlsIssuerConfigured() {
        return StringUtils.hasText(tlsIssuer);
    }
}
