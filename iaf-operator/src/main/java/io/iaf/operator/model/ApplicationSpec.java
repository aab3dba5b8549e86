package io.iaf.operator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Specification for an Application custom resource.
 * Exactly one image source is used: a literal image wins over git, git wins over blob.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationSpec {
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_REPLICAS = 1;

    private String image;
    private GitSource git;
    private String blob;

    private Integer port;
    private Integer replicas;
    private List<EnvVar> env;

    private String host;
    private TlsConfig tls;

    private List<AttachedDataSource> attachedDataSources;
    private List<BoundManagedService> boundManagedServices;

    public int resolvedPort() {
        return port == null || port == 0 ? DEFAULT_PORT : port;
    }

    public int resolvedReplicas() {
        return replicas == null || replicas == 0 ? DEFAULT_REPLICAS : replicas;
    }

    /**
     * TLS is on unless {@code tls.enabled} is explicitly false.
     */
    public boolean tlsRequested() {
        return tls == null || tls.getEnabled() == null || tls.getEnabled();
    }

    public boolean hasImage() {
        return StringUtils.hasText(image);
    }

    public boolean hasGitSource() {
        return git != null && StringUtils.hasText(git.getUrl());
    }

    public boolean hasBlobSource() {
        return StringUtils.hasText(blob);
    }
}
