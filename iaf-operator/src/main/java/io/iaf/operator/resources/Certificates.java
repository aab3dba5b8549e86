package io.iaf.operator.resources;

import io.iaf.operator.model.Application;
import io.iaf.operator.model.certmanager.Certificate;
import io.iaf.operator.model.certmanager.CertificateSpec;

import java.util.List;

public final class Certificates {
    public static final String ISSUER_KIND = "ClusterIssuer";

    private Certificates() {
    }

    public static String tlsSecretName(String appName) {
        return appName + "-tls";
    }

    /**
     * Certificate for {@code host} issued by the named ClusterIssuer into the {@code <name>-tls}
     * Secret.
     */
    public static Certificate certificate(Application app, String host, String issuerName) {
        String name = app.getMetadata().getName();

        Certificate certificate = new Certificate();
        certificate.setApiVersion(Certificate.GROUP + "/" + Certificate.VERSION);
        certificate.setKind(Certificate.KIND);
        certificate.setMetadata(ManagedResources.childMetadata(app, Application.KIND, name,
                ManagedResources.applicationLabels(name)));
        certificate.setSpec(CertificateSpec.builder()
                .secretName(tlsSecretName(name))
                .dnsNames(List.of(host))
                .issuerRef(new CertificateSpec.IssuerRef(issuerName, ISSUER_KIND))
                .build());
        return certificate;
    }
}
