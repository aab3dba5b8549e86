package io.iaf.operator.resources;

import io.iaf.operator.model.Application;
import io.iaf.operator.model.traefik.IngressRoute;
import io.iaf.operator.model.traefik.IngressRouteSpec;

import java.util.List;

public final class IngressRoutes {
    public static final String RULE_KIND = "Rule";

    private IngressRoutes() {
    }

    /**
     * Routes {@code host} to the Application's Service. With TLS the route listens on the secure
     * entry point and terminates with the {@code <name>-tls} Secret.
     */
    public static IngressRoute ingressRoute(Application app, String host, boolean tlsEnabled) {
        String name = app.getMetadata().getName();

        IngressRouteSpec.Route route = new IngressRouteSpec.Route(
                "Host(`" + host + "`)",
                RULE_KIND,
                List.of(new IngressRouteSpec.Service(name, app.getSpec().resolvedPort())));

        IngressRouteSpec.IngressRouteSpecBuilder spec = IngressRouteSpec.builder().routes(List.of(route));
        if (tlsEnabled) {
            spec.entryPoints(List.of(IngressRouteSpec.ENTRY_POINT_WEBSECURE))
                    .tls(new IngressRouteSpec.Tls(Certificates.tlsSecretName(name)));
        } else {
            spec.entryPoints(List.of(IngressRouteSpec.ENTRY_POINT_WEB));
        }

        IngressRoute ingressRoute = new IngressRoute();
        ingressRoute.setApiVersion(IngressRoute.GROUP + "/" + IngressRoute.VERSION);
        ingressRoute.setKind(IngressRoute.KIND);
        ingressRoute.setMetadata(ManagedResources.childMetadata(app, Application.KIND, name,
                ManagedResources.applicationLabels(name)));
        ingressRoute.setSpec(spec.build());
        return ingressRoute;
    }
}
