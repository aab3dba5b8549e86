package io.iaf.operator.model.traefik;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngressRouteSpec {
    public static final String ENTRY_POINT_WEB = "web";
    public static final String ENTRY_POINT_WEBSECURE = "websecure";

    private List<String> entryPoints;
    private List<Route> routes;
    private Tls tls;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Route {
        private String match;
        private String kind;
        private List<Service> services;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Service {
        private String name;
        private Integer port;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tls {
        private String secretName;
    }
}
