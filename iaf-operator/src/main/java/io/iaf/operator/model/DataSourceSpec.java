package io.iaf.operator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceSpec {
    private String kind;
    private String description;
    private String schema;
    private List<String> tags;
    private SecretRef secretRef;

    // secret key -> environment variable name
    private Map<String, String> envVarMapping;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SecretRef {
        private String name;
        private String namespace;
    }
}
