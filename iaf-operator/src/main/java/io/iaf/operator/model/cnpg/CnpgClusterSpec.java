package io.iaf.operator.model.cnpg;

import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CnpgClusterSpec {
    private Integer instances;
    private Storage storage;
    private V1ResourceRequirements resources;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Storage {
        private String size;
    }
}
