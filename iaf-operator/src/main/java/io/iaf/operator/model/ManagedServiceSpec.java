package io.iaf.operator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManagedServiceSpec {
    public static final String TYPE_POSTGRES = "postgres";

    private String type;
    private ServicePlan plan;
}
