package io.iaf.operator.model.cnpg;

import io.iaf.operator.model.ResourceCondition;
import lombok.Data;

import java.util.List;

@Data
public class CnpgClusterStatus {
    private String phase;
    private List<ResourceCondition> conditions;
}
