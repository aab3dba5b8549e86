package io.iaf.operator.model.kpack;

import io.iaf.operator.model.ResourceCondition;
import lombok.Data;

import java.util.List;

@Data
public class KpackImageStatus {
    private String latestImage;
    private List<ResourceCondition> conditions;
}
