package io.iaf.operator.model;

import io.kubernetes.client.openapi.models.V1Condition;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Status for an Application custom resource.
 */
@Data
public class ApplicationStatus {
    private ApplicationPhase phase;
    private String url;
    private String latestImage;
    private BuildStatus buildStatus;
    private Integer availableReplicas;
    private List<V1Condition> conditions = new ArrayList<>();
}
