package io.iaf.operator.status;

import io.iaf.operator.model.BuildStatus;
import io.iaf.operator.model.ResourceCondition;
import io.iaf.operator.model.kpack.KpackImage;
import io.iaf.operator.model.kpack.KpackImageStatus;

/**
 * Reduces a kpack Image's status to a {@link BuildResult}.
 */
public final class BuildStatusExtractor {

    private BuildStatusExtractor() {
    }

    public static BuildResult extract(KpackImage image) {
        KpackImageStatus status = image.getStatus();
        if (status == null) {
            return new BuildResult(BuildStatus.UNKNOWN, null);
        }
        String latestImage = status.getLatestImage();
        if (status.getConditions() == null) {
            return new BuildResult(BuildStatus.UNKNOWN, latestImage);
        }
        for (ResourceCondition condition : status.getConditions()) {
            if (ResourceCondition.READY.equals(condition.getType())) {
                return new BuildResult(toBuildStatus(condition.getStatus()), latestImage);
            }
        }
        return new BuildResult(BuildStatus.BUILDING, latestImage);
    }

    private static BuildStatus toBuildStatus(String conditionStatus) {
        if (ResourceCondition.TRUE.equals(conditionStatus)) {
            return BuildStatus.SUCCEEDED;
        }
        if (ResourceCondition.FALSE.equals(conditionStatus)) {
            return BuildStatus.FAILED;
        }
        return BuildStatus.BUILDING;
    }
}
