package io.iaf.operator.controller;

import io.iaf.operator.model.BuildStatus;
import lombok.Value;

/**
 * The image to deploy, or the build status to report while there is none yet.
 */
@Value
class ImageResolution {
    String image;
    BuildStatus buildStatus;

    static ImageResolution resolved(String image, BuildStatus buildStatus) {
        return new ImageResolution(image, buildStatus);
    }

    static ImageResolution pending(BuildStatus buildStatus) {
        return new ImageResolution(null, buildStatus);
    }

    boolean isResolved() {
        return image != null;
    }
}
