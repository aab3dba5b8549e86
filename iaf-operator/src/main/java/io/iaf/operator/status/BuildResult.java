package io.iaf.operator.status;

import io.iaf.operator.model.BuildStatus;
import lombok.Value;
import org.springframework.util.StringUtils;

/**
 * Build outcome plus the image it produced, if any.
 */
@Value
public class BuildResult {
    BuildStatus status;
    String latestImage;

    /**
     * An empty image means not ready yet, whatever the reported status.
     */
    public boolean hasImage() {
        return StringUtils.hasText(latestImage);
    }
}
