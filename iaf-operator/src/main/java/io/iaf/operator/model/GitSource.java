package io.iaf.operator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GitSource {
    public static final String DEFAULT_REVISION = "main";

    private String url;
    private String revision;

    public String resolvedRevision() {
        return StringUtils.hasText(revision) ? revision : DEFAULT_REVISION;
    }
}
