package io.iaf.operator.model.kpack;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpackImageSpec {
    private String tag;
    private BuilderRef builder;
    private String serviceAccountName;
    private Source source;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BuilderRef {
        private String kind;
        private String name;
    }

    /**
     * Exactly one of {@code git} or {@code blob} is set.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Source {
        private Git git;
        private Blob blob;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Git {
        private String url;
        private String revision;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Blob {
        private String url;
    }
}
