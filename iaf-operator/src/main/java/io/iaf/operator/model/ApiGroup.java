package io.iaf.operator.model;

/**
 * API group and version served by the IAF custom resource definitions.
 */
public final class ApiGroup {
    public static final String GROUP = "iaf.io";
    public static final String VERSION = "v1alpha1";
    public static final String API_VERSION = GROUP + "/" + VERSION;

    private ApiGroup() {
    }
}
