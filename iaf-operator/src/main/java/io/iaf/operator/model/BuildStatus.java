package io.iaf.operator.model;

import com.google.gson.annotations.SerializedName;

/**
 * Outcome of the container image build backing an Application.
 */
public enum BuildStatus {
    @SerializedName("NotRequired")
    NOT_REQUIRED,
    @SerializedName("Building")
    BUILDING,
    @SerializedName("Succeeded")
    SUCCEEDED,
    @SerializedName("Failed")
    FAILED,
    @SerializedName("Unknown")
    UNKNOWN
}
