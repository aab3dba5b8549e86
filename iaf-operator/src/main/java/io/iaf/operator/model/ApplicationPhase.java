package io.iaf.operator.model;

import com.google.gson.annotations.SerializedName;

public enum ApplicationPhase {
    @SerializedName("Pending")
    PENDING,
    @SerializedName("Building")
    BUILDING,
    @SerializedName("Deploying")
    DEPLOYING,
    @SerializedName("Running")
    RUNNING
}
