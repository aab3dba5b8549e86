package io.iaf.operator.model;

import com.google.gson.annotations.SerializedName;

public enum ManagedServicePhase {
    @SerializedName("Pending")
    PENDING,
    @SerializedName("Provisioning")
    PROVISIONING,
    @SerializedName("Ready")
    READY,
    // also written while deletion is blocked by bound applications
    @SerializedName("Failed")
    FAILED
}
