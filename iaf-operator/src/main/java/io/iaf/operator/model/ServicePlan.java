package io.iaf.operator.model;

import com.google.gson.annotations.SerializedName;

/**
 * Resource tier of a ManagedService. Each tier fixes the database cluster's instance count,
 * CPU and memory requests and storage size.
 */
public enum ServicePlan {
    @SerializedName("micro")
    MICRO(1, "250m", "256Mi", 1),
    @SerializedName("small")
    SMALL(1, "500m", "512Mi", 5),
    @SerializedName("ha")
    HA(3, "1", "1Gi", 10);

    private final int instances;
    private final String cpu;
    private final String memory;
    private final int storageGi;

    ServicePlan(int instances, String cpu, String memory, int storageGi) {
        this.instances = instances;
        this.cpu = cpu;
        this.memory = memory;
        this.storageGi = storageGi;
    }

    public int getInstances() {
        return instances;
    }

    public String getCpu() {
        return cpu;
    }

    public String getMemory() {
        return memory;
    }

    public String getStorageSize() {
        return storageGi + "Gi";
    }
}
