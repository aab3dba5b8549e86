package io.iaf.operator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Loosely typed condition as reported by third-party controllers (kpack, CloudNativePG),
 * whose conditions do not always carry every field a {@code V1Condition} requires.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceCondition {
    public static final String READY = "Ready";
    public static final String TRUE = "True";
    public static final String FALSE = "False";

    private String type;
    private String status;
    private String reason;
    private String message;
    private String lastTransitionTime;

    public ResourceCondition(String type, String status) {
        this.type = type;
        this.status = status;
    }
}
