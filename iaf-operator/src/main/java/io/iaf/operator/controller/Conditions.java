package io.iaf.operator.controller;

import io.kubernetes.client.openapi.models.V1Condition;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Upsert-by-type over an ordered condition list. Existing entries keep their position.
 */
public final class Conditions {
    public static final String READY = "Ready";
    public static final String TRUE = "True";
    public static final String FALSE = "False";

    private Conditions() {
    }

    public static void upsert(List<V1Condition> conditions, String type, boolean status,
                              String reason, String message) {
        String statusValue = status ? TRUE : FALSE;
        for (V1Condition condition : conditions) {
            if (type.equals(condition.getType())) {
                if (!statusValue.equals(condition.getStatus())) {
                    condition.setLastTransitionTime(now());
                }
                condition.setStatus(statusValue);
                condition.setReason(reason);
                condition.setMessage(message);
                return;
            }
        }
        conditions.add(new V1Condition()
                .type(type)
                .status(statusValue)
                .reason(reason)
                .message(message)
                .lastTransitionTime(now()));
    }

    public static V1Condition find(List<V1Condition> conditions, String type) {
        if (conditions == null) {
            return null;
        }
        return conditions.stream()
                .filter(condition -> type.equals(condition.getType()))
                .findFirst()
                .orElse(null);
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }
}
