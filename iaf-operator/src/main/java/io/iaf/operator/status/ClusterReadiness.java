package io.iaf.operator.status;

import io.iaf.operator.model.ManagedServicePhase;
import lombok.Value;

@Value
public class ClusterReadiness {
    ManagedServicePhase phase;
    String connectionSecretName;

    public boolean isReady() {
        return phase == ManagedServicePhase.READY;
    }
}
