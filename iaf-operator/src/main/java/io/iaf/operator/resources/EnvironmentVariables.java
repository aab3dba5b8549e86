package io.iaf.operator.resources;

import io.iaf.operator.model.AttachedDataSource;
import io.iaf.operator.model.BoundManagedService;
import io.iaf.operator.model.DataSource;
import io.iaf.operator.model.EnvVar;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1EnvVarSource;
import io.kubernetes.client.openapi.models.V1SecretKeySelector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the container environment of an Application workload.
 */
@Slf4j
public final class EnvironmentVariables {

    /**
     * Connection secret key -> injected variable, in injection order.
     */
    public static final Map<String, String> MANAGED_SERVICE_ENV;

    static {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("uri", "DATABASE_URL");
        mapping.put("host", "PGHOST");
        mapping.put("port", "PGPORT");
        mapping.put("dbname", "PGDATABASE");
        mapping.put("username", "PGUSER");
        mapping.put("password", "PGPASSWORD");
        MANAGED_SERVICE_ENV = Collections.unmodifiableMap(mapping);
    }

    private EnvironmentVariables() {
    }

    public static List<V1EnvVar> inline(List<EnvVar> env) {
        List<V1EnvVar> result = new ArrayList<>();
        if (env == null) {
            return result;
        }
        for (EnvVar var : env) {
            result.add(new V1EnvVar().name(var.getName()).value(var.getValue()));
        }
        return result;
    }

    /**
     * Secret references for an attached DataSource, read from the Application's copy of the
     * credential Secret. Mapped names that are not valid variable names are skipped.
     */
    public static List<V1EnvVar> fromDataSource(AttachedDataSource attached, DataSource dataSource) {
        List<V1EnvVar> result = new ArrayList<>();
        if (dataSource.getSpec() == null || dataSource.getSpec().getEnvVarMapping() == null) {
            return result;
        }
        Map<String, String> mapping = new TreeMap<>(dataSource.getSpec().getEnvVarMapping());
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            String envName = entry.getValue();
            if (!EnvVarNames.isValid(envName)) {
                log.warn("Skipping invalid env var name {} mapped from key {} of DataSource {}",
                        envName, entry.getKey(), attached.getDataSourceName());
                continue;
            }
            result.add(secretRef(envName, attached.getSecretName(), entry.getKey()));
        }
        return result;
    }

    public static List<V1EnvVar> fromManagedService(BoundManagedService bound) {
        List<V1EnvVar> result = new ArrayList<>();
        MANAGED_SERVICE_ENV.forEach((key, envName) ->
                result.add(secretRef(envName, bound.getSecretName(), key)));
        return result;
    }

    private static V1EnvVar secretRef(String envName, String secretName, String key) {
        return new V1EnvVar()
                .name(envName)
                .valueFrom(new V1EnvVarSource()
                        .secretKeyRef(new V1SecretKeySelector().name(secretName).key(key)));
    }
}
