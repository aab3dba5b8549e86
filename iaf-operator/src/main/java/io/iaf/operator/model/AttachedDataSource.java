package io.iaf.operator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A DataSource attached to an Application. The credential Secret named here lives in the
 * Application's namespace and is a copy of the DataSource's own Secret.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttachedDataSource {
    private String dataSourceName;
    private String secretName;
}
