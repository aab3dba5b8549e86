package io.iaf.operator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundManagedService {
    private String serviceName;
    private String secretName;
}
