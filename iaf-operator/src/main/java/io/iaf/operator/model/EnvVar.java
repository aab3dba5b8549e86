package io.iaf.operator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Literal environment variable declared inline on an Application.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnvVar {
    private String name;
    private String value;
}
