package io.iaf.operator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the IAF Kubernetes Operator.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class IafOperatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IafOperatorApplication.class, args);
    }
}
