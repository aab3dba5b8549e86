package io.iaf.operator.runner;

import io.kubernetes.client.extended.controller.ControllerManager;
import io.kubernetes.client.informer.SharedInformerFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Starts the informers, then blocks running the Application and ManagedService controllers.
 */
@Component
@Slf4j
public class ControllerRunner implements CommandLineRunner {
    private final SharedInformerFactory informerFactory;
    private final ControllerManager controllerManager;

    @Autowired
    public ControllerRunner(
            SharedInformerFactory informerFactory,
            ControllerManager controllerManager) {
        this.informerFactory = informerFactory;
        this.controllerManager = controllerManager;
    }

    @Override
    public void run(String... args) {
        log.info("Starting informers and controller manager");

        informerFactory.startAllRegisteredInformers();
        controllerManager.run();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping controller manager");
        controllerManager.shutdown();
    }
}
