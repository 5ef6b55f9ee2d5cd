package com.redarm.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;

/**
 * Logs how queue messages reach the workers in this instance.
 */
@Configuration
public class WorkerConfig implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger logger = LoggerFactory.getLogger(WorkerConfig.class);

    @Value("${app.messaging.mode:local}")
    private String messagingMode;

    @Value("${app.storage.mode:local}")
    private String storageMode;

    @Value("${app.worker.pull.enabled:false}")
    private boolean pullEnabled;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        logger.info("Messaging mode = {}, storage mode = {}, Pub/Sub pull workers enabled = {}",
                messagingMode, storageMode, pullEnabled);
    }
}
