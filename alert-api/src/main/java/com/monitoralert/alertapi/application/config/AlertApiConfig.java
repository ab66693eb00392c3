package com.monitoralert.alertapi.application.config;

import com.monitoralert.common.document.MonitorDocumentParser;
import com.monitoralert.common.document.MonitorDocumentWriter;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.lifecycle.AlertLifecycleTracker;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AlertingProperties.class)
public class AlertApiConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdGenerator idGenerator() {
        return IdGenerator.ULID;
    }

    @Bean
    public MonitorDocumentParser monitorDocumentParser(IdGenerator idGenerator) {
        return new MonitorDocumentParser(idGenerator);
    }

    @Bean
    public MonitorDocumentWriter monitorDocumentWriter() {
        return new MonitorDocumentWriter();
    }

    @Bean
    public AlertLifecycleTracker alertLifecycleTracker(IdGenerator idGenerator) {
        return new AlertLifecycleTracker(idGenerator);
    }
}
