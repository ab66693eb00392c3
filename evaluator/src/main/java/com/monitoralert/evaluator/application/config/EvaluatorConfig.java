package com.monitoralert.evaluator.application.config;

import com.monitoralert.common.document.MonitorDocumentParser;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.lifecycle.AlertLifecycleTracker;
import com.monitoralert.evaluator.domain.alert.AlertStore;
import com.monitoralert.evaluator.domain.execution.ActionDispatcher;
import com.monitoralert.evaluator.domain.execution.MonitorRunner;
import com.monitoralert.evaluator.domain.execution.NotificationSender;
import com.monitoralert.evaluator.domain.execution.SearchPort;
import com.monitoralert.evaluator.domain.execution.TemplateRenderer;
import com.monitoralert.evaluator.domain.execution.TriggerConditionEvaluator;
import com.monitoralert.evaluator.domain.ledger.ActionExecutionLedger;
import com.monitoralert.evaluator.infrastructure.search.HttpSearchAdapter;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(EvaluatorProperties.class)
public class EvaluatorConfig {

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
    public AlertLifecycleTracker alertLifecycleTracker(IdGenerator idGenerator) {
        return new AlertLifecycleTracker(idGenerator);
    }

    @Bean
    public SearchPort searchPort(EvaluatorProperties properties) {
        return new HttpSearchAdapter(RestClient.builder().baseUrl(properties.search().baseUrl()).build());
    }

    @Bean
    public ActionDispatcher actionDispatcher(
            TemplateRenderer templateRenderer,
            NotificationSender notificationSender,
            @Qualifier("actionExecutor") ThreadPoolTaskExecutor actionExecutor,
            EvaluatorProperties properties) {
        return new ActionDispatcher(
                templateRenderer, notificationSender, actionExecutor, properties.actions().timeout());
    }

    @Bean
    public MonitorRunner monitorRunner(
            SearchPort searchPort,
            TriggerConditionEvaluator conditionEvaluator,
            ActionExecutionLedger ledger,
            AlertLifecycleTracker tracker,
            ActionDispatcher dispatcher,
            AlertStore alertStore,
            EvaluatorProperties properties) {
        return new MonitorRunner(
                searchPort,
                conditionEvaluator,
                ledger,
                tracker,
                dispatcher,
                alertStore,
                properties.persist().maxRetries());
    }
}
