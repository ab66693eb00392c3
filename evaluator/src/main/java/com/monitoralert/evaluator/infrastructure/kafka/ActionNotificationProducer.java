package com.monitoralert.evaluator.infrastructure.kafka;

import com.monitoralert.common.event.ActionNotification;
import com.monitoralert.common.kafka.KafkaTopics;
import com.monitoralert.evaluator.domain.execution.NotificationSender;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Produces ActionNotification events to the alert-notifications topic, keyed by alert_id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionNotificationProducer implements NotificationSender {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public CompletableFuture<Void> send(ActionNotification notification) {
        return kafkaTemplate.send(KafkaTopics.ALERT_NOTIFICATIONS, notification.alertId(), notification)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to produce ActionNotification for action {} of alert {}: {}",
                                notification.actionId(), notification.alertId(), ex.getMessage());
                    } else {
                        log.debug("Produced ActionNotification for action {} of alert {} to partition {}",
                                notification.actionId(),
                                notification.alertId(),
                                result.getRecordMetadata().partition());
                    }
                })
                .thenApply(result -> null);
    }
}
