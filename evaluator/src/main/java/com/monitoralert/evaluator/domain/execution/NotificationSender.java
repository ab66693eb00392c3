package com.monitoralert.evaluator.domain.execution;

import com.monitoralert.common.event.ActionNotification;
import java.util.concurrent.CompletableFuture;

public interface NotificationSender {

    /**
     * Hands the notification off for delivery. The future completes once the hand-off is
     * acknowledged and fails if it is not.
     */
    CompletableFuture<Void> send(ActionNotification notification);
}
