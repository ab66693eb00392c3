package com.monitoralert.evaluator.domain.execution;

import com.monitoralert.common.event.ActionNotification;
import com.monitoralert.common.exceptions.ExecutorFailureException;
import com.monitoralert.common.model.ActionDefinition;
import com.monitoralert.evaluator.domain.ledger.ActionOutcome;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders and hands off each eligible action as its own unit of work. A slow or failing
 * action yields a failure outcome and never delays the other actions past the timeout.
 */
@Slf4j
@RequiredArgsConstructor
public class ActionDispatcher {

    private final TemplateRenderer templateRenderer;
    private final NotificationSender notificationSender;
    private final Executor executor;
    private final Duration timeout;

    /**
     * @return one outcome per action, in the order given
     */
    public List<ActionOutcome> dispatch(TriggerExecutionContext context, List<ActionDefinition> actions, Instant now) {
        var futures = new ArrayList<CompletableFuture<ActionOutcome>>(actions.size());
        for (var action : actions) {
            futures.add(dispatchOne(context, action, now));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<ActionOutcome> dispatchOne(
            TriggerExecutionContext context, ActionDefinition action, Instant now) {
        return CompletableFuture.supplyAsync(() -> render(context, action, now), executor)
                .thenCompose(notificationSender::send)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, ex) -> {
                    if (ex == null) {
                        log.debug("action.dispatched: action_id={}, alert_id={}", action.id(), alertId(context));
                        return ActionOutcome.success(action.id(), action.name());
                    }
                    var failure = toFailure(action, ex);
                    log.warn("action.failed: action_id={}, alert_id={}, reason={}",
                            action.id(), alertId(context), failure.getMessage());
                    return ActionOutcome.failure(action.id(), action.name(), failure.getMessage());
                });
    }

    private ActionNotification render(TriggerExecutionContext context, ActionDefinition action, Instant now) {
        var ctx = new HashMap<>(context.asTemplateArg());
        ctx.put("action", action.asTemplateArg());
        Map<String, Object> args = Map.of("ctx", ctx);

        var subject = action.subjectTemplate() == null
                ? null
                : templateRenderer.render(action.subjectTemplate(), args);
        var message = templateRenderer.render(action.messageTemplate(), args);

        var alert = context.alert();
        return ActionNotification.builder()
                .alertId(alertId(context))
                .monitorId(context.monitor().id())
                .monitorName(context.monitor().name())
                .triggerId(context.trigger().id())
                .triggerName(context.trigger().name())
                .severity(alert == null ? context.trigger().severity() : alert.severity())
                .actionId(action.id())
                .actionName(action.name())
                .destinationId(action.destinationId())
                .subject(subject)
                .message(message)
                .createdAt(now)
                .build();
    }

    private ExecutorFailureException toFailure(ActionDefinition action, Throwable ex) {
        var cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return ExecutorFailureException.timeout(action.id(), timeout);
        }
        if (cause instanceof ExecutorFailureException failure) {
            return failure;
        }
        return ExecutorFailureException.of(action.id(), cause);
    }

    private static String alertId(TriggerExecutionContext context) {
        return context.alert() == null ? null : context.alert().id();
    }
}
