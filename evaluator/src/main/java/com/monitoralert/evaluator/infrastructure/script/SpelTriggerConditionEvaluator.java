package com.monitoralert.evaluator.infrastructure.script;

import com.monitoralert.common.exceptions.EvaluationException;
import com.monitoralert.common.model.Script;
import com.monitoralert.evaluator.domain.execution.TriggerConditionEvaluator;
import com.monitoralert.evaluator.domain.execution.TriggerExecutionContext;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * Evaluates trigger conditions written in SpEL against a read-only context.
 *
 * <p>Variables: {@code #results} (list of search responses), {@code #hitCount} (total hits
 * of the first response), {@code #monitor}, {@code #trigger}, {@code #periodStart},
 * {@code #periodEnd}, {@code #alert}.
 */
@Component
public class SpelTriggerConditionEvaluator implements TriggerConditionEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> expressions = new ConcurrentHashMap<>();

    @Override
    public boolean evaluate(Script condition, TriggerExecutionContext context) {
        var triggerId = context.trigger().id();
        Object value;
        try {
            var expression = expressions.computeIfAbsent(condition.source(), parser::parseExpression);
            value = expression.getValue(evaluationContext(context));
        } catch (RuntimeException e) {
            throw EvaluationException.of(triggerId, e);
        }
        if (!(value instanceof Boolean result)) {
            throw EvaluationException.nonBoolean(triggerId, value);
        }
        return result;
    }

    private static SimpleEvaluationContext evaluationContext(TriggerExecutionContext context) {
        var evaluationContext = SimpleEvaluationContext.forReadOnlyDataBinding().withInstanceMethods().build();
        var arg = context.asTemplateArg();
        evaluationContext.setVariable("results", context.results());
        evaluationContext.setVariable("hitCount", hitCount(context));
        evaluationContext.setVariable("monitor", arg.get("monitor"));
        evaluationContext.setVariable("trigger", arg.get("trigger"));
        evaluationContext.setVariable("periodStart", context.periodStart());
        evaluationContext.setVariable("periodEnd", context.periodEnd());
        evaluationContext.setVariable("alert", arg.get("alert"));
        return evaluationContext;
    }

    @SuppressWarnings("unchecked")
    static long hitCount(TriggerExecutionContext context) {
        if (context.results().isEmpty()) {
            return 0L;
        }
        var hits = context.results().get(0).get("hits");
        if (!(hits instanceof Map)) {
            return 0L;
        }
        var total = ((Map<String, Object>) hits).get("total");
        if (total instanceof Map) {
            total = ((Map<String, Object>) total).get("value");
        }
        return total instanceof Number number ? number.longValue() : 0L;
    }
}
