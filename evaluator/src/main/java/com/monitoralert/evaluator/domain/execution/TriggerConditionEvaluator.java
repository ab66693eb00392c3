package com.monitoralert.evaluator.domain.execution;

import com.monitoralert.common.exceptions.EvaluationException;
import com.monitoralert.common.model.Script;

public interface TriggerConditionEvaluator {

    /**
     * @throws EvaluationException if the condition cannot be evaluated or is not boolean
     */
    boolean evaluate(Script condition, TriggerExecutionContext context);
}
