package com.monitoralert.common.exceptions;

/**
 * The trigger condition could not be evaluated. The alert moves to ERROR and no actions run.
 */
public class EvaluationException extends RuntimeException {

    private EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static EvaluationException of(String triggerId, Throwable cause) {
        return new EvaluationException(
                "Failed evaluating trigger " + triggerId + ": " + cause.getMessage(), cause);
    }

    public static EvaluationException nonBoolean(String triggerId, Object result) {
        return new EvaluationException(
                "Trigger " + triggerId + " condition returned " + result + " instead of a boolean", null);
    }
}
