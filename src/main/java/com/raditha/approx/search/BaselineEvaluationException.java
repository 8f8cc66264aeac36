package com.raditha.approx.search;

/**
 * The unmodified kernel could not be evaluated. Without a reference output and energy
 * there is nothing to compare against, so the run stops.
 */
public class BaselineEvaluationException extends Exception {

    public BaselineEvaluationException(String message) {
        super(message);
    }

    public BaselineEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
