package com.lawcheck.eval;

public class EvaluationLimitExceededException extends RuntimeException {

    public EvaluationLimitExceededException(String message) {
        super(message);
    }
}
