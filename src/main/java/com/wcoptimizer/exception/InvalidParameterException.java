package com.wcoptimizer.exception;

public class InvalidParameterException extends WcOptimizerException {
    public InvalidParameterException(String message) {
        super("INVALID_PARAMETER", message);
    }
}
