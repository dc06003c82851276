package com.wcoptimizer.exception;

import lombok.Getter;

@Getter
public abstract class WcOptimizerException extends RuntimeException {
    private final String errorCode;
    protected WcOptimizerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected WcOptimizerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
