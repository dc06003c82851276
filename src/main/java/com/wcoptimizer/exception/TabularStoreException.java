package com.wcoptimizer.exception;

public class TabularStoreException extends WcOptimizerException {
    public TabularStoreException(String message, Throwable cause) {
        super("TABULAR_STORE_ERROR", message, cause);
    }
}
