package com.wcoptimizer.exception;

public class DatasetLoadException extends WcOptimizerException {
    public DatasetLoadException(String message) {
        super("DATASET_LOAD_ERROR", message);
    }
    public DatasetLoadException(String message, Throwable cause) {
        super("DATASET_LOAD_ERROR", message, cause);
    }
}
