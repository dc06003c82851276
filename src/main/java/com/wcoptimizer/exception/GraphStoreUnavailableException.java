package com.wcoptimizer.exception;

public class GraphStoreUnavailableException extends WcOptimizerException {
    public GraphStoreUnavailableException(String message, Throwable cause) {
        super("GRAPH_STORE_UNAVAILABLE", message, cause);
    }
}
