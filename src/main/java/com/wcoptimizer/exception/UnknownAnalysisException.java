package com.wcoptimizer.exception;

public class UnknownAnalysisException extends WcOptimizerException {
    public UnknownAnalysisException(String name) {
        super("UNKNOWN_ANALYSIS", "Unknown analysis '" + name + "'.");
    }
}
