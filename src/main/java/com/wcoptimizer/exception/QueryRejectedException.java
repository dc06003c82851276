package com.wcoptimizer.exception;

import lombok.Getter;

@Getter
public class QueryRejectedException extends WcOptimizerException {
    private final String keyword;

    public QueryRejectedException(String keyword) {
        super("WRITE_BLOCKED", "Write operations blocked: " + keyword);
        this.keyword = keyword;
    }
}
