package com.wcoptimizer.exception;

import java.util.List;

public class InvalidCategoryException extends WcOptimizerException {
    public InvalidCategoryException(String category, List<String> valid) {
        super("INVALID_CATEGORY",
              "Invalid category '" + category + "'. Must be one of: " + valid);
    }
}
