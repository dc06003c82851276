package com.wcoptimizer.catalog;

import java.util.List;

/**
 * A dataset an analysis needs, optionally narrowed to the columns it reads.
 */
public record Requirement(DatasetCategory category, List<String> columns) {

    public Requirement {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static Requirement of(DatasetCategory category, String... columns) {
        return new Requirement(category, List.of(columns));
    }
}
