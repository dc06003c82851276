package com.wcoptimizer.service;

import com.wcoptimizer.catalog.DatasetCategory;
import com.wcoptimizer.catalog.Requirement;
import com.wcoptimizer.dto.InsufficientDataResponse;
import com.wcoptimizer.repository.TabularStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides whether an analysis can run against the datasets currently loaded.
 * A requirement fails when its table is absent, empty, or lacks a named column.
 */
@Service
@RequiredArgsConstructor
public class AvailabilityResolver {

    private final TabularStore store;

    public boolean isAvailable(DatasetCategory category) {
        return store.tableExists(category) && store.rowCount(category) > 0;
    }

    /** True when the table is loaded and carries every listed column. */
    public boolean isAvailable(DatasetCategory category, String... columns) {
        return isAvailable(category) && store.hasColumns(category, columns);
    }

    public Availability check(Requirement... requirements) {
        List<String> missingTables = new ArrayList<>();
        List<String> missingColumns = new ArrayList<>();
        for (Requirement requirement : requirements) {
            String table = requirement.category().getTableName();
            if (!isAvailable(requirement.category())) {
                missingTables.add(table);
                continue;
            }
            Set<String> present = store.columns(requirement.category());
            requirement.columns().stream()
                .filter(column -> !present.contains(column))
                .map(column -> table + "." + column)
                .forEach(missingColumns::add);
        }
        return new Availability(missingTables, missingColumns);
    }

    public record Availability(List<String> missingTables, List<String> missingColumns) {

        public boolean satisfied() {
            return missingTables.isEmpty() && missingColumns.isEmpty();
        }

        public String message() {
            List<String> parts = new ArrayList<>();
            if (!missingTables.isEmpty()) {
                parts.add("Upload " + String.join(" + ", missingTables) + " to enable this analysis.");
            }
            if (!missingColumns.isEmpty()) {
                parts.add("Missing column(s) " + String.join(", ", missingColumns)
                    + "; re-upload with these columns to enable this analysis.");
            }
            return String.join(" ", parts);
        }

        public InsufficientDataResponse toResponse(String analysis) {
            List<String> missing = new ArrayList<>(missingTables);
            missing.addAll(missingColumns);
            return InsufficientDataResponse.builder()
                .analysis(analysis)
                .message(message())
                .missing(missing)
                .build();
        }
    }
}
