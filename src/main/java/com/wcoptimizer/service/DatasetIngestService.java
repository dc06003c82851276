package com.wcoptimizer.service;

import com.wcoptimizer.catalog.DatasetCategory;
import com.wcoptimizer.dto.UploadResponse;
import com.wcoptimizer.exception.DatasetLoadException;
import com.wcoptimizer.repository.TabularStore;
import com.wcoptimizer.service.GraphSyncService.SyncOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Whole-table replacement of a dataset from a CSV upload, followed by the
 * graph mirror for supplier and purchase-order data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetIngestService {

    static final String STATUS_LOADED = "loaded";
    static final String STATUS_MISSING_COLUMNS = "missing_columns";

    private final TabularStore store;
    private final GraphSyncService graphSync;
    private final Clock clock;

    public UploadResponse upload(String category, MultipartFile file) {
        DatasetCategory target = DatasetCategory.fromName(category);
        if (file == null || file.isEmpty()) {
            throw new DatasetLoadException("Uploaded file is empty");
        }
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.csv";
        if (!filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new DatasetLoadException("Only .csv files are supported: " + filename);
        }

        Path temp = null;
        try {
            temp = Files.createTempFile("wc-upload-", ".csv");
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            }
            return replace(target, temp, filename);
        } catch (IOException e) {
            throw new DatasetLoadException("Could not read uploaded file " + filename, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Replaces the category's table with the CSV contents, checks the required
     * columns, logs the upload and mirrors graph-backed categories.
     */
    public UploadResponse replace(DatasetCategory category, Path csv, String filename) {
        long rows = store.replaceFromCsv(category, csv);
        Set<String> present = store.columns(category);
        List<String> missing = new ArrayList<>();
        for (String column : category.getRequiredColumns()) {
            if (!present.contains(column)) {
                missing.add(column);
            }
        }
        boolean valid = missing.isEmpty();
        store.recordUpload(category.getTableName(), filename, LocalDateTime.now(clock), rows,
            valid ? STATUS_LOADED : STATUS_MISSING_COLUMNS);
        log.info("Dataset replaced | category={} | file={} | rows={} | valid={}",
            category.getTableName(), filename, rows, valid);

        SyncOutcome sync = SyncOutcome.skipped();
        if (category.isGraphSynced()) {
            sync = valid
                ? graphSync.sync(category)
                : new SyncOutcome(false, "Graph sync skipped: required columns missing.");
        }

        return UploadResponse.builder()
            .category(category.getTableName())
            .table(category.getTableName())
            .filename(filename)
            .rows(rows)
            .columns(List.copyOf(present))
            .valid(valid)
            .missingColumns(valid ? null : missing)
            .destination(category.destination())
            .graphSynced(sync.synced())
            .graphNote(sync.note())
            .build();
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temp upload {} | {}", temp, e.getMessage());
        }
    }
}
