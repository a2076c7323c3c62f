package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.ingest.model.TombstoneImportSummary;
import com.nursingjobs.pipeline.ingest.persistence.ActivationStore;
import com.nursingjobs.pipeline.ingest.util.SlugUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Bulk retirement from a {@code slug_or_url,reason} CSV. Each row retires the job (when it
 * exists) and writes its tombstone; rows without a usable slug are reported and skipped.
 */
@Service
public class TombstoneImportService {
    private static final Logger log = LoggerFactory.getLogger(TombstoneImportService.class);
    private static final String DEFAULT_REASON = "removed";

    private final ActivationStore store;

    public TombstoneImportService(ActivationStore store) {
        this.store = store;
    }

    public TombstoneImportSummary importFile(Path csvPath) {
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            return importCsv(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read tombstone CSV at " + csvPath, e);
        }
    }

    public TombstoneImportSummary importCsv(Reader reader) {
        int rows = 0;
        int tombstoned = 0;
        List<String> errors = new ArrayList<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                rows++;
                String slug = SlugUtils.slugFromUrlOrSlug(getColumn(record, "slug_or_url", "slug", "url"));
                if (slug == null || slug.isBlank()) {
                    errors.add("csv row " + record.getRecordNumber() + " has no slug or url");
                    continue;
                }
                String reason = getColumn(record, "reason");
                store.retire(slug, reason == null ? DEFAULT_REASON : reason);
                tombstoned++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to parse tombstone CSV", e);
        }
        log.info("Tombstone import: rows={}, tombstoned={}, errors={}", rows, tombstoned, errors.size());
        return new TombstoneImportSummary(rows, tombstoned, List.copyOf(errors));
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header != null && header.trim().equalsIgnoreCase(name) && record.isSet(header)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }
}
