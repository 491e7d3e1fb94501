package com.geography.sync.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geography.sync.core.GeographySyncException;
import com.geography.sync.ingest.GeographyIngestService;
import com.geography.sync.ingest.IngestAcknowledgement;
import com.geography.sync.ingest.IngestRequest;
import com.geography.sync.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JSON Lines bulk importer for tenant geography trees.
 *
 * <p>One record per line, parents before children:</p>
 * <pre>
 * {"ref": "np", "tenantId": "party-a", "level": 0, "names": {"en": "Nepal"}}
 * {"ref": "ktm", "parentRef": "np", "tenantId": "party-a", "level": 1, "names": {"en": "Kathmandu", "ne": "काठमाडौं"}}
 * </pre>
 *
 * <p>Each record goes through {@link GeographyIngestService#ingest} in stream order. A failing
 * record is reported and skipped; records referring to it through {@code parentRef} fail too.</p>
 */
public class JsonBulkImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonBulkImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final GeographyIngestService ingestService;
    private final ObjectMapper objectMapper;

    public JsonBulkImporter(GeographyIngestService ingestService) {
        this(ingestService, new ObjectMapper());
    }

    public JsonBulkImporter(GeographyIngestService ingestService, ObjectMapper objectMapper) {
        this.ingestService = ingestService;
        this.objectMapper = objectMapper;
    }

    public ImportResult importUnits(InputStream input, ProgressCallback callback) {
        return importUnits(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ImportResult importUnits(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();
        Map<String, String> unitIdsByRef = new HashMap<>();

        long totalRecords = 0;
        long created = 0;
        long linked = 0;
        long conflicts = 0;
        long deferred = 0;
        long duplicates = 0;

        String importId = UUID.randomUUID().toString();
        try (LogContext ignored = LogContext.forImport(importId);
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                totalRecords++;

                ImportRecord record;
                try {
                    record = objectMapper.readValue(line, ImportRecord.class);
                } catch (JsonProcessingException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, "", "Malformed JSON: " + e.getOriginalMessage()));
                    log.warn("import.malformed line={} error={}", lineNumber, e.getOriginalMessage());
                    continue;
                }
                String ref = record.ref() != null ? record.ref() : "line-" + lineNumber;

                try {
                    String parentId = record.parentId();
                    if (record.parentRef() != null) {
                        parentId = unitIdsByRef.get(record.parentRef());
                        if (parentId == null) {
                            throw new IllegalArgumentException("Unknown parentRef '" + record.parentRef() + "'");
                        }
                    }
                    IngestAcknowledgement ack = ingestService.ingest(IngestRequest.builder()
                            .tenantId(record.tenantId())
                            .level(record.level())
                            .parentId(parentId)
                            .names(record.names() != null ? record.names() : Map.of())
                            .primaryLanguage(record.primaryLanguage())
                            .governmentCode(record.governmentCode())
                            .build());
                    unitIdsByRef.put(ref, ack.tenantUnitId());

                    if (ack.duplicateSubmission() || ack.outcome() == null) {
                        duplicates++;
                    } else {
                        switch (ack.outcome()) {
                            case CREATE_NEW -> created++;
                            case LINK_EXISTING -> linked++;
                            case FLAGGED_CONFLICT -> conflicts++;
                            case DEFERRED -> deferred++;
                            default -> log.debug("import.unexpected_outcome ref={} outcome={}", ref, ack.outcome());
                        }
                    }
                } catch (GeographySyncException | IllegalArgumentException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, ref, e.getMessage()));
                    log.warn("import.error line={} ref={} error={}", lineNumber, ref, e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRecords, created, linked, conflicts, deferred, duplicates, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed importId={} result={}", importId, result);
        return result;
    }
}
