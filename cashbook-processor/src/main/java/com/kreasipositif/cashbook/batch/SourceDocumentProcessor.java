package com.kreasipositif.cashbook.batch;

import com.kreasipositif.cashbook.classify.DocumentClassifier;
import com.kreasipositif.cashbook.domain.CanonicalRecord;
import com.kreasipositif.cashbook.domain.DecodedTable;
import com.kreasipositif.cashbook.domain.IngestionResult;
import com.kreasipositif.cashbook.domain.ProcessingWarning;
import com.kreasipositif.cashbook.domain.RowOutcome;
import com.kreasipositif.cashbook.domain.SourceDocument;
import com.kreasipositif.cashbook.domain.SourceSchema;
import com.kreasipositif.cashbook.mapping.ColumnMapper;
import com.kreasipositif.cashbook.mapping.ColumnMapping;
import com.kreasipositif.cashbook.mapping.SourceRow;
import com.kreasipositif.cashbook.normalize.DateContext;
import com.kreasipositif.cashbook.normalize.DateParser;
import com.kreasipositif.cashbook.normalize.DateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one export file through decoding, column mapping, date resolution and classification.
 *
 * <h3>Per row</h3>
 * <ol>
 *   <li>Classify: unknown or out-of-place document codes and zero totals are ignored silently.</li>
 *   <li>Resolve the operation date through {@link DateResolver}; a row without one is rejected
 *       with a warning naming the file and line.</li>
 *   <li>Build the {@link CanonicalRecord}.</li>
 * </ol>
 *
 * <p>File-level failures ({@code DecodeException}, {@code MappingException}) are not caught here;
 * the caller decides to skip the file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceDocumentProcessor {

    private final TabularDecoder decoder;
    private final ColumnMapper columnMapper;
    private final DateResolver dateResolver;
    private final DocumentClassifier classifier;

    public IngestionResult process(SourceDocument document, String period) {
        SourceSchema schema = document.schema();
        DecodedTable table = decoder.decode(document.content(), document.name());
        ColumnMapping mapping = columnMapper.map(table, schema);

        List<SourceRow> rows = table.rows().stream()
                .map(row -> SourceRow.from(row, mapping))
                .toList();
        DateContext dateContext = new DateContext(document.name(), period, indexDocumentDates(rows, schema));

        List<CanonicalRecord> records = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>(table.warnings());
        int ignored = 0;
        for (SourceRow row : rows) {
            RowOutcome<CanonicalRecord> outcome = toRecord(row, schema, dateContext);
            switch (outcome.status()) {
                case ACCEPTED -> records.add(outcome.value());
                case IGNORED -> {
                    ignored++;
                    log.debug("'{}' line {} ignored: {}", document.name(), row.lineNumber(), outcome.reason());
                }
                case REJECTED -> {
                    log.debug("'{}' line {} rejected: {}", document.name(), row.lineNumber(), outcome.reason());
                    warnings.add(ProcessingWarning.forLine(document.name(), row.lineNumber(), outcome.reason()));
                }
            }
        }

        log.info("File '{}' ({}): {} records, {} rows ignored, {} warnings",
                document.name(), schema, records.size(), ignored, warnings.size());
        return new IngestionResult(List.copyOf(records), List.copyOf(warnings));
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private RowOutcome<CanonicalRecord> toRecord(SourceRow row, SourceSchema schema, DateContext dateContext) {
        return classifier.classify(schema, row).flatMap(classification ->
                dateResolver.resolve(row.rawDate(), row.documentKey(schema), dateContext)
                        .map(resolved -> RowOutcome.accepted(classifier.toRecord(classification, row, resolved.date())))
                        .orElseGet(() -> RowOutcome.rejected("No usable operation date")));
    }

    /**
     * First parsable date per document key, for rows of the same document that lack one.
     */
    private static Map<String, LocalDate> indexDocumentDates(List<SourceRow> rows, SourceSchema schema) {
        Map<String, LocalDate> index = new HashMap<>();
        for (SourceRow row : rows) {
            String key = row.documentKey(schema);
            if (!key.isEmpty()) {
                DateParser.parse(row.rawDate()).ifPresent(date -> index.putIfAbsent(key, date));
            }
        }
        return index;
    }
}
