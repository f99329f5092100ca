package com.kreasipositif.cashbook.domain;

import java.util.List;

/**
 * Result of decoding one export file.
 *
 * @param sourceName file name, used in warnings and for date fallback
 * @param separator  field separator that won the sniffing
 * @param charset    name of the encoding that produced the rows
 * @param headers    trimmed, deduplicated header names (synthetic columns removed)
 * @param rows       non-blank data rows in file order
 * @param warnings   malformed lines that were skipped
 */
public record DecodedTable(String sourceName,
                           char separator,
                           String charset,
                           List<String> headers,
                           List<RawRow> rows,
                           List<ProcessingWarning> warnings) {
}
