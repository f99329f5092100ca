package com.kreasipositif.cashbook.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data line of a decoded export: header name to cell text, in header order.
 *
 * @param lineNumber physical line number in the source, 1-based, header included
 * @param cells      trimmed cell values keyed by (deduplicated) header name
 */
public record RawRow(int lineNumber, Map<String, String> cells) {

    public RawRow {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public String get(String header) {
        return header == null ? "" : cells.getOrDefault(header, "");
    }

    public boolean isBlank() {
        return cells.values().stream().allMatch(String::isBlank);
    }

    public RawRow withLineNumber(int lineNumber) {
        return new RawRow(lineNumber, cells);
    }
}
