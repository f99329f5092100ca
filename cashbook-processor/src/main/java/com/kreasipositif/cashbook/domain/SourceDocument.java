package com.kreasipositif.cashbook.domain;

/**
 * One uploaded export together with the layout the caller declared for it.
 *
 * @param name    original file name; also feeds the date fallback chain
 * @param schema  layout of the file
 * @param content raw bytes, encoding unknown
 */
public record SourceDocument(String name, SourceSchema schema, byte[] content) {
}
