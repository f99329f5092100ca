package com.kreasipositif.cashbook.normalize;

/**
 * Step of the date fallback chain that produced an operation date.
 */
public enum DateSource {
    ROW,
    SIBLING_ROW,
    FILE_NAME,
    PERIOD,
    CURRENT_YEAR
}
