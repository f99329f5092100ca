package com.kreasipositif.cashbook.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operation kind of a cash book entry, carrying the fiscal code printed in the book.
 */
public enum OperationKind {

    /** Synthetic first entry holding the starting cash balance. */
    OPENING(0),

    /** Cash inflow. */
    INCOME(1),

    /** Cash outflow. */
    EXPENSE(2);

    private final int code;

    OperationKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Whether the entry counts on the income side of the totals. The opening balance does.
     */
    public boolean isInflow() {
        return this != EXPENSE;
    }

    public static Optional<OperationKind> fromCode(int code) {
        return Arrays.stream(values())
                .filter(kind -> kind.code == code)
                .findFirst();
    }
}
