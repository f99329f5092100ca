package com.kreasipositif.cashbook.normalize;

import java.time.LocalDate;

public record ResolvedDate(LocalDate date, DateSource source) {
}
