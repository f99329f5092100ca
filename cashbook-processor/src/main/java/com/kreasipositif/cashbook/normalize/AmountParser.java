package com.kreasipositif.cashbook.normalize;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Parses amounts written in the Chilean convention: {@code .} groups thousands, {@code ,} marks decimals.
 */
public final class AmountParser {

    private static final Pattern NOISE = Pattern.compile("[\\p{Sc}\\s\\u00A0]");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[-+]?\\d+(\\.\\d+)?");
    private static final Pattern THOUSANDS_GROUPED = Pattern.compile("[-+]?\\d{1,3}([.,]\\d{3})+");

    private AmountParser() {
    }

    /**
     * Lenient parse for export cells. Blank, placeholder or garbage text yields zero.
     * <pre>
     *   "1.234,50"   -> 1234.50
     *   "$ 119.000"  -> 119000
     *   ""  / "N/A"  -> 0
     * </pre>
     */
    public static BigDecimal parse(String raw) {
        if (raw == null) {
            return BigDecimal.ZERO;
        }
        String normalized = toDecimalNotation(strip(raw));
        return PLAIN_NUMBER.matcher(normalized).matches() ? new BigDecimal(normalized) : BigDecimal.ZERO;
    }

    /**
     * Strict parse for pasted manual entries, where thousands may be grouped with either
     * {@code .} or {@code ,} ({@code "$151,077"} is 151077).
     *
     * @throws NumberFormatException if the text is not a number
     */
    public static BigDecimal parseStrict(String raw) {
        String stripped = raw == null ? "" : strip(raw);
        String normalized = THOUSANDS_GROUPED.matcher(stripped).matches()
                ? stripped.replace(".", "").replace(",", "")
                : toDecimalNotation(stripped);
        if (!PLAIN_NUMBER.matcher(normalized).matches()) {
            throw new NumberFormatException("Not an amount: '%s'".formatted(raw));
        }
        return new BigDecimal(normalized);
    }

    private static String strip(String raw) {
        return NOISE.matcher(raw).replaceAll("");
    }

    private static String toDecimalNotation(String value) {
        return value.replace(".", "").replace(",", ".");
    }
}
