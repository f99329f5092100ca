package com.kreasipositif.cashbook.batch;

import org.springframework.batch.item.file.transform.DefaultFieldSet;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.batch.item.file.transform.IncorrectTokenCountException;
import org.springframework.batch.item.file.transform.LineTokenizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tokenizes export lines against a header learned at read time.
 *
 * <p>The header line is handed over through {@link #useHeader(String)}, which
 * {@link TabularDecoder} registers as the reader's skipped-lines callback. Exports
 * from the tax portal often end each data line with a stray separator, so the first
 * non-blank data line may be wider than the header; in that case placeholder
 * columns {@code _extra_0, _extra_1, ...} are appended and later dropped by
 * {@link RawRowFieldSetMapper}.
 *
 * <h3>Width rules</h3>
 * <ul>
 *   <li>Shorter than the header: padded with empty cells.</li>
 *   <li>Wider than the (extended) header: {@link IncorrectTokenCountException}, which the
 *       reader reports as a {@code FlatFileParseException} for that line.</li>
 * </ul>
 *
 * <p>Not thread-safe; one instance per file.
 */
public class HeaderAwareLineTokenizer implements LineTokenizer {

    static final String EXTRA_COLUMN_PREFIX = "_extra_";

    private static final String[] NO_TOKENS = new String[0];

    private final DelimitedLineTokenizer delegate;

    private String[] names = NO_TOKENS;
    private boolean widthSettled;

    public HeaderAwareLineTokenizer(char separator) {
        this.delegate = new DelimitedLineTokenizer(String.valueOf(separator));
        this.delegate.setQuoteCharacter('"');
        this.delegate.setStrict(false);
    }

    /**
     * Learns the header: names are trimmed and repeated names get {@code .1}, {@code .2} suffixes.
     */
    public void useHeader(String headerLine) {
        String[] raw = delegate.tokenize(headerLine).getValues();
        Set<String> seen = new HashSet<>();
        List<String> unique = new ArrayList<>(raw.length);
        for (String token : raw) {
            String name = token.trim();
            String candidate = name;
            for (int suffix = 1; !seen.add(candidate); suffix++) {
                candidate = name + "." + suffix;
            }
            unique.add(candidate);
        }
        this.names = unique.toArray(NO_TOKENS);
        this.widthSettled = false;
    }

    public List<String> getHeaders() {
        return Arrays.stream(names)
                .filter(name -> !name.startsWith(EXTRA_COLUMN_PREFIX))
                .toList();
    }

    @Override
    public FieldSet tokenize(String line) {
        if (line == null || line.isBlank()) {
            return new DefaultFieldSet(NO_TOKENS, NO_TOKENS);
        }
        String[] values = delegate.tokenize(line).getValues();

        if (!widthSettled) {
            widthSettled = true;
            if (values.length > names.length) {
                names = withExtraColumns(values.length);
            }
        }
        if (values.length > names.length) {
            throw new IncorrectTokenCountException(names.length, values.length, line);
        }
        if (values.length < names.length) {
            int actual = values.length;
            values = Arrays.copyOf(values, names.length);
            Arrays.fill(values, actual, names.length, "");
        }
        return new DefaultFieldSet(values, names);
    }

    private String[] withExtraColumns(int width) {
        String[] extended = Arrays.copyOf(names, width);
        for (int i = names.length; i < width; i++) {
            extended[i] = EXTRA_COLUMN_PREFIX + (i - names.length);
        }
        return extended;
    }
}
