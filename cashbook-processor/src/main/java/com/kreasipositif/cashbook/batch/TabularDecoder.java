package com.kreasipositif.cashbook.batch;

import com.kreasipositif.cashbook.config.CashBookProperties;
import com.kreasipositif.cashbook.domain.DecodedTable;
import com.kreasipositif.cashbook.domain.ProcessingWarning;
import com.kreasipositif.cashbook.domain.RawRow;
import com.kreasipositif.cashbook.exception.DecodeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.FlatFileParseException;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the raw bytes of an export into header-keyed rows.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Separator: the candidate occurring most often in the first
 *       {@code cash-book.decoder.sample-bytes} bytes (read as ISO-8859-1); ties go to the
 *       earlier candidate.</li>
 *   <li>Encoding: each configured encoding is tried with strict decoding. One that cannot
 *       decode the bytes, or decodes them into no data rows, is skipped.</li>
 *   <li>Parsing: a {@link FlatFileItemReader} over the decoded text, with
 *       {@link HeaderAwareLineTokenizer} learning the header from the skipped first line.
 *       Malformed lines become line-numbered warnings; blank lines are dropped.</li>
 * </ol>
 *
 * <p>Fails with {@link DecodeException} only when no encoding yields rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TabularDecoder {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CashBookProperties properties;

    // ─── Public API ───────────────────────────────────────────────────────────

    public DecodedTable decode(byte[] content, String sourceName) {
        char separator = detectSeparator(content);
        log.debug("File '{}': separator '{}'", sourceName, printable(separator));

        for (String encoding : properties.getDecoder().getEncodings()) {
            Optional<String> text = decodeStrict(content, Charset.forName(encoding));
            if (text.isEmpty()) {
                log.debug("File '{}' is not valid {}", sourceName, encoding);
                continue;
            }
            DecodedTable table = parse(text.get(), separator, encoding, sourceName);
            if (!table.rows().isEmpty()) {
                log.info("Decoded '{}' as {} with separator '{}': {} rows, {} skipped lines",
                        sourceName, encoding, printable(separator), table.rows().size(), table.warnings().size());
                return table;
            }
            log.debug("File '{}' produced no rows as {}", sourceName, encoding);
        }
        throw new DecodeException(sourceName,
                "Could not read any rows with encodings %s".formatted(properties.getDecoder().getEncodings()));
    }

    /**
     * Most frequent separator candidate in the leading sample of {@code content}.
     */
    public char detectSeparator(byte[] content) {
        int sampleLength = Math.min(content.length, properties.getDecoder().getSampleBytes());
        String sample = new String(content, 0, sampleLength, StandardCharsets.ISO_8859_1);

        char best = properties.getDecoder().getSeparators().get(0).charAt(0);
        long bestCount = -1;
        for (String candidate : properties.getDecoder().getSeparators()) {
            char separator = candidate.charAt(0);
            long count = sample.chars().filter(c -> c == separator).count();
            if (count > bestCount) {
                best = separator;
                bestCount = count;
            }
        }
        return best;
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private Optional<String> decodeStrict(byte[] content, Charset charset) {
        try {
            String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            return Optional.of(!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text);
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private DecodedTable parse(String text, char separator, String encoding, String sourceName) {
        HeaderAwareLineTokenizer tokenizer = new HeaderAwareLineTokenizer(separator);
        FlatFileItemReader<RawRow> reader = new FlatFileItemReaderBuilder<RawRow>()
                .name("tabularDecoder")
                .resource(new ByteArrayResource(text.getBytes(StandardCharsets.UTF_8), sourceName))
                .encoding(StandardCharsets.UTF_8.name())
                .linesToSkip(1)
                .skippedLinesCallback(tokenizer::useHeader)
                .lineMapper(new RawRowLineMapper(tokenizer))
                .saveState(false)
                .build();
        // a leading '#' is data in these exports
        reader.setComments(new String[0]);

        List<RawRow> rows = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>();
        reader.open(new ExecutionContext());
        try {
            while (true) {
                try {
                    RawRow row = reader.read();
                    if (row == null) {
                        break;
                    }
                    if (!row.isBlank()) {
                        rows.add(row);
                    }
                } catch (FlatFileParseException e) {
                    String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
                    log.debug("Skipping line {} of '{}': {}", e.getLineNumber(), sourceName, reason);
                    warnings.add(ProcessingWarning.forLine(sourceName, e.getLineNumber(),
                            "Malformed line skipped: " + reason));
                }
            }
        } catch (Exception e) {
            throw new DecodeException(sourceName, "Unreadable content: " + e.getMessage());
        } finally {
            reader.close();
        }
        return new DecodedTable(sourceName, separator, encoding, tokenizer.getHeaders(),
                List.copyOf(rows), List.copyOf(warnings));
    }

    private static String printable(char separator) {
        return separator == '\t' ? "\\t" : String.valueOf(separator);
    }
}
