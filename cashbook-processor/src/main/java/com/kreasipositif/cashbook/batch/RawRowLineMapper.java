package com.kreasipositif.cashbook.batch;

import com.kreasipositif.cashbook.domain.RawRow;
import org.springframework.batch.item.file.mapping.DefaultLineMapper;

/**
 * {@link DefaultLineMapper} that stamps each row with its physical line number, so later
 * warnings can point at the offending line.
 */
public class RawRowLineMapper extends DefaultLineMapper<RawRow> {

    public RawRowLineMapper(HeaderAwareLineTokenizer tokenizer) {
        setLineTokenizer(tokenizer);
        setFieldSetMapper(new RawRowFieldSetMapper());
    }

    @Override
    public RawRow mapLine(String line, int lineNumber) throws Exception {
        return super.mapLine(line, lineNumber).withLineNumber(lineNumber);
    }
}
