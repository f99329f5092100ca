package com.kreasipositif.cashbook.batch;

import com.kreasipositif.cashbook.domain.RawRow;
import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.batch.item.file.transform.FieldSet;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a tokenized export line to a {@link RawRow}, keeping every named column except the
 * synthetic {@code _extra_} placeholders. Cells are trimmed. The line number is attached
 * afterwards by {@link RawRowLineMapper}.
 */
public class RawRowFieldSetMapper implements FieldSetMapper<RawRow> {

    @Override
    public RawRow mapFieldSet(FieldSet fieldSet) {
        String[] names = fieldSet.getNames();
        Map<String, String> cells = new LinkedHashMap<>();
        for (int i = 0; i < names.length; i++) {
            if (!names[i].startsWith(HeaderAwareLineTokenizer.EXTRA_COLUMN_PREFIX)) {
                cells.put(names[i], fieldSet.readString(i));
            }
        }
        return new RawRow(0, cells);
    }
}
