package com.kreasipositif.cashbook.mapping;

import com.kreasipositif.cashbook.domain.CanonicalField;
import com.kreasipositif.cashbook.domain.DecodedTable;
import com.kreasipositif.cashbook.domain.SourceSchema;
import com.kreasipositif.cashbook.exception.MappingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the headers of a decoded file to canonical fields, once per file.
 *
 * <p>For each field the aliases of {@link ColumnAliasTable} are tried in order and the first
 * one present among the (normalized) headers wins. If a field the schema requires is not
 * found, the file cannot be used and {@link MappingException} is thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColumnMapper {

    private final ColumnAliasTable aliasTable;

    public ColumnMapping map(DecodedTable table, SourceSchema schema) {
        Map<String, String> byNormalized = new LinkedHashMap<>();
        for (String header : table.headers()) {
            byNormalized.putIfAbsent(ColumnAliasTable.normalize(header), header);
        }

        Map<CanonicalField, String> resolved = new EnumMap<>(CanonicalField.class);
        for (CanonicalField field : CanonicalField.values()) {
            aliasTable.aliases(schema, field).stream()
                    .filter(byNormalized::containsKey)
                    .findFirst()
                    .ifPresent(alias -> resolved.put(field, byNormalized.get(alias)));
        }

        Set<CanonicalField> missing = EnumSet.noneOf(CanonicalField.class);
        schema.getRequiredFields().stream()
                .filter(field -> !resolved.containsKey(field))
                .forEach(missing::add);
        if (!missing.isEmpty()) {
            throw new MappingException(table.sourceName(), schema, missing);
        }

        log.debug("File '{}' mapped as {}: {}", table.sourceName(), schema, resolved);
        return new ColumnMapping(schema, resolved);
    }
}
