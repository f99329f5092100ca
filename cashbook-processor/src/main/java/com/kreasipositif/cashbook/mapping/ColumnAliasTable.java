package com.kreasipositif.cashbook.mapping;

import com.kreasipositif.cashbook.config.CashBookProperties;
import com.kreasipositif.cashbook.domain.CanonicalField;
import com.kreasipositif.cashbook.domain.SourceSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import static com.kreasipositif.cashbook.domain.CanonicalField.*;

/**
 * Ordered header aliases per schema and canonical field. Earlier aliases win.
 *
 * <p>The built-in table covers the headers of the tax portal's purchase and sales
 * registers and of the receipt summaries. Aliases from
 * {@code cash-book.column-aliases.<schema>.<field>} are appended after the built-in ones.
 * All aliases are stored normalized (see {@link #normalize(String)}).
 */
@Slf4j
@Component
public class ColumnAliasTable {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<String> NET = List.of("monto neto", "monto_neto", "neto");
    private static final List<String> EXEMPT = List.of("monto exento", "monto_exento", "exento");
    private static final List<String> TOTAL = List.of("monto total", "monto_total", "total");
    private static final List<String> NAME_ALIASES = List.of("razon social", "razón social", "razon_social");

    private final Map<SourceSchema, Map<CanonicalField, List<String>>> aliases = new EnumMap<>(SourceSchema.class);

    public ColumnAliasTable(CashBookProperties properties) {
        aliases.put(SourceSchema.SALES_DETAIL, salesDetail());
        aliases.put(SourceSchema.PURCHASE_DETAIL, purchaseDetail());
        aliases.put(SourceSchema.SALES_SUMMARY, salesSummary());
        properties.getColumnAliases().forEach((schemaKey, fields) ->
                fields.forEach((fieldKey, extra) -> append(SourceSchema.fromKey(schemaKey), CanonicalField.fromKey(fieldKey), extra)));
    }

    /**
     * Aliases for {@code field} in {@code schema}, highest priority first; empty if the schema
     * has no such column.
     */
    public List<String> aliases(SourceSchema schema, CanonicalField field) {
        return aliases.get(schema).getOrDefault(field, List.of());
    }

    /**
     * Lower-cases, trims and collapses internal whitespace, so {@code " Monto  Neto "} matches {@code "monto neto"}.
     */
    public static String normalize(String header) {
        return WHITESPACE.matcher(header.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    // ─── built-in table ──────────────────────────────────────────────────────

    private static Map<CanonicalField, List<String>> salesDetail() {
        Map<CanonicalField, List<String>> fields = new EnumMap<>(CanonicalField.class);
        fields.put(DOCUMENT_TYPE, List.of("tipo doc", "tipo_doc", "tipodoc", "tipo documento"));
        fields.put(FOLIO, List.of("folio", "n° folio", "numero folio"));
        fields.put(DATE, List.of("fecha docto", "fecha_docto", "fechadocto", "fecha operación", "fecha"));
        fields.put(COUNTERPARTY_ID, List.of("rut cliente", "rut_cliente", "rutcliente", "rut proveedor", "rut"));
        fields.put(NAME, NAME_ALIASES);
        fields.put(NET_AMOUNT, NET);
        fields.put(EXEMPT_AMOUNT, EXEMPT);
        fields.put(TOTAL_AMOUNT, TOTAL);
        return fields;
    }

    private static Map<CanonicalField, List<String>> purchaseDetail() {
        Map<CanonicalField, List<String>> fields = new EnumMap<>(CanonicalField.class);
        fields.put(DOCUMENT_TYPE, List.of("tipo doc", "tipo_doc", "tipodoc"));
        fields.put(FOLIO, List.of("folio", "n° folio"));
        fields.put(DATE, List.of("fecha docto", "fecha_docto", "fechadocto", "fecha recepcion", "fecha"));
        fields.put(COUNTERPARTY_ID, List.of("rut proveedor", "rut_proveedor", "rutproveedor"));
        fields.put(NAME, NAME_ALIASES);
        fields.put(NET_AMOUNT, NET);
        fields.put(EXEMPT_AMOUNT, EXEMPT);
        fields.put(TOTAL_AMOUNT, TOTAL);
        fields.put(FIXED_ASSET_NET, List.of("monto neto activo fijo", "neto activo fijo"));
        fields.put(NON_RECOVERABLE_TAX, List.of("monto iva no recuperable", "iva no recuperable"));
        fields.put(TOBACCO_CIGARS, List.of("tabacos puros"));
        fields.put(TOBACCO_CIGARETTES, List.of("tabacos cigarrillos"));
        fields.put(TOBACCO_PROCESSED, List.of("tabacos elaborados"));
        fields.put(NON_CREDITABLE_TAX, List.of("impto. sin derecho a credito", "impto. sin derecho a crédito",
                "impuesto sin derecho a credito"));
        fields.put(OTHER_TAX, List.of("valor otro impuesto", "valor otro imp.", "otro impuesto"));
        return fields;
    }

    private static Map<CanonicalField, List<String>> salesSummary() {
        Map<CanonicalField, List<String>> fields = new EnumMap<>(CanonicalField.class);
        fields.put(DOCUMENT_TYPE, List.of("tipo documento", "tipo_documento", "tipodocumento"));
        fields.put(DATE, List.of("fecha", "fecha docto", "fecha_docto"));
        fields.put(NET_AMOUNT, NET);
        fields.put(EXEMPT_AMOUNT, EXEMPT);
        fields.put(TOTAL_AMOUNT, TOTAL);
        fields.put(FOLIO_FROM, List.of("folio inicial", "folio_inicial", "desde"));
        fields.put(FOLIO_TO, List.of("folio final", "folio_final", "hasta"));
        return fields;
    }

    private void append(SourceSchema schema, CanonicalField field, List<String> extra) {
        List<String> merged = new ArrayList<>(aliases(schema, field));
        extra.stream()
                .map(ColumnAliasTable::normalize)
                .filter(alias -> !merged.contains(alias))
                .forEach(merged::add);
        aliases.get(schema).put(field, List.copyOf(merged));
        log.info("Column aliases for {}.{}: {}", schema, field, merged);
    }
}
