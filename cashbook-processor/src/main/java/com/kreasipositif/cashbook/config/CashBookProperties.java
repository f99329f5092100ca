package com.kreasipositif.cashbook.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the {@code cash-book} section from application.yml.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "cash-book")
public class CashBookProperties {

    private Decoder decoder = new Decoder();

    private Dates dates = new Dates();

    /**
     * Extra header aliases, keyed by schema then by canonical field, e.g.
     * {@code column-aliases.purchase-detail.other-tax: ["otros impuestos"]}.
     * They are tried after the built-in aliases.
     */
    private Map<String, Map<String, List<String>>> columnAliases = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Decoder {
        /** Separator candidates; on equal counts the earlier one wins. */
        private List<String> separators = new ArrayList<>(List.of(";", ",", "\t", "|"));
        /** Encodings tried in order with strict decoding. */
        private List<String> encodings = new ArrayList<>(List.of("UTF-8", "windows-1252", "ISO-8859-1"));
        /** Number of leading bytes inspected when sniffing the separator. */
        private int sampleBytes = 2000;
    }

    @Getter
    @Setter
    public static class Dates {
        /** Last step of the date fallback chain: December 31 of the current year. */
        private boolean currentYearFallback = true;
    }
}
