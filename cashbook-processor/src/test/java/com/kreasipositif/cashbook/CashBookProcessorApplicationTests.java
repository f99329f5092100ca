package com.kreasipositif.cashbook;

import com.kreasipositif.cashbook.config.CashBookProperties;
import com.kreasipositif.cashbook.domain.CanonicalField;
import com.kreasipositif.cashbook.domain.SourceSchema;
import com.kreasipositif.cashbook.mapping.ColumnAliasTable;
import com.kreasipositif.cashbook.service.CashBookService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@TestPropertySource(properties = "cash-book.column-aliases.purchase-detail.other-tax=otros impuestos")
class CashBookProcessorApplicationTests {

    @Autowired
    private CashBookService cashBookService;

    @Autowired
    private CashBookProperties properties;

    @Autowired
    private ColumnAliasTable columnAliasTable;

    @Autowired
    private Clock clock;

    @Test
    void contextLoads() {
        assertThat(cashBookService).isNotNull();
        assertThat(clock).isNotNull();
    }

    @Test
    void decoderSettingsAreBound() {
        assertThat(properties.getDecoder().getSeparators()).containsExactly(";", ",", "\t", "|");
        assertThat(properties.getDecoder().getEncodings()).containsExactly("UTF-8", "windows-1252", "ISO-8859-1");
        assertThat(properties.getDecoder().getSampleBytes()).isEqualTo(2000);
        assertThat(properties.getDates().isCurrentYearFallback()).isTrue();
    }

    @Test
    void configuredAliasIsAppended() {
        assertThat(columnAliasTable.aliases(SourceSchema.PURCHASE_DETAIL, CanonicalField.OTHER_TAX))
                .contains("valor otro impuesto")
                .last().isEqualTo("otros impuestos");
    }
}
