package com.kreasipositif.cashbook.classify;

import java.util.Arrays;
import java.util.Optional;

/**
 * Electronic document types issued under the tax authority's code table.
 */
public enum DocumentType {

    ELECTRONIC_INVOICE(33, "Factura Electrónica", DocumentCategory.INVOICE),
    EXEMPT_INVOICE(34, "Factura No Afecta o Exenta Electrónica", DocumentCategory.INVOICE),
    AFFECTED_RECEIPT(35, "Boleta Afecta Electrónica", DocumentCategory.AFFECTED_RECEIPT),
    EXEMPT_RECEIPT(38, "Boleta No Afecta o Exenta Electrónica", DocumentCategory.EXEMPT_RECEIPT),
    ELECTRONIC_RECEIPT(39, "Boleta Electrónica", DocumentCategory.AFFECTED_RECEIPT),
    EXEMPT_ELECTRONIC_RECEIPT(41, "Boleta Exenta Electrónica", DocumentCategory.EXEMPT_RECEIPT),
    PURCHASE_INVOICE(46, "Factura de Compra Electrónica", DocumentCategory.PURCHASE_INVOICE),
    PAYMENT_VOUCHER(48, "Comprobante de Pago Electrónico", DocumentCategory.PAYMENT_VOUCHER),
    DISPATCH_GUIDE(52, "Guía de Despacho Electrónica", DocumentCategory.DISPATCH_GUIDE),
    DEBIT_NOTE(56, "Nota de Débito Electrónica", DocumentCategory.DEBIT_NOTE),
    CREDIT_NOTE(61, "Nota de Crédito Electrónica", DocumentCategory.CREDIT_NOTE),
    EXPORT_INVOICE(110, "Factura de Exportación Electrónica", DocumentCategory.INVOICE),
    EXPORT_DEBIT_NOTE(111, "Nota de Débito de Exportación Electrónica", DocumentCategory.DEBIT_NOTE),
    EXPORT_CREDIT_NOTE(112, "Nota de Crédito de Exportación Electrónica", DocumentCategory.CREDIT_NOTE),
    IMPORT_DECLARATION(914, "Declaración de Ingreso (DIN)", DocumentCategory.PURCHASE_INVOICE);

    private final int code;
    private final String officialName;
    private final DocumentCategory category;

    DocumentType(int code, String officialName, DocumentCategory category) {
        this.code = code;
        this.officialName = officialName;
        this.category = category;
    }

    public int getCode() {
        return code;
    }

    public String getOfficialName() {
        return officialName;
    }

    public DocumentCategory getCategory() {
        return category;
    }

    public static Optional<DocumentType> fromCode(int code) {
        return Arrays.stream(values())
                .filter(type -> type.code == code)
                .findFirst();
    }
}
