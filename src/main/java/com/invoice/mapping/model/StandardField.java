package com.invoice.mapping.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed catalog of standardized invoice fields. Every mapping run emits
 * exactly one {@link FieldMapping} per constant, in declaration order.
 *
 * A non-null {@code pretrainedName} is the name under which the external
 * OCR/AI service reports its own pre-extracted value for the field; those
 * values are tried before any mapping rule.
 */
public enum StandardField {

    // ─── BASIC ─────────────────────────────────────────────────────────
    INVOICE_NUMBER("invoiceNumber", Category.BASIC, DataType.STRING, true, "InvoiceId"),
    INVOICE_DATE("invoiceDate", Category.BASIC, DataType.DATE, true, "InvoiceDate"),
    DUE_DATE("dueDate", Category.BASIC, DataType.DATE, false, "DueDate"),
    CURRENCY("currency", Category.BASIC, DataType.STRING, true, "CurrencyCode"),
    FORWARDER_NAME("forwarderName", Category.BASIC, DataType.STRING, true, "VendorName"),
    FORWARDER_ACCOUNT("forwarderAccount", Category.BASIC, DataType.STRING, false, null),
    SERVICE_TYPE("serviceType", Category.BASIC, DataType.STRING, false, null),
    INCOTERM("incoterm", Category.BASIC, DataType.STRING, false, null),
    CUSTOMS_ENTRY_NUMBER("customsEntryNumber", Category.BASIC, DataType.STRING, false, null),
    BILLING_PERIOD("billingPeriod", Category.BASIC, DataType.STRING, false, null),
    DOCUMENT_TYPE("documentType", Category.BASIC, DataType.STRING, false, null),
    TAX_ID("taxId", Category.BASIC, DataType.STRING, false, null),
    PAGE_NUMBER("pageNumber", Category.BASIC, DataType.NUMBER, false, null),
    STATEMENT_NUMBER("statementNumber", Category.BASIC, DataType.STRING, false, null),
    CUSTOMER_CODE("customerCode", Category.BASIC, DataType.STRING, false, null),

    // ─── SHIPPER ───────────────────────────────────────────────────────
    SHIPPER_NAME("shipperName", Category.SHIPPER, DataType.STRING, true, null),
    SHIPPER_ADDRESS("shipperAddress", Category.SHIPPER, DataType.ADDRESS, false, null),
    SHIPPER_CITY("shipperCity", Category.SHIPPER, DataType.STRING, false, null),
    SHIPPER_STATE("shipperState", Category.SHIPPER, DataType.STRING, false, null),
    SHIPPER_POSTAL_CODE("shipperPostalCode", Category.SHIPPER, DataType.STRING, false, null),
    SHIPPER_COUNTRY("shipperCountry", Category.SHIPPER, DataType.STRING, false, null),
    SHIPPER_PHONE("shipperPhone", Category.SHIPPER, DataType.PHONE, false, null),
    SHIPPER_EMAIL("shipperEmail", Category.SHIPPER, DataType.EMAIL, false, null),
    SHIPPER_CONTACT("shipperContact", Category.SHIPPER, DataType.STRING, false, null),
    SHIPPER_REFERENCE("shipperReference", Category.SHIPPER, DataType.STRING, false, null),
    SHIPPER_TAX_ID("shipperTaxId", Category.SHIPPER, DataType.STRING, false, null),

    // ─── CONSIGNEE ─────────────────────────────────────────────────────
    CONSIGNEE_NAME("consigneeName", Category.CONSIGNEE, DataType.STRING, true, "CustomerName"),
    CONSIGNEE_ADDRESS("consigneeAddress", Category.CONSIGNEE, DataType.ADDRESS, false, "CustomerAddress"),
    CONSIGNEE_CITY("consigneeCity", Category.CONSIGNEE, DataType.STRING, false, null),
    CONSIGNEE_STATE("consigneeState", Category.CONSIGNEE, DataType.STRING, false, null),
    CONSIGNEE_POSTAL_CODE("consigneePostalCode", Category.CONSIGNEE, DataType.STRING, false, null),
    CONSIGNEE_COUNTRY("consigneeCountry", Category.CONSIGNEE, DataType.STRING, false, null),
    CONSIGNEE_PHONE("consigneePhone", Category.CONSIGNEE, DataType.PHONE, false, null),
    CONSIGNEE_EMAIL("consigneeEmail", Category.CONSIGNEE, DataType.EMAIL, false, null),
    CONSIGNEE_CONTACT("consigneeContact", Category.CONSIGNEE, DataType.STRING, false, null),
    CONSIGNEE_REFERENCE("consigneeReference", Category.CONSIGNEE, DataType.STRING, false, null),
    CONSIGNEE_TAX_ID("consigneeTaxId", Category.CONSIGNEE, DataType.STRING, false, null),

    // ─── SHIPPING ──────────────────────────────────────────────────────
    TRACKING_NUMBER("trackingNumber", Category.SHIPPING, DataType.STRING, true, null),
    MASTER_TRACKING_NUMBER("masterTrackingNumber", Category.SHIPPING, DataType.STRING, false, null),
    HOUSE_TRACKING_NUMBER("houseTrackingNumber", Category.SHIPPING, DataType.STRING, false, null),
    SHIP_DATE("shipDate", Category.SHIPPING, DataType.DATE, false, null),
    DELIVERY_DATE("deliveryDate", Category.SHIPPING, DataType.DATE, false, null),
    ORIGIN_CODE("originCode", Category.SHIPPING, DataType.STRING, false, null),
    DESTINATION_CODE("destinationCode", Category.SHIPPING, DataType.STRING, false, null),
    TRANSPORT_MODE("transportMode", Category.SHIPPING, DataType.STRING, false, null),
    CARRIER_CODE("carrierCode", Category.SHIPPING, DataType.STRING, false, null),
    FLIGHT_NUMBER("flightNumber", Category.SHIPPING, DataType.STRING, false, null),
    VESSEL_NAME("vesselName", Category.SHIPPING, DataType.STRING, false, null),
    VOYAGE_NUMBER("voyageNumber", Category.SHIPPING, DataType.STRING, false, null),
    CONTAINER_NUMBER("containerNumber", Category.SHIPPING, DataType.STRING, false, null),
    SEAL_NUMBER("sealNumber", Category.SHIPPING, DataType.STRING, false, null),
    ETD("etd", Category.SHIPPING, DataType.DATE, false, null),
    ETA("eta", Category.SHIPPING, DataType.DATE, false, null),

    // ─── PACKAGE ───────────────────────────────────────────────────────
    TOTAL_PIECES("totalPieces", Category.PACKAGE, DataType.NUMBER, false, null),
    GROSS_WEIGHT("grossWeight", Category.PACKAGE, DataType.WEIGHT, true, null),
    GROSS_WEIGHT_UNIT("grossWeightUnit", Category.PACKAGE, DataType.STRING, false, null),
    NET_WEIGHT("netWeight", Category.PACKAGE, DataType.WEIGHT, false, null),
    CHARGEABLE_WEIGHT("chargeableWeight", Category.PACKAGE, DataType.WEIGHT, false, null),
    VOLUME_WEIGHT("volumeWeight", Category.PACKAGE, DataType.WEIGHT, false, null),
    LENGTH("length", Category.PACKAGE, DataType.DIMENSION, false, null),
    WIDTH("width", Category.PACKAGE, DataType.DIMENSION, false, null),
    HEIGHT("height", Category.PACKAGE, DataType.DIMENSION, false, null),
    DIMENSION_UNIT("dimensionUnit", Category.PACKAGE, DataType.STRING, false, null),
    COMMODITY_DESCRIPTION("commodityDescription", Category.PACKAGE, DataType.STRING, false, null),

    // ─── CHARGES ───────────────────────────────────────────────────────
    FREIGHT_CHARGE("freightCharge", Category.CHARGES, DataType.CURRENCY, true, null),
    FUEL_SURCHARGE("fuelSurcharge", Category.CHARGES, DataType.CURRENCY, false, null),
    SECURITY_SURCHARGE("securitySurcharge", Category.CHARGES, DataType.CURRENCY, false, null),
    HANDLING_FEE("handlingFee", Category.CHARGES, DataType.CURRENCY, false, null),
    CUSTOMS_DUTY("customsDuty", Category.CHARGES, DataType.CURRENCY, false, null),
    IMPORT_TAX("importTax", Category.CHARGES, DataType.CURRENCY, false, null),
    DOCUMENTATION_FEE("documentationFee", Category.CHARGES, DataType.CURRENCY, false, null),
    INSURANCE("insurance", Category.CHARGES, DataType.CURRENCY, false, null),
    STORAGE_FEE("storageFee", Category.CHARGES, DataType.CURRENCY, false, null),
    DELIVERY_FEE("deliveryFee", Category.CHARGES, DataType.CURRENCY, false, null),
    PICKUP_FEE("pickupFee", Category.CHARGES, DataType.CURRENCY, false, null),
    MISC_CHARGES("miscCharges", Category.CHARGES, DataType.CURRENCY, false, null),
    SUBTOTAL("subtotal", Category.CHARGES, DataType.CURRENCY, false, "SubTotal"),
    TAX_AMOUNT("taxAmount", Category.CHARGES, DataType.CURRENCY, false, "TotalTax"),
    TOTAL_AMOUNT("totalAmount", Category.CHARGES, DataType.CURRENCY, true, "InvoiceTotal"),

    // ─── REFERENCE ─────────────────────────────────────────────────────
    PO_NUMBER("poNumber", Category.REFERENCE, DataType.STRING, false, "PurchaseOrder"),
    SO_NUMBER("soNumber", Category.REFERENCE, DataType.STRING, false, null),
    BOOKING_NUMBER("bookingNumber", Category.REFERENCE, DataType.STRING, false, null),
    BATCH_NUMBER("batchNumber", Category.REFERENCE, DataType.STRING, false, null),
    JOB_NUMBER("jobNumber", Category.REFERENCE, DataType.STRING, false, null),

    // ─── PAYMENT ───────────────────────────────────────────────────────
    PAYMENT_TERMS("paymentTerms", Category.PAYMENT, DataType.STRING, false, null),
    BANK_NAME("bankName", Category.PAYMENT, DataType.STRING, false, null),
    BANK_ACCOUNT("bankAccount", Category.PAYMENT, DataType.STRING, false, null),
    SWIFT_CODE("swiftCode", Category.PAYMENT, DataType.STRING, false, null),
    REMITTANCE_INFO("remittanceInfo", Category.PAYMENT, DataType.STRING, false, null),
    CREDIT_NOTE("creditNote", Category.PAYMENT, DataType.STRING, false, null);

    public enum Category { BASIC, SHIPPER, CONSIGNEE, SHIPPING, PACKAGE, CHARGES, REFERENCE, PAYMENT }

    public enum DataType { STRING, NUMBER, DATE, CURRENCY, ADDRESS, PHONE, EMAIL, WEIGHT, DIMENSION }

    private static final Map<String, StandardField> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(StandardField::fieldName, Function.identity()));

    private final String fieldName;
    private final Category category;
    private final DataType dataType;
    private final boolean required;
    private final String pretrainedName;

    StandardField(String fieldName, Category category, DataType dataType,
                  boolean required, String pretrainedName) {
        this.fieldName = fieldName;
        this.category = category;
        this.dataType = dataType;
        this.required = required;
        this.pretrainedName = pretrainedName;
    }

    public String fieldName() {
        return fieldName;
    }

    public Category category() {
        return category;
    }

    public DataType dataType() {
        return dataType;
    }

    public boolean isRequired() {
        return required;
    }

    public Optional<String> pretrainedName() {
        return Optional.ofNullable(pretrainedName);
    }

    public static Optional<StandardField> byName(String fieldName) {
        return fieldName == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(fieldName));
    }

    public static int catalogSize() {
        return values().length;
    }
}
