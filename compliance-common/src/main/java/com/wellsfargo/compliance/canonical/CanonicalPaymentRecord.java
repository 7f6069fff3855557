package com.wellsfargo.compliance.canonical;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.wellsfargo.compliance.canonical.enums.RecordFormat;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Canonical, scheme-agnostic representation of one transfer instruction.
 *
 * Every inbound payload (free-form field map, JSON document, pacs.008 XML)
 * is normalized into this shape before evaluation. All fields except
 * {@code identifier} and {@code sourceFormat} are optional; an absent field
 * is null and never an empty placeholder string.
 *
 * Key properties:
 * 1. Immutable: built once by the normalizer, never modified afterwards
 * 2. Identifier always resolvable: falls back to transaction, end-to-end and
 *    message identifiers, then to a generated placeholder
 * 3. Amount is a BigDecimal so threshold comparisons are exact
 * 4. Scheme-specific extras live in {@code extensions}
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CanonicalPaymentRecord {

    public static final String PLACEHOLDER_PREFIX = "UNKNOWN-";

    /**
     * Record identifier used in results and logs.
     */
    @NotBlank
    String identifier;

    /**
     * Scheme the record claims to follow (e.g., "SEPA", "SWIFT_MT103").
     */
    String scheme;

    /**
     * ISO 4217 currency code.
     */
    String currency;

    /**
     * Transfer amount, absent when the payload carried no parseable amount.
     */
    BigDecimal amount;

    /**
     * Amount text exactly as received (used for decimal-format checks).
     */
    String rawAmount;

    String messageId;
    String endToEndId;
    String transactionId;
    String instructionId;

    /**
     * Originator (debtor) side.
     */
    String debtorName;
    String debtorIban;
    String debtorAgentBic;
    String debtorCountry;
    String orderingCustomer;

    /**
     * Beneficiary (creditor) side.
     */
    String creditorName;
    String creditorIban;
    String creditorAgentBic;
    String creditorCountry;
    String beneficiary;

    /**
     * Payment type and purpose.
     */
    String purposeCode;
    String categoryPurpose;
    String serviceLevel;
    String localInstrument;
    String chargeBearer;

    /**
     * Settlement metadata.
     */
    String settlementMethod;
    String settlementDate;
    String clearingSystem;
    String creationDateTime;

    /**
     * Remittance information.
     */
    String remittanceInformation;
    String creditorReference;
    String creditorReferenceType;

    /**
     * Payload shape this record was normalized from.
     */
    RecordFormat sourceFormat;

    /**
     * Scheme-specific fields with no canonical counterpart.
     */
    Map<String, Object> extensions;

    @Builder(toBuilder = true)
    private CanonicalPaymentRecord(String identifier, String scheme, String currency, BigDecimal amount,
                                   String rawAmount, String messageId, String endToEndId, String transactionId,
                                   String instructionId, String debtorName, String debtorIban,
                                   String debtorAgentBic, String debtorCountry, String orderingCustomer,
                                   String creditorName, String creditorIban, String creditorAgentBic,
                                   String creditorCountry, String beneficiary, String purposeCode,
                                   String categoryPurpose, String serviceLevel, String localInstrument,
                                   String chargeBearer, String settlementMethod, String settlementDate,
                                   String clearingSystem, String creationDateTime, String remittanceInformation,
                                   String creditorReference, String creditorReferenceType,
                                   RecordFormat sourceFormat, Map<String, Object> extensions) {
        this.identifier = resolveIdentifier(identifier, transactionId, endToEndId, messageId);
        this.scheme = scheme;
        this.currency = currency;
        this.amount = amount;
        this.rawAmount = rawAmount != null ? rawAmount : (amount != null ? amount.toPlainString() : null);
        this.messageId = messageId;
        this.endToEndId = endToEndId;
        this.transactionId = transactionId;
        this.instructionId = instructionId;
        this.debtorName = debtorName;
        this.debtorIban = debtorIban;
        this.debtorAgentBic = debtorAgentBic;
        this.debtorCountry = debtorCountry;
        this.orderingCustomer = orderingCustomer;
        this.creditorName = creditorName;
        this.creditorIban = creditorIban;
        this.creditorAgentBic = creditorAgentBic;
        this.creditorCountry = creditorCountry;
        this.beneficiary = beneficiary;
        this.purposeCode = purposeCode;
        this.categoryPurpose = categoryPurpose;
        this.serviceLevel = serviceLevel;
        this.localInstrument = localInstrument;
        this.chargeBearer = chargeBearer;
        this.settlementMethod = settlementMethod;
        this.settlementDate = settlementDate;
        this.clearingSystem = clearingSystem;
        this.creationDateTime = creationDateTime;
        this.remittanceInformation = remittanceInformation;
        this.creditorReference = creditorReference;
        this.creditorReferenceType = creditorReferenceType;
        this.sourceFormat = sourceFormat != null ? sourceFormat : RecordFormat.FIELD_MAP;
        this.extensions = extensions == null || extensions.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    /**
     * Reference of the sending side: debtor IBAN, ordering customer, or debtor name.
     */
    @JsonIgnore
    public String getSenderReference() {
        return firstPresent(debtorIban, orderingCustomer, debtorName);
    }

    /**
     * Reference of the receiving side: creditor IBAN, beneficiary, or creditor name.
     */
    @JsonIgnore
    public String getReceiverReference() {
        return firstPresent(creditorIban, beneficiary, creditorName);
    }

    /**
     * True when the identifier had to be generated because the payload carried none.
     */
    @JsonIgnore
    public boolean hasPlaceholderIdentifier() {
        return identifier.startsWith(PLACEHOLDER_PREFIX);
    }

    /**
     * Look up a scheme-specific extension field.
     */
    public Optional<Object> extension(String name) {
        return Optional.ofNullable(extensions.get(name));
    }

    private static String resolveIdentifier(String... candidates) {
        String resolved = firstPresent(candidates);
        return resolved != null ? resolved : PLACEHOLDER_PREFIX + UUID.randomUUID();
    }

    private static String firstPresent(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return null;
    }
}
