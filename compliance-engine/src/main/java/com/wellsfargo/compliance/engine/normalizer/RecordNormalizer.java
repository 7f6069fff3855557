package com.wellsfargo.compliance.engine.normalizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellsfargo.compliance.canonical.CanonicalPaymentRecord;
import com.wellsfargo.compliance.canonical.enums.RecordFormat;
import com.wellsfargo.compliance.error.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes heterogeneous payment payloads into a {@link CanonicalPaymentRecord}.
 *
 * Accepted shapes:
 * - Free-form field map (snake_case or camelCase keys, optionally nested)
 * - JSON object text (parsed into a field map)
 * - ISO 20022 PACS.008 XML (delegated to {@link Pacs008RecordParser})
 *
 * Every canonical field is looked up through a list of aliases with a
 * null-safe dotted-path lookup ("debtor.iban"). A missing field is null on
 * the record, never an error. Keys that map to no canonical field are kept
 * in the record's extensions.
 *
 * Pure transform, thread-safe.
 */
@Service
public class RecordNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    private static final TypeReference<Map<String, Object>> FIELD_MAP_TYPE = new TypeReference<>() { };

    // Canonical field -> accepted input keys, first match wins
    private static final List<String> ID = Arrays.asList("id", "payment_id", "paymentId", "record_id");
    private static final List<String> SCHEME = Arrays.asList("scheme", "payment_scheme", "paymentScheme");
    private static final List<String> CURRENCY = Arrays.asList("currency", "ccy", "amount.currency");
    private static final List<String> AMOUNT = Arrays.asList("amount", "amount.value", "instructed_amount", "instructedAmount");
    private static final List<String> MESSAGE_ID = Arrays.asList("message_id", "messageId", "msg_id", "msgId");
    private static final List<String> END_TO_END_ID = Arrays.asList("end_to_end_id", "endToEndId");
    private static final List<String> TRANSACTION_ID = Arrays.asList("transaction_id", "transactionId", "tx_id", "txId");
    private static final List<String> INSTRUCTION_ID = Arrays.asList("instruction_id", "instructionId");
    private static final List<String> DEBTOR_NAME = Arrays.asList("debtor_name", "debtorName", "debtor.name");
    private static final List<String> DEBTOR_IBAN = Arrays.asList("debtor_iban", "debtorIban", "debtor.iban");
    private static final List<String> DEBTOR_AGENT = Arrays.asList("debtor_agent", "debtorAgent", "debtor_bic", "debtorBic", "debtor.bic");
    private static final List<String> DEBTOR_COUNTRY = Arrays.asList("debtor_country", "debtorCountry", "debtor.country");
    private static final List<String> ORDERING_CUSTOMER = Arrays.asList("ordering_customer", "orderingCustomer", "field_50", "field50");
    private static final List<String> CREDITOR_NAME = Arrays.asList("creditor_name", "creditorName", "creditor.name");
    private static final List<String> CREDITOR_IBAN = Arrays.asList("creditor_iban", "creditorIban", "creditor.iban");
    private static final List<String> CREDITOR_AGENT = Arrays.asList("creditor_agent", "creditorAgent", "creditor_bic", "creditorBic", "creditor.bic");
    private static final List<String> CREDITOR_COUNTRY = Arrays.asList("creditor_country", "creditorCountry", "creditor.country");
    private static final List<String> BENEFICIARY = Arrays.asList("beneficiary", "field_59", "field59");
    private static final List<String> PURPOSE_CODE = Arrays.asList("purpose_code", "purposeCode", "purpose");
    private static final List<String> CATEGORY_PURPOSE = Arrays.asList("category_purpose", "categoryPurpose");
    private static final List<String> SERVICE_LEVEL = Arrays.asList("service_level", "serviceLevel");
    private static final List<String> LOCAL_INSTRUMENT = Arrays.asList("local_instrument", "localInstrument");
    private static final List<String> CHARGE_BEARER = Arrays.asList("charge_bearer", "chargeBearer", "charges", "field_71a");
    private static final List<String> SETTLEMENT_METHOD = Arrays.asList("settlement_method", "settlementMethod");
    private static final List<String> SETTLEMENT_DATE = Arrays.asList("settlement_date", "settlementDate", "value_date", "valueDate");
    private static final List<String> CLEARING_SYSTEM = Arrays.asList("clearing_system", "clearingSystem");
    private static final List<String> CREATION_DATE_TIME = Arrays.asList("creation_date_time", "creationDateTime");
    private static final List<String> REMITTANCE = Arrays.asList("remittance_info", "remittanceInfo",
        "remittance_unstructured", "remittanceInformation", "remittance", "field_70", "field70");
    private static final List<String> CREDITOR_REFERENCE = Arrays.asList("creditor_reference", "creditorReference");
    private static final List<String> CREDITOR_REFERENCE_TYPE = Arrays.asList("creditor_reference_type", "creditorReferenceType");

    private static final Set<String> KNOWN_ROOT_KEYS = knownRootKeys(ID, SCHEME, CURRENCY, AMOUNT, MESSAGE_ID,
        END_TO_END_ID, TRANSACTION_ID, INSTRUCTION_ID, DEBTOR_NAME, DEBTOR_IBAN, DEBTOR_AGENT, DEBTOR_COUNTRY,
        ORDERING_CUSTOMER, CREDITOR_NAME, CREDITOR_IBAN, CREDITOR_AGENT, CREDITOR_COUNTRY, BENEFICIARY,
        PURPOSE_CODE, CATEGORY_PURPOSE, SERVICE_LEVEL, LOCAL_INSTRUMENT, CHARGE_BEARER, SETTLEMENT_METHOD,
        SETTLEMENT_DATE, CLEARING_SYSTEM, CREATION_DATE_TIME, REMITTANCE, CREDITOR_REFERENCE,
        CREDITOR_REFERENCE_TYPE);

    private final ObjectMapper objectMapper;
    private final Pacs008RecordParser pacs008Parser;

    public RecordNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.pacs008Parser = new Pacs008RecordParser();
    }

    /**
     * Normalize a textual payload, detecting its shape from the first character.
     *
     * @param payload XML ('&lt;') or JSON object ('{') text
     * @param scheme scheme override, null to take it from the payload
     * @return canonical record
     * @throws MalformedRecordException if the payload is blank or in no recognised shape
     */
    public CanonicalPaymentRecord normalize(String payload, String scheme) throws MalformedRecordException {
        if (payload == null || payload.trim().isEmpty()) {
            throw new MalformedRecordException("Payment payload cannot be null or empty");
        }

        String trimmed = stripByteOrderMark(payload.trim());
        if (trimmed.startsWith("<")) {
            return normalizePacs008(trimmed, scheme);
        }
        if (trimmed.startsWith("{")) {
            return normalizeJson(trimmed, scheme);
        }
        throw new MalformedRecordException("Unrecognised payment payload: expected PACS.008 XML or a JSON object");
    }

    /**
     * Normalize a PACS.008 XML message.
     */
    public CanonicalPaymentRecord normalizePacs008(String xml, String scheme) throws MalformedRecordException {
        CanonicalPaymentRecord record = pacs008Parser.parse(xml, normalizeScheme(scheme));
        log.debug("Normalized PACS.008 record: id={}, amount={} {}",
            record.getIdentifier(), record.getRawAmount(), record.getCurrency());
        return record;
    }

    /**
     * Normalize a JSON object.
     */
    public CanonicalPaymentRecord normalizeJson(String json, String scheme) throws MalformedRecordException {
        Map<String, Object> fields;
        try {
            fields = objectMapper.readerFor(FIELD_MAP_TYPE)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .readValue(json);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Invalid JSON payment payload: " + e.getOriginalMessage(), e);
        }
        if (fields == null) {
            throw new MalformedRecordException("JSON payment payload must be an object");
        }
        return normalize(fields, scheme);
    }

    /**
     * Normalize a free-form field map.
     *
     * @param raw field map, values may be nested maps
     * @param scheme scheme override, null to take it from the map
     * @return canonical record
     * @throws MalformedRecordException if the map is null
     */
    public CanonicalPaymentRecord normalize(Map<String, ?> raw, String scheme) throws MalformedRecordException {
        if (raw == null) {
            throw new MalformedRecordException("Payment field map cannot be null");
        }

        String rawAmount = lookup(raw, AMOUNT);
        String schemeOverride = normalizeScheme(scheme);

        CanonicalPaymentRecord record = CanonicalPaymentRecord.builder()
            .identifier(lookup(raw, ID))
            .scheme(schemeOverride != null ? schemeOverride : normalizeScheme(lookup(raw, SCHEME)))
            .currency(upper(lookup(raw, CURRENCY)))
            .amount(parseAmount(rawAmount))
            .rawAmount(rawAmount)
            .messageId(lookup(raw, MESSAGE_ID))
            .endToEndId(lookup(raw, END_TO_END_ID))
            .transactionId(lookup(raw, TRANSACTION_ID))
            .instructionId(lookup(raw, INSTRUCTION_ID))
            .debtorName(lookup(raw, DEBTOR_NAME))
            .debtorIban(lookup(raw, DEBTOR_IBAN))
            .debtorAgentBic(lookup(raw, DEBTOR_AGENT))
            .debtorCountry(lookup(raw, DEBTOR_COUNTRY))
            .orderingCustomer(lookup(raw, ORDERING_CUSTOMER))
            .creditorName(lookup(raw, CREDITOR_NAME))
            .creditorIban(lookup(raw, CREDITOR_IBAN))
            .creditorAgentBic(lookup(raw, CREDITOR_AGENT))
            .creditorCountry(lookup(raw, CREDITOR_COUNTRY))
            .beneficiary(lookup(raw, BENEFICIARY))
            .purposeCode(lookup(raw, PURPOSE_CODE))
            .categoryPurpose(lookup(raw, CATEGORY_PURPOSE))
            .serviceLevel(lookup(raw, SERVICE_LEVEL))
            .localInstrument(lookup(raw, LOCAL_INSTRUMENT))
            .chargeBearer(lookup(raw, CHARGE_BEARER))
            .settlementMethod(lookup(raw, SETTLEMENT_METHOD))
            .settlementDate(lookup(raw, SETTLEMENT_DATE))
            .clearingSystem(lookup(raw, CLEARING_SYSTEM))
            .creationDateTime(lookup(raw, CREATION_DATE_TIME))
            .remittanceInformation(lookup(raw, REMITTANCE))
            .creditorReference(lookup(raw, CREDITOR_REFERENCE))
            .creditorReferenceType(lookup(raw, CREDITOR_REFERENCE_TYPE))
            .sourceFormat(RecordFormat.FIELD_MAP)
            .extensions(extensions(raw))
            .build();

        log.debug("Normalized field-map record: id={}, scheme={}", record.getIdentifier(), record.getScheme());
        return record;
    }

    /**
     * Null-safe lookup through a list of aliases. Each alias may be a dotted
     * path into nested maps. Blank values count as absent.
     */
    static String lookup(Map<String, ?> raw, List<String> aliases) {
        for (String alias : aliases) {
            Object value = resolvePath(raw, alias);
            if (value instanceof Map || value instanceof Iterable) {
                continue;
            }
            if (value != null) {
                String text = value instanceof BigDecimal
                    ? ((BigDecimal) value).toPlainString()
                    : value.toString().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static Object resolvePath(Map<String, ?> raw, String path) {
        if (raw.containsKey(path)) {
            return raw.get(path);
        }
        Object current = raw;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current == raw ? null : current;
    }

    private static BigDecimal parseAmount(String rawAmount) {
        if (rawAmount == null) {
            return null;
        }
        try {
            return new BigDecimal(rawAmount.replace(",", "").replace(" ", ""));
        } catch (NumberFormatException e) {
            log.warn("Amount '{}' is not a decimal number, keeping raw value only", rawAmount);
            return null;
        }
    }

    private static Map<String, Object> extensions(Map<String, ?> raw) {
        Map<String, Object> extensions = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (entry.getKey() != null && !KNOWN_ROOT_KEYS.contains(entry.getKey()) && entry.getValue() != null) {
                extensions.put(entry.getKey(), entry.getValue());
            }
        }
        return extensions;
    }

    @SafeVarargs
    private static Set<String> knownRootKeys(List<String>... aliasLists) {
        Set<String> keys = new HashSet<>();
        for (List<String> aliases : aliasLists) {
            for (String alias : aliases) {
                int dot = alias.indexOf('.');
                keys.add(dot > 0 ? alias.substring(0, dot) : alias);
            }
        }
        return Collections.unmodifiableSet(keys);
    }

    static String normalizeScheme(String scheme) {
        if (scheme == null || scheme.trim().isEmpty()) {
            return null;
        }
        return scheme.trim().toUpperCase();
    }

    private static String upper(String value) {
        return value != null ? value.toUpperCase() : null;
    }

    private static String stripByteOrderMark(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
