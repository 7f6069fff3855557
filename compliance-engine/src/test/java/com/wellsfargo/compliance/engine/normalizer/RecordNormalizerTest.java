package com.wellsfargo.compliance.engine.normalizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellsfargo.compliance.canonical.CanonicalPaymentRecord;
import com.wellsfargo.compliance.canonical.enums.RecordFormat;
import com.wellsfargo.compliance.error.MalformedRecordException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RecordNormalizerTest {

    private final RecordNormalizer normalizer = new RecordNormalizer(new ObjectMapper());

    @Test
    public void testFieldMapWithSnakeCaseAliases() throws Exception {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", "PAY-001");
        raw.put("amount", "15,000.00");
        raw.put("currency", "eur");
        raw.put("debtor_iban", "DE89370400440532013000");
        raw.put("creditor_name", "Dupont SA");
        raw.put("remittance_info", "Invoice 42");
        raw.put("batch_booking", true);

        CanonicalPaymentRecord record = normalizer.normalize(raw, "sepa");

        assertEquals("PAY-001", record.getIdentifier());
        assertEquals("SEPA", record.getScheme());
        assertEquals("EUR", record.getCurrency());
        assertEquals(0, new BigDecimal("15000.00").compareTo(record.getAmount()));
        assertEquals("15,000.00", record.getRawAmount());
        assertEquals("DE89370400440532013000", record.getDebtorIban());
        assertEquals("Invoice 42", record.getRemittanceInformation());
        assertEquals(RecordFormat.FIELD_MAP, record.getSourceFormat());
        assertEquals(Boolean.TRUE, record.extension("batch_booking").orElse(null));
        assertNull(record.getPurposeCode());
    }

    @Test
    public void testCamelCaseAliasesAndNestedPaths() throws Exception {
        Map<String, Object> debtor = new HashMap<>();
        debtor.put("name", "Muller GmbH");
        debtor.put("iban", "DE89370400440532013000");
        Map<String, Object> raw = new HashMap<>();
        raw.put("paymentId", "PAY-002");
        raw.put("purposeCode", "SUPP");
        raw.put("remittanceInfo", "Order 7");
        raw.put("debtor", debtor);

        CanonicalPaymentRecord record = normalizer.normalize(raw, null);

        assertEquals("PAY-002", record.getIdentifier());
        assertEquals("SUPP", record.getPurposeCode());
        assertEquals("Order 7", record.getRemittanceInformation());
        assertEquals("Muller GmbH", record.getDebtorName());
        assertEquals("DE89370400440532013000", record.getDebtorIban());
        assertNull(record.getScheme());
    }

    @Test
    public void testUnparseableAmountKeepsRawText() throws Exception {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", "PAY-003");
        raw.put("amount", "fifteen thousand");

        CanonicalPaymentRecord record = normalizer.normalize(raw, "SEPA");

        assertNull(record.getAmount());
        assertEquals("fifteen thousand", record.getRawAmount());
    }

    @Test
    public void testJsonKeepsDecimalPrecision() throws Exception {
        CanonicalPaymentRecord record = normalizer.normalizeJson(
            "{\"id\":\"PAY-004\",\"amount\":12500.005,\"scheme\":\"sepa\"}", null);

        assertEquals(new BigDecimal("12500.005"), record.getAmount());
        assertEquals("SEPA", record.getScheme());
    }

    @Test
    public void testAutoDetectRoutesByFirstCharacter() throws Exception {
        CanonicalPaymentRecord json = normalizer.normalize("  {\"id\":\"PAY-005\",\"amount\":10}", "SEPA");
        assertEquals(RecordFormat.FIELD_MAP, json.getSourceFormat());

        CanonicalPaymentRecord xml = normalizer.normalize(fixture("payments/pacs008_sepa_compliant.xml"), null);
        assertEquals(RecordFormat.ISO20022_PACS008, xml.getSourceFormat());
    }

    @Test
    public void testPacs008FieldsAreExtracted() throws Exception {
        CanonicalPaymentRecord record = normalizer.normalizePacs008(fixture("payments/pacs008_sepa_compliant.xml"), null);

        assertEquals("TX-SEPA-001", record.getIdentifier());
        assertEquals("SEPA", record.getScheme());
        assertEquals("MSG-SEPA-20240115-001", record.getMessageId());
        assertEquals("E2E-SEPA-001", record.getEndToEndId());
        assertEquals("INSTR-001", record.getInstructionId());
        assertEquals(new BigDecimal("15000.00"), record.getAmount());
        assertEquals("EUR", record.getCurrency());
        assertEquals("CLRG", record.getSettlementMethod());
        assertEquals("ST2", record.getClearingSystem());
        assertEquals("2024-01-15", record.getSettlementDate());
        assertEquals("SEPA", record.getServiceLevel());
        assertEquals("SLEV", record.getChargeBearer());
        assertEquals("SUPP", record.getPurposeCode());
        assertEquals("Muller Maschinenbau GmbH", record.getDebtorName());
        assertEquals("DE", record.getDebtorCountry());
        assertEquals("DE89370400440532013000", record.getDebtorIban());
        assertEquals("COBADEFFXXX", record.getDebtorAgentBic());
        assertEquals("BNPAFRPPXXX", record.getCreditorAgentBic());
        assertEquals("FR1420041010050500013M02606", record.getCreditorIban());
        assertEquals("Invoice 2024-0042 machine parts", record.getRemittanceInformation());
        assertEquals("1", record.extension("number_of_transactions").orElse(null));
    }

    @Test
    public void testPacs008SchemeOverride() throws Exception {
        CanonicalPaymentRecord record = normalizer.normalizePacs008(
            fixture("payments/pacs008_sepa_compliant.xml"), "sepa_inst");

        assertEquals("SEPA_INST", record.getScheme());
    }

    @Test
    public void testMalformedInputsAreRejected() {
        assertThrows(MalformedRecordException.class, () -> normalizer.normalize("   ", "SEPA"));
        assertThrows(MalformedRecordException.class, () -> normalizer.normalize("amount=15000", "SEPA"));
        assertThrows(MalformedRecordException.class, () -> normalizer.normalizeJson("{\"id\": ", "SEPA"));
        assertThrows(MalformedRecordException.class, () -> normalizer.normalizeJson("[1, 2, 3]", "SEPA"));
        assertThrows(MalformedRecordException.class, () -> normalizer.normalizePacs008("<Document><unclosed></Document>", null));
        assertThrows(MalformedRecordException.class,
            () -> normalizer.normalizePacs008("<Document><Other/></Document>", null));
        assertThrows(MalformedRecordException.class, () -> normalizer.normalize((Map<String, Object>) null, "SEPA"));
    }

    @Test
    public void testExternalEntitiesAreNotResolved() {
        String xxe = "<?xml version=\"1.0\"?>"
            + "<!DOCTYPE Document [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>"
            + "<Document><FIToFICstmrCdtTrf><GrpHdr><MsgId>&xxe;</MsgId></GrpHdr></FIToFICstmrCdtTrf></Document>";

        assertThrows(MalformedRecordException.class, () -> normalizer.normalizePacs008(xxe, null));
    }

    private static String fixture(String path) throws IOException {
        try (InputStream in = RecordNormalizerTest.class.getClassLoader().getResourceAsStream(path)) {
            assertNotNull(in, "Missing fixture " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
