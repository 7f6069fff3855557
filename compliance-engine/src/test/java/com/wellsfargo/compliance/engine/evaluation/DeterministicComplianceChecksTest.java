package com.wellsfargo.compliance.engine.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellsfargo.compliance.canonical.CanonicalPaymentRecord;
import com.wellsfargo.compliance.canonical.Violation;
import com.wellsfargo.compliance.canonical.enums.Severity;
import com.wellsfargo.compliance.engine.normalizer.RecordNormalizer;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DeterministicComplianceChecksTest {

    private final DeterministicComplianceChecks checks = new DeterministicComplianceChecks();

    @Test
    public void testAmountAtThresholdHasNoPurposeCodeFinding() {
        for (String amount : new String[] {"0.01", "100.00", "12499.99", "12500", "12500.00"}) {
            List<Violation> violations = checks.check(sepa(amount).build(), "SEPA");
            assertTrue(violations.isEmpty(), "Unexpected findings for " + amount + ": " + violations);
        }
    }

    @Test
    public void testAmountAboveThresholdWithoutPurposeCode() {
        for (String amount : new String[] {"12500.01", "15000", "999999.99"}) {
            List<Violation> violations = checks.check(sepa(amount).build(), "SEPA");

            assertEquals(1, violations.size(), "Findings for " + amount + ": " + violations);
            Violation violation = violations.get(0);
            assertEquals(Severity.HIGH, violation.getSeverity());
            assertEquals(DeterministicComplianceChecks.PURPOSE_CODE_RULE, violation.getRule());
        }
    }

    @Test
    public void testPurposeOrCategoryPurposeSatisfiesThreshold() {
        assertTrue(checks.check(sepa("15000").purposeCode("SUPP").build(), "SEPA").isEmpty());
        assertTrue(checks.check(sepa("15000").categoryPurpose("SALA").build(), "SEPA").isEmpty());
    }

    @Test
    public void testSepaCurrencyRemittanceDecimalsAndRange() {
        CanonicalPaymentRecord record = sepa("100.123")
            .currency("USD")
            .remittanceInformation("x".repeat(141))
            .build();

        List<Violation> violations = checks.check(record, "SEPA");

        assertEquals(List.of("AT-T002: Currency Requirement", "AT-05: Unstructured Remittance Information",
            "Amount Decimal Format"), rules(violations));
        assertEquals(Severity.MEDIUM, violations.get(1).getSeverity());

        assertEquals(List.of("Amount Range Validation"), rules(checks.check(sepa("0.00").build(), "SEPA")));
        assertTrue(rules(checks.check(sepa("1000000000.00").purposeCode("TRAD").build(), "SEPA"))
            .contains("Amount Range Validation"));
    }

    @Test
    public void testSchemeFamilyMatching() {
        assertEquals(1, checks.check(sepa("15000").build(), "sepa_inst").size());
        assertTrue(checks.check(sepa("15000").build(), "FEDWIRE").isEmpty());
    }

    @Test
    public void testPacs008SpecificChecks() throws Exception {
        RecordNormalizer normalizer = new RecordNormalizer(new ObjectMapper());

        CanonicalPaymentRecord compliant = normalizer.normalizePacs008(fixture("payments/pacs008_sepa_compliant.xml"), null);
        assertTrue(checks.check(compliant, "SEPA").isEmpty());

        CanonicalPaymentRecord broken = normalizer.normalizePacs008(fixture("payments/pacs008_sepa_violations.xml"), null);
        List<String> rules = rules(checks.check(broken, "SEPA"));
        assertEquals(List.of(
            DeterministicComplianceChecks.PURPOSE_CODE_RULE,
            "AT-T002: Currency Requirement",
            "AT-T001: Service Level Code",
            "Charge Bearer Requirement",
            "Settlement Method Restriction",
            "Creditor Agent BIC (AT-C002)"), rules);
    }

    @Test
    public void testSwiftChecks() {
        CanonicalPaymentRecord record = CanonicalPaymentRecord.builder()
            .identifier("MT-1")
            .amount(new BigDecimal("5000"))
            .remittanceInformation("y".repeat(200))
            .build();

        List<Violation> violations = checks.check(record, "SWIFT_MT103");

        assertEquals(List.of("SWIFT MT103 Field 70", "SWIFT MT103 Field 50", "SWIFT MT103 Field 59"), rules(violations));
        assertTrue(violations.stream().allMatch(v -> v.getSeverity() == Severity.HIGH));

        CanonicalPaymentRecord complete = record.toBuilder()
            .remittanceInformation("INV 42")
            .orderingCustomer("ACME CORP")
            .beneficiary("GLOBEX LTD")
            .build();
        assertTrue(checks.check(complete, "MT103").isEmpty());
    }

    @Test
    public void testChapsAndSixCurrencies() {
        assertEquals(1, checks.check(withCurrency("EUR"), "CHAPS").size());
        assertTrue(checks.check(withCurrency("GBP"), "CHAPS").isEmpty());
        assertTrue(checks.check(withCurrency("CHF"), "SIX").isEmpty());
        assertTrue(checks.check(withCurrency("EUR"), "SIX").isEmpty());
        assertEquals(1, checks.check(withCurrency("USD"), "SIX").size());
    }

    @Test
    public void testUncheckableRecordsYieldNoFindings() {
        CanonicalPaymentRecord noAmount = CanonicalPaymentRecord.builder().identifier("P").rawAmount("n/a").build();

        assertTrue(checks.check(noAmount, "SEPA").isEmpty());
        assertTrue(checks.check(null, "SEPA").isEmpty());
        assertTrue(checks.check(noAmount, null).isEmpty());
    }

    @Test
    public void testSameInputSameFindings() {
        CanonicalPaymentRecord record = sepa("20000.999").currency("GBP").build();

        assertEquals(checks.check(record, "SEPA"), checks.check(record, "SEPA"));
    }

    private static CanonicalPaymentRecord.CanonicalPaymentRecordBuilder sepa(String amount) {
        return CanonicalPaymentRecord.builder()
            .identifier("SEPA-" + amount)
            .scheme("SEPA")
            .currency("EUR")
            .amount(new BigDecimal(amount));
    }

    private static CanonicalPaymentRecord withCurrency(String currency) {
        return CanonicalPaymentRecord.builder().identifier("C-" + currency).currency(currency)
            .amount(new BigDecimal("100")).build();
    }

    private static List<String> rules(List<Violation> violations) {
        return violations.stream().map(Violation::getRule).collect(Collectors.toList());
    }

    private static String fixture(String path) throws Exception {
        try (InputStream in = DeterministicComplianceChecksTest.class.getClassLoader().getResourceAsStream(path)) {
            assertNotNull(in);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
