package com.wellsfargo.compliance.engine.evaluation;

import com.wellsfargo.compliance.canonical.CanonicalPaymentRecord;
import com.wellsfargo.compliance.canonical.Violation;
import com.wellsfargo.compliance.canonical.enums.RecordFormat;
import com.wellsfargo.compliance.canonical.enums.Severity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scheme-specific checks used when no reasoning answer is available.
 *
 * Pure: the same record always yields the same violations, and a record
 * that cannot be checked yields fewer findings instead of an error.
 * Scheme families are recognised by name: anything containing "SEPA",
 * anything containing "SWIFT" or starting with "MT", "CHAPS" and "SIX".
 */
@Component
public class DeterministicComplianceChecks {

    static final BigDecimal PURPOSE_CODE_THRESHOLD = new BigDecimal("12500.00");
    static final BigDecimal MIN_AMOUNT = new BigDecimal("0.01");
    static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999.99");
    static final int MAX_REMITTANCE_LENGTH = 140;

    static final String PURPOSE_CODE_RULE = "EPC Rulebook - Purpose Code Requirement (AT-44)";

    private static final Set<String> SEPA_SETTLEMENT_METHODS = new TreeSet<>(Arrays.asList("CLRG", "INGA", "INDA"));
    private static final Set<String> SIX_CURRENCIES = new TreeSet<>(Arrays.asList("CHF", "EUR"));

    public List<Violation> check(CanonicalPaymentRecord record, String scheme) {
        if (record == null || scheme == null) {
            return Collections.emptyList();
        }
        String family = scheme.trim().toUpperCase();
        List<Violation> violations = new ArrayList<>();

        if (family.contains("SEPA")) {
            checkSepa(record, violations);
            if (record.getSourceFormat() == RecordFormat.ISO20022_PACS008) {
                checkSepaPacs008(record, violations);
            }
        } else if (family.contains("SWIFT") || family.startsWith("MT")) {
            checkSwift(record, violations);
        } else if (family.contains("CHAPS")) {
            checkCurrencyIn(record, Collections.singleton("GBP"), "CHAPS Reference Manual - Currency Requirement",
                "CHAPS settles GBP payments only", violations);
        } else if (family.contains("SIX")) {
            checkCurrencyIn(record, SIX_CURRENCIES, "SIX Implementation Guidelines - Currency Requirement",
                "SIX accepts CHF and EUR payments only", violations);
        }
        return violations;
    }

    private void checkSepa(CanonicalPaymentRecord record, List<Violation> violations) {
        BigDecimal amount = record.getAmount();

        if (amount != null && amount.compareTo(PURPOSE_CODE_THRESHOLD) > 0
                && isBlank(record.getPurposeCode()) && isBlank(record.getCategoryPurpose())) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule(PURPOSE_CODE_RULE)
                .issue("Missing Purpose Code for EUR " + formatAmount(amount) + " transaction")
                .impact("Break STP, 24-48 hour delay, manual investigation required")
                .suggestion("Add Purpose Code: SUPP (supplier), SALA (salary), or TRAD (trade)")
                .path("CdtTrfTxInf/Purp/Cd")
                .build());
        }

        String currency = record.getCurrency();
        if (!isBlank(currency) && !"EUR".equals(currency)) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule("AT-T002: Currency Requirement")
                .issue("Currency is '" + currency + "' but SEPA only accepts EUR")
                .impact("Payment will be rejected")
                .suggestion("Change currency to EUR")
                .path("CdtTrfTxInf/IntrBkSttlmAmt[@Ccy]")
                .build());
        }

        String remittance = record.getRemittanceInformation();
        if (remittance != null && remittance.length() > MAX_REMITTANCE_LENGTH) {
            violations.add(Violation.builder()
                .severity(Severity.MEDIUM)
                .rule("AT-05: Unstructured Remittance Information")
                .issue("Remittance information exceeds " + MAX_REMITTANCE_LENGTH + " chars ("
                    + remittance.length() + " chars)")
                .impact("Remittance text truncated or payment rejected")
                .suggestion("Shorten remittance information to " + MAX_REMITTANCE_LENGTH + " characters")
                .path("CdtTrfTxInf/RmtInf/Ustrd")
                .build());
        }

        if (amount != null) {
            if (amount.scale() > 2) {
                violations.add(Violation.builder()
                    .severity(Severity.MEDIUM)
                    .rule("Amount Decimal Format")
                    .issue("Amount " + amount.toPlainString() + " has more than two decimals")
                    .impact("Payment will be rejected at format validation")
                    .suggestion("Round the amount to two decimals")
                    .path("CdtTrfTxInf/IntrBkSttlmAmt")
                    .build());
            }
            if (amount.compareTo(MIN_AMOUNT) < 0 || amount.compareTo(MAX_AMOUNT) > 0) {
                violations.add(Violation.builder()
                    .severity(Severity.HIGH)
                    .rule("Amount Range Validation")
                    .issue("Amount " + amount.toPlainString() + " is outside valid range 0.01-999999999.99")
                    .impact("Payment will be rejected")
                    .suggestion("Ensure amount is between 0.01 and 999,999,999.99")
                    .path("CdtTrfTxInf/IntrBkSttlmAmt")
                    .build());
            }
        }
    }

    private void checkSepaPacs008(CanonicalPaymentRecord record, List<Violation> violations) {
        if (!"SEPA".equals(record.getServiceLevel())) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule("AT-T001: Service Level Code")
                .issue("Service Level is '" + record.getServiceLevel() + "' but must be 'SEPA'")
                .impact("Payment will be rejected by SEPA system")
                .suggestion("Set Service Level Code to 'SEPA'")
                .path("GrpHdr/PmtTpInf/SvcLvl/Cd")
                .build());
        }

        if (!"SLEV".equals(record.getChargeBearer())) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule("Charge Bearer Requirement")
                .issue("Charge Bearer is '" + record.getChargeBearer() + "' but must be 'SLEV'")
                .impact("Payment will be rejected")
                .suggestion("Set Charge Bearer to 'SLEV'")
                .path("CdtTrfTxInf/ChrgBr")
                .build());
        }

        String settlementMethod = record.getSettlementMethod();
        if (!isBlank(settlementMethod) && !SEPA_SETTLEMENT_METHODS.contains(settlementMethod)) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule("Settlement Method Restriction")
                .issue("Settlement Method is '" + settlementMethod + "' but must be one of "
                    + SEPA_SETTLEMENT_METHODS)
                .impact("Payment will be rejected")
                .suggestion("Use CLRG, INGA or INDA")
                .path("GrpHdr/SttlmInf/SttlmMtd")
                .build());
        }

        Map<String, String> mandatory = new LinkedHashMap<>();
        mandatory.put("Debtor Name (AT-P001)|CdtTrfTxInf/Dbtr/Nm", record.getDebtorName());
        mandatory.put("Creditor Name (AT-E001)|CdtTrfTxInf/Cdtr/Nm", record.getCreditorName());
        mandatory.put("Debtor IBAN (AT-D001)|CdtTrfTxInf/DbtrAcct/Id/IBAN", record.getDebtorIban());
        mandatory.put("Creditor IBAN (AT-C001)|CdtTrfTxInf/CdtrAcct/Id/IBAN", record.getCreditorIban());
        mandatory.put("Debtor Agent BIC (AT-D002)|CdtTrfTxInf/DbtrAgt/FinInstnId/BICFI", record.getDebtorAgentBic());
        mandatory.put("Creditor Agent BIC (AT-C002)|CdtTrfTxInf/CdtrAgt/FinInstnId/BICFI", record.getCreditorAgentBic());

        for (Map.Entry<String, String> field : mandatory.entrySet()) {
            if (isBlank(field.getValue())) {
                String[] ruleAndPath = field.getKey().split("\\|");
                violations.add(Violation.builder()
                    .severity(Severity.HIGH)
                    .rule(ruleAndPath[0])
                    .issue("Mandatory field " + ruleAndPath[0] + " is missing")
                    .impact("Payment will be rejected")
                    .suggestion("Provide " + ruleAndPath[0])
                    .path(ruleAndPath[1])
                    .build());
            }
        }
    }

    private void checkSwift(CanonicalPaymentRecord record, List<Violation> violations) {
        String remittance = record.getRemittanceInformation();
        if (remittance != null && remittance.length() > MAX_REMITTANCE_LENGTH) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule("SWIFT MT103 Field 70")
                .issue("Remittance info exceeds " + MAX_REMITTANCE_LENGTH + " chars (" + remittance.length() + " chars)")
                .impact("Rejected by intermediary bank")
                .suggestion("Truncate to " + MAX_REMITTANCE_LENGTH + " characters maximum")
                .path("MT103/70")
                .build());
        }

        if (isBlank(record.getOrderingCustomer()) && isBlank(record.getDebtorName())) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule("SWIFT MT103 Field 50")
                .issue("Ordering customer is missing")
                .impact("Fails sanctions screening and is rejected")
                .suggestion("Provide ordering customer name and account")
                .path("MT103/50")
                .build());
        }

        if (isBlank(record.getBeneficiary()) && isBlank(record.getCreditorName())) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule("SWIFT MT103 Field 59")
                .issue("Beneficiary customer is missing")
                .impact("Payment cannot be credited")
                .suggestion("Provide beneficiary name and account")
                .path("MT103/59")
                .build());
        }
    }

    private void checkCurrencyIn(CanonicalPaymentRecord record, Set<String> allowed, String rule, String impact,
                                 List<Violation> violations) {
        String currency = record.getCurrency();
        if (!isBlank(currency) && !allowed.contains(currency)) {
            violations.add(Violation.builder()
                .severity(Severity.HIGH)
                .rule(rule)
                .issue("Currency is '" + currency + "' but must be one of " + allowed)
                .impact(impact)
                .suggestion("Change currency to " + String.join(" or ", allowed))
                .path("CdtTrfTxInf/IntrBkSttlmAmt[@Ccy]")
                .build());
        }
    }

    private static String formatAmount(BigDecimal amount) {
        return new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(amount);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
