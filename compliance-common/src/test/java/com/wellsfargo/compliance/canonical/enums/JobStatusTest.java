package com.wellsfargo.compliance.canonical.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    @Test
    public void testForwardTransitionsOnly() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.PROCESSING));
        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.FAILED));

        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED));
        assertFalse(JobStatus.PROCESSING.canTransitionTo(JobStatus.PENDING));
        assertFalse(JobStatus.COMPLETED.canTransitionTo(JobStatus.PROCESSING));
        assertFalse(JobStatus.FAILED.canTransitionTo(JobStatus.COMPLETED));
    }

    @Test
    public void testTerminalStates() {
        assertFalse(JobStatus.PENDING.isTerminal());
        assertFalse(JobStatus.PROCESSING.isTerminal());
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
    }

    @Test
    public void testComplianceStatusFromViolationCount() {
        assertEquals(ComplianceStatus.COMPLIANT, ComplianceStatus.fromViolationCount(0));
        assertEquals(ComplianceStatus.NON_COMPLIANT, ComplianceStatus.fromViolationCount(1));
    }

    @Test
    public void testRulebookSourceTags() {
        assertEquals("uploaded-document:sepa.pdf", RulebookSourceKind.UPLOADED_DOCUMENT.tag("sepa.pdf"));
        assertEquals("uploaded-document:unnamed", RulebookSourceKind.UPLOADED_DOCUMENT.tag(null));
        assertEquals("rule-library", RulebookSourceKind.RULE_LIBRARY.tag("ignored"));
        assertEquals("fallback-rules", RulebookSourceKind.FALLBACK_RULES.tag(null));
    }
}
