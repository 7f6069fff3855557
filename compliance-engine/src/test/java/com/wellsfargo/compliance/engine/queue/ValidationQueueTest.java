package com.wellsfargo.compliance.engine.queue;

import com.wellsfargo.compliance.canonical.CanonicalPaymentRecord;
import com.wellsfargo.compliance.canonical.ComplianceResult;
import com.wellsfargo.compliance.canonical.ProcessingStatistics;
import com.wellsfargo.compliance.canonical.QueuedJob;
import com.wellsfargo.compliance.canonical.enums.ComplianceStatus;
import com.wellsfargo.compliance.canonical.enums.JobStatus;
import com.wellsfargo.compliance.canonical.enums.RulebookSourceKind;
import com.wellsfargo.compliance.engine.evaluation.ComplianceEvaluator;
import com.wellsfargo.compliance.engine.reasoning.DisabledReasoningClient;
import com.wellsfargo.compliance.engine.support.TestComponents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ValidationQueueTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private TestComponents components;
    private ValidationQueue queue;

    @AfterEach
    public void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
        if (components != null) {
            components.gateway.shutdown();
        }
    }

    @Test
    public void testSubmitAndComplete() throws Exception {
        List<ComplianceResult> published = new CopyOnWriteArrayList<>();
        queue = newQueue(Collections.singletonList((jobId, result) -> published.add(result)), 100, 2);

        String jobId = queue.submit(record("TX-1", "15000.00"), "SEPA");

        assertTrue(jobId.startsWith("JOB_"));
        assertTrue(queue.awaitIdle(WAIT));
        QueuedJob job = queue.status(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(ComplianceStatus.NON_COMPLIANT, job.getResult().getStatus());
        assertEquals(1, job.getResult().getQueuePosition());
        assertNotNull(job.getStartedAt());
        assertNotNull(job.getProcessedAt());
        assertNull(job.getError());
        waitFor(() -> !published.isEmpty());
        assertEquals(1, published.size());
        assertEquals("TX-1", published.get(0).getRecordId());
    }

    @Test
    public void testBatchOfFive() throws Exception {
        queue = newQueue(Collections.emptyList(), 100, 2);
        List<CanonicalPaymentRecord> records = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            records.add(record("TX-B" + i, i % 2 == 0 ? "20000.00" : "100.00"));
        }

        BatchSubmission batch = queue.submitBatch(records, "SEPA");

        assertTrue(batch.getBatchId().startsWith("BATCH_"));
        assertEquals(5, batch.getJobIds().size());
        assertEquals(batch.getBatchId() + "_001", batch.getJobIds().get(0));
        assertEquals(batch.getBatchId() + "_005", batch.getJobIds().get(4));
        assertTrue(queue.awaitIdle(WAIT));

        List<QueuedJob> jobs = queue.listBatch(batch.getBatchId());
        assertEquals(batch.getJobIds(), jobs.stream().map(QueuedJob::getId).collect(Collectors.toList()));
        assertTrue(jobs.stream().allMatch(job -> job.getStatus() == JobStatus.COMPLETED));

        ProcessingStatistics stats = queue.statistics();
        assertEquals(5, stats.getTotalSubmitted());
        assertEquals(5, stats.getTotalProcessed());
        assertEquals(3, stats.getCompliant());
        assertEquals(2, stats.getNonCompliant());
        assertEquals(60.0, stats.getStraightThroughRate());
    }

    @Test
    public void testInvalidSubmissionsAreRejected() {
        queue = newQueue(Collections.emptyList(), 10, 1);

        assertThrows(IllegalArgumentException.class, () -> queue.submit(null, "SEPA"));
        assertThrows(IllegalArgumentException.class, () -> queue.submitBatch(Collections.emptyList(), "SEPA"));
        assertThrows(IllegalArgumentException.class,
            () -> queue.submitBatch(Collections.singletonList(null), "SEPA"));
        assertEquals(0, queue.statistics().getTotalSubmitted());
        assertTrue(queue.status("JOB_UNKNOWN").isEmpty());
    }

    @Test
    public void testCountersStayConsistentUnderConcurrentSubmission() throws Exception {
        queue = newQueue(Collections.emptyList(), 1000, 4);
        int producers = 4;
        int perProducer = 50;
        ExecutorService submitters = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);

        for (int p = 0; p < producers; p++) {
            int producer = p;
            submitters.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perProducer; i++) {
                    queue.submit(record("TX-" + producer + "-" + i, i % 5 == 0 ? "13000.00" : "10.00"), "SEPA");
                    ProcessingStatistics stats = queue.statistics();
                    assertEquals(stats.getTotalProcessed(), stats.getCompliant() + stats.getNonCompliant());
                }
            });
        }
        start.countDown();
        submitters.shutdown();
        assertTrue(submitters.awaitTermination(10, TimeUnit.SECONDS));
        assertTrue(queue.awaitIdle(WAIT));

        ProcessingStatistics stats = queue.statistics();
        assertEquals(producers * perProducer, stats.getTotalSubmitted());
        assertEquals(producers * perProducer, stats.getTotalProcessed());
        assertEquals(stats.getTotalProcessed(), stats.getCompliant() + stats.getNonCompliant());
        assertEquals(producers * perProducer / 5, stats.getNonCompliant());
        assertEquals(0, stats.getInFlight());
    }

    @Test
    public void testOldestJobsAreEvictedWhenFull() throws Exception {
        queue = newQueue(Collections.emptyList(), 3, 1);
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            ids.add(queue.submit(record("TX-E" + i, "100.00"), "SEPA"));
        }

        assertTrue(queue.awaitIdle(WAIT));

        ProcessingStatistics stats = queue.statistics();
        assertEquals(5, stats.getTotalSubmitted());
        assertEquals(5, stats.getTotalProcessed());
        assertEquals(2, stats.getEvicted());
        assertEquals(3, stats.getQueueSize());
        assertEquals(ids.subList(2, 5), queue.list().stream().map(QueuedJob::getId).collect(Collectors.toList()));
        assertTrue(queue.status(ids.get(0)).isEmpty());
    }

    @Test
    public void testEvaluatorFailureMarksJobFailed() throws Exception {
        ComplianceEvaluator broken = new ComplianceEvaluator(null, null, null, null, null, null, null) {
            @Override
            public ComplianceResult evaluate(CanonicalPaymentRecord record, String scheme) {
                throw new IllegalStateException("rule engine offline");
            }
        };
        queue = new ValidationQueue(broken, Collections.emptyList(), new JobIdGenerator(), 10, 1);

        String jobId = queue.submit(record("TX-F", "100.00"), "SEPA");

        assertTrue(queue.awaitIdle(WAIT));
        QueuedJob job = queue.status(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("IllegalStateException: rule engine offline", job.getError());
        assertNull(job.getResult());
        assertEquals(1, queue.statistics().getFailed());
        assertEquals(0, queue.statistics().getTotalProcessed());
    }

    @Test
    public void testListenerFailureDoesNotFailJob() throws Exception {
        List<String> notified = new CopyOnWriteArrayList<>();
        List<ComplianceResultListener> listeners = List.of(
            (jobId, result) -> {
                throw new IllegalStateException("broker down");
            },
            (jobId, result) -> notified.add(jobId));
        queue = newQueue(listeners, 10, 1);

        String jobId = queue.submit(record("TX-L", "100.00"), "SEPA");

        assertTrue(queue.awaitIdle(WAIT));
        assertEquals(JobStatus.COMPLETED, queue.status(jobId).orElseThrow().getStatus());
        waitFor(() -> notified.contains(jobId));
    }

    @Test
    public void testSnapshotsCannotAlterStoredResult() throws Exception {
        queue = newQueue(Collections.emptyList(), 10, 1);
        String jobId = queue.submit(record("TX-SNAP", "15000.00"), "SEPA");
        assertTrue(queue.awaitIdle(WAIT));

        ComplianceResult seen = queue.status(jobId).orElseThrow().getResult();
        assertThrows(UnsupportedOperationException.class, () -> seen.getViolations().clear());
        assertThrows(UnsupportedOperationException.class, () -> queue.list().get(0).getResult().getViolations().clear());

        ComplianceResult again = queue.status(jobId).orElseThrow().getResult();
        assertEquals(ComplianceStatus.NON_COMPLIANT, again.getStatus());
        assertEquals(1, again.getViolations().size());
        assertEquals(1, queue.statistics().getNonCompliant());
    }

    @Test
    public void testJobStatusOnlyMovesForward() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ComplianceEvaluator gated = new ComplianceEvaluator(null, null, null, null, null, null, null) {
            @Override
            public ComplianceResult evaluate(CanonicalPaymentRecord record, String scheme) {
                started.countDown();
                try {
                    release.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ComplianceResult.builder()
                    .recordId(record.getIdentifier())
                    .scheme("SEPA")
                    .status(ComplianceStatus.COMPLIANT)
                    .rulebookSource("rule-based")
                    .rulebookSourceKind(RulebookSourceKind.RULE_BASED)
                    .build();
            }
        };
        queue = new ValidationQueue(gated, Collections.emptyList(), new JobIdGenerator(), 10, 1);

        String first = queue.submit(record("TX-G1", "10.00"), "SEPA");
        String second = queue.submit(record("TX-G2", "10.00"), "SEPA");
        assertTrue(started.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));

        List<JobStatus> firstSeen = new ArrayList<>();
        List<JobStatus> secondSeen = new ArrayList<>();
        observe(firstSeen, queue.status(first).orElseThrow());
        observe(secondSeen, queue.status(second).orElseThrow());
        assertEquals(List.of(JobStatus.PROCESSING), firstSeen);
        assertEquals(List.of(JobStatus.PENDING), secondSeen);

        release.countDown();
        long deadline = System.currentTimeMillis() + WAIT.toMillis();
        while (!secondSeen.get(secondSeen.size() - 1).isTerminal()) {
            assertTrue(System.currentTimeMillis() < deadline, "Jobs did not finish in time");
            observe(firstSeen, queue.status(first).orElseThrow());
            observe(secondSeen, queue.status(second).orElseThrow());
        }
        observe(firstSeen, queue.status(first).orElseThrow());

        assertEquals(List.of(JobStatus.PROCESSING, JobStatus.COMPLETED), firstSeen);
        assertEquals(JobStatus.PENDING, secondSeen.get(0));
        assertEquals(JobStatus.COMPLETED, secondSeen.get(secondSeen.size() - 1));
        assertForwardOnly(firstSeen);
        assertForwardOnly(secondSeen);
    }

    @Test
    public void testSubmitAfterShutdownIsRejected() {
        queue = newQueue(Collections.emptyList(), 10, 1);
        queue.shutdown();

        assertThrows(IllegalStateException.class, () -> queue.submit(record("TX-S", "1.00"), "SEPA"));
    }

    @Test
    public void testInvalidSizingIsRejected() {
        components = new TestComponents(new DisabledReasoningClient());

        assertThrows(IllegalArgumentException.class,
            () -> new ValidationQueue(components.evaluator, Collections.emptyList(), new JobIdGenerator(), 0, 1));
        assertThrows(IllegalArgumentException.class,
            () -> new ValidationQueue(components.evaluator, Collections.emptyList(), new JobIdGenerator(), 1, 0));
    }

    private ValidationQueue newQueue(List<ComplianceResultListener> listeners, int capacity, int workers) {
        components = new TestComponents(new DisabledReasoningClient());
        return new ValidationQueue(components.evaluator, listeners, new JobIdGenerator(), capacity, workers);
    }

    private static CanonicalPaymentRecord record(String id, String amount) {
        return CanonicalPaymentRecord.builder()
            .identifier(id)
            .scheme("SEPA")
            .currency("EUR")
            .amount(new BigDecimal(amount))
            .build();
    }

    private static void observe(List<JobStatus> seen, QueuedJob job) {
        if (job.getProcessedAt() != null) {
            assertTrue(job.getStatus().isTerminal(), job.getId() + " has processedAt but is " + job.getStatus());
        }
        if (seen.isEmpty() || seen.get(seen.size() - 1) != job.getStatus()) {
            seen.add(job.getStatus());
        }
    }

    private static void assertForwardOnly(List<JobStatus> seen) {
        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i - 1).canTransitionTo(seen.get(i)), "Illegal transition in " + seen);
        }
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT.toMillis();
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + WAIT);
            }
            Thread.sleep(10);
        }
    }
}
