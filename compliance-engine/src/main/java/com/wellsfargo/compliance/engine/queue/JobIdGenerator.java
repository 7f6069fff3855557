package com.wellsfargo.compliance.engine.queue;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Job and batch identifiers.
 *
 * Formats:
 * - job:          JOB_yyyyMMdd_HHmmss_000042
 * - batch:        BATCH_yyyyMMdd_HHmmss_7
 * - batch member: BATCH_yyyyMMdd_HHmmss_7_003 (1-based)
 *
 * A process-wide sequence keeps ids unique within the same second.
 */
public class JobIdGenerator {

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AtomicLong jobSequence = new AtomicLong();
    private final AtomicLong batchSequence = new AtomicLong();

    public JobIdGenerator() {
        this(Clock.systemUTC());
    }

    public JobIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextJobId() {
        return String.format("JOB_%s_%06d", timestamp(), jobSequence.incrementAndGet());
    }

    public String nextBatchId() {
        return "BATCH_" + timestamp() + "_" + batchSequence.incrementAndGet();
    }

    public static String batchMemberId(String batchId, int index) {
        return String.format("%s_%03d", batchId, index);
    }

    private String timestamp() {
        return TIMESTAMP.format(clock.instant());
    }
}
