package com.wellsfargo.compliance.engine.queue;

import com.wellsfargo.compliance.canonical.CanonicalPaymentRecord;
import com.wellsfargo.compliance.canonical.ComplianceResult;
import com.wellsfargo.compliance.canonical.ProcessingStatistics;
import com.wellsfargo.compliance.canonical.QueuedJob;
import com.wellsfargo.compliance.canonical.enums.ComplianceStatus;
import com.wellsfargo.compliance.canonical.enums.JobStatus;
import com.wellsfargo.compliance.engine.evaluation.ComplianceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Validation Queue.
 *
 * Bounded, ordered collection of validation jobs processed by a fixed worker
 * pool. Submission never blocks on evaluation.
 *
 * Invariants:
 * - The job index, the ordered queue and the counters are guarded by one lock,
 *   so a job's transition and its counter update are seen together
 * - Jobs only move PENDING -> PROCESSING -> COMPLETED | FAILED
 * - When full, the oldest job is evicted from the listing; it still runs and
 *   is still counted, only {@code evicted} records the eviction
 * - compliant + nonCompliant == totalProcessed
 *
 * Result listeners run on the worker thread after the lock is released.
 */
@Service
public class ValidationQueue {

    private static final Logger log = LoggerFactory.getLogger(ValidationQueue.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final ComplianceEvaluator evaluator;
    private final List<ComplianceResultListener> listeners;
    private final JobIdGenerator idGenerator;
    private final int capacity;
    private final int workerThreads;
    private final ExecutorService executorService;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private final Deque<JobEntry> queue = new ArrayDeque<>();
    private final Map<String, JobEntry> index = new HashMap<>();

    private long totalSubmitted;
    private long totalProcessed;
    private long compliant;
    private long nonCompliant;
    private long failed;
    private long evicted;
    private int inFlight;
    private boolean shutdown;

    @Autowired
    public ValidationQueue(ComplianceEvaluator evaluator,
                           ObjectProvider<ComplianceResultListener> listeners,
                           @Value("${compliance.queue.capacity:1000}") int capacity,
                           @Value("${compliance.queue.worker-threads:4}") int workerThreads) {
        this(evaluator, listeners.orderedStream().collect(Collectors.toList()), new JobIdGenerator(),
            capacity, workerThreads);
    }

    public ValidationQueue(ComplianceEvaluator evaluator,
                           List<ComplianceResultListener> listeners,
                           JobIdGenerator idGenerator,
                           int capacity,
                           int workerThreads) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1, got " + capacity);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("Worker threads must be at least 1, got " + workerThreads);
        }
        this.evaluator = evaluator;
        this.listeners = List.copyOf(listeners);
        this.idGenerator = idGenerator;
        this.capacity = capacity;
        this.workerThreads = workerThreads;
        this.executorService = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
        log.info("Validation queue initialized: capacity={}, workerThreads={}, listeners={}",
            capacity, workerThreads, this.listeners.size());
    }

    /**
     * Queue one record for evaluation.
     *
     * @param record canonical record
     * @param scheme scheme to evaluate against; null uses the record's scheme
     * @return job id
     */
    public String submit(CanonicalPaymentRecord record, String scheme) {
        if (record == null) {
            throw new IllegalArgumentException("Record is required");
        }
        JobEntry job;
        lock.lock();
        try {
            ensureRunning();
            job = enqueueLocked(idGenerator.nextJobId(), record, scheme, null);
        } finally {
            lock.unlock();
        }
        schedule(job);
        log.debug("Queued job {} for record {} at position {}", job.id, record.getIdentifier(), job.position);
        return job.id;
    }

    /**
     * Queue a batch of records. All jobs are enqueued before any is scheduled.
     */
    public BatchSubmission submitBatch(List<CanonicalPaymentRecord> records, String scheme) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one record");
        }
        if (records.contains(null)) {
            throw new IllegalArgumentException("Batch contains a null record");
        }

        String batchId = idGenerator.nextBatchId();
        List<JobEntry> jobs = new ArrayList<>(records.size());
        lock.lock();
        try {
            ensureRunning();
            for (int i = 0; i < records.size(); i++) {
                jobs.add(enqueueLocked(JobIdGenerator.batchMemberId(batchId, i + 1), records.get(i), scheme, batchId));
            }
        } finally {
            lock.unlock();
        }

        jobs.forEach(this::schedule);
        log.info("Queued batch {} with {} jobs", batchId, jobs.size());
        return new BatchSubmission(batchId, jobs.stream().map(job -> job.id).collect(Collectors.toList()));
    }

    public Optional<QueuedJob> status(String jobId) {
        lock.lock();
        try {
            JobEntry job = index.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retained jobs, oldest first.
     */
    public List<QueuedJob> list() {
        lock.lock();
        try {
            List<QueuedJob> jobs = new ArrayList<>(queue.size());
            for (JobEntry job : queue) {
                jobs.add(job.snapshot());
            }
            return Collections.unmodifiableList(jobs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retained jobs of one batch, in submission order.
     */
    public List<QueuedJob> listBatch(String batchId) {
        lock.lock();
        try {
            List<QueuedJob> jobs = new ArrayList<>();
            for (JobEntry job : queue) {
                if (batchId != null && batchId.equals(job.batchId)) {
                    jobs.add(job.snapshot());
                }
            }
            return Collections.unmodifiableList(jobs);
        } finally {
            lock.unlock();
        }
    }

    public ProcessingStatistics statistics() {
        lock.lock();
        try {
            return ProcessingStatistics.builder()
                .totalSubmitted(totalSubmitted)
                .totalProcessed(totalProcessed)
                .compliant(compliant)
                .nonCompliant(nonCompliant)
                .failed(failed)
                .evicted(evicted)
                .inFlight(inFlight)
                .queueSize(queue.size())
                .queueCapacity(capacity)
                .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until every submitted job has reached a terminal state.
     *
     * @return true when idle, false when the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (outstandingLocked() > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
        } finally {
            lock.unlock();
        }

        log.info("Shutting down validation queue");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Validation workers did not finish within {} s, forcing shutdown", SHUTDOWN_WAIT_SECONDS);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Validation queue shut down: {}", statistics());
    }

    private JobEntry enqueueLocked(String id, CanonicalPaymentRecord record, String scheme, String batchId) {
        if (queue.size() >= capacity) {
            JobEntry oldest = queue.pollFirst();
            index.remove(oldest.id);
            evicted++;
            log.debug("Evicted job {} ({}) from full queue", oldest.id, oldest.status.getValue());
        }
        JobEntry job = new JobEntry(id, record, scheme, batchId);
        queue.addLast(job);
        index.put(job.id, job);
        job.position = queue.size();
        totalSubmitted++;
        return job;
    }

    private void schedule(JobEntry job) {
        try {
            executorService.execute(() -> process(job));
        } catch (RejectedExecutionException e) {
            log.error("Job {} could not be scheduled", job.id, e);
            lock.lock();
            try {
                job.status = JobStatus.FAILED;
                job.error = e.getClass().getSimpleName() + ": " + e.getMessage();
                job.processedAt = Instant.now().toString();
                failed++;
                idle.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private void process(JobEntry job) {
        lock.lock();
        try {
            if (!job.status.canTransitionTo(JobStatus.PROCESSING)) {
                log.warn("Job {} is {} and cannot start processing", job.id, job.status.getValue());
                return;
            }
            job.status = JobStatus.PROCESSING;
            job.startedAt = Instant.now().toString();
            inFlight++;
        } finally {
            lock.unlock();
        }

        ComplianceResult result;
        try {
            result = evaluator.evaluate(job.record, job.scheme);
            result = result.toBuilder().queuePosition(job.position).build();
        } catch (RuntimeException e) {
            log.error("Job {} failed for record {}", job.id, job.record.getIdentifier(), e);
            lock.lock();
            try {
                job.status = JobStatus.FAILED;
                job.error = e.getClass().getSimpleName() + ": " + e.getMessage();
                job.processedAt = Instant.now().toString();
                inFlight--;
                failed++;
                idle.signalAll();
            } finally {
                lock.unlock();
            }
            return;
        }

        lock.lock();
        try {
            job.status = JobStatus.COMPLETED;
            job.result = result;
            job.processedAt = Instant.now().toString();
            inFlight--;
            totalProcessed++;
            if (result.getStatus() == ComplianceStatus.COMPLIANT) {
                compliant++;
            } else {
                nonCompliant++;
            }
            idle.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("Job {} completed: record={}, status={}, violations={}, source={}",
            job.id, result.getRecordId(), result.getStatus().getValue(), result.getViolations().size(),
            result.getRulebookSource());
        notifyListeners(job.id, result);
    }

    private void notifyListeners(String jobId, ComplianceResult result) {
        for (ComplianceResultListener listener : listeners) {
            try {
                listener.onComplianceResult(jobId, result);
            } catch (RuntimeException e) {
                log.warn("Result listener {} failed for job {}: {}", listener.getClass().getSimpleName(), jobId,
                    e.getMessage(), e);
            }
        }
    }

    private long outstandingLocked() {
        return totalSubmitted - totalProcessed - failed;
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new IllegalStateException("Validation queue is shut down");
        }
    }

    /**
     * Mutable job state; only touched under the queue lock.
     */
    private static final class JobEntry {
        private final String id;
        private final CanonicalPaymentRecord record;
        private final String scheme;
        private final String batchId;
        private final String queuedAt = Instant.now().toString();
        private int position;
        private JobStatus status = JobStatus.PENDING;
        private ComplianceResult result;
        private String error;
        private String startedAt;
        private String processedAt;

        private JobEntry(String id, CanonicalPaymentRecord record, String scheme, String batchId) {
            this.id = id;
            this.record = record;
            this.scheme = scheme;
            this.batchId = batchId;
        }

        private QueuedJob snapshot() {
            return QueuedJob.builder()
                .id(id)
                .scheme(scheme != null ? scheme : record.getScheme())
                .record(record)
                .status(status)
                .result(result)
                .error(error)
                .queuedAt(queuedAt)
                .startedAt(startedAt)
                .processedAt(processedAt)
                .batchId(batchId)
                .position(position)
                .build();
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "validation-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
