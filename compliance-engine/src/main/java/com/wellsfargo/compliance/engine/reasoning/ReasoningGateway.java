package com.wellsfargo.compliance.engine.reasoning;

import com.wellsfargo.compliance.error.ExtractionFailureException;
import com.wellsfargo.compliance.error.ExtractionFailureException.Reason;
import com.wellsfargo.compliance.error.ReasoningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for reasoning calls.
 *
 * Every call runs on a bounded pool of reasoning threads and is awaited for
 * at most the configured timeout, including time spent waiting for a free
 * thread. A timed-out call is cancelled and its thread interrupted.
 * Unavailability, timeouts, client errors and empty answers all surface as
 * {@link ExtractionFailureException}, which callers recover from locally.
 */
@Component
public class ReasoningGateway {

    private static final Logger log = LoggerFactory.getLogger(ReasoningGateway.class);

    /**
     * Upper bound on rule text sent along with a record.
     */
    static final int MAX_RULE_TEXT_LENGTH = 10_000;

    static final int DEFAULT_MAX_CONCURRENT_CALLS = 8;

    private final ReasoningClient client;
    private final long timeoutMillis;
    private final int maxConcurrentCalls;
    private final ExecutorService executorService;

    public ReasoningGateway(ReasoningClient client, long timeoutMillis) {
        this(client, timeoutMillis, DEFAULT_MAX_CONCURRENT_CALLS);
    }

    @Autowired
    public ReasoningGateway(ReasoningClient client,
                            @Value("${compliance.reasoning.timeout-ms:30000}") long timeoutMillis,
                            @Value("${compliance.reasoning.max-concurrent-calls:8}") int maxConcurrentCalls) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("Max concurrent reasoning calls must be at least 1, got "
                + maxConcurrentCalls);
        }
        this.client = client;
        this.timeoutMillis = timeoutMillis;
        this.maxConcurrentCalls = maxConcurrentCalls;
        this.executorService = Executors.newFixedThreadPool(maxConcurrentCalls, new ReasoningThreadFactory());
        log.info("Reasoning gateway initialized: client={}, available={}, timeoutMs={}, maxConcurrentCalls={}",
            client.getClass().getSimpleName(), client.isAvailable(), timeoutMillis, maxConcurrentCalls);
    }

    public boolean isAvailable() {
        return client.isAvailable();
    }

    public String proposeViolations(String scheme, String ruleText, String recordJson)
            throws ExtractionFailureException {
        String cappedText = ruleText != null && ruleText.length() > MAX_RULE_TEXT_LENGTH
            ? ruleText.substring(0, MAX_RULE_TEXT_LENGTH)
            : ruleText;
        return call("proposeViolations", () -> client.proposeViolations(scheme, cappedText, recordJson));
    }

    public String proposeRules(String scheme, String ruleText) throws ExtractionFailureException {
        return call("proposeRules", () -> client.proposeRules(scheme, ruleText));
    }

    public String summarize(String text) throws ExtractionFailureException {
        return call("summarize", () -> client.summarize(text));
    }

    private String call(String operation, Callable<String> task) throws ExtractionFailureException {
        if (!client.isAvailable()) {
            throw new ExtractionFailureException(Reason.UNAVAILABLE,
                "Reasoning collaborator unavailable for " + operation);
        }

        Future<String> future = executorService.submit(task);
        String response;
        try {
            response = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Reasoning call {} timed out after {} ms", operation, timeoutMillis);
            throw new ExtractionFailureException(Reason.TIMEOUT,
                "Reasoning call " + operation + " timed out after " + timeoutMillis + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ReasoningException) {
                log.warn("Reasoning call {} failed: {}", operation, cause.getMessage());
            } else {
                log.error("Reasoning call {} failed unexpectedly", operation, cause);
            }
            throw new ExtractionFailureException(Reason.CALL_FAILED,
                "Reasoning call " + operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionFailureException(Reason.CALL_FAILED,
                "Interrupted while waiting for reasoning call " + operation, e);
        }

        if (response == null || response.trim().isEmpty()) {
            throw new ExtractionFailureException(Reason.INVALID_RESPONSE,
                "Reasoning call " + operation + " returned an empty response");
        }
        return response;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down reasoning gateway");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static class ReasoningThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "reasoning-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
