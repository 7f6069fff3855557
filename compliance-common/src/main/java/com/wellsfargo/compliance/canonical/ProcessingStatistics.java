package com.wellsfargo.compliance.canonical;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of the cumulative validation counters.
 * 
 * compliant + nonCompliant == totalProcessed always holds. Counters are
 * cumulative and independent of how many jobs the queue still retains.
 */
@Value
@Builder
public class ProcessingStatistics {
    long totalSubmitted;
    long totalProcessed;
    long compliant;
    long nonCompliant;
    long failed;
    long evicted;
    int inFlight;
    int queueSize;
    int queueCapacity;

    /**
     * Share of processed records that were compliant, in percent (0 when nothing processed).
     */
    public double getStraightThroughRate() {
        if (totalProcessed == 0) {
            return 0.0;
        }
        return Math.round(compliant * 1000.0 / totalProcessed) / 10.0;
    }
}
