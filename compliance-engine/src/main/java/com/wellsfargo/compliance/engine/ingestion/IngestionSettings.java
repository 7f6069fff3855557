package com.wellsfargo.compliance.engine.ingestion;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables of rulebook ingestion, bound from {@code compliance.ingestion.*}.
 */
@Value
@Builder
public class IngestionSettings {

    @Builder.Default
    int minTextLength = 100;

    @Builder.Default
    int chunkSize = 12_000;

    @Builder.Default
    int maxChunks = 2;

    @Builder.Default
    RuleMergePolicy mergePolicy = RuleMergePolicy.APPEND;

    public static IngestionSettings defaults() {
        return IngestionSettings.builder().build();
    }
}
