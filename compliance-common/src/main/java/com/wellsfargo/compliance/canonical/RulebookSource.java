package com.wellsfargo.compliance.canonical;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * The active uploaded rulebook of a scheme.
 * 
 * At most one exists per scheme; uploading a new one replaces the old one.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RulebookSource {
    String scheme;

    /**
     * Filename or origin label of the uploaded document.
     */
    String filename;

    /**
     * Raw extracted text. Excluded from JSON views; it can be very large.
     */
    @JsonIgnore
    String text;

    String uploadedAt;

    /**
     * Estimated page count (about 50 lines per page).
     */
    int pages;

    int textLength;

    /**
     * Optional summary of the rulebook.
     */
    String summary;
}
