package com.wellsfargo.compliance.engine.ingestion;

import com.wellsfargo.compliance.error.DocumentDecodeException;

/**
 * Turns the bytes of an uploaded rulebook document into plain text.
 */
public interface DocumentTextExtractor {

    String extractText(byte[] content) throws DocumentDecodeException;
}
