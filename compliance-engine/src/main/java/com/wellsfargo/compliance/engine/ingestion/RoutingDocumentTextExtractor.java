package com.wellsfargo.compliance.engine.ingestion;

import com.wellsfargo.compliance.error.DocumentDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Picks the extractor from the content itself: PDF magic bytes go to the
 * PDF extractor, everything else is decoded as UTF-8 text.
 */
public class RoutingDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(RoutingDocumentTextExtractor.class);

    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    private final DocumentTextExtractor pdfExtractor;
    private final DocumentTextExtractor textExtractor;

    public RoutingDocumentTextExtractor(DocumentTextExtractor pdfExtractor, DocumentTextExtractor textExtractor) {
        this.pdfExtractor = pdfExtractor;
        this.textExtractor = textExtractor;
    }

    @Override
    public String extractText(byte[] content) throws DocumentDecodeException {
        if (isPdf(content)) {
            log.debug("Extracting text from PDF document ({} bytes)", content.length);
            return pdfExtractor.extractText(content);
        }
        return textExtractor.extractText(content);
    }

    static boolean isPdf(byte[] content) {
        return content != null
            && content.length >= PDF_MAGIC.length
            && Arrays.equals(Arrays.copyOf(content, PDF_MAGIC.length), PDF_MAGIC);
    }
}
