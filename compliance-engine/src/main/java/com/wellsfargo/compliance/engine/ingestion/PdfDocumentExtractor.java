package com.wellsfargo.compliance.engine.ingestion;

import com.wellsfargo.compliance.error.DocumentDecodeException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;

/**
 * Text layer extraction from PDF rulebooks.
 *
 * Scanned documents without a text layer produce little or no text; the
 * ingestion length check rejects those.
 */
public class PdfDocumentExtractor implements DocumentTextExtractor {

    @Override
    public String extractText(byte[] content) throws DocumentDecodeException {
        if (content == null || content.length == 0) {
            throw new DocumentDecodeException("Document is empty");
        }
        try (PDDocument document = Loader.loadPDF(content)) {
            if (document.isEncrypted()) {
                throw new DocumentDecodeException("Encrypted PDF documents are not supported");
            }
            return new PDFTextStripper().getText(document);
        } catch (IOException e) {
            throw new DocumentDecodeException("Cannot read PDF document: " + e.getMessage(), e);
        }
    }
}
