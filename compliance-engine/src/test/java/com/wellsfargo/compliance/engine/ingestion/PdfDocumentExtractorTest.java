package com.wellsfargo.compliance.engine.ingestion;

import com.wellsfargo.compliance.error.DocumentDecodeException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class PdfDocumentExtractorTest {

    private final PdfDocumentExtractor extractor = new PdfDocumentExtractor();

    @Test
    public void testExtractsTextLayer() throws Exception {
        byte[] pdf = singlePagePdf("AT-44 Purpose code mandatory above EUR 12,500.00");

        String text = extractor.extractText(pdf);

        assertTrue(text.contains("AT-44 Purpose code mandatory"), text);
        assertTrue(RoutingDocumentTextExtractor.isPdf(pdf));
    }

    @Test
    public void testEmptyContentIsRejected() {
        assertThrows(DocumentDecodeException.class, () -> extractor.extractText(new byte[0]));
    }

    private static byte[] singlePagePdf(String line) throws Exception {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(72, 700);
                content.showText(line);
                content.endText();
            }
            document.save(out);
            return out.toByteArray();
        }
    }
}
