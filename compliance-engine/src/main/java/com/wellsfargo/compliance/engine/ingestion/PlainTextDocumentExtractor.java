package com.wellsfargo.compliance.engine.ingestion;

import com.wellsfargo.compliance.error.DocumentDecodeException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoding of text documents.
 *
 * Malformed byte sequences and binary content (NUL bytes, or a high share
 * of control characters) are rejected instead of being replaced.
 */
public class PlainTextDocumentExtractor implements DocumentTextExtractor {

    private static final String BOM = "\uFEFF";

    /**
     * Share of non-whitespace control characters above which content counts as binary.
     */
    private static final double MAX_CONTROL_RATIO = 0.05;

    @Override
    public String extractText(byte[] content) throws DocumentDecodeException {
        if (content == null || content.length == 0) {
            throw new DocumentDecodeException("Document is empty");
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        String text;
        try {
            text = decoder.decode(ByteBuffer.wrap(content)).toString();
        } catch (CharacterCodingException e) {
            throw new DocumentDecodeException("Document is not valid UTF-8 text", e);
        }

        if (text.startsWith(BOM)) {
            text = text.substring(1);
        }

        int controlCount = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\0') {
                throw new DocumentDecodeException("Document contains binary content (NUL byte at offset " + i + ")");
            }
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t' && c != '\f') {
                controlCount++;
            }
        }
        if (!text.isEmpty() && controlCount > text.length() * MAX_CONTROL_RATIO) {
            throw new DocumentDecodeException("Document looks binary: " + controlCount + " control characters");
        }
        return text;
    }
}
