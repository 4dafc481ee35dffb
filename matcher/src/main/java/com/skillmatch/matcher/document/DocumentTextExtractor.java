package com.skillmatch.matcher.document;

import io.micrometer.core.instrument.MeterRegistry;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Turns an uploaded document into plain text for the matcher.
 *
 * PDFs (by file extension or content type) go through PDFBox; everything else
 * is decoded as strict UTF-8. Any failure is reported as
 * {@link ExtractionFailureException}, never as empty text.
 *
 * Metrics:
 * <pre>
 *   skillmatch.parse.requests{format="pdf|text", status="success|failed"}
 * </pre>
 */
@Component
public class DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractor.class);

    public enum Format { PDF, TEXT }

    private final MeterRegistry meterRegistry;

    public DocumentTextExtractor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param content     Raw upload bytes.
     * @param fileName    Declared file name; may be null.
     * @param contentType Declared MIME type; may be null.
     * @throws ExtractionFailureException if the document cannot be converted
     */
    public String extractText(byte[] content, String fileName, String contentType) {
        Format format = detectFormat(fileName, contentType);
        String status = "success";
        try {
            String text = switch (format) {
                case PDF  -> pdfToText(content, fileName);
                case TEXT -> decodeUtf8(content, fileName);
            };
            log.info("Extracted {} chars from '{}' ({})", text.length(), fileName, format);
            return text;
        } catch (ExtractionFailureException e) {
            status = "failed";
            log.warn("Text extraction failed for '{}': {}", fileName, e.getMessage());
            throw e;
        } finally {
            meterRegistry.counter("skillmatch.parse.requests",
                    "format", format.name().toLowerCase(Locale.ROOT), "status", status).increment();
        }
    }

    public static Format detectFormat(String fileName, String contentType) {
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return Format.PDF;
        }
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("application/pdf")) {
            return Format.PDF;
        }
        return Format.TEXT;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static String pdfToText(byte[] content, String fileName) {
        try (PDDocument document = Loader.loadPDF(content)) {
            log.debug("'{}': {} pages", fileName, document.getNumberOfPages());
            return new PDFTextStripper().getText(document);
        } catch (IOException e) {
            throw new ExtractionFailureException(fileName,
                    "Could not read PDF '" + fileName + "': " + e.getMessage(), e);
        }
    }

    private static String decodeUtf8(byte[] content, String fileName) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ExtractionFailureException(fileName,
                    "'" + fileName + "' is not valid UTF-8 text", e);
        }
    }
}
