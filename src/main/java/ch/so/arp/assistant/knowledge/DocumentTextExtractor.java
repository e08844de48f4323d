package ch.so.arp.assistant.knowledge;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the bytes of an uploaded document into plain text. PDF pages and Word
 * paragraphs are separated by blank lines so that the chunker sees them as
 * paragraphs.
 */
public class DocumentTextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentTextExtractor.class);

    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final Tika tika;

    public DocumentTextExtractor() {
        this.tika = new Tika();
        this.tika.setMaxStringLength(-1);
    }

    public String extract(DocumentFormat format, byte[] content) {
        return switch (format) {
            case TXT, MD -> decodeUtf8(content);
            case PDF -> extractPdf(content);
            case DOCX -> extractDocx(content);
        };
    }

    private String decodeUtf8(byte[] content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(content)).toString();
        } catch (CharacterCodingException ex) {
            throw new DocumentExtractionException("Unable to decode text document", ex);
        }
    }

    private String extractPdf(byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            List<String> pages = new ArrayList<>();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document).replace('\u00A0', ' ');
                if (!text.isBlank()) {
                    pages.add(text.strip());
                }
            }
            LOGGER.debug("Extracted {} non-empty pages of {}", pages.size(), document.getNumberOfPages());
            return String.join(PARAGRAPH_SEPARATOR, pages);
        } catch (IOException ex) {
            throw new DocumentExtractionException("Unable to read PDF document", ex);
        }
    }

    private String extractDocx(byte[] content) {
        try (InputStream input = new ByteArrayInputStream(content)) {
            String text = tika.parseToString(input);
            List<String> paragraphs = text.lines()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty())
                    .toList();
            return String.join(PARAGRAPH_SEPARATOR, paragraphs);
        } catch (IOException | TikaException ex) {
            throw new DocumentExtractionException("Unable to read Word document", ex);
        }
    }
}
