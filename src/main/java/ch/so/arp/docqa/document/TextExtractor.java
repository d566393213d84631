package ch.so.arp.docqa.document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import ch.so.arp.docqa.exception.UnsupportedFormatException;
import ch.so.arp.docqa.exception.ValidationException;

/**
 * Extracts plain text from PDF, Word and text files. Files are validated for
 * size and type before any parser sees them.
 */
public class TextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextExtractor.class);

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".pdf", ".docx", ".doc", ".txt");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\n ?");
    private static final Pattern BLANK_LINES = Pattern.compile("\n{3,}");

    private final long maxFileSize;

    public TextExtractor(long maxFileSize) {
        if (maxFileSize <= 0) {
            throw new IllegalArgumentException("maxFileSize must be positive");
        }
        this.maxFileSize = maxFileSize;
    }

    public ExtractedText extract(byte[] content, String filename) {
        String extension = validate(content, filename);
        String raw = switch (extension) {
            case ".pdf" -> extractPdf(content, filename);
            case ".docx" -> extractDocx(content, filename);
            case ".doc" -> extractDoc(content, filename);
            default -> decodeText(content);
        };
        String text = normalize(raw);
        if (text.isEmpty()) {
            throw new ValidationException("No text content could be extracted from " + filename);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_size", content.length);
        metadata.put("file_extension", extension);
        LOGGER.debug("Extracted {} characters from {}", text.length(), filename);
        return new ExtractedText(text, metadata);
    }

    /**
     * @return the lower case extension including the dot
     */
    String validate(byte[] content, String filename) {
        if (!StringUtils.hasText(filename)) {
            throw new ValidationException("Filename must not be blank");
        }
        if (content == null || content.length == 0) {
            throw new ValidationException("File is empty");
        }
        if (content.length > maxFileSize) {
            throw new ValidationException("File too large. Maximum size is " + (maxFileSize / (1024 * 1024)) + "MB");
        }
        String extension = extensionOf(filename);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new UnsupportedFormatException(extension);
        }
        return extension;
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    private String extractPdf(byte[] content, String filename) {
        try (PDDocument document = Loader.loadPDF(content)) {
            return new PDFTextStripper().getText(document);
        } catch (IOException ex) {
            throw new ValidationException("Could not read PDF file " + filename + ": " + ex.getMessage());
        }
    }

    private String extractDocx(byte[] content, String filename) {
        try (XWPFWordExtractor extractor = new XWPFWordExtractor(
                new XWPFDocument(new ByteArrayInputStream(content)))) {
            return extractor.getText();
        } catch (IOException | RuntimeException ex) {
            throw new ValidationException("Could not read DOCX file " + filename + ": " + ex.getMessage());
        }
    }

    private String extractDoc(byte[] content, String filename) {
        try (WordExtractor extractor = new WordExtractor(new HWPFDocument(new ByteArrayInputStream(content)))) {
            return extractor.getText();
        } catch (IOException | RuntimeException ex) {
            throw new ValidationException("Could not read DOC file " + filename + ": " + ex.getMessage());
        }
    }

    /**
     * Decodes strict UTF-8 and falls back to ISO-8859-1, which accepts every
     * byte sequence.
     */
    static String decodeText(byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException ex) {
            LOGGER.debug("Text is not valid UTF-8, decoding as ISO-8859-1");
            return new String(content, StandardCharsets.ISO_8859_1);
        }
    }

    static String normalize(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        normalized = HORIZONTAL_WHITESPACE.matcher(normalized).replaceAll(" ");
        normalized = SPACE_AROUND_NEWLINE.matcher(normalized).replaceAll("\n");
        normalized = BLANK_LINES.matcher(normalized).replaceAll("\n\n");
        return normalized.strip();
    }
}
