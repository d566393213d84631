package ch.so.arp.docqa.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;

import ch.so.arp.docqa.exception.UnsupportedFormatException;
import ch.so.arp.docqa.exception.ValidationException;

class TextExtractorTest {

    private final TextExtractor extractor = new TextExtractor(10L * 1024 * 1024);

    @Test
    void extractsUtf8TextAndNormalizesWhitespace() {
        byte[] content = "Zonenplan\r\n\r\n\r\n\r\nGrünzone   und\tBauzone \r\nEnde  ".getBytes(StandardCharsets.UTF_8);

        ExtractedText extracted = extractor.extract(content, "notes.TXT");

        assertThat(extracted.text()).isEqualTo("Zonenplan\n\nGrünzone und Bauzone\nEnde");
        assertThat(extracted.metadata())
                .containsEntry("file_size", content.length)
                .containsEntry("file_extension", ".txt");
    }

    @Test
    void fallsBackToLatin1ForInvalidUtf8() {
        byte[] content = "Grünzone".getBytes(StandardCharsets.ISO_8859_1);

        assertThat(extractor.extract(content, "legacy.txt").text()).isEqualTo("Grünzone");
    }

    @Test
    void extractsPdfText() throws IOException {
        byte[] pdf;
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.beginText();
                stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                stream.newLineAtOffset(72, 700);
                stream.showText("Solar panels are allowed on flat roofs.");
                stream.endText();
            }
            document.save(out);
            pdf = out.toByteArray();
        }

        ExtractedText extracted = extractor.extract(pdf, "rules.pdf");

        assertThat(extracted.text()).isEqualTo("Solar panels are allowed on flat roofs.");
        assertThat(extracted.metadata()).containsEntry("file_extension", ".pdf");
    }

    @Test
    void extractsDocxParagraphs() throws IOException {
        byte[] docx;
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.createParagraph().createRun().setText("First paragraph.");
            document.createParagraph().createRun().setText("Second paragraph.");
            document.write(out);
            docx = out.toByteArray();
        }

        ExtractedText extracted = extractor.extract(docx, "report.docx");

        assertThat(extracted.text()).contains("First paragraph.").contains("Second paragraph.");
    }

    @Test
    void rejectsCorruptDocument() {
        byte[] garbage = "definitely not a word file".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(garbage, "broken.doc")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> extractor.extract(garbage, "broken.pdf")).isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsUnsupportedExtension() {
        byte[] content = "a,b".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(content, "table.csv"))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining(".csv");
        assertThatThrownBy(() -> extractor.extract(content, "README"))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void rejectsEmptyAndOversizedFiles() {
        TextExtractor small = new TextExtractor(4);

        assertThatThrownBy(() -> small.extract(new byte[0], "empty.txt"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("File is empty");
        assertThatThrownBy(() -> small.extract("12345".getBytes(StandardCharsets.UTF_8), "big.txt"))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("File too large");
    }

    @Test
    void rejectsFilesWithoutText() {
        byte[] whitespace = " \n\t \n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(whitespace, "blank.txt"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("No text content");
    }
}
