package io.inboxflow.content;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

public final class FileContentExtractor implements ContentExtractor {
    public static final String TYPE_TEXT = "text_note";
    public static final String TYPE_PDF = "pdf_document";
    public static final String TYPE_IMAGE = "image";

    private final Logger log;

    public FileContentExtractor() {
        this(LoggerFactory.getLogger(FileContentExtractor.class));
    }

    public FileContentExtractor(Logger log) {
        this.log = log;
    }

    @Override
    public String extract(Path file) throws IOException {
        String extension = extensionOf(file);
        byte[] bytes = Files.readAllBytes(file);
        switch (extension) {
            case ".pdf":
                return pdfText(file, bytes);
            case ".png":
            case ".jpg":
            case ".jpeg":
                return imageDescriptor(file, bytes);
            default:
                return decodeUtf8(bytes);
        }
    }

    @Override
    public String initialType(Path file) {
        switch (extensionOf(file)) {
            case ".pdf":
                return TYPE_PDF;
            case ".png":
            case ".jpg":
            case ".jpeg":
                return TYPE_IMAGE;
            default:
                return TYPE_TEXT;
        }
    }

    public static String extensionOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private String pdfText(Path file, byte[] bytes) {
        try (PDDocument document = PDDocument.load(bytes)) {
            String text = new PDFTextStripper().getText(document).strip();
            return text.isEmpty() ? "[PDF contains no extractable text]" : text;
        } catch (IOException e) {
            log.warn("Could not extract text from PDF {}: {}", file.getFileName(), e.getMessage());
            return "[Error reading PDF: " + e.getMessage() + "]";
        }
    }

    private String imageDescriptor(Path file, byte[] bytes) {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                return "[Image error: unrecognized image format]";
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in);
                String format = reader.getFormatName().toUpperCase(Locale.ROOT);
                return "[Image file: " + format + " " + reader.getWidth(0) + "x" + reader.getHeight(0) + "]";
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.warn("Could not read image metadata for {}: {}", file.getFileName(), e.getMessage());
            return "[Image error: " + e.getMessage() + "]";
        }
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (IOException e) {
            throw new RuntimeException("Failed to decode text content", e);
        }
    }
}
