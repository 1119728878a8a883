package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.config.AnalyzerProperties;
import com.raketman.resumeanalyzer.exception.DocumentParsingException;
import lombok.Builder;
import lombok.Value;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Extracts plain text from uploaded resume documents and judges whether the result is readable.
 */
@Service
public class DocumentParserService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentParserService.class);

    private static final int MAX_EXTRACTED_CHARACTERS = 100000;

    private final Tika tika;
    private final long maxFileSizeBytes;
    private final List<String> supportedFormats;
    private final double readableRatio;

    @Value
    @Builder
    public static class ExtractedText {
        String text;
        long sourceByteSize;
        boolean readable;
    }

    public DocumentParserService(AnalyzerProperties properties) {
        this.tika = new Tika();
        this.tika.setMaxStringLength(MAX_EXTRACTED_CHARACTERS);
        this.maxFileSizeBytes = properties.getContent().getMaxFileSizeBytes();
        this.supportedFormats = properties.getContent().getSupportedFormats().stream()
                .map(format -> format.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        this.readableRatio = properties.getContent().getReadableRatio();
    }

    /**
     * Parse an uploaded document
     * @param fileName original file name, used for the format check
     * @param size declared size in bytes
     * @param content document bytes
     * @return extracted text with its readability verdict
     * @throws DocumentParsingException if the document is rejected or cannot be parsed
     */
    public ExtractedText parseDocument(String fileName, long size, InputStream content) {
        validate(fileName, size);
        try {
            long startTime = System.currentTimeMillis();
            String text = tika.parseToString(content);
            logger.debug("Parsed {} in {}ms, content length: {}",
                    fileName, System.currentTimeMillis() - startTime, text.length());

            return ExtractedText.builder()
                    .text(text)
                    .sourceByteSize(size)
                    .readable(isReadable(text))
                    .build();
        } catch (IOException e) {
            logger.error("IO error parsing file: {}", fileName, e);
            throw new DocumentParsingException("Failed to read file: " + fileName, e);
        } catch (TikaException e) {
            logger.error("Tika parsing error for file: {}", fileName, e);
            throw new DocumentParsingException("Failed to parse document: " + fileName, e);
        }
    }

    public ExtractedText parseDocument(File file) {
        if (file == null || !file.exists()) {
            throw new DocumentParsingException("File does not exist: " +
                    (file != null ? file.getPath() : "null"));
        }
        try (FileInputStream inputStream = new FileInputStream(file)) {
            return parseDocument(file.getName(), file.length(), inputStream);
        } catch (IOException e) {
            throw new DocumentParsingException("Failed to read file: " + file.getPath(), e);
        }
    }

    /**
     * Readable when there is text and most of its visible characters are letters or digits.
     * Scanned images and broken encodings fail this check.
     */
    public boolean isReadable(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        int visible = 0;
        int alphanumeric = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            visible++;
            if (Character.isLetterOrDigit(c)) {
                alphanumeric++;
            }
        }
        return visible > 0 && (double) alphanumeric / visible >= readableRatio;
    }

    public boolean isSupportedFormat(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return false;
        }
        return supportedFormats.contains(getFileExtension(fileName).toLowerCase(Locale.ROOT));
    }

    private void validate(String fileName, long size) {
        if (size <= 0) {
            throw new DocumentParsingException("File is empty: " + fileName);
        }
        if (size > maxFileSizeBytes) {
            throw new DocumentParsingException("File too large: " + fileName +
                    " (" + size + " bytes, limit " + maxFileSizeBytes + ")");
        }
        if (!isSupportedFormat(fileName)) {
            throw new DocumentParsingException("Unsupported file format: " + getFileExtension(fileName));
        }
    }

    private String getFileExtension(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return "";
        }
        int lastDotIndex = fileName.lastIndexOf('.');
        return lastDotIndex > 0 ? fileName.substring(lastDotIndex + 1) : "";
    }
}
