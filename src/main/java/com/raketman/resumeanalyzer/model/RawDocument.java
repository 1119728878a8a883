package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized text of one resume: non-blank, trimmed lines in document order.
 */
@Value
@Builder
public class RawDocument {

    List<String> lines;
    long sourceByteSize;
    int bulletLineCount;

    public int lineCount() {
        return lines.size();
    }

    public String line(int index) {
        return lines.get(index);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int wordCount() {
        return lines.stream()
                .mapToInt(line -> line.split("\\s+").length)
                .sum();
    }

    public int characterCount() {
        return lines.stream().mapToInt(String::length).sum();
    }
}
