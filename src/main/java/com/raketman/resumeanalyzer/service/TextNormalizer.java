package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.model.RawDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans extracted text into the canonical line stream consumed by the rest of the pipeline.
 */
@Service
public class TextNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(TextNormalizer.class);

    // UTF-8 bytes decoded as Windows-1252
    private static final Map<String, String> MOJIBAKE = new LinkedHashMap<>();

    static {
        MOJIBAKE.put("â€¢", "•");
        MOJIBAKE.put("â€“", "-");
        MOJIBAKE.put("â€”", "-");
        MOJIBAKE.put("â€™", "'");
        MOJIBAKE.put("â€˜", "'");
        MOJIBAKE.put("â€œ", "\"");
        MOJIBAKE.put("â€\u009d", "\"");
        MOJIBAKE.put("â€¦", "...");
        MOJIBAKE.put("Â ", " ");
    }

    private static final Pattern INVISIBLE_SPACE = Pattern.compile("[\\u00a0\\u2007\\u202f\\u2002-\\u200a]");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200b-\\u200d\\u2060\\ufeff]");
    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern DASHES = Pattern.compile("[\\u2012-\\u2015\\u2212]");
    private static final Pattern BULLET = Pattern.compile(
            "^(?:[\\u2022\\u25cf\\u25aa\\u25e6\\u25a0\\u25ba\\u2713\\u2714\\u00b7\\u2023\\u2043\\u27a2*>]|-(?=\\s))\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\t]+");

    public RawDocument normalize(String text, long sourceByteSize) {
        if (text == null || text.isEmpty()) {
            return RawDocument.builder().lines(List.of()).sourceByteSize(sourceByteSize).build();
        }

        String cleaned = text.replace("\r\n", "\n").replace('\r', '\n');
        for (Map.Entry<String, String> artifact : MOJIBAKE.entrySet()) {
            cleaned = cleaned.replace(artifact.getKey(), artifact.getValue());
        }
        cleaned = ZERO_WIDTH.matcher(cleaned).replaceAll("");
        cleaned = INVISIBLE_SPACE.matcher(cleaned).replaceAll(" ");
        cleaned = CONTROL.matcher(cleaned).replaceAll(" ");
        cleaned = DASHES.matcher(cleaned).replaceAll("-");

        List<String> lines = new ArrayList<>();
        int bulletLines = 0;
        for (String rawLine : cleaned.split("\n")) {
            String line = WHITESPACE.matcher(rawLine).replaceAll(" ").trim();
            Matcher bullet = BULLET.matcher(line);
            if (bullet.find()) {
                line = line.substring(bullet.end()).trim();
                if (!line.isEmpty()) {
                    bulletLines++;
                }
            }
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }

        logger.debug("Normalized {} characters into {} lines ({} bullet lines)",
                text.length(), lines.size(), bulletLines);

        return RawDocument.builder()
                .lines(List.copyOf(lines))
                .sourceByteSize(sourceByteSize)
                .bulletLineCount(bulletLines)
                .build();
    }
}
