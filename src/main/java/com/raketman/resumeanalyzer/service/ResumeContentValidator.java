package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.config.AnalyzerProperties;
import com.raketman.resumeanalyzer.model.ContentValidation;
import com.raketman.resumeanalyzer.model.RawDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Judges whether scored text looks like a resume at all: enough resume vocabulary and a
 * sensible length. The verdict is advisory and travels next to the score.
 */
@Service
public class ResumeContentValidator {

    private static final Logger logger = LoggerFactory.getLogger(ResumeContentValidator.class);

    private final Map<String, Pattern> indicators;
    private final int minIndicators;
    private final int minWords;
    private final int maxWords;

    public ResumeContentValidator(AnalyzerProperties properties) {
        AnalyzerProperties.Content content = properties.getContent();
        this.indicators = new LinkedHashMap<>();
        for (String indicator : content.getResumeIndicators()) {
            String word = indicator.trim().toLowerCase(Locale.ROOT);
            if (!word.isEmpty()) {
                // word start only, so "work" does not count inside "framework"
                indicators.put(word, Pattern.compile("(?<![a-z])" + Pattern.quote(word)));
            }
        }
        this.minIndicators = content.getMinResumeIndicators();
        this.minWords = content.getAdvisoryMinWords();
        this.maxWords = content.getAdvisoryMaxWords();
    }

    public ContentValidation validate(RawDocument document) {
        String text = String.join("\n", document.getLines()).toLowerCase(Locale.ROOT);
        List<String> found = indicators.entrySet().stream()
                .filter(entry -> entry.getValue().matcher(text).find())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        int wordCount = document.isEmpty() ? 0 : document.wordCount();

        boolean valid;
        String message;
        if (found.size() < minIndicators) {
            valid = false;
            message = "Content may not be a resume. Found only " + found.size() + " resume indicators.";
        } else if (wordCount < minWords) {
            valid = false;
            message = "Resume too short (" + wordCount + " words). Professional resumes typically contain "
                    + "300-1000 words.";
        } else if (wordCount > maxWords) {
            valid = true;
            message = "Resume is quite long (" + wordCount + " words). Consider condensing for better ATS performance.";
        } else {
            valid = true;
            message = "Resume validation successful. Document contains " + wordCount + " words.";
        }

        logger.debug("Content validation: {} indicators, {} words, valid={}", found.size(), wordCount, valid);
        return ContentValidation.builder()
                .valid(valid)
                .indicatorsFound(List.copyOf(found))
                .wordCount(wordCount)
                .message(message)
                .build();
    }
}
