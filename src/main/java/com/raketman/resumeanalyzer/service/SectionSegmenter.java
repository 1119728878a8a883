package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.model.RawDocument;
import com.raketman.resumeanalyzer.model.Section;
import com.raketman.resumeanalyzer.model.SectionKind;
import com.raketman.resumeanalyzer.util.Terms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Partitions a normalized document into labeled sections. Every line belongs to exactly one
 * section; a detected heading is the first line of the section it opens.
 */
@Service
public class SectionSegmenter {

    private static final Logger logger = LoggerFactory.getLogger(SectionSegmenter.class);

    private static final String SENTENCE_ENDINGS = ".!?,;";

    private final AnalyzerTables tables;
    private final List<Phrase> phrases;

    public SectionSegmenter(AnalyzerTables tables) {
        this.tables = tables;
        this.phrases = new ArrayList<>();
        for (AnalyzerTables.HeadingSynonyms heading : tables.getHeadings()) {
            for (String synonym : heading.getPhrases()) {
                phrases.add(new Phrase(synonym.split(" "), heading.getKind()));
            }
        }
        // longest phrase first so "work experience" wins over "experience"
        phrases.sort(Comparator.comparingInt((Phrase phrase) -> phrase.tokens.length).reversed());
    }

    public List<Section> segment(RawDocument document) {
        int lineCount = document.lineCount();
        if (lineCount == 0) {
            return List.of();
        }

        List<Integer> headingLines = new ArrayList<>();
        List<SectionKind> headingKinds = new ArrayList<>();
        for (int i = 0; i < lineCount; i++) {
            Optional<SectionKind> kind = headingKind(document.line(i));
            if (kind.isPresent()) {
                headingLines.add(i);
                headingKinds.add(kind.get());
            }
        }

        List<Section> sections = new ArrayList<>();
        if (headingLines.isEmpty()) {
            sections.add(section(document, SectionKind.OTHER, 0, lineCount, false));
            logger.debug("No section headings detected in {} lines", lineCount);
            return List.copyOf(sections);
        }

        int firstHeading = headingLines.get(0);
        if (firstHeading > 0) {
            int contactEnd = Math.min(firstHeading, tables.getMaxContactLines());
            sections.add(section(document, SectionKind.CONTACT, 0, contactEnd, false));
            if (contactEnd < firstHeading) {
                sections.add(section(document, SectionKind.SUMMARY, contactEnd, firstHeading, false));
            }
        }

        for (int h = 0; h < headingLines.size(); h++) {
            int start = headingLines.get(h);
            int end = h + 1 < headingLines.size() ? headingLines.get(h + 1) : lineCount;
            sections.add(section(document, headingKinds.get(h), start, end, true));
        }

        logger.debug("Segmented {} lines into {} sections ({} headings)",
                lineCount, sections.size(), headingLines.size());
        return List.copyOf(sections);
    }

    /**
     * Section kind for a heading line, or empty when the line is body text. When synonyms of
     * several kinds make up the line, the kind declared first in the heading table wins.
     */
    public Optional<SectionKind> headingKind(String line) {
        String candidate = line.trim();
        while (candidate.endsWith(":")) {
            candidate = candidate.substring(0, candidate.length() - 1).trim();
        }
        if (candidate.isEmpty() || candidate.length() > tables.getMaxHeadingLength()) {
            return Optional.empty();
        }
        if (SENTENCE_ENDINGS.indexOf(candidate.charAt(candidate.length() - 1)) >= 0) {
            return Optional.empty();
        }
        String[] words = candidate.split("\\s+");
        if (words.length > tables.getMaxHeadingWords() || !isTitleOrUpperCase(words)) {
            return Optional.empty();
        }

        String normalized = Terms.normalizeHeading(candidate);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        Set<SectionKind> matched = coveringKinds(normalized.split(" "));
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        return tables.getHeadings().stream()
                .map(AnalyzerTables.HeadingSynonyms::getKind)
                .filter(matched::contains)
                .findFirst();
    }

    private boolean isTitleOrUpperCase(String[] words) {
        for (String word : words) {
            String letters = word.replaceAll("[^\\p{L}]", "");
            if (letters.isEmpty() || tables.getConnectorWords().contains(letters.toLowerCase())) {
                continue;
            }
            if (!Character.isUpperCase(letters.charAt(0))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Kinds of the synonym phrases that, together with connector words, make up every token.
     * Empty when any token is left uncovered.
     */
    private Set<SectionKind> coveringKinds(String[] tokens) {
        Set<SectionKind> kinds = EnumSet.noneOf(SectionKind.class);
        int i = 0;
        while (i < tokens.length) {
            Phrase match = longestPhraseAt(tokens, i);
            if (match != null) {
                kinds.add(match.kind);
                i += match.tokens.length;
            } else if (tables.getConnectorWords().contains(tokens[i])) {
                i++;
            } else {
                return EnumSet.noneOf(SectionKind.class);
            }
        }
        return kinds;
    }

    private Phrase longestPhraseAt(String[] tokens, int offset) {
        for (Phrase phrase : phrases) {
            if (phrase.matchesAt(tokens, offset)) {
                return phrase;
            }
        }
        return null;
    }

    private Section section(RawDocument document, SectionKind kind, int start, int end, boolean headed) {
        return Section.builder()
                .kind(kind)
                .startLine(start)
                .endLine(end)
                .heading(headed ? document.line(start) : null)
                .lines(document.getLines().subList(start, end))
                .build();
    }

    private static final class Phrase {
        private final String[] tokens;
        private final SectionKind kind;

        private Phrase(String[] tokens, SectionKind kind) {
            this.tokens = tokens;
            this.kind = kind;
        }

        private boolean matchesAt(String[] text, int offset) {
            if (offset + tokens.length > text.length) {
                return false;
            }
            for (int i = 0; i < tokens.length; i++) {
                if (!tokens[i].equals(text[offset + i])) {
                    return false;
                }
            }
            return true;
        }
    }
}
