package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.model.ContactInfo;
import com.raketman.resumeanalyzer.model.DateRange;
import com.raketman.resumeanalyzer.model.ExperienceEntry;
import com.raketman.resumeanalyzer.model.ExperienceLevel;
import com.raketman.resumeanalyzer.model.MatchConfidence;
import com.raketman.resumeanalyzer.model.QuantifiedClaim;
import com.raketman.resumeanalyzer.model.RawDocument;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.Section;
import com.raketman.resumeanalyzer.model.SectionKind;
import com.raketman.resumeanalyzer.model.SkillDefinition;
import com.raketman.resumeanalyzer.model.SkillToken;
import com.raketman.resumeanalyzer.util.Terms;
import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls contact fields, skills, role facts and document statistics out of segmented sections.
 * Nothing here fails on odd content: a field that cannot be read is left absent.
 */
@Service
public class EntityExtractor {

    private static final Logger logger = LoggerFactory.getLogger(EntityExtractor.class);

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"
    );

    private static final Pattern PHONE_PATTERN = Pattern.compile(
            "(?<![\\w+])(?:\\+\\d{1,3}[\\s.-]?)?(?:\\(\\d{1,4}\\)[\\s.-]?)?\\d{2,4}(?:[\\s.-]?\\d{2,4}){1,4}(?![\\w])"
    );

    private static final Pattern YEAR_RANGE = Pattern.compile("^(?:19|20)\\d{2}\\s*-\\s*(?:19|20)\\d{2}$");

    private static final Pattern NAME_PATTERN = Pattern.compile(
            "^([A-Z][a-z]+(?:[ -][A-Z][a-z'.]+){1,3}|[A-Z]+(?: [A-Z]+){1,3})$"
    );

    private static final Pattern LOCATION_PATTERN = Pattern.compile(
            "^[A-Z][A-Za-z .'-]+,\\s*[A-Z][A-Za-z .'-]+$"
    );

    private static final Pattern LOCATION_LABEL = Pattern.compile("(?i)^(?:location|address)\\s*:\\s*(.+)$");

    private static final Pattern CONTACT_SEPARATORS = Pattern.compile("\\s*[|•·]\\s*|\\s{2,}");

    private static final Pattern SKILL_ITEM_SEPARATORS = Pattern.compile("[,|;/:•]");

    private static final String MONTH = "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
            + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";
    private static final String POINT = "(?:" + MONTH + "\\s+\\d{4}|\\d{1,2}/\\d{4}|\\d{4})";

    private static final Pattern DATE_RANGE = Pattern.compile(
            "(?i)\\b(?<start>" + POINT + ")\\s*(?:-|to|until)\\s*(?<end>" + POINT
                    + "|present|current|now|ongoing|today)\\b"
    );

    private static final Pattern MONTH_YEAR = Pattern.compile("(?i)^(" + MONTH + ")\\s+(\\d{4})$");
    private static final Pattern NUMERIC_MONTH_YEAR = Pattern.compile("^(\\d{1,2})/(\\d{4})$");
    private static final Pattern YEAR_ONLY = Pattern.compile("^\\d{4}$");

    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private static final List<String> MONTHS = List.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    private final AnalyzerTables tables;
    private final Clock clock;
    private final QuantificationDetector quantificationDetector;
    private final Map<String, List<Pattern>> aliasPatterns;
    private final Map<String, Integer> taxonomyOrder;

    public EntityExtractor(AnalyzerTables tables, Clock clock, QuantificationDetector quantificationDetector) {
        this.tables = tables;
        this.clock = clock;
        this.quantificationDetector = quantificationDetector;
        this.aliasPatterns = new LinkedHashMap<>();
        this.taxonomyOrder = new LinkedHashMap<>();
        for (SkillDefinition skill : tables.getSkills().values()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String alias : skill.getAliases()) {
                patterns.add(Terms.tokenPattern(alias));
            }
            aliasPatterns.put(skill.getId(), patterns);
            taxonomyOrder.put(skill.getId(), taxonomyOrder.size());
        }
    }

    public ResumeProfile extract(RawDocument document, List<Section> sections) {
        ContactInfo contact = extractContact(sections);
        List<SkillToken> skills = extractSkills(sections);
        List<QuantifiedClaim> claims = quantificationDetector.detect(sections);
        List<ExperienceEntry> experiences = extractExperiences(sections);

        Map<SectionKind, Integer> coverage = new EnumMap<>(SectionKind.class);
        int headingCount = 0;
        for (Section section : sections) {
            coverage.merge(section.getKind(), section.getBodyLines().size(), Integer::sum);
            if (section.hasHeading()) {
                headingCount++;
            }
        }

        List<DateRange> experienceRanges = new ArrayList<>();
        for (ExperienceEntry entry : experiences) {
            if (entry.getSectionKind() == SectionKind.EXPERIENCE && entry.isDated()) {
                experienceRanges.add(entry.getDateRange());
            }
        }
        int totalMonths = totalMonths(experienceRanges);

        ResumeProfile profile = ResumeProfile.builder()
                .contact(contact)
                .skills(skills)
                .claims(claims)
                .experiences(experiences)
                .sectionCoverage(Collections.unmodifiableMap(coverage))
                .headingCount(headingCount)
                .wordCount(document.wordCount())
                .actionVerbCount(countActionVerbs(sections))
                .bulletLineCount(document.getBulletLineCount())
                .totalExperienceMonths(totalMonths)
                .experienceLevel(ExperienceLevel.fromMonths(totalMonths, !experienceRanges.isEmpty()))
                .build();

        logger.debug("Extracted profile: email={}, phone={}, {} skills, {} claims, {} entries, {} months",
                contact.hasEmail(), contact.hasPhone(), skills.size(), claims.size(),
                experiences.size(), totalMonths);
        return profile;
    }

    /**
     * Only the top of the document is searched: CONTACT sections and the untitled lines that
     * precede the first heading.
     */
    ContactInfo extractContact(List<Section> sections) {
        String email = null;
        String phone = null;
        String location = null;
        String name = null;

        for (Section section : sections) {
            boolean topOfDocument = section.getKind() == SectionKind.CONTACT
                    || (section.getKind() == SectionKind.SUMMARY && !section.hasHeading());
            if (!topOfDocument) {
                continue;
            }
            for (String line : section.getBodyLines()) {
                if (email == null) {
                    email = findEmail(line);
                }
                if (phone == null) {
                    phone = findPhone(line);
                }
                if (section.getKind() != SectionKind.CONTACT) {
                    continue;
                }
                if (location == null) {
                    location = findLocation(line);
                }
                if (name == null) {
                    name = findName(line);
                }
            }
        }

        return ContactInfo.builder()
                .fullName(name)
                .email(email)
                .phone(phone)
                .location(location)
                .build();
    }

    private String findEmail(String line) {
        Matcher matcher = EMAIL_PATTERN.matcher(line);
        return matcher.find() ? matcher.group().toLowerCase(Locale.ROOT) : null;
    }

    private String findPhone(String line) {
        // emails and urls carry digit runs that are never phone numbers
        String text = EMAIL_PATTERN.matcher(line).replaceAll(" ").replaceAll("(?i)\\S*(?:https?://|www\\.)\\S*", " ");
        Matcher matcher = PHONE_PATTERN.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group().trim();
            if (isValidPhoneNumber(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private boolean isValidPhoneNumber(String candidate) {
        if (YEAR_RANGE.matcher(candidate).matches()) {
            return false;
        }
        int digits = candidate.replaceAll("\\D", "").length();
        return digits >= 7 && digits <= 15;
    }

    private String findLocation(String line) {
        Matcher labelled = LOCATION_LABEL.matcher(line);
        if (labelled.matches()) {
            return labelled.group(1).trim();
        }
        for (String part : CONTACT_SEPARATORS.split(line)) {
            String candidate = part.trim();
            if (!candidate.contains("@") && !candidate.matches(".*\\d.*")
                    && LOCATION_PATTERN.matcher(candidate).matches()) {
                return candidate;
            }
        }
        return null;
    }

    private String findName(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.contains("curriculum") || lower.contains("resume")) {
            return null;
        }
        Matcher matcher = NAME_PATTERN.matcher(line.trim());
        return matcher.matches() ? matcher.group(1) : null;
    }

    /**
     * Exact alias matches across skills, experience and project text, plus fuzzy matches for
     * the items of skills sections. Tokens are collapsed per canonical skill with exact matches
     * taking precedence, and ordered as the taxonomy declares them.
     */
    List<SkillToken> extractSkills(List<Section> sections) {
        Map<String, SkillToken> found = new LinkedHashMap<>();

        for (Section section : sections) {
            SectionKind kind = section.getKind();
            if (kind != SectionKind.SKILLS && !kind.isWorkHistory()) {
                continue;
            }
            for (String line : section.getBodyLines()) {
                String normalized = Terms.normalizeSkillText(line);
                matchExact(normalized).forEach(token -> found.putIfAbsent(token.getId(), token));

                if (kind == SectionKind.SKILLS) {
                    for (String item : SKILL_ITEM_SEPARATORS.split(line)) {
                        matchFuzzy(item).ifPresent(token -> found.putIfAbsent(token.getId(), token));
                    }
                }
            }
        }

        List<SkillToken> skills = new ArrayList<>(found.values());
        skills.sort(Comparator.comparingInt(token -> taxonomyOrder.get(token.getId())));
        return List.copyOf(skills);
    }

    private List<SkillToken> matchExact(String normalizedLine) {
        List<SkillToken> tokens = new ArrayList<>();
        if (normalizedLine.isEmpty()) {
            return tokens;
        }
        aliasPatterns.forEach((skillId, patterns) -> {
            for (Pattern pattern : patterns) {
                Matcher matcher = pattern.matcher(normalizedLine);
                if (matcher.find()) {
                    tokens.add(token(skillId, matcher.group(), MatchConfidence.EXACT));
                    return;
                }
            }
        });
        return tokens;
    }

    private Optional<SkillToken> matchFuzzy(String item) {
        String normalized = Terms.normalizeSkillText(item);
        if (normalized.length() < tables.getFuzzyMinLength() || !matchExact(normalized).isEmpty()) {
            return Optional.empty();
        }

        String bestId = null;
        int bestScore = 0;
        for (SkillDefinition skill : tables.getSkills().values()) {
            for (String alias : skill.getAliases()) {
                if (alias.length() < tables.getFuzzyMinLength()) {
                    continue;
                }
                int score = FuzzySearch.ratio(normalized, alias);
                if (score > bestScore) {
                    bestScore = score;
                    bestId = skill.getId();
                }
            }
        }

        if (bestId == null || bestScore < tables.getFuzzyThreshold()) {
            return Optional.empty();
        }
        logger.debug("Fuzzy skill match '{}' -> {} ({})", item.trim(), bestId, bestScore);
        return Optional.of(token(bestId, item.trim(), MatchConfidence.FUZZY));
    }

    private SkillToken token(String skillId, String rawText, MatchConfidence confidence) {
        SkillDefinition skill = tables.getSkills().get(skillId);
        return SkillToken.builder()
                .id(skill.getId())
                .name(skill.getName())
                .rawText(rawText)
                .category(skill.getCategory())
                .confidence(confidence)
                .build();
    }

    /**
     * Role and project facts. A line carrying a date range opens a dated entry titled by the
     * rest of that line or, failing that, the line above. A section without any date range
     * contributes one undated entry titled by its first body line.
     */
    List<ExperienceEntry> extractExperiences(List<Section> sections) {
        List<ExperienceEntry> entries = new ArrayList<>();
        for (Section section : sections) {
            if (!section.getKind().isWorkHistory() || !section.hasBody()) {
                continue;
            }
            List<String> body = section.getBodyLines();
            boolean sawDateLine = false;
            for (int i = 0; i < body.size(); i++) {
                Matcher matcher = DATE_RANGE.matcher(body.get(i));
                if (!matcher.find()) {
                    continue;
                }
                sawDateLine = true;
                DateRange range = parseRange(matcher.group("start"), matcher.group("end"));
                String title = titleFrom(body.get(i), matcher);
                if (title == null && i > 0 && !DATE_RANGE.matcher(body.get(i - 1)).find()) {
                    title = body.get(i - 1);
                }
                entries.add(ExperienceEntry.builder()
                        .sectionKind(section.getKind())
                        .lineIndex(section.bodyStartLine() + i)
                        .title(title)
                        .dateRange(range)
                        .build());
            }
            if (!sawDateLine) {
                entries.add(ExperienceEntry.builder()
                        .sectionKind(section.getKind())
                        .lineIndex(section.bodyStartLine())
                        .title(body.get(0))
                        .build());
            }
        }
        return List.copyOf(entries);
    }

    private String titleFrom(String line, Matcher dateMatch) {
        String rest = (line.substring(0, dateMatch.start()) + " " + line.substring(dateMatch.end()))
                .replaceAll("[|()\\[\\],@]", " ")
                .replaceAll("\\s+-\\s+|^\\s*-|-\\s*$", " ")
                .replaceAll("\\s+", " ")
                .trim();
        return rest.matches(".*\\p{L}{2,}.*") ? rest : null;
    }

    private DateRange parseRange(String startText, String endText) {
        YearMonth start = parsePoint(startText, false);
        if (start == null) {
            return null;
        }
        String end = endText.toLowerCase(Locale.ROOT);
        if (end.equals("present") || end.equals("current") || end.equals("now")
                || end.equals("ongoing") || end.equals("today")) {
            return DateRange.builder().start(start).current(true).build();
        }
        YearMonth endMonth = parsePoint(endText, true);
        if (endMonth == null || endMonth.isBefore(start)) {
            return null;
        }
        return DateRange.builder().start(start).end(endMonth).build();
    }

    private YearMonth parsePoint(String text, boolean isEnd) {
        String value = text.trim();
        try {
            Matcher named = MONTH_YEAR.matcher(value);
            if (named.matches()) {
                int month = MONTHS.indexOf(named.group(1).toLowerCase(Locale.ROOT).substring(0, 3)) + 1;
                return plausible(YearMonth.of(Integer.parseInt(named.group(2)), month));
            }
            Matcher numeric = NUMERIC_MONTH_YEAR.matcher(value);
            if (numeric.matches()) {
                return plausible(YearMonth.of(Integer.parseInt(numeric.group(2)), Integer.parseInt(numeric.group(1))));
            }
            if (YEAR_ONLY.matcher(value).matches()) {
                return plausible(YearMonth.of(Integer.parseInt(value), isEnd ? 12 : 1));
            }
        } catch (DateTimeException e) {
            logger.debug("Ignoring malformed date '{}': {}", value, e.getMessage());
        }
        return null;
    }

    private YearMonth plausible(YearMonth value) {
        return value.getYear() >= 1950 && value.getYear() <= 2100 ? value : null;
    }

    /**
     * Months covered by the union of the given ranges, so overlapping roles are counted once.
     */
    private int totalMonths(List<DateRange> ranges) {
        if (ranges.isEmpty()) {
            return 0;
        }
        YearMonth now = YearMonth.now(clock);
        List<int[]> spans = new ArrayList<>();
        for (DateRange range : ranges) {
            YearMonth end = range.isCurrent() ? now : range.getEnd();
            if (!end.isBefore(range.getStart())) {
                spans.add(new int[]{index(range.getStart()), index(end)});
            }
        }
        spans.sort(Comparator.comparingInt(span -> span[0]));

        int total = 0;
        int[] current = null;
        for (int[] span : spans) {
            if (current == null || span[0] > current[1] + 1) {
                if (current != null) {
                    total += current[1] - current[0] + 1;
                }
                current = new int[]{span[0], span[1]};
            } else {
                current[1] = Math.max(current[1], span[1]);
            }
        }
        if (current != null) {
            total += current[1] - current[0] + 1;
        }
        return total;
    }

    private int index(YearMonth month) {
        return month.getYear() * 12 + month.getMonthValue() - 1;
    }

    private int countActionVerbs(List<Section> sections) {
        int count = 0;
        for (Section section : sections) {
            if (!section.getKind().isWorkHistory()) {
                continue;
            }
            for (String line : section.getBodyLines()) {
                Matcher words = WORD.matcher(line.toLowerCase(Locale.ROOT));
                while (words.find()) {
                    if (tables.getActionVerbs().contains(words.group())) {
                        count++;
                    }
                }
            }
        }
        return count;
    }
}
