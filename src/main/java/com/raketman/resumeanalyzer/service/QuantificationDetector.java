package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.model.MetricType;
import com.raketman.resumeanalyzer.model.QuantifiedClaim;
import com.raketman.resumeanalyzer.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds numeric-impact phrases in experience and project sections. Each qualifying line yields
 * exactly one claim typed by the first matching {@link MetricType} in declaration order.
 */
@Service
public class QuantificationDetector {

    private static final Logger logger = LoggerFactory.getLogger(QuantificationDetector.class);

    // a standalone number: digits glued to letters (ec2, html5) are part of a name
    private static final String NUMBER = "(?<![a-z0-9.])(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)";
    private static final String SCALE = "(k|mm|m|bn|b|thousand|million|billion)?";

    private static final String COUNT_NOUNS = "users|customers|clients|requests|transactions|records|employees"
            + "|members|people|projects|applications|apps|services|microservices|servers|downloads|visitors"
            + "|orders|tickets|deployments|teams|engineers|developers|stakeholders|students|queries|events"
            + "|messages|endpoints|features|releases|reports|sites|stores|products|partners|accounts"
            + "|subscribers|installs|leads|calls|files|documents|pages|tests|bugs|issues|incidents|hires"
            + "|countries|languages|vendors|repositories|pipelines|jobs|sessions|devices";

    private static final Map<MetricType, List<Pattern>> PATTERNS = new EnumMap<>(MetricType.class);

    static {
        PATTERNS.put(MetricType.PERCENT, List.of(
                Pattern.compile(NUMBER + "\\s*(?:%|percent\\b|pct\\b)")));
        PATTERNS.put(MetricType.CURRENCY, List.of(
                Pattern.compile("(?:[$€£¥₹]|\\b(?:usd|eur|gbp|inr|aud|cad)\\s?)\\s*" + NUMBER + "\\s*" + SCALE + "\\b"),
                Pattern.compile(NUMBER + "\\s*" + SCALE + "\\s*(?:usd|eur|gbp|dollars|euros|pounds)\\b")));
        PATTERNS.put(MetricType.COUNT, List.of(
                Pattern.compile(NUMBER + "\\s*" + SCALE + "\\+?\\s+(?:[a-z-]+\\s+)?(?:" + COUNT_NOUNS + ")\\b"),
                Pattern.compile(NUMBER + "\\s?x(?![a-z0-9])"),
                Pattern.compile("\\b(?:team|group|staff) of " + NUMBER + "\\b")));
        PATTERNS.put(MetricType.DURATION, List.of(
                Pattern.compile(NUMBER + "\\+?\\s*(?:hours?|hrs?|days?|weeks?|months?|years?|yrs?|minutes?"
                        + "|mins?|seconds?|secs?|milliseconds?|ms)\\b")));
    }

    public List<QuantifiedClaim> detect(List<Section> sections) {
        List<QuantifiedClaim> claims = new ArrayList<>();
        for (Section section : sections) {
            if (!section.getKind().isWorkHistory()) {
                continue;
            }
            List<String> body = section.getBodyLines();
            for (int i = 0; i < body.size(); i++) {
                int lineIndex = section.bodyStartLine() + i;
                String line = body.get(i);
                detectLine(line).ifPresent(match -> claims.add(QuantifiedClaim.builder()
                        .lineIndex(lineIndex)
                        .sectionKind(section.getKind())
                        .metricType(match.type)
                        .value(match.value)
                        .text(line)
                        .build()));
            }
        }
        logger.debug("Detected {} quantified claims", claims.size());
        return List.copyOf(claims);
    }

    private Optional<Match> detectLine(String line) {
        String text = line.toLowerCase(Locale.ROOT);
        for (Map.Entry<MetricType, List<Pattern>> entry : PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                Matcher matcher = pattern.matcher(text);
                if (matcher.find()) {
                    return Optional.of(new Match(entry.getKey(), valueOf(matcher)));
                }
            }
        }
        return Optional.empty();
    }

    private double valueOf(Matcher matcher) {
        double value = Double.parseDouble(matcher.group(1).replace(",", ""));
        String scale = matcher.groupCount() >= 2 ? matcher.group(2) : null;
        if (scale == null) {
            return value;
        }
        switch (scale) {
            case "k":
            case "thousand":
                return value * 1_000;
            case "m":
            case "mm":
            case "million":
                return value * 1_000_000;
            case "b":
            case "bn":
            case "billion":
                return value * 1_000_000_000;
            default:
                return value;
        }
    }

    private static final class Match {
        private final MetricType type;
        private final double value;

        private Match(MetricType type, double value) {
            this.type = type;
            this.value = value;
        }
    }
}
