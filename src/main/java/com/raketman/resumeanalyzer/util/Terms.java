package com.raketman.resumeanalyzer.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical forms shared by heading detection and skill matching, applied identically to
 * configured tables and to resume text so that both sides compare equal.
 */
public final class Terms {

    private static final Pattern NON_SKILL_CHARS = Pattern.compile("[^a-z0-9+#.]+");
    private static final Pattern NON_HEADING_CHARS = Pattern.compile("[^a-z&]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private Terms() {
    }

    /**
     * Lower-cases and keeps only letters, digits and the {@code + # .} characters that are part
     * of technology names (c++, c#, node.js). Everything else becomes a single space.
     */
    public static String normalizeSkillText(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return SPACES.matcher(NON_SKILL_CHARS.matcher(lower).replaceAll(" ")).replaceAll(" ").trim();
    }

    /**
     * Lower-cases and keeps only letters and ampersands.
     */
    public static String normalizeHeading(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT).replace("&", " & ");
        return SPACES.matcher(NON_HEADING_CHARS.matcher(lower).replaceAll(" ")).replaceAll(" ").trim();
    }

    /**
     * Pattern matching {@code term} as a whole token inside text produced by
     * {@link #normalizeSkillText(String)}.
     */
    public static Pattern tokenPattern(String term) {
        return Pattern.compile("(?<![a-z0-9+#])" + Pattern.quote(term) + "(?![a-z0-9+#])");
    }
}
