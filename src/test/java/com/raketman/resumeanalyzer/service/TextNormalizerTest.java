package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.model.RawDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    @DisplayName("drops blank lines and collapses runs of whitespace")
    void collapsesWhitespace() {
        RawDocument document = normalizer.normalize("  Jane   Doe \r\n\r\n\n\tSoftware\t\tEngineer  \n   \n", 64);

        assertThat(document.getLines()).containsExactly("Jane Doe", "Software Engineer");
        assertThat(document.getSourceByteSize()).isEqualTo(64);
    }

    @Test
    @DisplayName("strips bullet glyphs and counts bullet lines")
    void stripsBullets() {
        RawDocument document = normalizer.normalize(String.join("\n",
                "• Built the billing service",
                "- Led a team of 4",
                "* Shipped weekly",
                "●",
                "-5 degrees is not a bullet"), 0);

        assertThat(document.getLines()).containsExactly(
                "Built the billing service",
                "Led a team of 4",
                "Shipped weekly",
                "-5 degrees is not a bullet");
        assertThat(document.getBulletLineCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("repairs mis-decoded punctuation and unifies dashes")
    void repairsEncodingArtifacts() {
        RawDocument document = normalizer.normalize(
                "â€¢ Jan 2020 â€“ Present\nMar 2018 — Dec 2019\nit’s fine​", 0);

        assertThat(document.getLines()).containsExactly(
                "Jan 2020 - Present",
                "Mar 2018 - Dec 2019",
                "it’s fine");
        assertThat(document.getBulletLineCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("null or empty text yields an empty document")
    void emptyInput() {
        assertThat(normalizer.normalize(null, 10).isEmpty()).isTrue();
        assertThat(normalizer.normalize("", 10).isEmpty()).isTrue();
        assertThat(normalizer.normalize(" \n\t\n ", 10).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("normalizing normalized text changes nothing")
    void idempotent() {
        RawDocument first = normalizer.normalize("Skills:\n• Java,  Spring\n\n  Docker–Compose ", 0);
        RawDocument second = normalizer.normalize(String.join("\n", first.getLines()), 0);

        assertThat(second.getLines()).isEqualTo(first.getLines());
    }

    @Test
    @DisplayName("word and character counts cover every line")
    void counts() {
        RawDocument document = normalizer.normalize("one two\nthree", 0);

        assertThat(document.wordCount()).isEqualTo(3);
        assertThat(document.characterCount()).isEqualTo(12);
    }
}
