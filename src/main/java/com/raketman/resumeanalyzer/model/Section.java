package com.raketman.resumeanalyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A labeled block of the document covering lines {@code [startLine, endLine)}.
 * When a heading was detected it is the first line of the block.
 */
@Value
@Builder
public class Section {

    SectionKind kind;
    int startLine;
    int endLine;
    String heading;
    List<String> lines;

    public boolean hasHeading() {
        return heading != null;
    }

    @JsonIgnore
    public List<String> getBodyLines() {
        return hasHeading() ? lines.subList(1, lines.size()) : lines;
    }

    /**
     * Document line index of the first body line.
     */
    public int bodyStartLine() {
        return hasHeading() ? startLine + 1 : startLine;
    }

    public boolean hasBody() {
        return !getBodyLines().isEmpty();
    }
}
