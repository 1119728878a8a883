package com.raketman.resumeanalyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExperienceEntry {

    SectionKind sectionKind;
    int lineIndex;
    String title;
    DateRange dateRange;

    public boolean hasTitle() {
        return title != null;
    }

    public boolean isDated() {
        return dateRange != null;
    }
}
