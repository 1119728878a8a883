package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Advisory check that the text reads like a resume. It never changes the score.
 */
@Value
@Builder
public class ContentValidation {

    boolean valid;
    List<String> indicatorsFound;
    int wordCount;
    String message;
}
