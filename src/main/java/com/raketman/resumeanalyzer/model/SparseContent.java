package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SparseContent {

    String reason;
    int characterCount;
    int wordCount;
    int minCharacters;
    int minWords;
}
