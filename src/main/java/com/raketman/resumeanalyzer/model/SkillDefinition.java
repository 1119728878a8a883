package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One taxonomy entry. Aliases are stored lower-cased and punctuation-normalized.
 */
@Value
@Builder
public class SkillDefinition {

    String id;
    String name;
    SkillCategory category;
    List<String> aliases;
}
