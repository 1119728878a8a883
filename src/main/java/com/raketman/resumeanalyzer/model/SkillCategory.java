package com.raketman.resumeanalyzer.model;

public enum SkillCategory {
    LANGUAGE,
    FRAMEWORK,
    TOOL,
    SOFT_SKILL,
    DOMAIN
}
