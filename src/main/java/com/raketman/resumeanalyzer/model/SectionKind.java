package com.raketman.resumeanalyzer.model;

public enum SectionKind {
    CONTACT,
    SUMMARY,
    SKILLS,
    EXPERIENCE,
    PROJECTS,
    EDUCATION,
    CERTIFICATIONS,
    OTHER;

    /**
     * Sections whose body lines describe work done: role facts, skills in use and measurable impact.
     */
    public boolean isWorkHistory() {
        return this == EXPERIENCE || this == PROJECTS;
    }
}
