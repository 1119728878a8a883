package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RoleProfile {

    String name;
    String description;
    ExperienceLevel experienceLevel;
    List<RequiredSkill> requiredSkills;
}
