package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RoleMatchResult {

    String roleName;
    int compatibility;
    FitLevel fitLevel;
    List<RequiredSkill> matchedSkills;
    List<RequiredSkill> missingSkills;
    List<RequiredSkill> weakSkills;
    SeniorityFit seniorityFit;
}
