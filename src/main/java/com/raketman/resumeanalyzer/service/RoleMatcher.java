package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.model.FitLevel;
import com.raketman.resumeanalyzer.model.RequiredSkill;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.RoleMatchResult;
import com.raketman.resumeanalyzer.model.RoleProfile;
import com.raketman.resumeanalyzer.model.SeniorityFit;
import com.raketman.resumeanalyzer.model.SkillToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares a profile's skills with role requirements. Every missing requirement subtracts its
 * weight from 100, floored at zero.
 */
@Service
public class RoleMatcher {

    private static final Logger logger = LoggerFactory.getLogger(RoleMatcher.class);

    private static final int FULL_COMPATIBILITY = 100;

    public RoleMatchResult match(ResumeProfile profile, RoleProfile role) {
        Map<String, SkillToken> owned = profile.getSkills().stream()
                .collect(Collectors.toMap(SkillToken::getId, Function.identity(), (first, second) -> first));

        List<RequiredSkill> matched = new ArrayList<>();
        List<RequiredSkill> missing = new ArrayList<>();
        List<RequiredSkill> weak = new ArrayList<>();
        for (RequiredSkill required : role.getRequiredSkills()) {
            SkillToken token = owned.get(required.getSkillId());
            if (token == null) {
                missing.add(required);
            } else {
                matched.add(required);
                if (!token.isExact()) {
                    weak.add(required);
                }
            }
        }

        // List.sort is stable, so equal weights keep the role's declared order
        missing.sort(Comparator.comparingInt(RequiredSkill::getWeight).reversed());

        int penalty = missing.stream().mapToInt(RequiredSkill::getWeight).sum();
        int compatibility = Math.max(0, FULL_COMPATIBILITY - penalty);

        logger.debug("Role '{}': {}% compatible, {} missing skills", role.getName(), compatibility, missing.size());

        return RoleMatchResult.builder()
                .roleName(role.getName())
                .compatibility(compatibility)
                .fitLevel(FitLevel.of(compatibility))
                .matchedSkills(List.copyOf(matched))
                .missingSkills(List.copyOf(missing))
                .weakSkills(List.copyOf(weak))
                .seniorityFit(SeniorityFit.compare(profile.getExperienceLevel(), role.getExperienceLevel()))
                .build();
    }

    /**
     * Matches every role independently; best fit first, declared order among equals.
     */
    public List<RoleMatchResult> matchAll(ResumeProfile profile, List<RoleProfile> roles) {
        return roles.stream()
                .map(role -> match(profile, role))
                .sorted(Comparator.comparingInt(RoleMatchResult::getCompatibility).reversed())
                .collect(Collectors.toList());
    }
}
