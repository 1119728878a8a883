package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.model.RoleProfile;
import com.raketman.resumeanalyzer.model.SkillCategory;
import com.raketman.resumeanalyzer.model.SkillDefinition;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only view of the loaded configuration tables for API clients.
 */
@Service
public class AnalyzerCatalogService {

    private final AnalyzerTables tables;
    private final CategoryScorer categoryScorer;

    public AnalyzerCatalogService(AnalyzerTables tables, CategoryScorer categoryScorer) {
        this.tables = tables;
        this.categoryScorer = categoryScorer;
    }

    public List<RoleProfile> getRoles() {
        return tables.getRoles();
    }

    public Map<SkillCategory, List<SkillDefinition>> getSkillsByCategory() {
        return tables.getSkills().values().stream()
                .collect(Collectors.groupingBy(SkillDefinition::getCategory,
                        () -> new EnumMap<>(SkillCategory.class), Collectors.toList()));
    }

    public Map<String, Object> getScoringConfiguration() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("categoryMax", tables.getCategoryMax());
        config.put("gradeTiers", tables.getGradeTiers());
        config.put("strengthRatio", tables.getStrengthRatio());
        config.put("weaknessRatio", tables.getWeaknessRatio());
        config.put("gates", categoryScorer.getGates());
        config.put("rules", categoryScorer.getRules());
        return config;
    }
}
