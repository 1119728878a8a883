package com.raketman.resumeanalyzer.ai;

import com.raketman.resumeanalyzer.config.AnalyzerProperties;
import com.raketman.resumeanalyzer.model.AiCostEstimate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Rough token and dollar estimate for an AI narrative, computed locally without calling the
 * provider.
 */
@Service
public class AiCostEstimator {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final AnalyzerProperties.Cost cost;

    public AiCostEstimator(AnalyzerProperties properties) {
        this.cost = properties.getAi().getCost();
    }

    /**
     * @param text resume text as submitted, may be {@code null}
     * @param targetRole optional role; a role-specific analysis costs more
     */
    public AiCostEstimate estimate(String text, String targetRole) {
        int resumeTokens = text == null ? 0 : text.length() / cost.getCharactersPerToken();
        int inputTokens = resumeTokens + cost.getPromptTokens();
        int outputTokens = cost.getResponseTokens();
        int totalTokens = inputTokens + outputTokens;

        BigDecimal estimatedCost = BigDecimal.valueOf(totalTokens)
                .divide(THOUSAND)
                .multiply(BigDecimal.valueOf(cost.getUsdPer1kTokens()));

        List<String> analysisTypes = new ArrayList<>();
        analysisTypes.add("Comprehensive Analysis");
        if (targetRole != null && !targetRole.isBlank()) {
            analysisTypes.add("Role-Specific Analysis");
            estimatedCost = estimatedCost.multiply(BigDecimal.valueOf(cost.getRoleSpecificFactor()));
        }

        return AiCostEstimate.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .estimatedTokens(totalTokens)
                .estimatedCostUsd(estimatedCost.setScale(4, RoundingMode.HALF_UP))
                .analysisTypes(List.copyOf(analysisTypes))
                .build();
    }
}
