package com.geocompliance.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.ComplianceProperties;
import com.geocompliance.evidence.EvidenceNormalizer;
import com.geocompliance.logic.ExpressionEvaluator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class RulesConfiguration {

    @Bean
    public ExpressionEvaluator expressionEvaluator() {
        return new ExpressionEvaluator();
    }

    @Bean
    public RuleCatalogStore ruleCatalogStore(ComplianceProperties properties, ObjectMapper objectMapper) {
        return new RuleCatalogStore(Path.of(properties.rules().catalogPath()), objectMapper);
    }

    /**
     * The catalog is loaded (or bootstrapped) exactly once, when the context starts.
     */
    @Bean
    public RuleCatalogService ruleCatalogService(RuleCatalogStore ruleCatalogStore) {
        return RuleCatalogService.initialize(ruleCatalogStore);
    }

    @Bean
    public RulesEngine rulesEngine(EvidenceNormalizer evidenceNormalizer, ExpressionEvaluator expressionEvaluator) {
        return new RulesEngine(evidenceNormalizer, expressionEvaluator);
    }
}
