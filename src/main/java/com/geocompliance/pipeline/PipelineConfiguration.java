package com.geocompliance.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.ComplianceProperties;
import com.geocompliance.evidence.EvidenceContractValidator;
import com.geocompliance.rules.RuleCatalogService;
import com.geocompliance.rules.RulesEngine;
import com.geocompliance.synthesis.DecisionSynthesizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class PipelineConfiguration {

    @Bean
    public EvidenceStore evidenceStore(ComplianceProperties properties, ObjectMapper objectMapper) {
        return new FileEvidenceStore(Path.of(properties.evidence().directory()), objectMapper);
    }

    @Bean
    public CompliancePipeline compliancePipeline(EvidenceStore evidenceStore,
                                                 EvidenceContractValidator validator,
                                                 RuleCatalogService ruleCatalogService,
                                                 RulesEngine rulesEngine,
                                                 DecisionSynthesizer decisionSynthesizer) {
        return new CompliancePipeline(evidenceStore, validator, ruleCatalogService, rulesEngine, decisionSynthesizer);
    }
}
