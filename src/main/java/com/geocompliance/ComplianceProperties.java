package com.geocompliance;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings under the {@code geocompliance} prefix.
 */
@ConfigurationProperties(prefix = "geocompliance")
public record ComplianceProperties(
    @DefaultValue Rules rules,
    @DefaultValue Evidence evidence,
    @DefaultValue Policy policy,
    @DefaultValue Reasoning reasoning
) {

    /** Location of the rule catalog document; bootstrapped with defaults when absent. */
    public record Rules(@DefaultValue("./data/rules/compliance_rules.json") String catalogPath) {}

    /** Directory holding {@code <feature_id>.json} evidence and the result documents. */
    public record Evidence(@DefaultValue("./artifacts/evidence") String directory) {}

    /** Optional policy snippet file overriding the built-in snippets. */
    public record Policy(String snippetsPath) {}

    /** External reasoning collaborator; off unless a ChatModel is available and this is enabled. */
    public record Reasoning(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("30s") Duration timeout,
        @DefaultValue("4") int maxConcurrentCalls
    ) {}
}
