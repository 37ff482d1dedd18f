package com.geocompliance.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One declarative catalog entry, in its document form.
 *
 * {@code logic} is the JSON-logic tree as written in the catalog file; it is
 * compiled into an {@link com.geocompliance.logic.Expression} when the rule
 * enters a {@link RuleCatalog}. {@code id} is the catalog's primary key and is
 * never reused for a different rule. Disabled rules stay in the catalog but are
 * never evaluated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComplianceRule(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("logic") JsonNode logic,
    @JsonProperty("requires_controls") List<String> requiresControls,
    @JsonProperty("regulations") List<String> regulations,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("description") String description,
    @JsonProperty("enabled") boolean enabled
) {

    public ComplianceRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id is required");
        }
        if (logic == null || logic.isNull() || logic.isMissingNode()) {
            throw new IllegalArgumentException("rule " + id + " has no logic");
        }
        name = name == null ? id : name;
        requiresControls = requiresControls == null ? List.of() : List.copyOf(requiresControls);
        regulations = regulations == null ? List.of() : List.copyOf(regulations);
        severity = severity == null ? Severity.MEDIUM : severity;
    }

    /**
     * Document entry point: a missing {@code enabled} flag means enabled.
     */
    @JsonCreator
    public static ComplianceRule fromDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("logic") JsonNode logic,
        @JsonProperty("requires_controls") List<String> requiresControls,
        @JsonProperty("regulations") List<String> regulations,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("description") String description,
        @JsonProperty("enabled") Boolean enabled
    ) {
        return new ComplianceRule(id, name, logic, requiresControls, regulations, severity,
            description, enabled == null || enabled);
    }

    public ComplianceRule withEnabled(boolean flag) {
        return new ComplianceRule(id, name, logic, requiresControls, regulations, severity, description, flag);
    }
}
