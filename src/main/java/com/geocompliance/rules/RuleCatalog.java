package com.geocompliance.rules;

import com.geocompliance.logic.ExpressionParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of compiled compliance rules.
 *
 * Catalog order only determines the order of {@code matched_rules}; edits
 * return a new catalog and never move an existing rule. A single instance is
 * safe to share between concurrent evaluations.
 */
public final class RuleCatalog {

    private static final ExpressionParser PARSER = new ExpressionParser();

    private final List<CompiledRule> entries;
    private final Map<String, CompiledRule> byId;

    private RuleCatalog(List<CompiledRule> entries) {
        Map<String, CompiledRule> index = new LinkedHashMap<>();
        for (CompiledRule entry : entries) {
            if (index.putIfAbsent(entry.rule().id(), entry) != null) {
                throw new DuplicateRuleException(entry.rule().id());
            }
        }
        this.entries = List.copyOf(entries);
        this.byId = Collections.unmodifiableMap(index);
    }

    /**
     * Compiles every rule's logic. Rules whose logic does not parse are kept
     * and fail at evaluation time.
     *
     * @throws DuplicateRuleException if two rules share an id
     */
    public static RuleCatalog of(List<ComplianceRule> rules) {
        List<CompiledRule> compiled = new ArrayList<>(rules.size());
        for (ComplianceRule rule : rules) {
            compiled.add(CompiledRule.compile(rule, PARSER));
        }
        return new RuleCatalog(compiled);
    }

    public static RuleCatalog empty() {
        return new RuleCatalog(List.of());
    }

    public List<CompiledRule> entries() {
        return entries;
    }

    public List<ComplianceRule> rules() {
        return entries.stream().map(CompiledRule::rule).toList();
    }

    public Optional<ComplianceRule> find(String ruleId) {
        return Optional.ofNullable(byId.get(ruleId)).map(CompiledRule::rule);
    }

    /** Every rule in the catalog, enabled or not. */
    public int size() {
        return entries.size();
    }

    public RuleCatalog withEnabled(String ruleId, boolean enabled) {
        if (!byId.containsKey(ruleId)) {
            throw new UnknownRuleException(ruleId);
        }
        List<CompiledRule> updated = new ArrayList<>(entries.size());
        for (CompiledRule entry : entries) {
            updated.add(entry.rule().id().equals(ruleId) ? entry.withEnabled(enabled) : entry);
        }
        return new RuleCatalog(updated);
    }

    /**
     * Appends a rule at the end of evaluation order.
     *
     * @throws DuplicateRuleException if the id is taken
     * @throws InvalidRuleException if the rule's logic does not parse
     */
    public RuleCatalog withRule(ComplianceRule rule) {
        if (byId.containsKey(rule.id())) {
            throw new DuplicateRuleException(rule.id());
        }
        CompiledRule compiled = CompiledRule.compile(rule, PARSER);
        if (!compiled.isCompiled()) {
            throw new InvalidRuleException(rule.id(), compiled.compileError());
        }
        List<CompiledRule> updated = new ArrayList<>(entries);
        updated.add(compiled);
        return new RuleCatalog(updated);
    }
}
