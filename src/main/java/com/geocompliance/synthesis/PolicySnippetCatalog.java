package com.geocompliance.synthesis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.rules.DefaultComplianceRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Regulatory snippets available to the synthesizer, linked to rules by id.
 *
 * An override document may be a plain array of snippets or
 * {@code {"snippets": [...]}}. A missing path means the built-in set.
 */
public class PolicySnippetCatalog {

    private static final Logger log = LoggerFactory.getLogger(PolicySnippetCatalog.class);

    public static final int MAX_RELATED_REGULATIONS = 5;

    private static final TypeReference<List<PolicySnippet>> SNIPPET_LIST = new TypeReference<>() {};

    private final List<PolicySnippet> snippets;

    public PolicySnippetCatalog(List<PolicySnippet> snippets) {
        this.snippets = List.copyOf(snippets);
    }

    public static PolicySnippetCatalog builtIn() {
        return new PolicySnippetCatalog(List.of(
            new PolicySnippet(
                "utah_social_media_act",
                "Utah Social Media Regulation Act - Minor Protections",
                "Social media companies must implement curfew restrictions for users under 18 in Utah, "
                    + "blocking access between 10:30 PM and 6:30 AM unless parental consent is provided.",
                "https://le.utah.gov/~2023/bills/static/SB0152.html",
                "Utah, USA",
                List.of(DefaultComplianceRules.UT_MINORS_CURFEW)),
            new PolicySnippet(
                "ncmec_reporting",
                "NCMEC Mandatory Reporting Requirements",
                "Electronic service providers must report known instances of child sexual abuse material (CSAM) "
                    + "to the National Center for Missing & Exploited Children within a reasonable time.",
                "https://www.missingkids.org/gethelpnow/cybertipline",
                "United States",
                List.of(DefaultComplianceRules.NCMEC_REPORTING)),
            new PolicySnippet(
                "eu_dsa",
                "EU Digital Services Act - Transparency Obligations",
                "Very large online platforms must provide transparency reports, implement user flagging "
                    + "mechanisms, and establish appeal processes for content moderation decisions.",
                "https://digital-strategy.ec.europa.eu/en/policies/digital-services-act-package",
                "European Union",
                List.of(DefaultComplianceRules.DSA_TRANSPARENCY)),
            new PolicySnippet(
                "gdpr",
                "GDPR - Lawful Basis for Processing",
                "Processing personal data requires a lawful basis under Article 6. Data subjects have rights "
                    + "to access, portability, erasure, and objection to processing.",
                "https://gdpr.eu/article-6-how-to-process-personal-data-legally/",
                "European Union",
                List.of(DefaultComplianceRules.GDPR_DATA_PROCESSING)),
            new PolicySnippet(
                "coppa",
                "COPPA - Children's Online Privacy Protection",
                "Websites directed to children under 13 must obtain verifiable parental consent before "
                    + "collecting personal information from children.",
                "https://www.ftc.gov/enforcement/rules/rulemaking-regulatory-reform-proceedings/childrens-online-privacy-protection-rule",
                "United States",
                List.of(DefaultComplianceRules.STATE_MINORS_PF_DEFAULT_OFF))
        ));
    }

    /**
     * Loads snippets from {@code path}, falling back to {@link #builtIn()} when the
     * path is unset, missing or unreadable.
     */
    public static PolicySnippetCatalog load(String path, ObjectMapper objectMapper) {
        if (path == null || path.isBlank()) {
            return builtIn();
        }
        Path file = Path.of(path);
        if (!Files.exists(file)) {
            log.warn("Policy snippet file {} not found, using built-in snippets", file);
            return builtIn();
        }
        try {
            JsonNode document = objectMapper.readTree(file.toFile());
            JsonNode list = document != null && document.isObject() ? document.get("snippets") : document;
            if (list == null || !list.isArray()) {
                log.warn("Policy snippet file {} has no snippet array, using built-in snippets", file);
                return builtIn();
            }
            for (JsonNode entry : list) {
                if (!entry.isObject()) {
                    log.warn("Policy snippet file {} has a non-object entry, using built-in snippets", file);
                    return builtIn();
                }
            }
            List<PolicySnippet> loaded = objectMapper.convertValue(list, SNIPPET_LIST);
            log.info("Loaded {} policy snippets from {}", loaded.size(), file);
            return new PolicySnippetCatalog(loaded);
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Failed to load policy snippets from {}: {}; using built-in snippets", file, ex.getMessage());
            return builtIn();
        }
    }

    public List<PolicySnippet> snippets() {
        return snippets;
    }

    /**
     * Snippets linked to any of the given rules, in rule order, each at most once.
     */
    public List<PolicySnippet> relevantFor(List<String> ruleIds) {
        Set<PolicySnippet> relevant = new LinkedHashSet<>();
        for (String ruleId : ruleIds) {
            for (PolicySnippet snippet : snippets) {
                if (snippet.appliesTo(ruleId)) {
                    relevant.add(snippet);
                }
            }
        }
        return new ArrayList<>(relevant);
    }

    /**
     * Distinct titles of the snippets linked to the given rules, at most
     * {@value #MAX_RELATED_REGULATIONS}.
     */
    public List<String> titlesFor(List<String> ruleIds) {
        return relevantFor(ruleIds).stream()
            .map(PolicySnippet::title)
            .distinct()
            .limit(MAX_RELATED_REGULATIONS)
            .toList();
    }
}
