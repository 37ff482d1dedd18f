package com.geocompliance.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.geocompliance.evidence.DocumentWriteException;
import com.geocompliance.evidence.MalformedDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * File-backed persistence for the rule catalog.
 *
 * Document shape: {@code {"version": "1.0", "rules": [ ...ComplianceRule... ]}}.
 * A missing document, or one that cannot be used (unparsable JSON, no
 * {@code rules} array, invalid entries, duplicate ids), is replaced by
 * {@link DefaultComplianceRules} which are then written back. An unusable file
 * is first moved aside to {@code <name>.corrupt-<epochMillis>}.
 */
public class RuleCatalogStore {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalogStore.class);

    public static final String CATALOG_VERSION = "1.0";

    private final Path catalogPath;
    private final ObjectMapper objectMapper;

    public RuleCatalogStore(Path catalogPath, ObjectMapper objectMapper) {
        this.catalogPath = catalogPath;
        this.objectMapper = objectMapper;
    }

    public Path getCatalogPath() {
        return catalogPath;
    }

    /**
     * Loads the persisted catalog, installing and persisting the defaults when
     * there is none. Never fails: a default catalog that cannot be written is
     * still returned.
     */
    public RuleCatalog loadOrBootstrap() {
        if (!Files.exists(catalogPath)) {
            log.info("No rule catalog at {}, installing default rules", catalogPath);
            return bootstrap();
        }
        try {
            RuleCatalog catalog = read();
            log.info("Loaded {} compliance rules from {}", catalog.size(), catalogPath);
            return catalog;
        } catch (MalformedDocumentException ex) {
            log.warn("Rule catalog at {} is unusable ({}), installing default rules",
                catalogPath, ex.getMessage());
            quarantine();
            return bootstrap();
        }
    }

    /**
     * @throws MalformedDocumentException if the document cannot be used as a catalog
     */
    public RuleCatalog read() {
        JsonNode document;
        try {
            document = objectMapper.readTree(catalogPath.toFile());
        } catch (IOException ex) {
            throw new MalformedDocumentException("cannot read rule catalog: " + ex.getMessage(), ex);
        }
        if (document == null || !document.isObject()) {
            throw new MalformedDocumentException("rule catalog must be a JSON object");
        }
        JsonNode rulesNode = document.get("rules");
        if (rulesNode == null || !rulesNode.isArray()) {
            throw new MalformedDocumentException("rule catalog has no rules array");
        }

        List<ComplianceRule> rules = new ArrayList<>(rulesNode.size());
        for (JsonNode ruleNode : rulesNode) {
            if (!ruleNode.isObject()) {
                throw new MalformedDocumentException("rule entry " + rules.size() + " is not a JSON object");
            }
            try {
                rules.add(objectMapper.treeToValue(ruleNode, ComplianceRule.class));
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                throw new MalformedDocumentException("invalid rule entry: " + ex.getMessage(), ex);
            }
        }
        try {
            return RuleCatalog.of(rules);
        } catch (DuplicateRuleException ex) {
            throw new MalformedDocumentException(ex.getMessage(), ex);
        }
    }

    /**
     * @throws DocumentWriteException if the document cannot be written
     */
    public void save(RuleCatalog catalog) {
        ObjectNode document = objectMapper.createObjectNode();
        document.put("version", CATALOG_VERSION);
        ArrayNode rules = document.putArray("rules");
        for (ComplianceRule rule : catalog.rules()) {
            rules.add(objectMapper.valueToTree(rule));
        }

        try {
            Path parent = catalogPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path staging = catalogPath.resolveSibling(catalogPath.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(staging.toFile(), document);
            Files.move(staging, catalogPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new DocumentWriteException("failed to write rule catalog " + catalogPath, ex);
        }
    }

    private RuleCatalog bootstrap() {
        RuleCatalog catalog = RuleCatalog.of(DefaultComplianceRules.defaults());
        try {
            save(catalog);
            log.info("Persisted {} default compliance rules to {}", catalog.size(), catalogPath);
        } catch (DocumentWriteException ex) {
            log.error("Failed to persist default rule catalog to {}", catalogPath, ex);
        }
        return catalog;
    }

    private void quarantine() {
        Path aside = catalogPath.resolveSibling(
            catalogPath.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(catalogPath, aside, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Moved unusable rule catalog to {}", aside);
        } catch (IOException ex) {
            log.warn("Could not move unusable rule catalog {} aside: {}", catalogPath, ex.getMessage());
        }
    }
}
