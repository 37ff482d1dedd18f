package com.geocompliance.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the process-wide catalog handle.
 *
 * Readers take {@link #current()} once per run and keep using that snapshot;
 * edits build a new catalog, persist it, and only then publish it.
 */
public class RuleCatalogService {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalogService.class);

    private final RuleCatalogStore store;
    private final AtomicReference<RuleCatalog> current;

    private RuleCatalogService(RuleCatalogStore store, RuleCatalog initial) {
        this.store = store;
        this.current = new AtomicReference<>(initial);
    }

    /**
     * One-time initialization: loads the persisted catalog or bootstraps the defaults.
     */
    public static RuleCatalogService initialize(RuleCatalogStore store) {
        return new RuleCatalogService(store, store.loadOrBootstrap());
    }

    public RuleCatalog current() {
        return current.get();
    }

    public synchronized RuleCatalog setEnabled(String ruleId, boolean enabled) {
        RuleCatalog updated = current.get().withEnabled(ruleId, enabled);
        store.save(updated);
        current.set(updated);
        log.info("Rule {} {}", ruleId, enabled ? "enabled" : "disabled");
        return updated;
    }

    public synchronized RuleCatalog addRule(ComplianceRule rule) {
        RuleCatalog updated = current.get().withRule(rule);
        store.save(updated);
        current.set(updated);
        log.info("Rule {} added to catalog ({} rules)", rule.id(), updated.size());
        return updated;
    }
}
