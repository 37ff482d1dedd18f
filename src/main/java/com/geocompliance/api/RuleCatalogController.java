package com.geocompliance.api;

import com.geocompliance.rules.ComplianceRule;
import com.geocompliance.rules.RuleCatalogService;
import com.geocompliance.rules.UnknownRuleException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/rules")
public class RuleCatalogController {

    private final RuleCatalogService catalogService;

    public RuleCatalogController(RuleCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public List<ComplianceRule> list() {
        return catalogService.current().rules();
    }

    @GetMapping("/{ruleId}")
    public ComplianceRule get(@PathVariable String ruleId) {
        return catalogService.current().find(ruleId)
            .orElseThrow(() -> new UnknownRuleException(ruleId));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ComplianceRule add(@RequestBody ComplianceRule rule) {
        return catalogService.addRule(rule).find(rule.id()).orElse(rule);
    }

    @PostMapping("/{ruleId}/enable")
    public ComplianceRule enable(@PathVariable String ruleId) {
        return catalogService.setEnabled(ruleId, true).find(ruleId).orElseThrow(() -> new UnknownRuleException(ruleId));
    }

    @PostMapping("/{ruleId}/disable")
    public ComplianceRule disable(@PathVariable String ruleId) {
        return catalogService.setEnabled(ruleId, false).find(ruleId).orElseThrow(() -> new UnknownRuleException(ruleId));
    }
}
