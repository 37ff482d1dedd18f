package com.geocompliance.rules;

import com.geocompliance.logic.Expression;
import com.geocompliance.logic.ExpressionWriter;

import java.util.List;

import static com.geocompliance.logic.Expressions.and;
import static com.geocompliance.logic.Expressions.eq;
import static com.geocompliance.logic.Expressions.in;
import static com.geocompliance.logic.Expressions.list;
import static com.geocompliance.logic.Expressions.literal;
import static com.geocompliance.logic.Expressions.lt;
import static com.geocompliance.logic.Expressions.or;
import static com.geocompliance.logic.Expressions.var;

/**
 * Baseline catalog installed when no usable catalog document exists.
 */
public final class DefaultComplianceRules {

    public static final String UT_MINORS_CURFEW = "UT_MINORS_CURFEW";
    public static final String NCMEC_REPORTING = "NCMEC_REPORTING";
    public static final String DSA_TRANSPARENCY = "DSA_TRANSPARENCY";
    public static final String STATE_MINORS_PF_DEFAULT_OFF = "STATE_MINORS_PF_DEFAULT_OFF";
    public static final String GDPR_DATA_PROCESSING = "GDPR_DATA_PROCESSING";

    private static final ExpressionWriter WRITER = new ExpressionWriter();

    private DefaultComplianceRules() {
    }

    public static List<ComplianceRule> defaults() {
        return List.of(
            rule(UT_MINORS_CURFEW, "Utah Minors Curfew Enforcement",
                and(
                    lt(var("runtime.persona.age"), literal(18)),
                    eq(var("runtime.persona.country"), literal("US")),
                    in(literal("UT"), var("static.geo_branching.*.countries"))),
                List.of("curfew_enforcement", "age_verification"),
                List.of("Utah Social Media Regulation Act"),
                Severity.HIGH,
                "Minors in Utah must be subject to night-time curfew restrictions"),
            rule(NCMEC_REPORTING, "NCMEC Mandatory Reporting",
                or(
                    in(literal("NCMEC"), var("static.reporting_clients")),
                    in(literal("csam_detection"), var("static.tags")),
                    eq(var("static.reco_system"), literal(true))),
                List.of("ncmec_report_pipeline", "content_moderation"),
                List.of("US NCMEC reporting requirements"),
                Severity.CRITICAL,
                "Known CSAM must be reported to NCMEC"),
            rule(DSA_TRANSPARENCY, "EU Digital Services Act Transparency",
                and(
                    eq(var("runtime.persona.country"), literal("EU")),
                    or(
                        eq(var("static.reco_system"), literal(true)),
                        in(literal("content_moderation"), var("static.tags")))),
                List.of("transparency_reports", "user_flagging", "appeal_process"),
                List.of("EU Digital Services Act"),
                Severity.HIGH,
                "Recommender and moderation systems serving EU users need transparency controls"),
            rule(STATE_MINORS_PF_DEFAULT_OFF, "State Minors Parental Features Default Off",
                and(
                    lt(var("runtime.persona.age"), literal(18)),
                    eq(var("static.pf_controls"), literal(true)),
                    in(literal("US"), var("static.geo_branching.*.countries"))),
                List.of("parental_consent", "default_privacy_settings"),
                List.of("Various US state minors privacy laws"),
                Severity.MEDIUM,
                "Parental features for US minors must default to the most protective setting"),
            rule(GDPR_DATA_PROCESSING, "GDPR Lawful Basis for Processing",
                and(
                    in(var("runtime.persona.country"), list("EU", "GB", "CH")),
                    or(
                        in(literal("user_data"), var("static.tags")),
                        in(literal("eu-west"), var("static.data_residency.*.region")))),
                List.of("consent_management", "data_portability", "right_to_erasure"),
                List.of("EU GDPR"),
                Severity.HIGH,
                "Processing personal data of European users requires a lawful basis")
        );
    }

    private static ComplianceRule rule(String id, String name, Expression logic,
                                       List<String> requiresControls, List<String> regulations,
                                       Severity severity, String description) {
        return new ComplianceRule(id, name, WRITER.write(logic), requiresControls, regulations,
            severity, description, true);
    }
}
