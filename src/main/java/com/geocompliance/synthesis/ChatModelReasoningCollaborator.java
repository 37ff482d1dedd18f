package com.geocompliance.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.evidence.NormalizedEvidence;
import com.geocompliance.evidence.RuntimeSignals;
import com.geocompliance.evidence.StaticSignals;
import com.geocompliance.rules.RulesResult;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ReasoningCollaborator} backed by a LangChain4j {@link ChatModel}.
 *
 * The model is asked for a single JSON object; a markdown code fence around
 * it is tolerated. Calls run on the supplied executor and are interrupted
 * once the timeout elapses.
 */
public class ChatModelReasoningCollaborator implements ReasoningCollaborator {

    private static final Logger log = LoggerFactory.getLogger(ChatModelReasoningCollaborator.class);

    private static final int MAX_SIGNALS_PER_KIND = 3;
    private static final int MAX_SNIPPETS = 3;
    private static final int MAX_SNIPPET_CHARS = 200;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final ExecutorService executor;

    public ChatModelReasoningCollaborator(ChatModel chatModel, ObjectMapper objectMapper,
                                          Duration timeout, ExecutorService executor) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public ReasoningResponse explain(ReasoningRequest request) {
        String prompt = buildPrompt(request);
        String answer = call(prompt);
        log.debug("Reasoning answer for {}: {} chars", request.evidence().featureId(), answer.length());
        return parse(answer);
    }

    private String call(String prompt) {
        Future<String> future;
        try {
            future = executor.submit(() -> chatModel.chat(prompt));
        } catch (RejectedExecutionException ex) {
            throw new ReasoningException("too many chat model calls in flight", ex);
        }
        try {
            String answer = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (answer == null || answer.isBlank()) {
                throw new ReasoningException("chat model returned an empty answer");
            }
            return answer;
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ReasoningException("chat model did not answer within " + timeout, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new ReasoningException("chat model call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReasoningException("interrupted while waiting for chat model", ex);
        }
    }

    ReasoningResponse parse(String answer) {
        String json = stripCodeFence(answer.strip());
        try {
            ReasoningResponse response = objectMapper.readValue(json, ReasoningResponse.class);
            if (response == null) {
                throw new ReasoningException("chat model answer is not a JSON object");
            }
            return response;
        } catch (JsonProcessingException ex) {
            throw new ReasoningException("chat model answer is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    static String stripCodeFence(String text) {
        if (!text.startsWith("```") || !text.endsWith("```") || text.length() < 6) {
            return text;
        }
        String body = text.substring(3, text.length() - 3);
        if (body.startsWith("json")) {
            body = body.substring(4);
        }
        return body.strip();
    }

    String buildPrompt(ReasoningRequest request) {
        NormalizedEvidence evidence = request.evidence();
        StaticSignals statics = evidence.staticSignals();
        RuntimeSignals runtime = evidence.runtimeSignals();
        RulesResult result = request.rulesResult();

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a compliance analysis assistant. Decide whether a feature requires ")
            .append("geo-specific compliance logic.\n")
            .append("Base your answer only on the evidence below and cite file:line references.\n\n")
            .append("FEATURE ID: ").append(evidence.featureId()).append("\n\n")
            .append("STATIC ANALYSIS EVIDENCE:\n");

        prompt.append("- Geographic branching signals: ").append(statics.geoBranching().size()).append('\n');
        statics.geoBranching().stream().limit(MAX_SIGNALS_PER_KIND).forEach(s ->
            prompt.append("  * ").append(s.file()).append(':').append(s.line())
                .append(" countries ").append(s.countries()).append('\n'));
        prompt.append("- Age verification signals: ").append(statics.ageChecks().size()).append('\n');
        statics.ageChecks().stream().limit(MAX_SIGNALS_PER_KIND).forEach(s ->
            prompt.append("  * ").append(s.file()).append(':').append(s.line())
                .append(" library ").append(s.lib()).append('\n'));
        prompt.append("- Data residency signals: ").append(statics.dataResidency().size()).append('\n');
        statics.dataResidency().stream().limit(MAX_SIGNALS_PER_KIND).forEach(s ->
            prompt.append("  * ").append(s.file()).append(':').append(s.line())
                .append(" region ").append(s.region()).append('\n'));
        prompt.append("- Reporting clients: ").append(statics.reportingClients()).append('\n')
            .append("- Recommendation system: ").append(statics.recoSystem()).append('\n')
            .append("- Parental controls: ").append(statics.pfControls()).append('\n');

        if (runtime.persona() != null) {
            prompt.append("\nRUNTIME EVIDENCE:\n")
                .append("- Test persona: ").append(runtime.persona().country())
                .append(", age ").append(runtime.persona().age()).append('\n')
                .append("- Blocked actions: ").append(runtime.blockedActions()).append('\n')
                .append("- UI states: ").append(runtime.uiStates()).append('\n')
                .append("- Feature flags resolved: ").append(runtime.flagResolutions().size()).append('\n');
        }

        prompt.append("\nRULES ENGINE RESULTS:\n")
            .append("- Requires geo logic: ").append(result.requiresGeoLogic()).append('\n')
            .append("- Confidence: ").append(String.format(Locale.ROOT, "%.2f", result.confidence())).append('\n')
            .append("- Matched rules: ").append(result.matchedRules()).append('\n')
            .append("- Missing controls: ").append(result.missingControls()).append('\n');

        if (!request.policySnippets().isEmpty()) {
            prompt.append("\nRELEVANT REGULATIONS:\n");
            request.policySnippets().stream().limit(MAX_SNIPPETS).forEach(snippet -> {
                String content = snippet.content() == null ? "" : snippet.content();
                if (content.length() > MAX_SNIPPET_CHARS) {
                    content = content.substring(0, MAX_SNIPPET_CHARS) + "...";
                }
                prompt.append("- ").append(snippet.title()).append(": ").append(content).append('\n');
            });
        }

        prompt.append("""

            Answer with one JSON object and nothing else:
            {
              "reasoning": "explanation citing file:line references",
              "related_regulations": ["applicable regulation titles"],
              "confidence": number between 0.0 and 1.0,
              "evidence_refs": ["evidence references"],
              "code_refs": ["file:line"],
              "runtime_observation": "summary of runtime behaviour",
              "needs_review": boolean,
              "severity": "low|medium|high|critical"
            }

            Confidence guide: 0.9-1.0 clear legal requirement; 0.7-0.89 strong indicators with some ambiguity;
            0.4-0.69 mixed signals that need human review; 0.2-0.39 likely business-driven; below 0.2 no evidence.
            Flag uncertainty when it is unclear whether a geographic variation is legally required.
            """);
        return prompt.toString();
    }
}
