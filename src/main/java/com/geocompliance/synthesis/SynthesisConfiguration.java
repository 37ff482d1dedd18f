package com.geocompliance.synthesis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.ComplianceProperties;
import com.geocompliance.evidence.EvidenceNormalizer;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SynthesisConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SynthesisConfiguration.class);

    @Bean
    public PolicySnippetCatalog policySnippetCatalog(ComplianceProperties properties, ObjectMapper objectMapper) {
        return PolicySnippetCatalog.load(properties.policy().snippetsPath(), objectMapper);
    }

    @Bean
    public FallbackSynthesizer fallbackSynthesizer(PolicySnippetCatalog snippets) {
        return new FallbackSynthesizer(snippets);
    }

    /**
     * Threads for chat model calls; pending calls beyond the queue are rejected.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService reasoningExecutor(ComplianceProperties properties) {
        int threads = properties.reasoning().maxConcurrentCalls();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "reasoning-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(threads * 4), factory, new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * A {@link ReasoningCollaborator} bean, when one is defined, wins. Otherwise a
     * {@link ChatModel} bean is used if {@code geocompliance.reasoning.enabled} is set.
     */
    @Bean
    public DecisionSynthesizer decisionSynthesizer(EvidenceNormalizer normalizer,
                                                   FallbackSynthesizer fallback,
                                                   PolicySnippetCatalog snippets,
                                                   ComplianceProperties properties,
                                                   ObjectMapper objectMapper,
                                                   ExecutorService reasoningExecutor,
                                                   ObjectProvider<ReasoningCollaborator> collaborators,
                                                   ObjectProvider<ChatModel> chatModels) {
        ReasoningCollaborator collaborator = collaborators.getIfAvailable();
        if (collaborator == null && properties.reasoning().enabled()) {
            ChatModel chatModel = chatModels.getIfAvailable();
            if (chatModel != null) {
                collaborator = new ChatModelReasoningCollaborator(
                    chatModel, objectMapper, properties.reasoning().timeout(), reasoningExecutor);
            } else {
                log.warn("Reasoning is enabled but no ChatModel bean is configured; using deterministic explanations");
            }
        }
        log.info("Decision synthesis using {}", collaborator != null
            ? collaborator.getClass().getSimpleName() : "deterministic fallback only");
        return new DecisionSynthesizer(normalizer, fallback, snippets, Optional.ofNullable(collaborator));
    }
}
