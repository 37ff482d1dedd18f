package com.geocompliance.synthesis;

/**
 * External explainer consulted before the deterministic fallback.
 */
public interface ReasoningCollaborator {

    /**
     * @throws ReasoningException if no usable answer can be produced
     */
    ReasoningResponse explain(ReasoningRequest request);
}
