package com.thedigest.continuity.service.brief;

import com.thedigest.continuity.model.Depth;

/**
 * External text-generation service used for the narrative brief.
 */
public interface NarrativeGenerationClient {

    /**
     * @return false when the service has no credentials/model configured
     */
    boolean isConfigured();

    /**
     * Sends one prompt and returns the raw text answer. Shallow depth may be routed to a
     * cheaper model.
     *
     * @throws RuntimeException on any transport or service failure
     */
    NarrativeResponse generate(String prompt, Depth depth, int maxTokens);
}
