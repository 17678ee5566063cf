package com.purchasingpower.agentmail.client;

/**
 * Chat completion backend used by the round agent.
 */
public interface LLMProvider {

    /**
     * Execute chat completion with the LLM.
     *
     * @param prompt The prompt to send
     * @param agentName Name of the calling agent (for logging)
     * @param conversationId Flow the call belongs to
     * @return The LLM's response text
     */
    String chat(String prompt, String agentName, String conversationId);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
