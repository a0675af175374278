package com.example.honeypot.llm;

/**
 * Port to the language model. Implementations must bound every call with a timeout
 * and report any failure (including the timeout) as an {@link LlmException}.
 */
public interface LlmClient {

    String complete(String systemPrompt, String userPrompt);
}
