package com.switchboard.core.llm;

/**
 * Text-in, text-out access to a language model. Implementations must honour
 * the per-call timeout in {@link InferenceOptions}.
 */
public interface InferenceService {

    /**
     * @return the raw model output, never blank
     * @throws InferenceTimeoutException when the call exceeds {@link InferenceOptions#timeout()}
     * @throws InferenceFailureException when the backend errors or returns nothing
     */
    String complete(String systemPrompt, String userPrompt, InferenceOptions options);

    /** Model identifier recorded alongside classifications. */
    String modelName();
}
