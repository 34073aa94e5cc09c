package com.merlt.orchestrator.llm;

/**
 * Structured-output access to the reasoning model. Implementations return a parsed instance of
 * {@code responseType} or throw {@link LanguageModelUnavailableException} once every configured
 * provider has failed.
 */
public interface LanguageModelClient {

    <T> T generateStructured(String systemPrompt, String userPrompt, Class<T> responseType);
}
