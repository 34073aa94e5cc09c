package com.merlt.orchestrator.llm;

/**
 * One backend able to complete a system/user prompt pair into raw text.
 */
public interface LanguageModelProvider {

    String name();

    String complete(String systemPrompt, String userPrompt);
}
