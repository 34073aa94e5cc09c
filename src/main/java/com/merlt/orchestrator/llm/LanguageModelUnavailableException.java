package com.merlt.orchestrator.llm;

import java.util.List;

public class LanguageModelUnavailableException extends RuntimeException {
    private final List<String> failures;

    public LanguageModelUnavailableException(String message, List<String> failures, Throwable cause) {
        super(message, cause);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public List<String> getFailures() {
        return this.failures;
    }
}
