package com.merlt.orchestrator.expert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolDecision(
        @JsonProperty("action") String action,
        @JsonProperty("tool") String tool,
        @JsonProperty("argument") String argument,
        @JsonProperty("reason") String reason) {

    public static ToolDecision finalizeNow(String reason) {
        return new ToolDecision("finalize", null, null, reason);
    }

    public boolean callsTool() {
        return this.action != null && this.action.trim().toLowerCase(Locale.ROOT).startsWith("call")
                && this.tool != null && !this.tool.isBlank();
    }
}
