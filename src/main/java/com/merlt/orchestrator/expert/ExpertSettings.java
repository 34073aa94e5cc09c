package com.merlt.orchestrator.expert;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ExpertSettings {
    @Value("${merlt.experts.max-tool-rounds:5}")
    private int maxToolRounds = 5;
    @Value("${merlt.experts.seed-top-k:5}")
    private int seedTopK = 5;
    @Value("${merlt.experts.tool-top-k:5}")
    private int toolTopK = 5;
    @Value("${merlt.experts.prompt-evidence-limit:8}")
    private int promptEvidenceLimit = 8;

    public ExpertSettings() {
    }

    public ExpertSettings(int maxToolRounds, int seedTopK, int toolTopK) {
        this.maxToolRounds = maxToolRounds;
        this.seedTopK = seedTopK;
        this.toolTopK = toolTopK;
    }

    public int getMaxToolRounds() {
        return Math.max(0, this.maxToolRounds);
    }

    public int getSeedTopK() {
        return Math.max(1, this.seedTopK);
    }

    public int getToolTopK() {
        return Math.max(1, this.toolTopK);
    }

    public int getPromptEvidenceLimit() {
        return Math.max(1, this.promptEvidenceLimit);
    }
}
