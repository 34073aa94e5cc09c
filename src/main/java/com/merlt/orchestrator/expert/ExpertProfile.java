package com.merlt.orchestrator.expert;

import com.merlt.orchestrator.model.ExpertType;
import java.util.List;
import java.util.Optional;

public record ExpertProfile(ExpertType type, String instructions, List<ToolSpec> tools) {

    public ExpertProfile {
        tools = List.copyOf(tools);
    }

    /** First traversal tool, used to expand the norm candidates before the first decision. */
    public Optional<ToolSpec> primaryTraversal() {
        return this.tools.stream().filter(ToolSpec::isTraversal).findFirst();
    }
}
