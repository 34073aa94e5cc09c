package com.merlt.orchestrator.expert;

import static com.merlt.orchestrator.weights.RelationTypes.*;

import com.merlt.orchestrator.llm.LanguageModelClient;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.retrieval.KnowledgeRetrievalClient;
import com.merlt.orchestrator.weights.TraversalWeightStore;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Case-law view: how courts, above all the Corte di Cassazione, interpret and apply the norm.
 */
@Component
public class PrecedentExpert extends ReasoningExpert {

    static final String INSTRUCTIONS = """
            You are the precedent expert of an Italian legal reasoning system.
            Report how courts interpret and apply the provisions. Distinguish settled case law from
            isolated or overruled decisions and point out conflicts between chambers.""";

    public PrecedentExpert(LanguageModelClient languageModel, KnowledgeRetrievalClient retrieval,
            TraversalWeightStore weightStore, ExpertSettings settings) {
        super(defaultProfile(), languageModel, retrieval, weightStore, settings);
    }

    static ExpertProfile defaultProfile() {
        return new ExpertProfile(ExpertType.PRECEDENT, INSTRUCTIONS, List.of(
                ToolSpec.semanticSearch(),
                ToolSpec.traversal("citation_lookup", "decisions interpreting, applying or citing the norm",
                        INTERPRETS, APPLIES, CITES),
                ToolSpec.traversal("case_history", "confirming, overruling and conflicting decisions",
                        CONFIRMS, OVERRULES, CONFLICTS_WITH, COMMENTS)));
    }
}
